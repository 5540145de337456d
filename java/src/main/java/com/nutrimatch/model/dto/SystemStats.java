package com.nutrimatch.model.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Aggregate corpus statistics for dashboards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SystemStats {
    private int totalRecipes;
    private int vectorStoreSize;
    private int embeddingDimension;
    private int vocabularySize;
    private Map<String, Object> embeddingModel;
    private Map<String, Object> vectorStore;
    private int dietaryRestrictions;
    private int healthConditions;
    private int allergies;
    private int uniqueIngredients;
    private int cuisineTypes;
    private int dietaryTagsAvailable;
    private int healthBenefitsAvailable;
    private Map<String, NutrientRange> nutritionStats;
    private Map<String, Coverage> dietaryCoverage;
    private Map<String, Coverage> healthCoverage;
    private List<String> availableSources;
    private Map<String, Object> sourceStats;
}
