package com.nutrimatch.model.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How close a recipe is to a set of nutrient targets, and what to change.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NutritionOptimization {
    private double optimizationScore;

    @Builder.Default
    private List<OptimizationSuggestion> suggestions = new ArrayList<>();

    @Builder.Default
    private Map<String, NutrientAnalysis> nutrientAnalysis = new LinkedHashMap<>();

    private Map<String, Double> currentNutrition;
    private Map<String, Double> targetNutrition;
}
