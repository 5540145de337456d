package com.nutrimatch.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.nutrimatch.model.entity.Recipe;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Single ranked search result DTO.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SearchResult {
    private Recipe recipe;
    private CompatibilityResult compatibility;
    private double searchScore;
    private double overallScore;
    private double distance;
    private Map<String, Object> metadata;

    /**
     * Present only in recommendation mode when the profile has nutritional goals.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private NutritionOptimization nutritionOptimization;
}
