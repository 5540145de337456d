package com.nutrimatch.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Either an ingredient to add (nutrient deficit) or an ingredient swap
 * (nutrient excess). Fields that do not apply to the type are null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OptimizationSuggestion {
    private SuggestionType type;
    private String nutrient;
    private String ingredient;
    private Double nutrientValue;
    private String originalIngredient;
    private String substituteIngredient;
    private Double reduction;
    private double compatibilityScore;
    private String suggestion;
}
