package com.nutrimatch.model.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A scored replacement candidate for an ingredient.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SubstitutionOption {
    private String originalIngredient;
    private String substituteName;
    private String ratio;
    private String notes;
    private double compatibilityScore;
    private double nutritionalSimilarity;
    private double overallScore;
}
