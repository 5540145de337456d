package com.nutrimatch.model.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HealthCheck {
    private boolean compatible;
    private double score;
    private boolean hasRecommendedBenefits;
    private double nutritionalScore;
    private List<String> recommendedBenefits;
    private List<String> avoidNutrients;
    private List<String> recommendedNutrients;
}
