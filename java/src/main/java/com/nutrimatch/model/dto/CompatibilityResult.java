package com.nutrimatch.model.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of checking one recipe against one user's constraints.
 * Computed per request, never cached.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CompatibilityResult {
    private boolean overallCompatible;
    private double overallScore;
    private DimensionResult<RestrictionCheck> restrictionCompatibility;
    private DimensionResult<AllergyCheck> allergyCompatibility;
    private DimensionResult<HealthCheck> healthCompatibility;

    @Builder.Default
    private List<String> issues = new ArrayList<>();

    @Builder.Default
    private List<String> suggestions = new ArrayList<>();
}
