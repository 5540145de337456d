package com.nutrimatch.model.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-request description of the user being served.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UserProfile {

    @Builder.Default
    private Set<String> dietaryRestrictions = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> allergies = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> healthConditions = new LinkedHashSet<>();

    @Builder.Default
    private List<String> preferences = new ArrayList<>();

    /**
     * Nutrient name to target value, e.g. {"protein": 30}.
     */
    @Builder.Default
    private Map<String, Double> nutritionalGoals = new LinkedHashMap<>();
}
