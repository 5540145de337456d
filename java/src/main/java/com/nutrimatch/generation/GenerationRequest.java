package com.nutrimatch.generation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * What synthetic recipes to produce.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationRequest {
    private String query;

    @Builder.Default
    private Set<String> dietaryRestrictions = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> allergies = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> healthConditions = new LinkedHashSet<>();

    /**
     * Ingredient names that must not appear, typically derived from allergy guidelines.
     */
    @Builder.Default
    private Set<String> excludedIngredients = new LinkedHashSet<>();

    private int count;
}
