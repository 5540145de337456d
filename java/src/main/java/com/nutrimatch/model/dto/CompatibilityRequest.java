package com.nutrimatch.model.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Request DTO for checking one corpus recipe against a user's constraints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CompatibilityRequest {

    @NotBlank(message = "Recipe ID is required")
    private String recipeId;

    @Builder.Default
    private Set<String> dietaryRestrictions = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> allergies = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> healthConditions = new LinkedHashSet<>();
}
