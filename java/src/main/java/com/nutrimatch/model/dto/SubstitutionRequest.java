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

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SubstitutionRequest {

    @NotBlank(message = "Ingredient is required")
    private String ingredient;

    @Builder.Default
    private Set<String> dietaryRestrictions = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> allergies = new LinkedHashSet<>();
}
