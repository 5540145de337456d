package com.nutrimatch.model.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Request DTO for recipe search.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SearchRequest {

    @NotBlank(message = "Query is required")
    private String query;

    @Builder.Default
    private Set<String> dietaryRestrictions = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> allergies = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> healthConditions = new LinkedHashSet<>();

    @Builder.Default
    @Min(value = 1, message = "Limit must be at least 1")
    @Max(value = 50, message = "Limit cannot exceed 50")
    private Integer limit = 5;

    @Builder.Default
    private Boolean includeDynamic = true;
}
