package com.nutrimatch.model.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for personalized recommendations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RecommendationRequest {

    @Valid
    @NotNull(message = "Profile is required")
    private UserProfile profile;

    @Builder.Default
    @Min(value = 1, message = "Limit must be at least 1")
    @Max(value = 25, message = "Limit cannot exceed 25")
    private Integer limit = 5;

    @Builder.Default
    private Boolean includeDynamic = true;
}
