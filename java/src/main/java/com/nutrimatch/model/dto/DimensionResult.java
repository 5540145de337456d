package com.nutrimatch.model.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Score of one compatibility dimension plus the per-key detail behind it.
 *
 * @param <T> detail type for a single restriction, allergy or condition
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DimensionResult<T> {
    private boolean compatible;
    private double score;

    @Builder.Default
    private Map<String, T> results = new LinkedHashMap<>();

    public static <T> DimensionResult<T> neutral() {
        return DimensionResult.<T>builder()
                .compatible(true)
                .score(1.0)
                .build();
    }
}
