package com.nutrimatch.generation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A configured origin of dynamic recipes. Only sources with a {@code mock://}
 * URL are backed by the built-in generator; others are listed for reporting.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecipeSource {

    public static final String GENERATOR_SCHEME = "mock://";

    private String name;
    private String apiUrl;

    @Builder.Default
    private int rateLimit = 100;

    @Builder.Default
    private boolean enabled = true;

    public boolean isGeneratorBacked() {
        return apiUrl != null && apiUrl.startsWith(GENERATOR_SCHEME);
    }
}
