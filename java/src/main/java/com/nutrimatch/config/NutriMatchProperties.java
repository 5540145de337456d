package com.nutrimatch.config;

import com.nutrimatch.generation.RecipeSource;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings bound from the {@code nutrimatch} prefix of application.yml.
 */
@Data
@ConfigurationProperties(prefix = "nutrimatch")
public class NutriMatchProperties {

    /**
     * Spring resource location holding recipes.json, nutritional_data.json
     * and dietary_guidelines.json.
     */
    private String dataLocation = "classpath:data/";

    private int embeddingDimension = 100;

    /**
     * Maximum characters per indexed document chunk.
     */
    private int chunkSize = 1000;

    /**
     * Seed for dynamic recipe generation. Unset means non-reproducible output.
     */
    private Long seed;

    private List<RecipeSource> sources = new ArrayList<>(List.of(RecipeSource.builder()
            .name("mock_dynamic")
            .apiUrl("mock://dynamic")
            .rateLimit(1000)
            .build()));

    /**
     * Health condition to the recipe health benefits that serve it.
     */
    private Map<String, List<String>> healthBenefitMapping = defaultHealthBenefitMapping();

    public static Map<String, List<String>> defaultHealthBenefitMapping() {
        Map<String, List<String>> mapping = new LinkedHashMap<>();
        mapping.put("diabetes", List.of("diabetes_friendly", "blood_sugar_control"));
        mapping.put("heart_disease", List.of("heart_healthy", "cholesterol_lowering"));
        mapping.put("hypertension", List.of("blood_pressure_control", "heart_healthy"));
        mapping.put("celiac_disease", List.of("celiac_safe", "gluten_free"));
        mapping.put("lactose_intolerance", List.of("lactose_intolerance_safe", "dairy_free"));
        mapping.put("obesity", List.of("weight_management", "low_carb"));
        return mapping;
    }
}
