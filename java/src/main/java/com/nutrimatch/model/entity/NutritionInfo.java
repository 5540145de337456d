package com.nutrimatch.model.entity;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Nutrition record of a recipe or an ingredient.
 * A null field means the value is unknown, which is not the same as zero.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NutritionInfo {

    public static final List<String> NUTRIENTS = List.of(
            "calories", "protein", "carbohydrates", "fat", "fiber", "sodium", "sugar");

    private Double calories;
    private Double protein;
    private Double carbohydrates;
    private Double fat;
    private Double fiber;
    private Double sodium;
    private Double sugar;

    /**
     * Look up a nutrient by name.
     *
     * @param nutrient nutrient name, e.g. "protein"
     * @return the value, or null when absent or not a known nutrient
     */
    public Double nutrient(String nutrient) {
        if (nutrient == null) {
            return null;
        }
        return switch (nutrient.toLowerCase(Locale.ROOT)) {
            case "calories" -> calories;
            case "protein" -> protein;
            case "carbohydrates", "carbs" -> carbohydrates;
            case "fat" -> fat;
            case "fiber" -> fiber;
            case "sodium" -> sodium;
            case "sugar" -> sugar;
            default -> null;
        };
    }

    /**
     * Nutrient value with absent values read as zero.
     */
    public double nutrientOrZero(String nutrient) {
        Double value = nutrient(nutrient);
        return value != null ? value : 0.0;
    }

    public boolean hasPositive(String nutrient) {
        return nutrientOrZero(nutrient) > 0;
    }

    /**
     * Present nutrients only, in canonical order.
     */
    public Map<String, Double> asMap() {
        Map<String, Double> values = new LinkedHashMap<>();
        for (String nutrient : NUTRIENTS) {
            Double value = nutrient(nutrient);
            if (value != null) {
                values.put(nutrient, value);
            }
        }
        return values;
    }
}
