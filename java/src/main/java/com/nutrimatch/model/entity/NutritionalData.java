package com.nutrimatch.model.entity;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Known-ingredient nutrient database, keyed by ingredient name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NutritionalData {

    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.SKIP)
    @Builder.Default
    private Map<String, IngredientProfile> ingredients = new LinkedHashMap<>();

    public static NutritionalData empty() {
        return new NutritionalData();
    }

    public IngredientProfile profile(String ingredient) {
        return ingredient != null && ingredients != null ? ingredients.get(ingredient) : null;
    }
}
