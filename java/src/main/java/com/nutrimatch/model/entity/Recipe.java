package com.nutrimatch.model.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recipe record. Static recipes come from the corpus and are never modified
 * after loading; dynamic ones are generated for a single request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Recipe {

    public static final String SOURCE_STATIC = "static";
    public static final String SOURCE_DYNAMIC = "dynamic_generation";

    private String id;
    private String title;
    private String description;
    private String cuisineType;

    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.SKIP)
    @Builder.Default
    private List<String> dietaryTags = new ArrayList<>();

    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.SKIP)
    @Builder.Default
    private List<String> healthBenefits = new ArrayList<>();

    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.SKIP)
    @Builder.Default
    private List<Ingredient> ingredients = new ArrayList<>();

    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.SKIP)
    @Builder.Default
    private List<String> instructions = new ArrayList<>();

    private NutritionInfo nutritionalInfo;
    private Integer prepTime;
    private Integer cookTime;
    private Integer servings;
    private String difficulty;

    @Builder.Default
    private String source = SOURCE_STATIC;

    /**
     * Lower-cased ingredient names, in recipe order.
     */
    public List<String> ingredientNames() {
        List<String> names = new ArrayList<>();
        if (ingredients == null) {
            return names;
        }
        for (Ingredient ingredient : ingredients) {
            if (ingredient != null && ingredient.getName() != null) {
                names.add(ingredient.getName().toLowerCase(Locale.ROOT));
            }
        }
        return names;
    }

    public NutritionInfo nutritionOrEmpty() {
        return nutritionalInfo != null ? nutritionalInfo : new NutritionInfo();
    }

    @JsonIgnore
    public boolean isDynamic() {
        return SOURCE_DYNAMIC.equals(source);
    }
}
