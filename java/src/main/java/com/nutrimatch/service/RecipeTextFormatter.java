package com.nutrimatch.service;

import com.nutrimatch.model.entity.Ingredient;
import com.nutrimatch.model.entity.NutritionInfo;
import com.nutrimatch.model.entity.Recipe;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Renders recipes into the pipe-delimited text that gets embedded, and back
 * out again as far as the title goes.
 */
public final class RecipeTextFormatter {

    static final String TITLE_PREFIX = "Title: ";
    static final String SECTION_SEPARATOR = " | ";

    private RecipeTextFormatter() {}

    public static String format(Recipe recipe) {
        NutritionInfo nutrition = recipe.nutritionOrEmpty();
        List<String> sections = List.of(
                TITLE_PREFIX + nullToEmpty(recipe.getTitle()),
                "Description: " + nullToEmpty(recipe.getDescription()),
                "Cuisine Type: " + nullToEmpty(recipe.getCuisineType()),
                "Dietary Tags: " + join(recipe.getDietaryTags(), ", "),
                "Health Benefits: " + join(recipe.getHealthBenefits(), ", "),
                "Ingredients: " + join(ingredientNames(recipe), ", "),
                "Instructions: " + join(recipe.getInstructions(), " "),
                "Nutritional Info: Calories " + number(nutrition.getCalories())
                        + ", Protein " + number(nutrition.getProtein()) + "g"
                        + ", Carbs " + number(nutrition.getCarbohydrates()) + "g"
                        + ", Fat " + number(nutrition.getFat()) + "g");
        return String.join(SECTION_SEPARATOR, sections);
    }

    /**
     * Split a rendered recipe on section boundaries into chunks of at most
     * {@code chunkSize} characters where possible. A single oversized section
     * becomes its own chunk.
     */
    public static List<String> chunk(String text, int chunkSize) {
        if (text.length() <= chunkSize) {
            return List.of(text);
        }
        List<String> chunks = new ArrayList<>();
        String current = "";
        for (String section : text.split(" \\| ")) {
            if ((current + section).length() > chunkSize) {
                if (!current.isEmpty()) {
                    chunks.add(current.strip());
                }
                current = section;
            } else {
                current = current.isEmpty() ? section : current + SECTION_SEPARATOR + section;
            }
        }
        if (!current.isEmpty()) {
            chunks.add(current.strip());
        }
        return chunks;
    }

    /**
     * Title embedded in a rendered document, if the document starts with one.
     */
    public static Optional<String> parseTitle(String document) {
        if (document == null || !document.startsWith(TITLE_PREFIX)) {
            return Optional.empty();
        }
        String rest = document.substring(TITLE_PREFIX.length());
        int end = rest.indexOf(SECTION_SEPARATOR);
        return Optional.of((end >= 0 ? rest.substring(0, end) : rest).strip());
    }

    /**
     * Filterable metadata stored beside each indexed chunk.
     */
    public static Map<String, Object> metadata(Recipe recipe) {
        NutritionInfo nutrition = recipe.nutritionOrEmpty();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("id", recipe.getId());
        metadata.put("title", recipe.getTitle());
        metadata.put("cuisine_type", recipe.getCuisineType());
        metadata.put("dietary_tags", copy(recipe.getDietaryTags()));
        metadata.put("health_benefits", copy(recipe.getHealthBenefits()));
        metadata.put("ingredients", recipe.ingredientNames());
        for (String nutrient : List.of("calories", "protein", "carbohydrates", "fat", "fiber")) {
            metadata.put(nutrient, nutrition.nutrientOrZero(nutrient));
        }
        return metadata;
    }

    private static List<String> ingredientNames(Recipe recipe) {
        if (recipe.getIngredients() == null) {
            return List.of();
        }
        return recipe.getIngredients().stream()
                .filter(Objects::nonNull)
                .map(Ingredient::getName)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    private static List<String> copy(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }

    private static String join(List<String> values, String delimiter) {
        return values != null ? String.join(delimiter, values) : "";
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    // 350.0 renders as "350", 12.5 stays "12.5"
    static String number(Double value) {
        if (value == null) {
            return "0";
        }
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf(value.longValue());
        }
        return String.valueOf(value);
    }
}
