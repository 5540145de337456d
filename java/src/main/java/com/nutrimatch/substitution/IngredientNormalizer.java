package com.nutrimatch.substitution;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reduces free-form ingredient text to a lookup key:
 * "2 cups fresh Milk" becomes "milk".
 */
public final class IngredientNormalizer {

    private static final Pattern MODIFIERS = Pattern.compile(
            "\\b(fresh|dried|frozen|canned|organic|raw|cooked)\\b");
    private static final Pattern QUANTITY_WITH_UNIT = Pattern.compile(
            "\\b\\d+(?:\\.\\d+)?\\s*(?:cups?|tbsp|tsp|oz|lbs?|kg|g|ml|l)\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private IngredientNormalizer() {}

    public static String normalize(String ingredient) {
        if (ingredient == null) {
            return "";
        }
        String normalized = ingredient.toLowerCase(Locale.ROOT).trim();
        normalized = MODIFIERS.matcher(normalized).replaceAll(" ");
        normalized = QUANTITY_WITH_UNIT.matcher(normalized).replaceAll(" ");
        return WHITESPACE.matcher(normalized).replaceAll(" ").trim();
    }
}
