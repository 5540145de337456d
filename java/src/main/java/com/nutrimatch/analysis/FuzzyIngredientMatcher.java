package com.nutrimatch.analysis;

import java.util.Locale;

/**
 * Lenient matcher: equal names, substring in either direction, or any pair of
 * words where one is a substring of the other.
 *
 * The word rule gives known false positives: "pea" matches "peanut butter"
 * and "egg" matches "eggplant". Use a stricter {@link IngredientMatcher}
 * where that matters.
 */
public class FuzzyIngredientMatcher implements IngredientMatcher {

    @Override
    public boolean matches(String pattern, String ingredient) {
        if (pattern == null || ingredient == null) {
            return false;
        }
        String p = pattern.toLowerCase(Locale.ROOT).trim();
        String i = ingredient.toLowerCase(Locale.ROOT).trim();
        if (p.isEmpty() || i.isEmpty()) {
            return false;
        }
        if (p.equals(i) || i.contains(p) || p.contains(i)) {
            return true;
        }
        for (String patternWord : p.split("\\s+")) {
            for (String ingredientWord : i.split("\\s+")) {
                if (ingredientWord.contains(patternWord) || patternWord.contains(ingredientWord)) {
                    return true;
                }
            }
        }
        return false;
    }
}
