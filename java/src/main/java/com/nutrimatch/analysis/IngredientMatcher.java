package com.nutrimatch.analysis;

/**
 * Decides whether a recipe ingredient is covered by a guideline entry
 * such as an excluded or allergenic ingredient.
 */
public interface IngredientMatcher {

    /**
     * @param pattern guideline entry, e.g. "soy"
     * @param ingredient recipe ingredient name, e.g. "soy sauce"
     */
    boolean matches(String pattern, String ingredient);
}
