package com.nutrimatch.analysis;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FuzzyIngredientMatcherTest {

    private final FuzzyIngredientMatcher matcher = new FuzzyIngredientMatcher();

    @Test
    void matches_ExactAndSubstring() {
        assertThat(matcher.matches("milk", "milk")).isTrue();
        assertThat(matcher.matches("milk", "whole milk")).isTrue();
        assertThat(matcher.matches("soy sauce", "soy")).isTrue();
        assertThat(matcher.matches("Butter", "unsalted butter")).isTrue();
    }

    @Test
    void matches_WordLevelSubstring() {
        assertThat(matcher.matches("chicken stock", "chicken breast")).isTrue();
        assertThat(matcher.matches("peanuts", "peanut butter")).isTrue();
    }

    @Test
    void matches_KnownFalsePositives() {
        assertThat(matcher.matches("pea", "peanut")).isTrue();
        assertThat(matcher.matches("egg", "eggplant")).isTrue();
    }

    @Test
    void matches_UnrelatedOrBlank() {
        assertThat(matcher.matches("tofu", "rice")).isFalse();
        assertThat(matcher.matches("", "rice")).isFalse();
        assertThat(matcher.matches("rice", "  ")).isFalse();
        assertThat(matcher.matches(null, "rice")).isFalse();
    }
}
