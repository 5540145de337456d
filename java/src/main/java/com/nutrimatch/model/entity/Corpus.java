package com.nutrimatch.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything loaded at startup: recipes, ingredient database and guidelines.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Corpus {

    @Builder.Default
    private List<Recipe> recipes = new ArrayList<>();

    @Builder.Default
    private NutritionalData nutritionalData = NutritionalData.empty();

    @Builder.Default
    private DietaryGuidelines guidelines = DietaryGuidelines.empty();
}
