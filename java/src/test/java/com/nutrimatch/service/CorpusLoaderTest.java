package com.nutrimatch.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nutrimatch.exception.CorpusLoadException;
import com.nutrimatch.model.entity.Corpus;
import com.nutrimatch.model.entity.Recipe;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for CorpusLoader against the bundled data files.
 */
class CorpusLoaderTest {

    private CorpusLoader loader;

    @TempDir
    Path dataDir;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
        loader = new CorpusLoader(objectMapper, new DefaultResourceLoader());
    }

    @Test
    void load_ReadsBundledCorpus() {
        Corpus corpus = loader.load("classpath:data");

        assertThat(corpus.getRecipes()).hasSize(12);
        Recipe first = corpus.getRecipes().get(0);
        assertThat(first.getId()).isEqualTo("recipe_001");
        assertThat(first.getCuisineType()).isEqualTo("mediterranean");
        assertThat(first.getNutritionalInfo().getCalories()).isEqualTo(320.0);
        assertThat(first.getSource()).isEqualTo(Recipe.SOURCE_STATIC);

        assertThat(corpus.getGuidelines().allergy("soy").getIncompatibleIngredients()).contains("tofu", "soy sauce");
        assertThat(corpus.getGuidelines().substitution("milk").getSubstitutes())
                .extracting(s -> s.getName())
                .containsExactly("oat milk", "almond milk", "whole milk");
        assertThat(corpus.getNutritionalData().profile("tofu").getNutrition().getProtein()).isEqualTo(8.0);
        assertThat(corpus.getNutritionalData().profile("oat milk").getDietaryTags()).contains("vegan");
    }

    @Test
    void load_MissingFilesYieldEmptyCorpus() {
        Corpus corpus = loader.load("classpath:does-not-exist/");

        assertThat(corpus.getRecipes()).isEmpty();
        assertThat(corpus.getNutritionalData().getIngredients()).isEmpty();
        assertThat(corpus.getGuidelines().getAllergies()).isEmpty();
    }

    @Test
    void load_MalformedFileFails() {
        assertThatThrownBy(() -> loader.load("classpath:malformed/"))
                .isInstanceOf(CorpusLoadException.class)
                .hasMessageContaining("recipes.json");
    }

    @Test
    void load_NullIngredientDatabaseIsEmpty() throws IOException {
        write("nutritional_data.json", "{\"ingredients\": null}");

        Corpus corpus = loader.load("file:" + dataDir);

        assertThat(corpus.getNutritionalData().getIngredients()).isNotNull().isEmpty();
        assertThat(corpus.getNutritionalData().profile("tofu")).isNull();
    }

    @Test
    void load_NullGuidelineSectionsAreEmpty() throws IOException {
        write("dietary_guidelines.json", "{\"dietary_restrictions\": null, \"allergies\": null, "
                + "\"health_conditions\": null, \"ingredient_substitutions\": null}");

        Corpus corpus = loader.load("file:" + dataDir);

        assertThat(corpus.getGuidelines().getDietaryRestrictions()).isNotNull().isEmpty();
        assertThat(corpus.getGuidelines().getAllergies()).isNotNull().isEmpty();
        assertThat(corpus.getGuidelines().getHealthConditions()).isNotNull().isEmpty();
        assertThat(corpus.getGuidelines().getIngredientSubstitutions()).isNotNull().isEmpty();
    }

    @Test
    void load_NullRuleEntriesAndListsAreEmpty() throws IOException {
        write("dietary_guidelines.json", "{\"dietary_restrictions\": {\"vegan\": {\"excluded_ingredients\": null}}, "
                + "\"allergies\": {\"soy\": null, \"nuts\": {\"incompatible_ingredients\": [\"peanut\", null]}}, "
                + "\"health_conditions\": {\"diabetes\": {\"recommended_benefits\": null, "
                + "\"avoid_nutrients\": null, \"recommended_nutrients\": null}}, "
                + "\"ingredient_substitutions\": {\"milk\": {\"substitutes\": null}}}");

        Corpus corpus = loader.load("file:" + dataDir);

        assertThat(corpus.getGuidelines().restriction("vegan").getExcludedIngredients()).isEmpty();
        assertThat(corpus.getGuidelines().getAllergies()).containsOnlyKeys("nuts");
        assertThat(corpus.getGuidelines().allergy("nuts").getIncompatibleIngredients()).containsExactly("peanut");
        assertThat(corpus.getGuidelines().healthCondition("diabetes").getRecommendedBenefits()).isEmpty();
        assertThat(corpus.getGuidelines().healthCondition("diabetes").getAvoidNutrients()).isEmpty();
        assertThat(corpus.getGuidelines().substitution("milk").getSubstitutes()).isEmpty();
    }

    @Test
    void load_NullRecipeFieldsAreEmpty() throws IOException {
        write("recipes.json", "[{\"id\": \"r1\", \"title\": \"Plain Rice\", \"dietary_tags\": null, "
                + "\"health_benefits\": null, \"ingredients\": [null, {\"name\": \"Rice\"}], "
                + "\"instructions\": null}, null]");

        Corpus corpus = loader.load("file:" + dataDir);

        assertThat(corpus.getRecipes()).hasSize(1);
        Recipe recipe = corpus.getRecipes().get(0);
        assertThat(recipe.getDietaryTags()).isEmpty();
        assertThat(recipe.getHealthBenefits()).isEmpty();
        assertThat(recipe.getInstructions()).isEmpty();
        assertThat(recipe.ingredientNames()).containsExactly("rice");
    }

    private void write(String file, String json) throws IOException {
        Files.write(dataDir.resolve(file), json.getBytes(StandardCharsets.UTF_8));
    }
}
