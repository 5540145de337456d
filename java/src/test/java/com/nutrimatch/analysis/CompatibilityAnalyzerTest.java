package com.nutrimatch.analysis;

import com.nutrimatch.TestFixtures;
import com.nutrimatch.model.dto.CompatibilityResult;
import com.nutrimatch.model.entity.AllergyRule;
import com.nutrimatch.model.entity.DietaryGuidelines;
import com.nutrimatch.model.entity.Recipe;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for CompatibilityAnalyzer.
 */
class CompatibilityAnalyzerTest {

    private CompatibilityAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new CompatibilityAnalyzer(TestFixtures.guidelines(), new FuzzyIngredientMatcher());
    }

    @Test
    void analyze_SoyAllergyVetoesTofuRecipe() {
        CompatibilityResult result = analyzer.analyze(TestFixtures.tofuStirFry(),
                Set.of(), Set.of("soy"), Set.of());

        assertThat(result.isOverallCompatible()).isFalse();
        assertThat(result.getOverallScore()).isEqualTo(0.0);
        assertThat(result.getAllergyCompatibility().getScore()).isEqualTo(0.0);
        assertThat(result.getAllergyCompatibility().getResults().get("soy").getConflictingIngredients())
                .containsExactly("tofu", "soy sauce");
        assertThat(result.getIssues())
                .contains("Contains ingredients that may cause soy reaction: tofu, soy sauce");
        assertThat(result.getSuggestions())
                .contains("Substitute tofu, soy sauce to avoid soy triggers");
    }

    @Test
    void analyze_UpperCaseGuidelinePatternsMatchInAnyLocale() {
        DietaryGuidelines guidelines = DietaryGuidelines.builder()
                .allergies(Map.of("poultry", AllergyRule.builder().incompatibleIngredients(List.of("CHICKEN")).build()))
                .build();
        CompatibilityAnalyzer poultryAnalyzer = new CompatibilityAnalyzer(guidelines, new FuzzyIngredientMatcher());
        Locale defaultLocale = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            CompatibilityResult result = poultryAnalyzer.analyze(TestFixtures.chickenSalad(),
                    Set.of(), Set.of("poultry"), Set.of());

            assertThat(result.getAllergyCompatibility().getScore()).isEqualTo(0.0);
            assertThat(result.isOverallCompatible()).isFalse();
        } finally {
            Locale.setDefault(defaultLocale);
        }
    }

    @Test
    void analyze_NoConstraintsIsFullyCompatible() {
        CompatibilityResult result = analyzer.analyze(TestFixtures.chickenSalad(), null, null, null);

        assertThat(result.isOverallCompatible()).isTrue();
        assertThat(result.getOverallScore()).isCloseTo(1.0, within(1e-9));
        assertThat(result.getIssues()).isEmpty();
        assertThat(result.getSuggestions()).isEmpty();
    }

    @Test
    void analyze_ExcludedIngredientVetoesRestriction() {
        CompatibilityResult result = analyzer.analyze(TestFixtures.chickenSalad(),
                Set.of("vegan"), Set.of(), Set.of());

        assertThat(result.getRestrictionCompatibility().getScore()).isEqualTo(0.0);
        assertThat(result.getOverallScore()).isEqualTo(0.0);
        assertThat(result.getRestrictionCompatibility().getResults().get("vegan").getConflictingIngredients())
                .containsExactly("chicken breast", "cheese");
    }

    @Test
    void analyze_UntaggedButCleanRecipeScoresHalfOnRestriction() {
        CompatibilityResult result = analyzer.analyze(TestFixtures.lentilSoup(),
                Set.of("vegan"), Set.of(), Set.of());

        assertThat(result.getRestrictionCompatibility().getScore()).isEqualTo(0.5);
        assertThat(result.getRestrictionCompatibility().isCompatible()).isFalse();
        // 0.4 * 0.5 + 0.4 * 1.0 + 0.2 * 1.0
        assertThat(result.getOverallScore()).isCloseTo(0.8, within(1e-9));
        assertThat(result.isOverallCompatible()).isTrue();
        assertThat(result.getIssues()).containsExactly("Not tagged as vegan");
    }

    @Test
    void analyze_HealthConditionCombinesBenefitAndNutrients() {
        CompatibilityResult lentils = analyzer.analyze(TestFixtures.lentilSoup(),
                Set.of(), Set.of(), Set.of("diabetes"));
        CompatibilityResult chicken = analyzer.analyze(TestFixtures.chickenSalad(),
                Set.of(), Set.of(), Set.of("diabetes"));

        assertThat(lentils.getHealthCompatibility().getScore()).isCloseTo(1.0, within(1e-9));
        // no benefit, sugar present, protein present, no fiber: 0.4 * 0.9
        assertThat(chicken.getHealthCompatibility().getScore()).isCloseTo(0.36, within(1e-9));
        assertThat(chicken.getHealthCompatibility().isCompatible()).isFalse();
        assertThat(chicken.getOverallScore()).isCloseTo(0.872, within(1e-9));
        assertThat(chicken.getIssues()).contains("Not optimized for diabetes");
    }

    @Test
    void analyze_UnknownKeysAreTreatedAsEmptyRules() {
        CompatibilityResult result = analyzer.analyze(TestFixtures.tofuStirFry(),
                Set.of("paleo"), Set.of("sesame"), Set.of("gout"));

        assertThat(result.getRestrictionCompatibility().getScore()).isEqualTo(0.5);
        assertThat(result.getAllergyCompatibility().getScore()).isEqualTo(1.0);
        assertThat(result.getOverallScore()).isBetween(0.0, 1.0);
    }

    @Test
    void compatibleRecipes_FiltersByMinimumAndSortsDescending() {
        List<Recipe> recipes = TestFixtures.recipes();

        List<Map.Entry<Recipe, CompatibilityResult>> compatible = analyzer.compatibleRecipes(recipes,
                Set.of("vegetarian"), Set.of("dairy"), Set.of(), 0.7);

        assertThat(compatible).extracting(e -> e.getKey().getTitle())
                .containsExactly("Tofu Stir Fry", "Lentil Spinach Soup");
        assertThat(compatible).allSatisfy(e -> assertThat(e.getValue().getOverallScore()).isGreaterThanOrEqualTo(0.7));
    }

    @Test
    void fuse_ClampsAndVetoes() {
        assertThat(CompatibilityAnalyzer.fuse(1.0, 0.0, 1.0)).isEqualTo(0.0);
        assertThat(CompatibilityAnalyzer.fuse(0.0, 1.0, 1.0)).isEqualTo(0.0);
        assertThat(CompatibilityAnalyzer.fuse(1.0, 1.0, 1.0)).isCloseTo(1.0, within(1e-9));
    }
}
