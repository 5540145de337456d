package com.nutrimatch.substitution;

import com.nutrimatch.TestFixtures;
import com.nutrimatch.model.dto.NutritionOptimization;
import com.nutrimatch.model.dto.OptimizationSuggestion;
import com.nutrimatch.model.dto.SubstitutionOption;
import com.nutrimatch.model.dto.SuggestionType;
import com.nutrimatch.model.entity.Recipe;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for SubstitutionEngine.
 */
class SubstitutionEngineTest {

    private SubstitutionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SubstitutionEngine(TestFixtures.guidelines(), TestFixtures.nutritionalData());
    }

    @Test
    void findSubstitutions_DairyAllergyRanksWholeMilkLast() {
        List<SubstitutionOption> options = engine.findSubstitutions("milk", Set.of(), Set.of("dairy"));

        SubstitutionOption oatMilk = option(options, "oat milk");
        SubstitutionOption wholeMilk = option(options, "whole milk");
        assertThat(oatMilk.getCompatibilityScore()).isEqualTo(1.0);
        assertThat(oatMilk.getRatio()).isEqualTo("1:1");
        assertThat(oatMilk.getNotes()).isEqualTo("Creamy");
        assertThat(wholeMilk.getCompatibilityScore()).isEqualTo(0.0);
        assertThat(options.get(options.size() - 1).getSubstituteName()).isEqualTo("whole milk");
        assertThat(options.get(0).getSubstituteName()).isEqualTo("oat milk");
    }

    @Test
    void findSubstitutions_IsSortedByOverallScore() {
        List<SubstitutionOption> options = engine.findSubstitutions("milk", Set.of("vegan"), Set.of());

        assertThat(options).isNotEmpty();
        for (int i = 1; i < options.size(); i++) {
            assertThat(options.get(i - 1).getOverallScore())
                    .isGreaterThanOrEqualTo(options.get(i).getOverallScore());
        }
        for (SubstitutionOption option : options) {
            assertThat(option.getOverallScore()).isCloseTo(
                    0.7 * option.getCompatibilityScore() + 0.3 * option.getNutritionalSimilarity(), within(1e-9));
        }
    }

    @Test
    void findSubstitutions_NormalizesQuantityAndModifiers() {
        List<SubstitutionOption> options = engine.findSubstitutions("2 cups fresh Milk", Set.of(), Set.of());

        assertThat(options).extracting(SubstitutionOption::getSubstituteName).contains("oat milk", "whole milk");
        assertThat(options).allSatisfy(o -> assertThat(o.getOriginalIngredient()).isEqualTo("2 cups fresh Milk"));
    }

    @Test
    void findSubstitutions_FallbackSkipsDirectOptionsAndSelf() {
        List<SubstitutionOption> options = engine.findSubstitutions("milk", Set.of(), Set.of());

        assertThat(options).extracting(SubstitutionOption::getSubstituteName)
                .doesNotContain("milk")
                .doesNotHaveDuplicates();
        assertThat(options).filteredOn(o -> o.getNotes().equals("Nutritionally similar alternative"))
                .allSatisfy(o -> {
                    assertThat(o.getCompatibilityScore()).isGreaterThan(0.5);
                    assertThat(o.getNutritionalSimilarity()).isGreaterThan(0.3);
                });
    }

    @Test
    void findSubstitutions_UnknownIngredientReturnsEmpty() {
        assertThat(engine.findSubstitutions("unobtainium", Set.of(), Set.of())).isEmpty();
    }

    @Test
    void substituteCompatibility_AppliesPenaltyBonusAndAllergyVeto() {
        assertThat(engine.substituteCompatibility("whole milk", Set.of(), Set.of())).isEqualTo(1.0);
        assertThat(engine.substituteCompatibility("whole milk", Set.of("vegan"), Set.of())).isEqualTo(0.5);
        assertThat(engine.substituteCompatibility("oat milk", Set.of("vegan"), Set.of())).isEqualTo(1.0);
        assertThat(engine.substituteCompatibility("Whole Milk", Set.of(), Set.of("dairy"))).isEqualTo(0.0);
    }

    @Test
    void optimizeNutrition_CloseToTargetStillSuggestsBoosts() {
        Recipe recipe = TestFixtures.recipe("r9", "Protein Bowl", "", "american", List.of(), List.of(),
                List.of("rice"), TestFixtures.nutrition(400, 45, 40, 10, 5, 300, 4));

        NutritionOptimization optimization = engine.optimizeNutrition(recipe, Map.of("protein", 50.0),
                Set.of(), Set.of());

        assertThat(optimization.getOptimizationScore()).isEqualTo(1.0);
        assertThat(optimization.getSuggestions())
                .extracting(OptimizationSuggestion::getIngredient)
                .containsExactly("chicken breast", "lentils", "tofu");
        assertThat(optimization.getSuggestions())
                .allSatisfy(s -> assertThat(s.getType()).isEqualTo(SuggestionType.ADD_INGREDIENT));
        assertThat(optimization.getNutrientAnalysis().get("protein").getDifference()).isCloseTo(5.0, within(1e-9));
        assertThat(optimization.getNutrientAnalysis().get("protein").getSuggestionsCount()).isEqualTo(3);
    }

    @Test
    void optimizeNutrition_ExcessSuggestsLowerSubstitutes() {
        Recipe recipe = TestFixtures.recipe("r10", "Milk Drink", "", "american", List.of(), List.of(),
                List.of("whole milk"), TestFixtures.nutrition(200, 8, 12, 30, 0, 100, 12));

        NutritionOptimization optimization = engine.optimizeNutrition(recipe, Map.of("fat", 5.0),
                Set.of(), Set.of());

        assertThat(optimization.getSuggestions()).isNotEmpty();
        OptimizationSuggestion first = optimization.getSuggestions().get(0);
        assertThat(first.getType()).isEqualTo(SuggestionType.SUBSTITUTE_INGREDIENT);
        assertThat(first.getOriginalIngredient()).isEqualTo("whole milk");
        assertThat(first.getSubstituteIngredient()).isEqualTo("milk");
        assertThat(first.getReduction()).isCloseTo(2.3, within(1e-9));
        assertThat(optimization.getOptimizationScore()).isEqualTo(1.0);
    }

    @Test
    void optimizeNutrition_SmallDifferenceIsIgnored() {
        Recipe recipe = TestFixtures.lentilSoup();

        NutritionOptimization optimization = engine.optimizeNutrition(recipe, Map.of("protein", 18.05),
                Set.of(), Set.of());

        assertThat(optimization.getSuggestions()).isEmpty();
        assertThat(optimization.getNutrientAnalysis()).isEmpty();
    }

    @Test
    void optimizationScore_Bands() {
        assertThat(SubstitutionEngine.optimizationScore(TestFixtures.nutrition(0, 30, 0, 0, 0, 0, 0),
                Map.of("protein", 50.0))).isEqualTo(0.7);
        assertThat(SubstitutionEngine.optimizationScore(TestFixtures.nutrition(0, 10, 0, 0, 0, 0, 0),
                Map.of("protein", 50.0))).isEqualTo(0.3);
        assertThat(SubstitutionEngine.optimizationScore(TestFixtures.nutrition(0, 10, 0, 0, 0, 0, 0),
                Map.of())).isEqualTo(1.0);
    }

    @Test
    void nutritionalSimilarity_IdenticalIsOneAndDisjointIsZero() {
        assertThat(SubstitutionEngine.nutritionalSimilarity(
                TestFixtures.nutrition(100, 10, 10, 10, 10, 0, 0),
                TestFixtures.nutrition(100, 10, 10, 10, 10, 0, 0))).isCloseTo(1.0, within(1e-9));
        assertThat(SubstitutionEngine.nutritionalSimilarity(
                TestFixtures.nutrition(100, 0, 0, 0, 0, 0, 0),
                TestFixtures.nutrition(0, 10, 0, 0, 0, 0, 0))).isEqualTo(0.0);
    }

    private static SubstitutionOption option(List<SubstitutionOption> options, String name) {
        return options.stream()
                .filter(o -> o.getSubstituteName().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No option " + name));
    }
}
