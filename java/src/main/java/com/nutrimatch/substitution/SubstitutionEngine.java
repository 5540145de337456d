package com.nutrimatch.substitution;

import com.nutrimatch.model.dto.NutrientAnalysis;
import com.nutrimatch.model.dto.NutritionOptimization;
import com.nutrimatch.model.dto.OptimizationSuggestion;
import com.nutrimatch.model.dto.SubstitutionOption;
import com.nutrimatch.model.dto.SuggestionType;
import com.nutrimatch.model.entity.DietaryGuidelines;
import com.nutrimatch.model.entity.Ingredient;
import com.nutrimatch.model.entity.IngredientProfile;
import com.nutrimatch.model.entity.NutritionInfo;
import com.nutrimatch.model.entity.NutritionalData;
import com.nutrimatch.model.entity.Recipe;
import com.nutrimatch.model.entity.Substitute;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Finds ingredient substitutes and suggests changes that move a recipe
 * toward nutrient targets.
 */
@Slf4j
public class SubstitutionEngine {

    static final List<String> SIMILARITY_NUTRIENTS = List.of("calories", "protein", "carbohydrates", "fat", "fiber");

    private static final double COMPATIBILITY_WEIGHT = 0.7;
    private static final double SIMILARITY_WEIGHT = 0.3;
    private static final double FALLBACK_MIN_COMPATIBILITY = 0.5;
    private static final double FALLBACK_MIN_SIMILARITY = 0.3;
    private static final double BOOST_MIN_COMPATIBILITY = 0.7;
    private static final double EXCLUDED_PENALTY = 0.5;
    private static final double TAGGED_BONUS = 0.2;
    private static final double SIGNIFICANT_DIFFERENCE = 0.1;
    private static final int MAX_SUGGESTIONS_PER_NUTRIENT = 3;
    private static final int SUBSTITUTES_PER_INGREDIENT = 2;
    private static final String DEFAULT_RATIO = "1:1";
    private static final String FALLBACK_NOTES = "Nutritionally similar alternative";

    private final DietaryGuidelines guidelines;
    private final NutritionalData nutritionalData;

    public SubstitutionEngine(DietaryGuidelines guidelines, NutritionalData nutritionalData) {
        this.guidelines = guidelines != null ? guidelines : DietaryGuidelines.empty();
        this.nutritionalData = nutritionalData != null ? nutritionalData : NutritionalData.empty();
    }

    /**
     * Ranked substitutes for an ingredient.
     *
     * @param ingredient ingredient as written, e.g. "1 cup fresh milk"
     * @param restrictions dietary restrictions to respect
     * @param allergies allergies to respect
     * @return guideline substitutes and database look-alikes, best overall score first
     */
    public List<SubstitutionOption> findSubstitutions(String ingredient,
                                                      Collection<String> restrictions,
                                                      Collection<String> allergies) {
        String normalized = IngredientNormalizer.normalize(ingredient);
        NutritionInfo originalNutrition = nutritionOf(normalized);

        List<SubstitutionOption> options = new ArrayList<>();
        Set<String> offered = new HashSet<>();
        for (Substitute substitute : guidelines.substitution(normalized).getSubstitutes()) {
            if (substitute == null || substitute.getName() == null || substitute.getName().isBlank()) {
                continue;
            }
            double compatibility = substituteCompatibility(substitute.getName(), restrictions, allergies);
            double similarity = nutritionalSimilarity(originalNutrition, nutritionOf(substitute.getName()));
            options.add(option(ingredient, substitute.getName(),
                    substitute.getRatio() != null ? substitute.getRatio() : DEFAULT_RATIO,
                    substitute.getNotes() != null ? substitute.getNotes() : "",
                    compatibility, similarity));
            offered.add(substitute.getName().toLowerCase(Locale.ROOT));
        }

        for (Map.Entry<String, IngredientProfile> entry : nutritionalData.getIngredients().entrySet()) {
            String candidate = entry.getKey();
            if (candidate.equalsIgnoreCase(normalized) || offered.contains(candidate.toLowerCase(Locale.ROOT))) {
                continue;
            }
            double compatibility = substituteCompatibility(candidate, restrictions, allergies);
            if (compatibility <= FALLBACK_MIN_COMPATIBILITY) {
                continue;
            }
            double similarity = nutritionalSimilarity(originalNutrition, entry.getValue().getNutrition());
            if (similarity > FALLBACK_MIN_SIMILARITY) {
                options.add(option(ingredient, candidate, DEFAULT_RATIO, FALLBACK_NOTES, compatibility, similarity));
            }
        }

        options.sort(Comparator.comparingDouble(SubstitutionOption::getOverallScore).reversed());
        log.debug("Found {} substitutions for '{}' (normalized '{}')", options.size(), ingredient, normalized);
        return options;
    }

    /**
     * How well a substitute fits the user's constraints, in [0, 1].
     * Starts at 1.0, loses 0.5 per restriction that excludes it, gains 0.2 per
     * restriction tag it carries, and drops to 0 on any allergy listing it.
     */
    public double substituteCompatibility(String substitute,
                                          Collection<String> restrictions,
                                          Collection<String> allergies) {
        double score = 1.0;
        boolean noRestrictions = restrictions == null || restrictions.isEmpty();
        boolean noAllergies = allergies == null || allergies.isEmpty();
        if (noRestrictions && noAllergies) {
            return score;
        }

        String name = substitute.toLowerCase(Locale.ROOT);
        IngredientProfile profile = nutritionalData.profile(substitute);
        List<String> tags = profile != null && profile.getDietaryTags() != null ? profile.getDietaryTags() : List.of();

        if (!noRestrictions) {
            for (String restriction : restrictions) {
                if (containsIgnoreCase(guidelines.restriction(restriction).getExcludedIngredients(), name)) {
                    score -= EXCLUDED_PENALTY;
                } else if (tags.contains(restriction)) {
                    score += TAGGED_BONUS;
                }
            }
        }
        if (!noAllergies) {
            for (String allergy : allergies) {
                if (containsIgnoreCase(guidelines.allergy(allergy).getIncompatibleIngredients(), name)) {
                    return 0.0;
                }
            }
        }
        return clamp(score);
    }

    /**
     * Mean of {@code 1 - |a - b| / max(a, b)} over the macro nutrients known and
     * positive on both sides; 0 when nothing can be compared.
     */
    public static double nutritionalSimilarity(NutritionInfo first, NutritionInfo second) {
        if (first == null || second == null) {
            return 0.0;
        }
        double sum = 0.0;
        int shared = 0;
        for (String nutrient : SIMILARITY_NUTRIENTS) {
            double a = first.nutrientOrZero(nutrient);
            double b = second.nutrientOrZero(nutrient);
            if (a > 0 && b > 0) {
                sum += 1.0 - Math.abs(a - b) / Math.max(a, b);
                shared++;
            }
        }
        return shared == 0 ? 0.0 : sum / shared;
    }

    /**
     * Compare a recipe's nutrition with targets and suggest additions or swaps.
     *
     * @param recipe recipe to optimise
     * @param goals nutrient name to target value
     * @param restrictions dietary restrictions suggestions must respect
     * @param allergies allergies suggestions must respect
     * @return banded score plus suggestions for every target off by more than 0.1
     */
    public NutritionOptimization optimizeNutrition(Recipe recipe,
                                                   Map<String, Double> goals,
                                                   Collection<String> restrictions,
                                                   Collection<String> allergies) {
        NutritionInfo current = recipe.nutritionOrEmpty();
        Map<String, Double> targets = goals != null ? goals : Map.of();

        List<OptimizationSuggestion> suggestions = new ArrayList<>();
        Map<String, NutrientAnalysis> analysis = new LinkedHashMap<>();

        for (Map.Entry<String, Double> goal : targets.entrySet()) {
            if (goal.getValue() == null) {
                continue;
            }
            String nutrient = goal.getKey();
            double target = goal.getValue();
            double currentValue = current.nutrientOrZero(nutrient);
            double difference = target - currentValue;
            if (Math.abs(difference) <= SIGNIFICANT_DIFFERENCE) {
                continue;
            }

            List<OptimizationSuggestion> found = difference > 0
                    ? boostSuggestions(nutrient, restrictions, allergies)
                    : reductionSuggestions(recipe, nutrient, restrictions, allergies);
            suggestions.addAll(found);
            analysis.put(nutrient, NutrientAnalysis.builder()
                    .current(currentValue)
                    .target(target)
                    .difference(difference)
                    .suggestionsCount(found.size())
                    .build());
        }

        return NutritionOptimization.builder()
                .optimizationScore(optimizationScore(current, targets))
                .suggestions(suggestions)
                .nutrientAnalysis(analysis)
                .currentNutrition(current.asMap())
                .targetNutrition(new LinkedHashMap<>(targets))
                .build();
    }

    /**
     * Mean over targets above zero of 1.0 (at least 80% reached), 0.7 (at least 50%)
     * or 0.3 (below). 1.0 when there is nothing to score.
     */
    public static double optimizationScore(NutritionInfo current, Map<String, Double> targets) {
        if (targets == null || targets.isEmpty()) {
            return 1.0;
        }
        double sum = 0.0;
        int counted = 0;
        for (Map.Entry<String, Double> goal : targets.entrySet()) {
            Double target = goal.getValue();
            if (target == null || target <= 0) {
                continue;
            }
            double value = current.nutrientOrZero(goal.getKey());
            if (value >= target * 0.8) {
                sum += 1.0;
            } else if (value >= target * 0.5) {
                sum += 0.7;
            } else {
                sum += 0.3;
            }
            counted++;
        }
        return counted == 0 ? 1.0 : sum / counted;
    }

    private List<OptimizationSuggestion> boostSuggestions(String nutrient,
                                                          Collection<String> restrictions,
                                                          Collection<String> allergies) {
        List<OptimizationSuggestion> suggestions = new ArrayList<>();
        for (Map.Entry<String, IngredientProfile> entry : nutritionalData.getIngredients().entrySet()) {
            double value = entry.getValue().nutritionOrEmpty().nutrientOrZero(nutrient);
            if (value <= 0) {
                continue;
            }
            double compatibility = substituteCompatibility(entry.getKey(), restrictions, allergies);
            if (compatibility > BOOST_MIN_COMPATIBILITY) {
                suggestions.add(OptimizationSuggestion.builder()
                        .type(SuggestionType.ADD_INGREDIENT)
                        .ingredient(entry.getKey())
                        .nutrient(nutrient)
                        .nutrientValue(value)
                        .compatibilityScore(compatibility)
                        .suggestion("Add " + entry.getKey() + " to boost " + nutrient)
                        .build());
            }
        }
        suggestions.sort(Comparator.comparingDouble(OptimizationSuggestion::getNutrientValue).reversed());
        return top(suggestions);
    }

    private List<OptimizationSuggestion> reductionSuggestions(Recipe recipe,
                                                              String nutrient,
                                                              Collection<String> restrictions,
                                                              Collection<String> allergies) {
        List<OptimizationSuggestion> suggestions = new ArrayList<>();
        if (recipe.getIngredients() == null) {
            return suggestions;
        }
        for (Ingredient ingredient : recipe.getIngredients()) {
            if (ingredient == null || ingredient.getName() == null) {
                continue;
            }
            String name = ingredient.getName();
            double value = nutritionOf(IngredientNormalizer.normalize(name)).nutrientOrZero(nutrient);
            if (value <= 0) {
                continue;
            }
            List<SubstitutionOption> options = findSubstitutions(name, restrictions, allergies);
            for (SubstitutionOption option : options.subList(0, Math.min(SUBSTITUTES_PER_INGREDIENT, options.size()))) {
                double substituteValue = nutritionOf(option.getSubstituteName()).nutrientOrZero(nutrient);
                if (substituteValue < value) {
                    suggestions.add(OptimizationSuggestion.builder()
                            .type(SuggestionType.SUBSTITUTE_INGREDIENT)
                            .originalIngredient(name)
                            .substituteIngredient(option.getSubstituteName())
                            .nutrient(nutrient)
                            .reduction(value - substituteValue)
                            .compatibilityScore(option.getCompatibilityScore())
                            .suggestion("Substitute " + name + " with " + option.getSubstituteName()
                                    + " to reduce " + nutrient)
                            .build());
                }
            }
        }
        suggestions.sort(Comparator.comparingDouble(OptimizationSuggestion::getReduction).reversed());
        return top(suggestions);
    }

    private NutritionInfo nutritionOf(String ingredient) {
        IngredientProfile profile = nutritionalData.profile(ingredient);
        if (profile == null && ingredient != null) {
            profile = nutritionalData.profile(ingredient.toLowerCase(Locale.ROOT));
        }
        return profile != null ? profile.nutritionOrEmpty() : new NutritionInfo();
    }

    private static SubstitutionOption option(String original, String substitute, String ratio, String notes,
                                             double compatibility, double similarity) {
        return SubstitutionOption.builder()
                .originalIngredient(original)
                .substituteName(substitute)
                .ratio(ratio)
                .notes(notes)
                .compatibilityScore(compatibility)
                .nutritionalSimilarity(similarity)
                .overallScore(compatibility * COMPATIBILITY_WEIGHT + similarity * SIMILARITY_WEIGHT)
                .build();
    }

    private static List<OptimizationSuggestion> top(List<OptimizationSuggestion> suggestions) {
        return new ArrayList<>(suggestions.subList(0, Math.min(MAX_SUGGESTIONS_PER_NUTRIENT, suggestions.size())));
    }

    private static boolean containsIgnoreCase(List<String> values, String name) {
        if (values == null) {
            return false;
        }
        for (String value : values) {
            if (value != null && value.equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
