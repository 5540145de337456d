package com.nutrimatch.analysis;

import com.nutrimatch.model.dto.AllergyCheck;
import com.nutrimatch.model.dto.CompatibilityResult;
import com.nutrimatch.model.dto.DimensionResult;
import com.nutrimatch.model.dto.HealthCheck;
import com.nutrimatch.model.dto.RestrictionCheck;
import com.nutrimatch.model.entity.AllergyRule;
import com.nutrimatch.model.entity.DietaryGuidelines;
import com.nutrimatch.model.entity.HealthConditionRule;
import com.nutrimatch.model.entity.NutritionInfo;
import com.nutrimatch.model.entity.Recipe;
import com.nutrimatch.model.entity.RestrictionRule;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores recipes against dietary restrictions, allergies and health conditions.
 */
@Slf4j
public class CompatibilityAnalyzer {

    public static final double RESTRICTION_WEIGHT = 0.4;
    public static final double ALLERGY_WEIGHT = 0.4;
    public static final double HEALTH_WEIGHT = 0.2;
    public static final double COMPATIBLE_THRESHOLD = 0.7;
    public static final double HEALTH_COMPATIBLE_THRESHOLD = 0.6;

    private static final double MISSING_TAG_SCORE = 0.5;
    private static final double BENEFIT_WEIGHT = 0.6;
    private static final double NUTRIENT_WEIGHT = 0.4;
    private static final double AVOID_NUTRIENT_PENALTY = 0.2;
    private static final double RECOMMENDED_NUTRIENT_BONUS = 0.1;

    private final DietaryGuidelines guidelines;
    private final IngredientMatcher matcher;

    public CompatibilityAnalyzer(DietaryGuidelines guidelines, IngredientMatcher matcher) {
        this.guidelines = guidelines != null ? guidelines : DietaryGuidelines.empty();
        this.matcher = matcher;
    }

    /**
     * Analyze one recipe against a user's constraints.
     *
     * @param recipe recipe to check
     * @param restrictions dietary restrictions, e.g. "vegan"
     * @param allergies allergies, e.g. "peanuts"
     * @param healthConditions health conditions, e.g. "diabetes"
     * @return fresh result; overall score is 0 when any restriction or allergy dimension scores 0
     */
    public CompatibilityResult analyze(Recipe recipe,
                                       Collection<String> restrictions,
                                       Collection<String> allergies,
                                       Collection<String> healthConditions) {
        DimensionResult<RestrictionCheck> restrictionResult = checkRestrictions(recipe, orEmpty(restrictions));
        DimensionResult<AllergyCheck> allergyResult = checkAllergies(recipe, orEmpty(allergies));
        DimensionResult<HealthCheck> healthResult = checkHealthConditions(recipe, orEmpty(healthConditions));

        double overall = fuse(restrictionResult.getScore(), allergyResult.getScore(), healthResult.getScore());
        log.debug("Compatibility of '{}': restriction={}, allergy={}, health={}, overall={}",
                recipe.getTitle(), restrictionResult.getScore(), allergyResult.getScore(),
                healthResult.getScore(), overall);

        return CompatibilityResult.builder()
                .overallCompatible(overall >= COMPATIBLE_THRESHOLD)
                .overallScore(overall)
                .restrictionCompatibility(restrictionResult)
                .allergyCompatibility(allergyResult)
                .healthCompatibility(healthResult)
                .issues(identifyIssues(restrictionResult, allergyResult, healthResult))
                .suggestions(generateSuggestions(restrictionResult, allergyResult, healthResult))
                .build();
    }

    /**
     * Recipes whose overall score reaches {@code minScore}, best first.
     */
    public List<Map.Entry<Recipe, CompatibilityResult>> compatibleRecipes(Collection<Recipe> recipes,
                                                                         Collection<String> restrictions,
                                                                         Collection<String> allergies,
                                                                         Collection<String> healthConditions,
                                                                         double minScore) {
        List<Map.Entry<Recipe, CompatibilityResult>> compatible = new ArrayList<>();
        for (Recipe recipe : recipes) {
            CompatibilityResult result = analyze(recipe, restrictions, allergies, healthConditions);
            if (result.getOverallScore() >= minScore) {
                compatible.add(Map.entry(recipe, result));
            }
        }
        compatible.sort(Comparator.comparingDouble(
                (Map.Entry<Recipe, CompatibilityResult> e) -> e.getValue().getOverallScore()).reversed());
        return compatible;
    }

    static double fuse(double restrictionScore, double allergyScore, double healthScore) {
        // hard veto: a failed allergy or restriction cannot be compensated
        if (allergyScore == 0.0 || restrictionScore == 0.0) {
            return 0.0;
        }
        double overall = restrictionScore * RESTRICTION_WEIGHT
                + allergyScore * ALLERGY_WEIGHT
                + healthScore * HEALTH_WEIGHT;
        return clamp(overall);
    }

    private DimensionResult<RestrictionCheck> checkRestrictions(Recipe recipe, Collection<String> restrictions) {
        if (restrictions.isEmpty()) {
            return DimensionResult.neutral();
        }
        List<String> ingredients = recipe.ingredientNames();
        List<String> tags = orEmptyList(recipe.getDietaryTags());

        Map<String, RestrictionCheck> results = new LinkedHashMap<>();
        for (String restriction : restrictions) {
            RestrictionRule rule = guidelines.restriction(restriction);
            List<String> excluded = orEmptyList(rule.getExcludedIngredients());
            boolean hasTag = tags.contains(restriction);
            List<String> conflicts = findConflicts(ingredients, excluded);

            double score;
            if (!conflicts.isEmpty()) {
                score = 0.0;
            } else if (!hasTag) {
                score = MISSING_TAG_SCORE;
            } else {
                score = 1.0;
            }

            results.put(restriction, RestrictionCheck.builder()
                    .compatible(hasTag && conflicts.isEmpty())
                    .score(score)
                    .hasRestrictionTag(hasTag)
                    .conflictingIngredients(conflicts)
                    .excludedIngredients(excluded)
                    .build());
        }

        double score = mean(results.values().stream().mapToDouble(RestrictionCheck::getScore).toArray());
        return DimensionResult.<RestrictionCheck>builder()
                .compatible(score >= COMPATIBLE_THRESHOLD)
                .score(score)
                .results(results)
                .build();
    }

    private DimensionResult<AllergyCheck> checkAllergies(Recipe recipe, Collection<String> allergies) {
        if (allergies.isEmpty()) {
            return DimensionResult.neutral();
        }
        List<String> ingredients = recipe.ingredientNames();

        Map<String, AllergyCheck> results = new LinkedHashMap<>();
        for (String allergy : allergies) {
            AllergyRule rule = guidelines.allergy(allergy);
            List<String> incompatible = orEmptyList(rule.getIncompatibleIngredients());
            List<String> conflicts = findConflicts(ingredients, incompatible);
            boolean compatible = conflicts.isEmpty();

            results.put(allergy, AllergyCheck.builder()
                    .compatible(compatible)
                    .score(compatible ? 1.0 : 0.0)
                    .conflictingIngredients(conflicts)
                    .incompatibleIngredients(incompatible)
                    .build());
        }

        double score = mean(results.values().stream().mapToDouble(AllergyCheck::getScore).toArray());
        return DimensionResult.<AllergyCheck>builder()
                .compatible(score >= COMPATIBLE_THRESHOLD)
                .score(score)
                .results(results)
                .build();
    }

    private DimensionResult<HealthCheck> checkHealthConditions(Recipe recipe, Collection<String> conditions) {
        if (conditions.isEmpty()) {
            return DimensionResult.neutral();
        }
        List<String> benefits = orEmptyList(recipe.getHealthBenefits());
        NutritionInfo nutrition = recipe.nutritionOrEmpty();

        Map<String, HealthCheck> results = new LinkedHashMap<>();
        for (String condition : conditions) {
            HealthConditionRule rule = guidelines.healthCondition(condition);
            List<String> recommendedBenefits = orEmptyList(rule.getRecommendedBenefits());
            List<String> avoid = orEmptyList(rule.getAvoidNutrients());
            List<String> recommended = orEmptyList(rule.getRecommendedNutrients());

            boolean hasBenefit = recommendedBenefits.stream().anyMatch(benefits::contains);
            double nutritionalScore = nutrientContentScore(nutrition, recommended, avoid);
            double score = (hasBenefit ? BENEFIT_WEIGHT : 0.0) + nutritionalScore * NUTRIENT_WEIGHT;

            results.put(condition, HealthCheck.builder()
                    .compatible(score >= HEALTH_COMPATIBLE_THRESHOLD)
                    .score(score)
                    .hasRecommendedBenefits(hasBenefit)
                    .nutritionalScore(nutritionalScore)
                    .recommendedBenefits(recommendedBenefits)
                    .avoidNutrients(avoid)
                    .recommendedNutrients(recommended)
                    .build());
        }

        double score = mean(results.values().stream().mapToDouble(HealthCheck::getScore).toArray());
        return DimensionResult.<HealthCheck>builder()
                .compatible(score >= HEALTH_COMPATIBLE_THRESHOLD)
                .score(score)
                .results(results)
                .build();
    }

    static double nutrientContentScore(NutritionInfo nutrition, List<String> recommended, List<String> avoid) {
        double score = 1.0;
        for (String nutrient : avoid) {
            if (nutrition.hasPositive(nutrient)) {
                score -= AVOID_NUTRIENT_PENALTY;
            }
        }
        for (String nutrient : recommended) {
            if (nutrition.hasPositive(nutrient)) {
                score += RECOMMENDED_NUTRIENT_BONUS;
            }
        }
        return clamp(score);
    }

    private List<String> findConflicts(List<String> ingredients, List<String> patterns) {
        List<String> conflicts = new ArrayList<>();
        for (String ingredient : ingredients) {
            for (String pattern : patterns) {
                if (pattern != null && matcher.matches(pattern.toLowerCase(Locale.ROOT), ingredient)) {
                    conflicts.add(ingredient);
                    break;
                }
            }
        }
        return conflicts;
    }

    private List<String> identifyIssues(DimensionResult<RestrictionCheck> restrictions,
                                        DimensionResult<AllergyCheck> allergies,
                                        DimensionResult<HealthCheck> health) {
        List<String> issues = new ArrayList<>();
        restrictions.getResults().forEach((restriction, check) -> {
            if (check.isCompatible()) {
                return;
            }
            if (!check.getConflictingIngredients().isEmpty()) {
                issues.add("Contains ingredients incompatible with " + restriction + ": "
                        + String.join(", ", check.getConflictingIngredients()));
            } else if (!check.isHasRestrictionTag()) {
                issues.add("Not tagged as " + restriction);
            }
        });
        allergies.getResults().forEach((allergy, check) -> {
            if (!check.isCompatible()) {
                issues.add("Contains ingredients that may cause " + allergy + " reaction: "
                        + String.join(", ", check.getConflictingIngredients()));
            }
        });
        health.getResults().forEach((condition, check) -> {
            if (check.isCompatible()) {
                return;
            }
            if (!check.isHasRecommendedBenefits()) {
                issues.add("Not optimized for " + condition);
            }
            if (check.getNutritionalScore() < 0.5) {
                issues.add("Nutritional content not ideal for " + condition);
            }
        });
        return issues;
    }

    private List<String> generateSuggestions(DimensionResult<RestrictionCheck> restrictions,
                                             DimensionResult<AllergyCheck> allergies,
                                             DimensionResult<HealthCheck> health) {
        List<String> suggestions = new ArrayList<>();
        restrictions.getResults().forEach((restriction, check) -> {
            if (check.isCompatible()) {
                return;
            }
            if (!check.getConflictingIngredients().isEmpty()) {
                suggestions.add("Consider substituting " + String.join(", ", check.getConflictingIngredients())
                        + " for " + restriction + "-friendly alternatives");
            } else if (!check.isHasRestrictionTag()) {
                suggestions.add("Recipe may be compatible with " + restriction + " but not explicitly tagged");
            }
        });
        allergies.getResults().forEach((allergy, check) -> {
            if (!check.isCompatible()) {
                suggestions.add("Substitute " + String.join(", ", check.getConflictingIngredients())
                        + " to avoid " + allergy + " triggers");
            }
        });
        health.getResults().forEach((condition, check) -> {
            if (check.isCompatible()) {
                return;
            }
            if (!check.isHasRecommendedBenefits()) {
                suggestions.add("Consider adding ingredients beneficial for " + condition);
            }
            if (check.getNutritionalScore() < 0.5) {
                suggestions.add("Adjust portion size or ingredients for better " + condition + " management");
            }
        });
        return suggestions;
    }

    private static double mean(double[] values) {
        if (values.length == 0) {
            return 1.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static <T> List<T> orEmptyList(List<T> values) {
        return values != null ? values : List.of();
    }

    private static Collection<String> orEmpty(Collection<String> values) {
        return values != null ? values : List.of();
    }
}
