package com.nutrimatch.generation;

import com.nutrimatch.model.entity.Ingredient;
import com.nutrimatch.model.entity.NutritionInfo;
import com.nutrimatch.model.entity.Recipe;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Synthesizes recipe records on demand.
 *
 * Output is a pure function of the request and the {@link Random} passed in:
 * the same seed yields the same recipes. The recipes are plausible-looking
 * rather than realistic.
 */
public class CandidateGenerator {

    static final String ID_PREFIX = "dynamic_recipe_";

    private static final Map<String, List<String>> CATEGORY_KEYWORDS = new LinkedHashMap<>();
    private static final Map<String, List<String>> CATEGORY_INGREDIENTS = new LinkedHashMap<>();
    private static final Map<String, int[]> CATEGORY_CALORIES = new LinkedHashMap<>();

    static {
        CATEGORY_KEYWORDS.put("breakfast", List.of("pancakes", "oatmeal", "smoothie", "eggs", "toast"));
        CATEGORY_KEYWORDS.put("lunch", List.of("salad", "sandwich", "soup", "pasta", "rice"));
        CATEGORY_KEYWORDS.put("dinner", List.of("chicken", "fish", "beef", "vegetarian", "vegan"));
        CATEGORY_KEYWORDS.put("dessert", List.of("cake", "cookies", "ice_cream", "pudding", "fruit"));
        CATEGORY_KEYWORDS.put("snack", List.of("nuts", "fruit", "yogurt", "chips", "smoothie"));

        CATEGORY_INGREDIENTS.put("breakfast", List.of("eggs", "milk", "flour", "butter", "sugar", "vanilla"));
        CATEGORY_INGREDIENTS.put("lunch", List.of("chicken", "rice", "vegetables", "olive oil", "garlic", "onion"));
        CATEGORY_INGREDIENTS.put("dinner", List.of("beef", "pasta", "tomatoes", "cheese", "herbs", "wine"));
        CATEGORY_INGREDIENTS.put("dessert", List.of("flour", "sugar", "eggs", "butter", "vanilla", "chocolate"));
        CATEGORY_INGREDIENTS.put("snack", List.of("nuts", "fruits", "yogurt", "honey", "cinnamon", "seeds"));

        CATEGORY_CALORIES.put("breakfast", new int[]{200, 400});
        CATEGORY_CALORIES.put("lunch", new int[]{300, 600});
        CATEGORY_CALORIES.put("dinner", new int[]{400, 800});
        CATEGORY_CALORIES.put("dessert", new int[]{150, 350});
        CATEGORY_CALORIES.put("snack", new int[]{100, 250});
    }

    private static final List<String> CUISINES = List.of(
            "mediterranean", "asian", "indian", "american", "italian",
            "mexican", "french", "thai", "japanese", "chinese");

    private static final List<String> DIETARY_OPTIONS = List.of(
            "vegetarian", "vegan", "gluten-free", "dairy-free", "keto",
            "low_sodium", "diabetes_friendly", "heart_healthy");

    private static final Set<String> MEATS = Set.of("beef", "chicken", "pork", "fish", "bacon");
    private static final Set<String> DAIRY = Set.of("milk", "cheese", "butter", "yogurt", "cream");
    private static final Set<String> EGGS = Set.of("eggs");
    private static final Set<String> GLUTEN = Set.of("flour", "pasta", "bread");

    private static final List<String> UNITS = List.of("cup", "tbsp", "tsp", "oz", "piece");
    private static final List<String> NOTES = List.of("", "fresh", "organic", "diced", "chopped");
    private static final List<String> DIFFICULTIES = List.of("easy", "medium", "hard");
    private static final List<String> STEPS = List.of(
            "Prepare all ingredients as specified",
            "Heat cooking surface to medium temperature",
            "Combine ingredients in the specified order",
            "Cook until desired consistency is reached",
            "Let rest for a few minutes before serving",
            "Garnish and serve immediately");

    /**
     * Generate {@code request.count} recipes.
     *
     * @param request query and dietary constraints
     * @param random source of randomness; seed it for reproducible output
     */
    public List<Recipe> generate(GenerationRequest request, Random random) {
        Set<String> restrictions = normalizeKeys(request.getDietaryRestrictions());
        List<String> keywords = keywords(request.getQuery(), random);

        List<Recipe> recipes = new ArrayList<>();
        for (int i = 0; i < request.getCount(); i++) {
            String category = pick(new ArrayList<>(CATEGORY_KEYWORDS.keySet()), random);
            List<String> recipeKeywords = keywords.subList(0, Math.min(3, keywords.size()));
            recipes.add(createRecipe(ID_PREFIX + (i + 1), category, recipeKeywords,
                    request.getDietaryRestrictions(), restrictions, request.getExcludedIngredients(), random));
        }
        return recipes;
    }

    private Recipe createRecipe(String id, String category, List<String> keywords,
                                Collection<String> requestedRestrictions, Set<String> restrictions,
                                Collection<String> excludedIngredients, Random random) {
        String cuisine = pick(CUISINES, random);

        List<String> available = new ArrayList<>();
        for (String option : DIETARY_OPTIONS) {
            if (!restrictions.contains(option)) {
                available.add(option);
            }
        }
        Collections.shuffle(available, random);
        Set<String> dietaryTags = new LinkedHashSet<>(available.subList(0, Math.min(2, available.size())));
        if (requestedRestrictions != null) {
            dietaryTags.addAll(requestedRestrictions);
        }

        List<Ingredient> ingredients = ingredients(category, restrictions, excludedIngredients, random);

        List<String> titleParts = new ArrayList<>();
        titleParts.add(titleCase(category));
        if (!keywords.isEmpty()) {
            titleParts.add(titleCase(keywords.get(0)));
        }
        titleParts.add(titleCase(cuisine) + " Style");

        return Recipe.builder()
                .id(id)
                .title(String.join(" ", titleParts))
                .description("A delicious " + category + " recipe with " + cuisine + " influences")
                .cuisineType(cuisine)
                .dietaryTags(new ArrayList<>(dietaryTags))
                .healthBenefits(healthBenefits(dietaryTags))
                .ingredients(ingredients)
                .instructions(new ArrayList<>(STEPS.subList(0, Math.min(STEPS.size(), ingredients.size() + 1))))
                .nutritionalInfo(nutrition(category, restrictions, random))
                .prepTime(between(random, 10, 45))
                .cookTime(between(random, 15, 60))
                .servings(between(random, 2, 6))
                .difficulty(pick(DIFFICULTIES, random))
                .source(Recipe.SOURCE_DYNAMIC)
                .build();
    }

    private List<Ingredient> ingredients(String category, Set<String> restrictions,
                                         Collection<String> excludedIngredients, Random random) {
        List<String> pool = new ArrayList<>(CATEGORY_INGREDIENTS.get(category));
        if (restrictions.contains("vegetarian") || restrictions.contains("vegan")) {
            pool.removeAll(MEATS);
        }
        if (restrictions.contains("vegan")) {
            pool.removeAll(DAIRY);
            pool.removeAll(EGGS);
            pool.remove("honey");
        }
        if (restrictions.contains("dairy-free")) {
            pool.removeAll(DAIRY);
        }
        if (restrictions.contains("gluten-free")) {
            pool.removeAll(GLUTEN);
        }
        if (excludedIngredients != null) {
            pool.removeIf(item -> isExcluded(item, excludedIngredients));
        }

        List<Ingredient> ingredients = new ArrayList<>();
        for (String name : pool.subList(0, Math.min(6, pool.size()))) {
            ingredients.add(Ingredient.builder()
                    .name(name)
                    .amount((double) between(random, 1, 4))
                    .unit(pick(UNITS, random))
                    .notes(pick(NOTES, random))
                    .build());
        }
        return ingredients;
    }

    private NutritionInfo nutrition(String category, Set<String> restrictions, Random random) {
        int[] range = CATEGORY_CALORIES.getOrDefault(category, new int[]{200, 500});
        int calories = between(random, range[0], range[1]);

        boolean keto = restrictions.contains("keto");
        double proteinRatio = restrictions.contains("vegetarian") ? 0.10 : 0.15;
        double carbRatio = keto ? 0.20 : 0.55;
        double fatRatio = keto ? 0.70 : 0.30;

        return NutritionInfo.builder()
                .calories((double) calories)
                .protein((double) (int) (calories * proteinRatio / 4))
                .carbohydrates((double) (int) (calories * carbRatio / 4))
                .fat((double) (int) (calories * fatRatio / 9))
                .fiber((double) between(random, 2, 8))
                .sodium((double) between(random, 200, 800))
                .sugar((double) between(random, 5, 25))
                .build();
    }

    private static List<String> healthBenefits(Set<String> dietaryTags) {
        Set<String> benefits = new LinkedHashSet<>();
        if (dietaryTags.contains("diabetes_friendly")) {
            benefits.addAll(Arrays.asList("diabetes_friendly", "blood_sugar_control"));
        }
        if (dietaryTags.contains("heart_healthy")) {
            benefits.addAll(Arrays.asList("heart_healthy", "cholesterol_lowering"));
        }
        if (dietaryTags.contains("vegetarian")) {
            benefits.add("plant_based");
        }
        if (dietaryTags.contains("vegan")) {
            benefits.addAll(Arrays.asList("plant_based", "dairy_free"));
        }
        return new ArrayList<>(benefits);
    }

    private static List<String> keywords(String query, Random random) {
        if (query == null || query.isBlank()) {
            return new ArrayList<>(pick(new ArrayList<>(CATEGORY_KEYWORDS.values()), random));
        }
        return Arrays.asList(query.toLowerCase(Locale.ROOT).trim().split("\\s+"));
    }

    private static boolean isExcluded(String item, Collection<String> excluded) {
        for (String entry : excluded) {
            if (entry != null && !entry.isBlank()) {
                String e = entry.toLowerCase(Locale.ROOT);
                if (item.equals(e) || item.contains(e) || e.contains(item)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static Set<String> normalizeKeys(Collection<String> restrictions) {
        Set<String> keys = new LinkedHashSet<>();
        if (restrictions != null) {
            for (String restriction : restrictions) {
                keys.add(restriction.toLowerCase(Locale.ROOT).replace('_', '-'));
            }
        }
        return keys;
    }

    private static String titleCase(String text) {
        StringBuilder out = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char c : text.toCharArray()) {
            if (Character.isLetter(c)) {
                out.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                out.append(c);
                startOfWord = true;
            }
        }
        return out.toString();
    }

    private static int between(Random random, int lowInclusive, int highInclusive) {
        return lowInclusive + random.nextInt(highInclusive - lowInclusive + 1);
    }

    private static <T> T pick(List<T> values, Random random) {
        return values.get(random.nextInt(values.size()));
    }
}
