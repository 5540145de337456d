package com.nutrimatch.service;

import com.nutrimatch.analysis.CompatibilityAnalyzer;
import com.nutrimatch.config.NutriMatchProperties;
import com.nutrimatch.embedding.EncodedCorpus;
import com.nutrimatch.embedding.TextEmbedder;
import com.nutrimatch.embedding.Vocabulary;
import com.nutrimatch.exception.ResourceNotFoundException;
import com.nutrimatch.generation.GenerationRequest;
import com.nutrimatch.generation.RecipeIntegrator;
import com.nutrimatch.index.IndexSearchResult;
import com.nutrimatch.index.VectorIndex;
import com.nutrimatch.index.filter.FieldConstraint;
import com.nutrimatch.index.filter.MetadataFilter;
import com.nutrimatch.model.dto.CompatibilityResult;
import com.nutrimatch.model.dto.Coverage;
import com.nutrimatch.model.dto.FiltersApplied;
import com.nutrimatch.model.dto.NutrientRange;
import com.nutrimatch.model.dto.RecommendationResponse;
import com.nutrimatch.model.dto.SearchResponse;
import com.nutrimatch.model.dto.SearchResult;
import com.nutrimatch.model.dto.SubstitutionOption;
import com.nutrimatch.model.dto.SubstitutionResponse;
import com.nutrimatch.model.dto.SystemStats;
import com.nutrimatch.model.dto.UserProfile;
import com.nutrimatch.model.entity.AllergyRule;
import com.nutrimatch.model.entity.Corpus;
import com.nutrimatch.model.entity.DietaryGuidelines;
import com.nutrimatch.model.entity.NutritionInfo;
import com.nutrimatch.model.entity.Recipe;
import com.nutrimatch.substitution.SubstitutionEngine;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Retrieval plus ranking over the recipe corpus.
 *
 * The constructor is the only mutating phase: it renders, embeds and indexes
 * every recipe. After that the vocabulary, index and corpus are read-only and
 * the pipeline can serve concurrent requests.
 */
@Slf4j
public class RecommendationPipeline {

    static final double SEARCH_WEIGHT = 0.6;
    static final double COMPATIBILITY_WEIGHT = 0.4;
    static final double DYNAMIC_SEARCH_SCORE = 0.8;
    static final double DYNAMIC_DISTANCE = 0.2;
    static final String DEFAULT_QUERY = "healthy recipe";

    private static final Map<String, String> GOAL_PHRASES = new LinkedHashMap<>();

    static {
        GOAL_PHRASES.put("high_protein", "high protein");
        GOAL_PHRASES.put("low_carb", "low carb");
        GOAL_PHRASES.put("low_fat", "low fat");
        GOAL_PHRASES.put("high_fiber", "high fiber");
    }

    private final Corpus corpus;
    private final TextEmbedder embedder;
    private final CompatibilityAnalyzer analyzer;
    private final SubstitutionEngine substitutionEngine;
    private final RecipeIntegrator integrator;
    private final NutriMatchProperties properties;

    private final Vocabulary vocabulary;
    private final VectorIndex index;
    private final Map<String, Recipe> recipesByTitle = new LinkedHashMap<>();
    private final Map<String, Recipe> recipesById = new LinkedHashMap<>();

    public RecommendationPipeline(Corpus corpus,
                                  TextEmbedder embedder,
                                  CompatibilityAnalyzer analyzer,
                                  SubstitutionEngine substitutionEngine,
                                  RecipeIntegrator integrator,
                                  NutriMatchProperties properties) {
        this.corpus = corpus;
        this.embedder = embedder;
        this.analyzer = analyzer;
        this.substitutionEngine = substitutionEngine;
        this.integrator = integrator;
        this.properties = properties;
        this.index = new VectorIndex(embedder.getDimension());

        List<String> documents = new ArrayList<>();
        List<Map<String, Object>> metadatas = new ArrayList<>();
        for (Recipe recipe : corpus.getRecipes()) {
            if (recipe.getTitle() != null) {
                recipesByTitle.putIfAbsent(recipe.getTitle(), recipe);
            }
            if (recipe.getId() != null) {
                recipesById.putIfAbsent(recipe.getId(), recipe);
            }
            for (String chunk : RecipeTextFormatter.chunk(RecipeTextFormatter.format(recipe),
                    properties.getChunkSize())) {
                documents.add(chunk);
                metadatas.add(RecipeTextFormatter.metadata(recipe));
            }
        }

        EncodedCorpus encoded = embedder.fitAndEncode(documents);
        this.vocabulary = encoded.getVocabulary();
        if (!documents.isEmpty()) {
            index.add(documents, metadatas, encoded.getEmbeddings());
        }
        log.info("Recommendation pipeline ready: {} recipes, {} indexed chunks, vocabulary of {} words",
                corpus.getRecipes().size(), index.size(), vocabulary.size());
    }

    /**
     * Semantic search filtered and ranked by dietary compatibility.
     *
     * @param limit maximum number of results returned
     * @param includeDynamic whether generated candidates join the ranking
     */
    public SearchResponse search(String query,
                                 Collection<String> restrictions,
                                 Collection<String> allergies,
                                 Collection<String> healthConditions,
                                 int limit,
                                 boolean includeDynamic) {
        Set<String> restrictionSet = toSet(restrictions);
        Set<String> allergySet = toSet(allergies);
        Set<String> conditionSet = toSet(healthConditions);

        MetadataFilter filter = buildFilter(restrictionSet, allergySet, conditionSet);
        IndexSearchResult hits = index.search(embedder.encode(vocabulary, query), limit * 2, filter);

        List<SearchResult> ranked = new ArrayList<>();
        double maxDistance = hits.getDistances().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        for (int i = 0; i < hits.size(); i++) {
            Optional<Recipe> recipe = RecipeTextFormatter.parseTitle(hits.getDocuments().get(i))
                    .map(recipesByTitle::get);
            if (recipe.isEmpty()) {
                continue;
            }
            double distance = hits.getDistances().get(i);
            CompatibilityResult compatibility = analyzer.analyze(recipe.get(), restrictionSet, allergySet, conditionSet);
            double searchScore = searchScore(distance, maxDistance);
            ranked.add(SearchResult.builder()
                    .recipe(recipe.get())
                    .compatibility(compatibility)
                    .searchScore(searchScore)
                    .overallScore(SEARCH_WEIGHT * searchScore + COMPATIBILITY_WEIGHT * compatibility.getOverallScore())
                    .distance(distance)
                    .metadata(hits.getMetadatas().get(i))
                    .build());
        }

        if (includeDynamic) {
            GenerationRequest request = GenerationRequest.builder()
                    .query(query)
                    .dietaryRestrictions(restrictionSet)
                    .allergies(allergySet)
                    .healthConditions(conditionSet)
                    .excludedIngredients(excludedIngredients(restrictionSet, allergySet))
                    .count(limit)
                    .build();
            for (Recipe recipe : integrator.generateRecipes(request, newRandom())) {
                CompatibilityResult compatibility = analyzer.analyze(recipe, restrictionSet, allergySet, conditionSet);
                ranked.add(SearchResult.builder()
                        .recipe(recipe)
                        .compatibility(compatibility)
                        .searchScore(DYNAMIC_SEARCH_SCORE)
                        .overallScore(DYNAMIC_SEARCH_SCORE * compatibility.getOverallScore())
                        .distance(DYNAMIC_DISTANCE)
                        .metadata(RecipeTextFormatter.metadata(recipe))
                        .build());
            }
        }

        // List.sort is stable, so ties keep retrieval order
        ranked.sort(Comparator.comparingDouble(SearchResult::getOverallScore).reversed());
        List<SearchResult> unique = new ArrayList<>();
        Set<String> seenTitles = new HashSet<>();
        for (SearchResult result : ranked) {
            if (seenTitles.add(result.getRecipe().getTitle())) {
                unique.add(result);
            }
        }
        log.debug("Search '{}' with filter {}: {} index hits, {} unique results",
                query, filter, hits.size(), unique.size());

        return SearchResponse.builder()
                .results(new ArrayList<>(unique.subList(0, Math.min(limit, unique.size()))))
                .totalFound(unique.size())
                .query(query)
                .filtersApplied(filtersApplied(restrictionSet, allergySet, conditionSet))
                .dynamicRecipesIncluded(includeDynamic)
                .build();
    }

    /**
     * Recommendations for a profile. Nutrition optimization is attached to
     * each result when the profile has numeric nutrient targets such as
     * {@code protein}; goal flags like {@code low_carb} only shape the query.
     */
    public RecommendationResponse recommend(UserProfile profile, int limit, boolean includeDynamic) {
        String query = buildQuery(profile);
        SearchResponse searched = search(query, profile.getDietaryRestrictions(), profile.getAllergies(),
                profile.getHealthConditions(), limit * 2, includeDynamic);

        Map<String, Double> targets = nutrientTargets(profile.getNutritionalGoals());
        List<SearchResult> recommendations = new ArrayList<>();
        for (SearchResult result : searched.getResults()) {
            if (recommendations.size() == limit) {
                break;
            }
            if (!targets.isEmpty()) {
                result = result.toBuilder()
                        .nutritionOptimization(substitutionEngine.optimizeNutrition(result.getRecipe(), targets,
                                toSet(profile.getDietaryRestrictions()), toSet(profile.getAllergies())))
                        .build();
            }
            recommendations.add(result);
        }

        return RecommendationResponse.builder()
                .recommendations(recommendations)
                .userProfile(profile)
                .searchQuery(query)
                .dynamicRecipesIncluded(includeDynamic)
                .build();
    }

    public SubstitutionResponse substitute(String ingredient,
                                           Collection<String> restrictions,
                                           Collection<String> allergies) {
        Set<String> restrictionSet = toSet(restrictions);
        Set<String> allergySet = toSet(allergies);
        List<SubstitutionOption> options = substitutionEngine.findSubstitutions(ingredient, restrictionSet, allergySet);
        return SubstitutionResponse.builder()
                .originalIngredient(ingredient)
                .substitutions(options)
                .totalOptions(options.size())
                .filtersApplied(filtersApplied(restrictionSet, allergySet, new LinkedHashSet<>()))
                .build();
    }

    /**
     * @throws ResourceNotFoundException if no recipe has this id
     */
    public CompatibilityResult analyzeCompatibility(String recipeId,
                                                    Collection<String> restrictions,
                                                    Collection<String> allergies,
                                                    Collection<String> healthConditions) {
        return analyzer.analyze(findRecipe(recipeId), toSet(restrictions), toSet(allergies), toSet(healthConditions));
    }

    /**
     * @throws ResourceNotFoundException if no recipe has this id
     */
    public Recipe findRecipe(String recipeId) {
        Recipe recipe = recipesById.get(recipeId);
        if (recipe == null) {
            throw new ResourceNotFoundException("Recipe", recipeId);
        }
        return recipe;
    }

    public int recipeCount() {
        return corpus.getRecipes().size();
    }

    public SystemStats stats() {
        List<Recipe> recipes = corpus.getRecipes();
        DietaryGuidelines guidelines = corpus.getGuidelines();

        Set<String> ingredients = new HashSet<>();
        Set<String> cuisines = new HashSet<>();
        Set<String> tags = new HashSet<>();
        Set<String> benefits = new HashSet<>();
        for (Recipe recipe : recipes) {
            ingredients.addAll(recipe.ingredientNames());
            cuisines.add(recipe.getCuisineType() != null ? recipe.getCuisineType() : "Unknown");
            tags.addAll(orEmpty(recipe.getDietaryTags()));
            benefits.addAll(orEmpty(recipe.getHealthBenefits()));
        }

        Map<String, NutrientRange> nutritionStats = new LinkedHashMap<>();
        for (String nutrient : List.of("calories", "protein", "carbohydrates", "fat", "fiber")) {
            nutritionStats.put(nutrient, nutrientRange(recipes, nutrient));
        }

        Map<String, Coverage> dietaryCoverage = new LinkedHashMap<>();
        for (String restriction : guidelines.getDietaryRestrictions().keySet()) {
            long count = recipes.stream()
                    .filter(r -> orEmpty(r.getDietaryTags()).contains(restriction))
                    .count();
            dietaryCoverage.put(restriction, coverage(recipes.size(), (int) count));
        }

        Map<String, Coverage> healthCoverage = new LinkedHashMap<>();
        for (String condition : guidelines.getHealthConditions().keySet()) {
            List<String> relevant = properties.getHealthBenefitMapping().getOrDefault(condition, List.of());
            long count = recipes.stream()
                    .filter(r -> orEmpty(r.getHealthBenefits()).stream().anyMatch(relevant::contains))
                    .count();
            healthCoverage.put(condition, coverage(recipes.size(), (int) count));
        }

        return SystemStats.builder()
                .totalRecipes(recipes.size())
                .vectorStoreSize(index.size())
                .embeddingDimension(embedder.getDimension())
                .vocabularySize(vocabulary.size())
                .embeddingModel(embedder.modelInfo(vocabulary))
                .vectorStore(index.stats())
                .dietaryRestrictions(guidelines.getDietaryRestrictions().size())
                .healthConditions(guidelines.getHealthConditions().size())
                .allergies(guidelines.getAllergies().size())
                .uniqueIngredients(ingredients.size())
                .cuisineTypes(cuisines.size())
                .dietaryTagsAvailable(tags.size())
                .healthBenefitsAvailable(benefits.size())
                .nutritionStats(nutritionStats)
                .dietaryCoverage(dietaryCoverage)
                .healthCoverage(healthCoverage)
                .availableSources(integrator.availableSources())
                .sourceStats(integrator.sourceStats())
                .build();
    }

    MetadataFilter buildFilter(Set<String> restrictions, Set<String> allergies, Set<String> conditions) {
        MetadataFilter filter = MetadataFilter.none();
        if (!restrictions.isEmpty()) {
            filter = filter.and("dietary_tags", FieldConstraint.in(restrictions));
        }

        List<String> incompatible = new ArrayList<>();
        for (String allergy : allergies) {
            for (String ingredient : corpus.getGuidelines().allergy(allergy).getIncompatibleIngredients()) {
                incompatible.add(ingredient.toLowerCase(Locale.ROOT));
            }
        }
        if (!incompatible.isEmpty()) {
            filter = filter.and("ingredients", FieldConstraint.notContains(incompatible));
        }

        List<String> benefits = new ArrayList<>();
        for (String condition : conditions) {
            benefits.addAll(properties.getHealthBenefitMapping().getOrDefault(condition, List.of()));
        }
        if (!benefits.isEmpty()) {
            filter = filter.and("health_benefits", FieldConstraint.in(benefits));
        }
        return filter;
    }

    static String buildQuery(UserProfile profile) {
        List<String> parts = new ArrayList<>(orEmpty(profile.getPreferences()));
        Map<String, Double> goals = profile.getNutritionalGoals() != null ? profile.getNutritionalGoals() : Map.of();
        for (Map.Entry<String, String> phrase : GOAL_PHRASES.entrySet()) {
            Double flag = goals.get(phrase.getKey());
            if (flag != null && flag > 0) {
                parts.add(phrase.getValue());
            }
        }
        if (isPositive(goals.get("protein")) && !parts.contains("high protein")) {
            parts.add("high protein");
        }
        if (isPositive(goals.get("fiber")) && !parts.contains("high fiber")) {
            parts.add("high fiber");
        }
        return parts.isEmpty() ? DEFAULT_QUERY : String.join(" ", parts);
    }

    static double searchScore(double distance, double maxDistance) {
        if (maxDistance <= 0.0) {
            return 1.0;
        }
        return Math.max(0.0, Math.min(1.0, 1.0 - distance / maxDistance));
    }

    private Set<String> excludedIngredients(Set<String> restrictions, Set<String> allergies) {
        DietaryGuidelines guidelines = corpus.getGuidelines();
        Set<String> excluded = new LinkedHashSet<>();
        for (String restriction : restrictions) {
            excluded.addAll(guidelines.restriction(restriction).getExcludedIngredients());
        }
        for (String allergy : allergies) {
            AllergyRule rule = guidelines.allergy(allergy);
            excluded.addAll(rule.getIncompatibleIngredients());
        }
        return excluded;
    }

    private Random newRandom() {
        return properties.getSeed() != null ? new Random(properties.getSeed()) : new Random();
    }

    // goal flags such as "high_protein" steer the query but are not nutrients
    private static Map<String, Double> nutrientTargets(Map<String, Double> goals) {
        Map<String, Double> targets = new LinkedHashMap<>();
        if (goals != null) {
            goals.forEach((nutrient, target) -> {
                if (target != null && NutritionInfo.NUTRIENTS.contains(nutrient)) {
                    targets.put(nutrient, target);
                }
            });
        }
        return targets;
    }

    private static NutrientRange nutrientRange(List<Recipe> recipes, String nutrient) {
        if (recipes.isEmpty()) {
            return NutrientRange.builder().min(0).avg(0).max(0).build();
        }
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        double sum = 0.0;
        for (Recipe recipe : recipes) {
            double value = recipe.nutritionOrEmpty().nutrientOrZero(nutrient);
            min = Math.min(min, value);
            max = Math.max(max, value);
            sum += value;
        }
        return NutrientRange.builder().min(min).avg(sum / recipes.size()).max(max).build();
    }

    private static Coverage coverage(int total, int compatible) {
        return Coverage.builder()
                .totalRecipes(total)
                .compatibleRecipes(compatible)
                .coveragePercentage(total > 0 ? compatible * 100.0 / total : 0.0)
                .build();
    }

    private static FiltersApplied filtersApplied(Set<String> restrictions, Set<String> allergies, Set<String> conditions) {
        return FiltersApplied.builder()
                .dietaryRestrictions(restrictions)
                .allergies(allergies)
                .healthConditions(conditions)
                .build();
    }

    private static boolean isPositive(Double value) {
        return value != null && value > 0;
    }

    // request collections may carry JSON nulls
    private static Set<String> toSet(Collection<String> values) {
        Set<String> set = new LinkedHashSet<>();
        if (values != null) {
            values.stream().filter(Objects::nonNull).forEach(set::add);
        }
        return set;
    }

    private static <T> List<T> orEmpty(List<T> values) {
        return values != null ? values : List.of();
    }
}
