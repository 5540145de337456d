package com.nutrimatch.controller;

import com.nutrimatch.model.dto.CompatibilityRequest;
import com.nutrimatch.model.dto.CompatibilityResult;
import com.nutrimatch.model.dto.RecommendationRequest;
import com.nutrimatch.model.dto.RecommendationResponse;
import com.nutrimatch.model.dto.SearchRequest;
import com.nutrimatch.model.dto.SearchResponse;
import com.nutrimatch.model.dto.SubstitutionRequest;
import com.nutrimatch.model.dto.SubstitutionResponse;
import com.nutrimatch.model.dto.SystemStats;
import com.nutrimatch.model.entity.Recipe;
import com.nutrimatch.service.RecommendationPipeline;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.Callable;

/**
 * Controller for recipe search, recommendations, substitutions and compatibility.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class RecipeController {

    private static final int DEFAULT_LIMIT = 5;

    private final RecommendationPipeline pipeline;

    @PostMapping("/search")
    public Mono<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
        log.debug("Search request: {}", request.getQuery());
        return offload(() -> pipeline.search(
                request.getQuery(),
                request.getDietaryRestrictions(),
                request.getAllergies(),
                request.getHealthConditions(),
                limitOrDefault(request.getLimit()),
                Boolean.TRUE.equals(request.getIncludeDynamic())));
    }

    @PostMapping("/recommendations")
    public Mono<RecommendationResponse> recommend(@Valid @RequestBody RecommendationRequest request) {
        return offload(() -> pipeline.recommend(
                request.getProfile(),
                limitOrDefault(request.getLimit()),
                Boolean.TRUE.equals(request.getIncludeDynamic())));
    }

    @PostMapping("/substitutions")
    public Mono<SubstitutionResponse> substitutions(@Valid @RequestBody SubstitutionRequest request) {
        return offload(() -> pipeline.substitute(
                request.getIngredient(),
                request.getDietaryRestrictions(),
                request.getAllergies()));
    }

    @PostMapping("/compatibility")
    public Mono<CompatibilityResult> compatibility(@Valid @RequestBody CompatibilityRequest request) {
        return offload(() -> pipeline.analyzeCompatibility(
                request.getRecipeId(),
                request.getDietaryRestrictions(),
                request.getAllergies(),
                request.getHealthConditions()));
    }

    @GetMapping("/recipes/{recipeId}")
    public Mono<Recipe> getRecipe(@PathVariable String recipeId) {
        return offload(() -> pipeline.findRecipe(recipeId));
    }

    @GetMapping("/stats")
    public Mono<SystemStats> stats() {
        return offload(pipeline::stats);
    }

    private static int limitOrDefault(Integer limit) {
        return limit != null ? limit : DEFAULT_LIMIT;
    }

    // the core is synchronous and CPU-bound
    private static <T> Mono<T> offload(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
