package com.nutrimatch.generation;

import com.nutrimatch.model.entity.Recipe;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Boundary to dynamic recipe sources. A failing source never fails the
 * caller: errors are logged and yield an empty candidate list.
 */
@Slf4j
public class RecipeIntegrator {

    private final CandidateGenerator generator;
    private final List<RecipeSource> sources;

    public RecipeIntegrator(CandidateGenerator generator, List<RecipeSource> sources) {
        this.generator = generator;
        this.sources = sources != null ? List.copyOf(sources) : List.of();
    }

    /**
     * Up to {@code request.count} dynamic recipes, or an empty list when no
     * generator-backed source is enabled or generation fails.
     */
    public List<Recipe> generateRecipes(GenerationRequest request, Random random) {
        if (request.getCount() <= 0) {
            return List.of();
        }
        if (!generatorEnabled()) {
            log.debug("No generator-backed recipe source enabled, skipping dynamic recipes");
            return List.of();
        }
        try {
            List<Recipe> recipes = generator.generate(request, random);
            return recipes.size() > request.getCount()
                    ? new ArrayList<>(recipes.subList(0, request.getCount()))
                    : recipes;
        } catch (RuntimeException e) {
            log.warn("Dynamic recipe generation failed for query '{}'", request.getQuery(), e);
            return List.of();
        }
    }

    public boolean generatorEnabled() {
        return sources.stream().anyMatch(s -> s.isEnabled() && s.isGeneratorBacked());
    }

    public List<String> availableSources() {
        List<String> names = new ArrayList<>();
        for (RecipeSource source : sources) {
            if (source.isEnabled()) {
                names.add(source.getName());
            }
        }
        return names;
    }

    public Map<String, Object> sourceStats() {
        List<String> enabled = availableSources();
        int totalRateLimit = sources.stream()
                .filter(RecipeSource::isEnabled)
                .mapToInt(RecipeSource::getRateLimit)
                .sum();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total_sources", sources.size());
        stats.put("enabled_sources", enabled.size());
        stats.put("available_sources", enabled);
        stats.put("total_rate_limit", totalRateLimit);
        return stats;
    }
}
