package com.nutrimatch.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nutrimatch.exception.CorpusLoadException;
import com.nutrimatch.model.entity.Corpus;
import com.nutrimatch.model.entity.DietaryGuidelines;
import com.nutrimatch.model.entity.NutritionalData;
import com.nutrimatch.model.entity.Recipe;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Reads the recipe corpus, ingredient database and dietary guidelines from a
 * Spring resource location such as {@code classpath:data/}.
 */
@Slf4j
@RequiredArgsConstructor
public class CorpusLoader {

    public static final String RECIPES_FILE = "recipes.json";
    public static final String NUTRITION_FILE = "nutritional_data.json";
    public static final String GUIDELINES_FILE = "dietary_guidelines.json";

    private static final TypeReference<List<Recipe>> RECIPE_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    /**
     * Load all three files. Missing files yield empty data.
     *
     * @throws CorpusLoadException if a file exists but cannot be parsed
     */
    public Corpus load(String location) {
        String base = location.endsWith("/") ? location : location + "/";

        List<Recipe> recipes = read(base + RECIPES_FILE, RECIPE_LIST, ArrayList::new);
        recipes.removeIf(Objects::isNull);
        NutritionalData nutritionalData = read(base + NUTRITION_FILE,
                new TypeReference<NutritionalData>() { }, NutritionalData::empty);
        DietaryGuidelines guidelines = read(base + GUIDELINES_FILE,
                new TypeReference<DietaryGuidelines>() { }, DietaryGuidelines::empty);

        log.info("Loaded corpus from {}: {} recipes, {} ingredient profiles", base,
                recipes.size(), nutritionalData.getIngredients().size());
        return Corpus.builder()
                .recipes(recipes)
                .nutritionalData(nutritionalData)
                .guidelines(guidelines)
                .build();
    }

    private <T> T read(String path, TypeReference<T> type, Supplier<T> fallback) {
        Resource resource = resourceLoader.getResource(path);
        if (!resource.exists()) {
            log.warn("Data file {} not found, using empty data", path);
            return fallback.get();
        }
        try (InputStream in = resource.getInputStream()) {
            T value = objectMapper.readValue(in, type);
            return value != null ? value : fallback.get();
        } catch (IOException e) {
            throw new CorpusLoadException(path, e);
        }
    }
}
