package com.nutrimatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nutrimatch.analysis.CompatibilityAnalyzer;
import com.nutrimatch.analysis.FuzzyIngredientMatcher;
import com.nutrimatch.analysis.IngredientMatcher;
import com.nutrimatch.embedding.TextEmbedder;
import com.nutrimatch.generation.CandidateGenerator;
import com.nutrimatch.generation.RecipeIntegrator;
import com.nutrimatch.model.entity.Corpus;
import com.nutrimatch.service.CorpusLoader;
import com.nutrimatch.service.RecommendationPipeline;
import com.nutrimatch.substitution.SubstitutionEngine;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Wires the recommendation core. Everything here is built once at startup.
 */
@Configuration
@EnableConfigurationProperties(NutriMatchProperties.class)
public class PipelineConfig {

    @Bean
    public CorpusLoader corpusLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        return new CorpusLoader(objectMapper, resourceLoader);
    }

    @Bean
    public Corpus corpus(CorpusLoader corpusLoader, NutriMatchProperties properties) {
        return corpusLoader.load(properties.getDataLocation());
    }

    @Bean
    public TextEmbedder textEmbedder(NutriMatchProperties properties) {
        return new TextEmbedder(properties.getEmbeddingDimension());
    }

    @Bean
    public IngredientMatcher ingredientMatcher() {
        return new FuzzyIngredientMatcher();
    }

    @Bean
    public CompatibilityAnalyzer compatibilityAnalyzer(Corpus corpus, IngredientMatcher ingredientMatcher) {
        return new CompatibilityAnalyzer(corpus.getGuidelines(), ingredientMatcher);
    }

    @Bean
    public SubstitutionEngine substitutionEngine(Corpus corpus) {
        return new SubstitutionEngine(corpus.getGuidelines(), corpus.getNutritionalData());
    }

    @Bean
    public RecipeIntegrator recipeIntegrator(NutriMatchProperties properties) {
        return new RecipeIntegrator(new CandidateGenerator(), properties.getSources());
    }

    @Bean
    public RecommendationPipeline recommendationPipeline(Corpus corpus,
                                                         TextEmbedder textEmbedder,
                                                         CompatibilityAnalyzer compatibilityAnalyzer,
                                                         SubstitutionEngine substitutionEngine,
                                                         RecipeIntegrator recipeIntegrator,
                                                         NutriMatchProperties properties) {
        return new RecommendationPipeline(corpus, textEmbedder, compatibilityAnalyzer,
                substitutionEngine, recipeIntegrator, properties);
    }
}
