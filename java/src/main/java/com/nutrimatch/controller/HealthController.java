package com.nutrimatch.controller;

import com.nutrimatch.service.RecommendationPipeline;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Health check endpoints.
 */
@RestController
@RequestMapping
@RequiredArgsConstructor
public class HealthController {

    static final String VERSION = "1.0.0";

    private final RecommendationPipeline pipeline;

    @GetMapping("/")
    public Mono<Map<String, String>> root() {
        return Mono.just(Map.of(
            "service", "NutriMatch",
            "version", VERSION
        ));
    }

    @GetMapping("/v1/health")
    public Mono<Map<String, Object>> health() {
        return Mono.fromSupplier(() -> Map.of(
            "status", "healthy",
            "recipes", pipeline.recipeCount(),
            "version", VERSION
        ));
    }
}
