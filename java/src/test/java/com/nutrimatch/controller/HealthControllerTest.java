package com.nutrimatch.controller;

import com.nutrimatch.service.RecommendationPipeline;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.mockito.Mockito.when;

/**
 * Integration tests for HealthController.
 */
@WebFluxTest(controllers = HealthController.class)
@Import({HealthController.class})
class HealthControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private RecommendationPipeline pipeline;

    @Test
    void root_ReturnsServiceInfo() {
        webTestClient.get()
                .uri("/")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.service").isEqualTo("NutriMatch")
                .jsonPath("$.version").isEqualTo("1.0.0");
    }

    @Test
    void health_ReportsLoadedRecipes() {
        when(pipeline.recipeCount()).thenReturn(12);

        webTestClient.get()
                .uri("/v1/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("healthy")
                .jsonPath("$.recipes").isEqualTo(12)
                .jsonPath("$.version").isEqualTo("1.0.0");
    }
}
