package com.nutrimatch.controller;

import com.nutrimatch.TestFixtures;
import com.nutrimatch.exception.ResourceNotFoundException;
import com.nutrimatch.model.dto.SearchRequest;
import com.nutrimatch.model.dto.SearchResponse;
import com.nutrimatch.model.entity.Recipe;
import com.nutrimatch.service.RecommendationPipeline;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Set;

import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for RecipeController.
 */
@ExtendWith(MockitoExtension.class)
class RecipeControllerUnitTest {

    @Mock
    private RecommendationPipeline pipeline;

    @InjectMocks
    private RecipeController controller;

    @Test
    void getRecipe_Success() {
        when(pipeline.findRecipe("r1")).thenReturn(TestFixtures.tofuStirFry());

        Mono<Recipe> result = controller.getRecipe("r1");

        StepVerifier.create(result)
                .expectNextMatches(recipe -> recipe.getTitle().equals("Tofu Stir Fry"))
                .verifyComplete();
    }

    @Test
    void getRecipe_NotFound() {
        when(pipeline.findRecipe("nope")).thenThrow(new ResourceNotFoundException("Recipe", "nope"));

        StepVerifier.create(controller.getRecipe("nope"))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    void search_IsDeferredUntilSubscribed() {
        SearchRequest request = SearchRequest.builder().query("soup").build();

        controller.search(request);

        verifyNoInteractions(pipeline);
    }

    @Test
    void search_NullLimitFallsBackToDefault() {
        SearchRequest request = SearchRequest.builder()
                .query("soup")
                .limit(null)
                .includeDynamic(null)
                .build();
        SearchResponse response = SearchResponse.builder()
                .results(List.of())
                .query("soup")
                .build();
        when(pipeline.search(eq("soup"), anySet(), anySet(), anySet(), eq(5), eq(false))).thenReturn(response);

        StepVerifier.create(controller.search(request))
                .expectNextMatches(r -> r.getTotalFound() == 0 && r.getQuery().equals("soup"))
                .verifyComplete();

        verify(pipeline).search("soup", Set.of(), Set.of(), Set.of(), 5, false);
    }
}
