package com.nutrimatch.index;

import com.nutrimatch.index.filter.FieldConstraint;
import com.nutrimatch.index.filter.MetadataFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for VectorIndex.
 */
class VectorIndexTest {

    private VectorIndex index;

    @BeforeEach
    void setUp() {
        index = new VectorIndex(3);
        index.add(
                List.of("Title: A", "Title: B", "Title: C"),
                List.of(
                        Map.of("title", "A", "dietary_tags", List.of("vegan")),
                        Map.of("title", "B", "dietary_tags", List.of("vegetarian")),
                        Map.of("title", "C", "dietary_tags", List.of("vegan", "keto"))),
                new float[][]{
                        {1f, 0f, 0f},
                        {0.8f, 0.6f, 0f},
                        {0f, 1f, 0f}});
    }

    @Test
    void search_ReturnsTopKByCosineWithDistances() {
        IndexSearchResult result = index.search(new float[]{1f, 0f, 0f}, 2, null);

        assertThat(result.getDocuments()).containsExactly("Title: A", "Title: B");
        assertThat(result.getDistances().get(0)).isCloseTo(0.0, within(1e-6));
        assertThat(result.getDistances().get(1)).isCloseTo(0.2, within(1e-6));
        assertThat(result.getIds()).hasSize(2).doesNotHaveDuplicates();
    }

    @Test
    void search_AppliesFilterBeforeRanking() {
        MetadataFilter filter = MetadataFilter.of("dietary_tags", FieldConstraint.in(List.of("vegan")));

        IndexSearchResult result = index.search(new float[]{0.8f, 0.6f, 0f}, 5, filter);

        assertThat(result.getMetadatas()).extracting(m -> m.get("title")).containsExactly("A", "C");
    }

    @Test
    void search_FilterMatchingNothingReturnsEmpty() {
        MetadataFilter filter = MetadataFilter.of("cuisine_type", FieldConstraint.equalTo("thai"));

        IndexSearchResult result = index.search(new float[]{1f, 0f, 0f}, 5, filter);

        assertThat(result.isEmpty()).isTrue();
    }

    @Test
    void search_EmptyIndexReturnsFourEmptyLists() {
        IndexSearchResult result = new VectorIndex(3).search(new float[]{1f, 0f, 0f}, 5, MetadataFilter.none());

        assertThat(result.getIds()).isEmpty();
        assertThat(result.getDocuments()).isEmpty();
        assertThat(result.getMetadatas()).isEmpty();
        assertThat(result.getDistances()).isEmpty();
    }

    @Test
    void search_TiesKeepInsertionOrder() {
        VectorIndex ties = new VectorIndex(2);
        ties.add(List.of("first", "second"), null, new float[][]{{1f, 0f}, {1f, 0f}});

        assertThat(ties.search(new float[]{1f, 0f}, 2, null).getDocuments()).containsExactly("first", "second");
    }

    @Test
    void search_QueryOfOtherDimensionIsResized() {
        IndexSearchResult result = index.search(new float[]{0f, 1f, 0f, 7f}, 1, null);

        assertThat(result.getDocuments()).containsExactly("Title: C");
    }

    @Test
    void add_NullMetadataDefaultsToText() {
        VectorIndex fresh = new VectorIndex(2);
        List<String> ids = fresh.add(List.of("hello"), null, new float[][]{{1f, 0f}});

        assertThat(fresh.get(ids.get(0))).hasValueSatisfying(entry ->
                assertThat(entry.getMetadata()).containsEntry("text", "hello"));
    }

    @Test
    void add_MismatchedLengthsFail() {
        assertThatThrownBy(() -> index.add(List.of("x", "y"), null, new float[][]{{1f, 0f, 0f}}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(index.size()).isEqualTo(3);
    }

    @Test
    void stats_ReportsSize() {
        assertThat(index.stats())
                .containsEntry("collection_name", VectorIndex.COLLECTION_NAME)
                .containsEntry("total_documents", 3);
        index.clear();
        assertThat(index.size()).isZero();
    }
}
