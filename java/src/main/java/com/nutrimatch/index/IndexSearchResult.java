package com.nutrimatch.index;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Ranked hits as four parallel lists, best match first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexSearchResult {

    @Builder.Default
    private List<String> ids = new ArrayList<>();

    @Builder.Default
    private List<String> documents = new ArrayList<>();

    @Builder.Default
    private List<Map<String, Object>> metadatas = new ArrayList<>();

    @Builder.Default
    private List<Double> distances = new ArrayList<>();

    public static IndexSearchResult empty() {
        return new IndexSearchResult();
    }

    public int size() {
        return ids.size();
    }

    public boolean isEmpty() {
        return ids.isEmpty();
    }
}
