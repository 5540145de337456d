package com.nutrimatch.index;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Stored document: text, metadata and its embedding.
 */
@Data
@Builder
@AllArgsConstructor
public class IndexEntry {
    private String id;
    private String text;
    private Map<String, Object> metadata;
    private float[] embedding;
}
