package com.nutrimatch.index;

import com.nutrimatch.embedding.VectorMath;
import com.nutrimatch.index.filter.MetadataFilter;
import com.nutrimatch.index.filter.MetadataMatcher;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory vector store searched by linear cosine scan.
 *
 * Entries are appended in insertion order; nothing is reordered or
 * deduplicated. Writes happen only while the owning pipeline is being built;
 * afterwards the index is only read.
 */
@Slf4j
public class VectorIndex {

    public static final String COLLECTION_NAME = "recipe_index";

    private final int dimension;
    private final List<IndexEntry> entries = new ArrayList<>();

    public VectorIndex(int dimension) {
        this.dimension = dimension;
    }

    public int getDimension() {
        return dimension;
    }

    /**
     * Append documents with their metadata and embeddings.
     *
     * @param texts document texts
     * @param metadatas per-document metadata; null means {"text": text} for each
     * @param embeddings one vector per text, resized to the index dimension
     * @return generated ids, in input order
     */
    public List<String> add(List<String> texts, List<Map<String, Object>> metadatas, float[][] embeddings) {
        if (embeddings == null || embeddings.length != texts.size()) {
            throw new IllegalArgumentException("Expected " + texts.size() + " embeddings but got "
                    + (embeddings == null ? "none" : String.valueOf(embeddings.length)));
        }
        if (metadatas != null && metadatas.size() != texts.size()) {
            throw new IllegalArgumentException("Expected " + texts.size() + " metadata entries but got "
                    + metadatas.size());
        }

        List<String> ids = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            String id = UUID.randomUUID().toString();
            Map<String, Object> metadata = metadatas != null
                    ? metadatas.get(i)
                    : new LinkedHashMap<>(Map.of("text", texts.get(i)));
            entries.add(IndexEntry.builder()
                    .id(id)
                    .text(texts.get(i))
                    .metadata(metadata)
                    .embedding(VectorMath.fitToDimension(embeddings[i], dimension))
                    .build());
            ids.add(id);
        }
        log.debug("Added {} documents to {}, size now {}", texts.size(), COLLECTION_NAME, entries.size());
        return ids;
    }

    /**
     * Top-k entries by cosine similarity among those matching the filter.
     *
     * @param queryEmbedding query vector; truncated or zero-padded to the index dimension
     * @param k maximum number of hits
     * @param filter metadata filter, null or empty for none
     * @return hits with {@code distance = 1 - similarity}; empty lists when nothing matches
     */
    public IndexSearchResult search(float[] queryEmbedding, int k, MetadataFilter filter) {
        if (entries.isEmpty() || k <= 0) {
            return IndexSearchResult.empty();
        }
        float[] query = VectorMath.fitToDimension(queryEmbedding, dimension);

        List<ScoredEntry> scored = new ArrayList<>();
        for (IndexEntry entry : entries) {
            if (MetadataMatcher.matches(entry.getMetadata(), filter)) {
                scored.add(new ScoredEntry(entry, VectorMath.cosine(query, entry.getEmbedding())));
            }
        }
        // stable: equal similarities keep insertion order
        scored.sort(Comparator.comparingDouble(ScoredEntry::similarity).reversed());

        IndexSearchResult result = IndexSearchResult.empty();
        for (ScoredEntry hit : scored.subList(0, Math.min(k, scored.size()))) {
            result.getIds().add(hit.entry().getId());
            result.getDocuments().add(hit.entry().getText());
            result.getMetadatas().add(hit.entry().getMetadata());
            result.getDistances().add(1.0 - hit.similarity());
        }
        log.debug("Index search: {} candidates after filter {}, returning {}", scored.size(), filter, result.size());
        return result;
    }

    public Optional<IndexEntry> get(String id) {
        for (IndexEntry entry : entries) {
            if (entry.getId().equals(id)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("collection_name", COLLECTION_NAME);
        stats.put("total_documents", entries.size());
        stats.put("embedding_dimension", dimension);
        return stats;
    }

    private static final class ScoredEntry {
        private final IndexEntry entry;
        private final double similarity;

        ScoredEntry(IndexEntry entry, double similarity) {
            this.entry = entry;
            this.similarity = similarity;
        }

        IndexEntry entry() {
            return entry;
        }

        double similarity() {
            return similarity;
        }
    }
}
