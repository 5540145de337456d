package com.nutrimatch.embedding;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Frozen word-to-slot mapping produced by {@link TextEmbedder#fit(List)}.
 * Instances never change after construction and can be shared across threads.
 */
public final class Vocabulary {

    private final int dimension;
    private final Map<String, Integer> wordToIndex;

    Vocabulary(int dimension, List<String> words) {
        if (words.size() > dimension) {
            throw new IllegalArgumentException("Vocabulary of " + words.size()
                    + " words does not fit dimension " + dimension);
        }
        Map<String, Integer> index = new LinkedHashMap<>();
        for (String word : words) {
            index.putIfAbsent(word, index.size());
        }
        this.dimension = dimension;
        this.wordToIndex = Collections.unmodifiableMap(index);
    }

    /**
     * Length of every vector encoded against this vocabulary.
     */
    public int dimension() {
        return dimension;
    }

    /**
     * Number of known words, at most {@link #dimension()}.
     */
    public int size() {
        return wordToIndex.size();
    }

    /**
     * @return slot of the word, or -1 when it is out of vocabulary
     */
    public int indexOf(String word) {
        Integer index = wordToIndex.get(word);
        return index != null ? index : -1;
    }

    /**
     * Known words, most frequent first.
     */
    public List<String> words() {
        return List.copyOf(wordToIndex.keySet());
    }
}
