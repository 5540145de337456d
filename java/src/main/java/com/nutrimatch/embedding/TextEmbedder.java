package com.nutrimatch.embedding;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Bag-of-words text embedder.
 *
 * Works in two phases: {@link #fit(List)} counts word frequencies over a corpus
 * and freezes the top-N words into a {@link Vocabulary}; {@link #encode(Vocabulary, String)}
 * is then a pure function of that vocabulary and the text. The embedder itself
 * holds no mutable state.
 */
@Slf4j
public class TextEmbedder {

    public static final String MODEL_NAME = "bag_of_words_embedder";
    public static final String MODEL_TYPE = "simple_bow";

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int dimension;

    public TextEmbedder(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Embedding dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    public int getDimension() {
        return dimension;
    }

    /**
     * Build a vocabulary from the most frequent words of the corpus.
     * Words with equal counts keep the order in which they were first seen.
     *
     * @param corpus texts to count words over
     * @return frozen vocabulary of at most {@code dimension} words
     */
    public Vocabulary fit(List<String> corpus) {
        Map<String, Integer> frequencies = new LinkedHashMap<>();
        for (String text : corpus) {
            for (String word : tokenize(text)) {
                frequencies.merge(word, 1, Integer::sum);
            }
        }

        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(frequencies.entrySet());
        // List.sort is stable, so ties stay in first-seen order
        ranked.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));

        List<String> words = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : ranked) {
            if (words.size() == dimension) {
                break;
            }
            words.add(entry.getKey());
        }

        log.debug("Fitted vocabulary: {} distinct words, {} kept", frequencies.size(), words.size());
        return new Vocabulary(dimension, words);
    }

    /**
     * Encode one text as an L2-normalised term-count vector.
     * Out-of-vocabulary words are ignored.
     */
    public float[] encode(Vocabulary vocabulary, String text) {
        float[] vector = new float[vocabulary.dimension()];
        for (String word : tokenize(text)) {
            int index = vocabulary.indexOf(word);
            if (index >= 0) {
                vector[index] += 1.0f;
            }
        }
        return VectorMath.normalize(vector);
    }

    public float[][] encode(Vocabulary vocabulary, List<String> texts) {
        float[][] matrix = new float[texts.size()][];
        for (int i = 0; i < texts.size(); i++) {
            matrix[i] = encode(vocabulary, texts.get(i));
        }
        return matrix;
    }

    /**
     * Fit a vocabulary on the texts and encode the same texts with it.
     */
    public EncodedCorpus fitAndEncode(List<String> texts) {
        Vocabulary vocabulary = fit(texts);
        return new EncodedCorpus(vocabulary, encode(vocabulary, texts));
    }

    public double similarity(float[] a, float[] b) {
        return VectorMath.cosine(a, b);
    }

    public Map<String, Object> modelInfo(Vocabulary vocabulary) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("model_name", MODEL_NAME);
        info.put("model_type", MODEL_TYPE);
        info.put("embedding_dimension", dimension);
        info.put("vocab_size", vocabulary != null ? vocabulary.size() : 0);
        return info;
    }

    /**
     * Lower-case, replace non-alphanumerics with spaces and split on whitespace.
     */
    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        String cleaned = NON_ALPHANUMERIC.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
        if (cleaned.isEmpty()) {
            return tokens;
        }
        for (String token : WHITESPACE.split(cleaned)) {
            tokens.add(token);
        }
        return tokens;
    }
}
