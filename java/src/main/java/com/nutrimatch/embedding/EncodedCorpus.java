package com.nutrimatch.embedding;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Result of fitting a vocabulary and encoding the same texts with it.
 */
@Getter
@RequiredArgsConstructor
public class EncodedCorpus {
    private final Vocabulary vocabulary;
    private final float[][] embeddings;
}
