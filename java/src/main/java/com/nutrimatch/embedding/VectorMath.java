package com.nutrimatch.embedding;

/**
 * Vector helpers shared by the embedder and the index.
 */
public final class VectorMath {

    private VectorMath() {}

    /**
     * Cosine similarity; 0 when either vector has zero norm.
     * Vectors of different length are compared over the shorter length,
     * which is the same as zero-padding the shorter one.
     */
    public static double cosine(float[] a, float[] b) {
        int length = Math.min(a.length, b.length);
        double dot = 0.0;
        for (int i = 0; i < length; i++) {
            dot += (double) a[i] * b[i];
        }
        double normA = norm(a);
        double normB = norm(b);
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (normA * normB);
    }

    public static double norm(float[] vector) {
        double sum = 0.0;
        for (float v : vector) {
            sum += (double) v * v;
        }
        return Math.sqrt(sum);
    }

    /**
     * L2-normalises in place. Zero vectors are left untouched.
     */
    public static float[] normalize(float[] vector) {
        double norm = norm(vector);
        if (norm > 0.0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] = (float) (vector[i] / norm);
            }
        }
        return vector;
    }

    /**
     * Truncates or zero-pads a vector to the given dimension.
     */
    public static float[] fitToDimension(float[] vector, int dimension) {
        if (vector.length == dimension) {
            return vector;
        }
        float[] resized = new float[dimension];
        System.arraycopy(vector, 0, resized, 0, Math.min(vector.length, dimension));
        return resized;
    }
}
