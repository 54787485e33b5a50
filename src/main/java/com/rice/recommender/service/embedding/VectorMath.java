package com.rice.recommender.service.embedding;

public final class VectorMath {
    private static final double EPSILON = 1e-8;

    private VectorMath() {}

    /**
     * Cosine similarity in [-1, 1]. Zero vectors yield 0.
     *
     * @throws IllegalArgumentException when the vectors differ in length
     */
    public static double cosine(float[] a, float[] b) {
        if (a == null || b == null) return 0.0;
        if (a.length != b.length) {
            throw new IllegalArgumentException("dimension mismatch: " + a.length + " vs " + b.length);
        }
        double dot = 0.0, na = 0.0, nb = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            na += (double) a[i] * a[i];
            nb += (double) b[i] * b[i];
        }
        if (na == 0.0 || nb == 0.0) return 0.0;
        return dot / (Math.sqrt(na) * Math.sqrt(nb) + EPSILON);
    }
}
