package com.rice.recommender.service.embedding;

import java.util.Locale;

/**
 * Offline embedder: feature-hashes word tokens and character trigrams into a fixed
 * vector and L2-normalizes it. Deterministic and model-free, so similarity reflects
 * shared vocabulary rather than meaning.
 */
public class HashingEmbedder implements Embedder {
    private static final float TOKEN_WEIGHT = 1.0f;
    private static final float TRIGRAM_WEIGHT = 0.35f;

    private final int dimension;

    public HashingEmbedder(int dimension) {
        if (dimension <= 0) throw new IllegalArgumentException("dimension must be positive");
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }

        String normalized = text.toLowerCase(Locale.ROOT);
        for (String token : normalized.split("[^\\p{L}\\p{N}]+")) {
            if (token.isBlank()) {
                continue;
            }
            addHashed(vector, "tok:" + token, TOKEN_WEIGHT);
            if (token.length() >= 3) {
                for (int i = 0; i <= token.length() - 3; i++) {
                    addHashed(vector, "tri:" + token.substring(i, i + 3), TRIGRAM_WEIGHT);
                }
            }
        }

        normalize(vector);
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    private void addHashed(float[] vector, String key, float weight) {
        int index = Math.floorMod(key.hashCode(), vector.length);
        vector[index] += weight;
    }

    private static void normalize(float[] vector) {
        float norm = 0f;
        for (float value : vector) {
            norm += value * value;
        }
        norm = (float) Math.sqrt(norm);
        if (norm <= 0f) {
            return;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
    }
}
