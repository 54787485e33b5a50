package com.rice.recommender.service.embedding;

/** Embedder used when {@code embedding.provider=none}. */
public class DisabledEmbedder implements Embedder {

    @Override
    public float[] embed(String text) {
        throw new EmbeddingUnavailableException("embeddings are disabled");
    }

    @Override
    public int dimension() {
        return 0;
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
