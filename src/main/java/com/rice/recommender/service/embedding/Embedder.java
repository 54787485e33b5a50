package com.rice.recommender.service.embedding;

/**
 * Text embedding capability injected into intent extraction and ranking.
 *
 * <p>Implementations return a fixed-length vector per text. When the backing model is
 * absent or fails, {@link #embed(String)} throws {@link EmbeddingUnavailableException}
 * and callers degrade to exact-match behaviour.
 */
public interface Embedder {

    /**
     * @param text text to embed, {@code null} is treated as empty
     * @return embedding vector, length {@link #dimension()}
     * @throws EmbeddingUnavailableException if no vector can be produced
     */
    float[] embed(String text);

    int dimension();

    /** False when the embedder is configured off; {@link #embed} then always throws. */
    boolean isEnabled();

    default String getName() {
        return this.getClass().getSimpleName();
    }
}
