package com.rice.recommender.service.intent;

import com.rice.recommender.model.QueryIntent;
import com.rice.recommender.service.embedding.Embedder;
import com.rice.recommender.service.embedding.EmbeddingUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Per-call state shared by the extraction steps. Never shared across queries.
 */
public class ExtractionContext {
    private static final Logger log = LoggerFactory.getLogger(ExtractionContext.class);

    private final List<String> tokens;
    private final boolean[] consumed;
    private final String text;
    private final Embedder embedder;
    private final QueryIntent.Builder intent = QueryIntent.builder();

    private float[] queryVector;
    private boolean embeddingFailed;

    public ExtractionContext(List<String> tokens, Embedder embedder) {
        this.tokens = List.copyOf(tokens);
        this.consumed = new boolean[this.tokens.size()];
        this.text = String.join(" ", this.tokens);
        this.embedder = embedder;
    }

    public List<String> tokens() { return tokens; }

    /** Normalized query text (tokens joined by single spaces). */
    public String text() { return text; }

    public QueryIntent.Builder intent() { return intent; }

    public boolean isConsumed(int position) {
        return consumed[position];
    }

    /** True when none of the positions in [from, to) is consumed. */
    public boolean isFree(int from, int to) {
        for (int i = from; i < to; i++) {
            if (consumed[i]) return false;
        }
        return true;
    }

    public void consume(int from, int to) {
        for (int i = from; i < to; i++) consumed[i] = true;
    }

    public boolean canEmbed() {
        return embedder != null && embedder.isEnabled() && !embeddingFailed && !tokens.isEmpty();
    }

    public Embedder embedder() { return embedder; }

    /**
     * Embedding of the whole normalized query, computed at most once. Empty when the
     * embedder is absent or failed; a failure is remembered for the rest of the call.
     */
    public Optional<float[]> queryVector() {
        if (queryVector != null) return Optional.of(queryVector);
        if (!canEmbed()) return Optional.empty();
        try {
            queryVector = embedder.embed(text);
            return Optional.of(queryVector);
        } catch (EmbeddingUnavailableException e) {
            embeddingFailed = true;
            log.warn("Query embedding unavailable, semantic fallback skipped: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
