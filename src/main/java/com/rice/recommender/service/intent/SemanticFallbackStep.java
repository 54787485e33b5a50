package com.rice.recommender.service.intent;

import com.rice.recommender.model.FacetCategory;
import com.rice.recommender.service.embedding.Embedder;
import com.rice.recommender.service.embedding.EmbeddingUnavailableException;
import com.rice.recommender.service.embedding.VectorMath;
import com.rice.recommender.service.lexicon.Lexicon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Paraphrase resolution for a tag-backed category that found no lexical hit.
 *
 * <p>Compares the embedded query with each canonical value's reference phrase and
 * accepts the single best value when its cosine similarity is strictly above the
 * threshold. Reference vectors are computed lazily and cached for the life of the step;
 * a failed reference embedding is not cached and skips the step for that query.
 */
public class SemanticFallbackStep implements FacetStep {
    private static final Logger log = LoggerFactory.getLogger(SemanticFallbackStep.class);

    private final Lexicon lexicon;
    private final FacetCategory category;
    private final Embedder embedder;
    private final double threshold;
    private final Map<String, float[]> referenceVectors = new ConcurrentHashMap<>();

    public SemanticFallbackStep(Lexicon lexicon, FacetCategory category, Embedder embedder, double threshold) {
        if (!category.supportsSemanticFallback()) {
            throw new IllegalArgumentException(category.key() + " does not support semantic fallback");
        }
        this.lexicon = lexicon;
        this.category = category;
        this.embedder = embedder;
        this.threshold = threshold;
    }

    public FacetCategory category() { return category; }

    @Override
    public boolean supports(ExtractionContext context) {
        return !context.intent().has(category)
                && lexicon.size(category) > 0
                && context.canEmbed();
    }

    @Override
    public void apply(ExtractionContext context) {
        Optional<float[]> query = context.queryVector();
        if (query.isEmpty()) return;

        String best = null;
        double bestSim = threshold;
        try {
            for (String value : lexicon.canonicalValues(category)) {
                double sim = VectorMath.cosine(query.get(), referenceVector(value));
                if (sim > bestSim) {
                    bestSim = sim;
                    best = value;
                }
            }
        } catch (EmbeddingUnavailableException | IllegalArgumentException e) {
            log.warn("Semantic fallback for {} skipped: {}", category.key(), e.getMessage());
            return;
        }
        if (best != null) {
            log.debug("Semantic fallback resolved {}={} (similarity {})", category.key(), best, String.format("%.3f", bestSim));
            context.intent().add(category, best);
        }
    }

    private float[] referenceVector(String value) {
        float[] cached = referenceVectors.get(value);
        if (cached != null) return cached;
        float[] v = embedder.embed(lexicon.referencePhrase(category, value));
        referenceVectors.put(value, v);
        return v;
    }

    @Override
    public String getName() {
        return "SemanticFallback[" + category.key() + "]";
    }
}
