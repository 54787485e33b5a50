package com.rice.recommender.service.intent;

import com.rice.recommender.model.FacetCategory;
import com.rice.recommender.model.QueryIntent;
import com.rice.recommender.service.embedding.Embedder;
import com.rice.recommender.service.lexicon.Lexicon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns normalized tokens into a {@link QueryIntent} by running an ordered chain of
 * {@link FacetStep}s.
 *
 * <h3>Default chain</h3>
 * <ol>
 *   <li>time constraint: explicit amounts, then qualitative terms</li>
 *   <li>lexical match for cuisine, diet and meal type, in that order</li>
 *   <li>semantic fallback for each of those three that found nothing lexically</li>
 *   <li>ingredient: lexical only, over tokens nothing else consumed</li>
 * </ol>
 *
 * <p>Extraction never fails. A step that throws is logged and skipped, and unmatched
 * text is dropped; no match at all yields {@link QueryIntent#unconstrained()}.
 */
public class IntentExtractor {
    private static final Logger log = LoggerFactory.getLogger(IntentExtractor.class);

    private static final List<FacetCategory> TAG_CATEGORIES =
            List.of(FacetCategory.CUISINE, FacetCategory.DIET, FacetCategory.MEAL_TYPE);

    private final List<FacetStep> steps;
    private final Embedder embedder;

    public IntentExtractor(List<FacetStep> steps, Embedder embedder) {
        this.steps = List.copyOf(steps);
        this.embedder = embedder;
    }

    public static IntentExtractor standard(Lexicon lexicon, Embedder embedder, double semanticThreshold,
                                           int quickCeilingMinutes, int slowFloorMinutes) {
        return new IntentExtractor(defaultSteps(lexicon, embedder, semanticThreshold, quickCeilingMinutes, slowFloorMinutes), embedder);
    }

    public static List<FacetStep> defaultSteps(Lexicon lexicon, Embedder embedder, double semanticThreshold,
                                               int quickCeilingMinutes, int slowFloorMinutes) {
        List<FacetStep> steps = new ArrayList<>();
        steps.add(TimeConstraintStep.withDefaults(lexicon, quickCeilingMinutes, slowFloorMinutes));
        for (FacetCategory c : TAG_CATEGORIES) {
            steps.add(new LexicalMatchStep(lexicon, c));
        }
        for (FacetCategory c : TAG_CATEGORIES) {
            steps.add(new SemanticFallbackStep(lexicon, c, embedder, semanticThreshold));
        }
        steps.add(new IngredientStep(lexicon));
        return steps;
    }

    public List<FacetStep> steps() {
        return steps;
    }

    public QueryIntent extract(List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) return QueryIntent.unconstrained();
        ExtractionContext context = new ExtractionContext(tokens, embedder);
        for (FacetStep step : steps) {
            if (!step.supports(context)) continue;
            try {
                step.apply(context);
            } catch (RuntimeException e) {
                log.error("Error applying {} to query '{}': {}", step.getName(), context.text(), e.getMessage(), e);
            }
        }
        QueryIntent intent = context.intent().build();
        log.debug("Extracted {} from tokens {}", intent, tokens);
        return intent;
    }
}
