package com.rice.recommender.service.intent;

/**
 * One rule in the ordered intent extraction chain.
 *
 * <p>Steps run in list order over a shared {@link ExtractionContext}. A step adds canonical
 * values to the context's intent builder and may consume token positions so later steps
 * (notably ingredient matching) do not reinterpret them. Steps must be deterministic and
 * must not throw for any input; a step that cannot run (e.g. no embedder) reports
 * {@code false} from {@link #supports}.
 */
public interface FacetStep {

    boolean supports(ExtractionContext context);

    void apply(ExtractionContext context);

    default String getName() {
        return this.getClass().getSimpleName();
    }
}
