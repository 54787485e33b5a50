package com.rice.recommender.service.intent;

import com.rice.recommender.model.FacetCategory;
import com.rice.recommender.service.lexicon.Lexicon;

/** Exact and synonym matching for one tag-backed category. */
public class LexicalMatchStep implements FacetStep {
    private final Lexicon lexicon;
    private final FacetCategory category;

    public LexicalMatchStep(Lexicon lexicon, FacetCategory category) {
        if (category == FacetCategory.TIME_CONSTRAINT) {
            throw new IllegalArgumentException("time constraints are handled by TimeConstraintStep");
        }
        this.lexicon = lexicon;
        this.category = category;
    }

    public FacetCategory category() { return category; }

    @Override
    public boolean supports(ExtractionContext context) {
        return !context.tokens().isEmpty() && lexicon.size(category) > 0;
    }

    @Override
    public void apply(ExtractionContext context) {
        for (LexicalScanner.Hit hit : LexicalScanner.scan(context, lexicon, category)) {
            context.intent().add(category, hit.canonical());
        }
    }

    @Override
    public String getName() {
        return "LexicalMatch[" + category.key() + "]";
    }
}
