package com.rice.recommender.service.intent;

import com.rice.recommender.model.FacetCategory;
import com.rice.recommender.service.lexicon.Lexicon;

/**
 * Ingredient matching. Runs last and only sees tokens no earlier step consumed.
 * Lexical only: ingredients are never inferred from embeddings.
 */
public class IngredientStep implements FacetStep {
    private final Lexicon lexicon;

    public IngredientStep(Lexicon lexicon) {
        this.lexicon = lexicon;
    }

    @Override
    public boolean supports(ExtractionContext context) {
        return !context.tokens().isEmpty() && lexicon.size(FacetCategory.INGREDIENT) > 0;
    }

    @Override
    public void apply(ExtractionContext context) {
        for (LexicalScanner.Hit hit : LexicalScanner.scan(context, lexicon, FacetCategory.INGREDIENT)) {
            if (lexicon.stopwords().contains(hit.canonical())) continue;
            context.intent().add(FacetCategory.INGREDIENT, hit.canonical());
        }
    }
}
