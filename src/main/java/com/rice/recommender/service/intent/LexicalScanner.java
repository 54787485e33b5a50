package com.rice.recommender.service.intent;

import com.rice.recommender.model.FacetCategory;
import com.rice.recommender.service.lexicon.Lexicon;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Longest-match n-gram lookup of free tokens against one lexicon category.
 *
 * <p>Scans trigrams, then bigrams, then unigrams; each hit consumes its positions so a
 * shorter n-gram never re-matches part of a longer one ("main dish" wins over "dish").
 * Unigrams that miss are retried in singular form ("potatoes" -> "potato").
 */
final class LexicalScanner {
    static final int MAX_NGRAM = 3;

    private LexicalScanner() {}

    record Hit(String canonical, int from, int to) {}

    static List<Hit> scan(ExtractionContext ctx, Lexicon lexicon, FacetCategory category) {
        List<Hit> hits = new ArrayList<>();
        List<String> tokens = ctx.tokens();
        for (int n = Math.min(MAX_NGRAM, tokens.size()); n >= 1; n--) {
            for (int i = 0; i + n <= tokens.size(); i++) {
                if (!ctx.isFree(i, i + n)) continue;
                String surface = String.join(" ", tokens.subList(i, i + n));
                Optional<String> canonical = lexicon.lookup(category, surface);
                if (canonical.isEmpty() && n == 1) {
                    canonical = lookupSingular(lexicon, category, surface);
                }
                if (canonical.isPresent()) {
                    ctx.consume(i, i + n);
                    hits.add(new Hit(canonical.get(), i, i + n));
                }
            }
        }
        hits.sort((a, b) -> Integer.compare(a.from(), b.from()));
        return hits;
    }

    private static Optional<String> lookupSingular(Lexicon lexicon, FacetCategory category, String word) {
        for (String candidate : singularForms(word)) {
            Optional<String> hit = lexicon.lookup(category, candidate);
            if (hit.isPresent()) return hit;
        }
        return Optional.empty();
    }

    static List<String> singularForms(String word) {
        List<String> out = new ArrayList<>(3);
        if (word.length() <= 3 || !word.endsWith("s") || word.endsWith("ss")) return out;
        if (word.endsWith("ies")) out.add(word.substring(0, word.length() - 3) + "y");
        if (word.endsWith("es")) out.add(word.substring(0, word.length() - 2));
        out.add(word.substring(0, word.length() - 1));
        return out;
    }
}
