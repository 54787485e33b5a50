package com.rice.recommender.service.intent;

import com.rice.recommender.service.lexicon.Lexicon;
import com.rice.recommender.util.TextUtils;

import java.util.Arrays;
import java.util.List;

/**
 * Turns a raw utterance into match-ready tokens: lowercase, punctuation stripped,
 * filler phrases removed (longest first, whole words only), whitespace collapsed.
 * Pure and total; blank input yields an empty list.
 */
public class TextNormalizer {
    private final List<String> fillerPhrases;

    public TextNormalizer(Lexicon lexicon) {
        this(lexicon.fillerPhrases());
    }

    /** @param fillerPhrases simplified phrases, already sorted longest first */
    public TextNormalizer(List<String> fillerPhrases) {
        this.fillerPhrases = List.copyOf(fillerPhrases);
    }

    public List<String> normalize(String raw) {
        String s = TextUtils.simplify(raw);
        if (s.isEmpty()) return List.of();

        // Space padding turns phrase removal into whole-word matching
        String padded = " " + s + " ";
        for (String phrase : fillerPhrases) {
            String needle = " " + phrase + " ";
            while (padded.contains(needle)) {
                padded = padded.replace(needle, " ");
            }
        }
        String out = padded.trim();
        if (out.isEmpty()) return List.of();
        return Arrays.asList(out.split(" +"));
    }
}
