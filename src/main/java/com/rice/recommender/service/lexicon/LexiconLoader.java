package com.rice.recommender.service.lexicon;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rice.recommender.model.FacetCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Reads the lexicon JSON document.
 *
 * <pre>
 * {
 *   "fillerPhrases": ["give me", "i want", ...],
 *   "stopwords":     ["fresh", "chopped", ...],
 *   "categories":    { "cuisine": { "italian": ["italy"] }, "time_constraint": { "quick": ["fast"] } },
 *   "references":    { "diet": { "vegetarian": "no meat meatless plant based" } },
 *   "tagKeywords":   { "diet": ["low-fat", ...] }
 * }
 * </pre>
 *
 * Category keys are {@link FacetCategory#key()} values; unknown keys are logged and skipped.
 */
public class LexiconLoader {
    private static final Logger log = LoggerFactory.getLogger(LexiconLoader.class);

    private final ObjectMapper mapper;

    public LexiconLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Lexicon load(InputStream in) throws IOException {
        LexiconDocument doc;
        try {
            doc = mapper.readValue(in, LexiconDocument.class);
        } catch (IOException ex) {
            throw new IOException("Failed to parse lexicon JSON. Expect { categories: { category: { value: [synonyms] } } }", ex);
        }
        if (doc == null) throw new IOException("Lexicon JSON is empty");
        return toLexicon(doc);
    }

    Lexicon toLexicon(LexiconDocument doc) {
        Lexicon.Builder b = Lexicon.builder();
        if (doc.fillerPhrases != null) doc.fillerPhrases.forEach(b::fillerPhrase);
        if (doc.stopwords != null) doc.stopwords.forEach(b::stopword);

        if (doc.categories != null) {
            for (Map.Entry<String, Map<String, List<String>>> cat : doc.categories.entrySet()) {
                Optional<FacetCategory> category = FacetCategory.fromKey(cat.getKey());
                if (category.isEmpty()) {
                    log.warn("Skipping unknown lexicon category '{}'", cat.getKey());
                    continue;
                }
                if (cat.getValue() == null) continue;
                for (Map.Entry<String, List<String>> value : cat.getValue().entrySet()) {
                    b.add(category.get(), value.getKey(), value.getValue());
                }
            }
        }
        if (doc.references != null) {
            doc.references.forEach((key, refs) -> FacetCategory.fromKey(key).ifPresentOrElse(
                    c -> { if (refs != null) refs.forEach((value, phrase) -> b.reference(c, value, phrase)); },
                    () -> log.warn("Skipping references for unknown category '{}'", key)));
        }
        if (doc.tagKeywords != null) {
            doc.tagKeywords.forEach((key, words) -> FacetCategory.fromKey(key).ifPresentOrElse(
                    c -> { if (words != null) words.forEach(w -> b.tagKeyword(c, w)); },
                    () -> log.warn("Skipping tag keywords for unknown category '{}'", key)));
        }
        Lexicon lexicon = b.build();
        log.info("Lexicon loaded: cuisine={} diet={} meal_type={} time_constraint={} ingredient={} fillers={}",
                lexicon.size(FacetCategory.CUISINE), lexicon.size(FacetCategory.DIET),
                lexicon.size(FacetCategory.MEAL_TYPE), lexicon.size(FacetCategory.TIME_CONSTRAINT),
                lexicon.size(FacetCategory.INGREDIENT), lexicon.fillerPhrases().size());
        return lexicon;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LexiconDocument {
        public List<String> fillerPhrases;
        public List<String> stopwords;
        public Map<String, Map<String, List<String>>> categories;
        public Map<String, Map<String, String>> references;
        public Map<String, List<String>> tagKeywords;
    }
}
