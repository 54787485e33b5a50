package com.rice.recommender.service.lexicon;

import com.rice.recommender.model.FacetCategory;
import com.rice.recommender.model.Recipe;
import com.rice.recommender.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Extends a base lexicon with vocabulary found in the dataset.
 *
 * <ul>
 *   <li>Each dataset tag not yet known is classified by the lexicon's tag keywords, trying
 *       diet, cuisine and meal type in that order, and registered as a canonical value of the
 *       first category that claims it.</li>
 *   <li>Each ingredient string, and each of its words that is at least three letters long
 *       and not a stopword, becomes an ingredient value unless another category owns it.</li>
 * </ul>
 */
public class LexiconAugmenter {
    private static final Logger log = LoggerFactory.getLogger(LexiconAugmenter.class);
    private static final List<FacetCategory> TAG_CLASSIFICATION_ORDER =
            List.of(FacetCategory.DIET, FacetCategory.CUISINE, FacetCategory.MEAL_TYPE);

    public Lexicon augment(Lexicon base, List<Recipe> recipes) {
        if (recipes == null || recipes.isEmpty()) return base;
        Lexicon.Builder b = base.toBuilder();
        int tagsAdded = 0;
        int ingredientsAdded = 0;

        Set<String> seenTags = new LinkedHashSet<>();
        Set<String> seenIngredients = new LinkedHashSet<>();
        for (Recipe r : recipes) {
            seenTags.addAll(r.getTags());
            seenIngredients.addAll(r.getIngredients());
        }

        for (String tag : seenTags) {
            if (b.owns(tag)) continue;
            for (FacetCategory c : TAG_CLASSIFICATION_ORDER) {
                if (matchesKeyword(tag, base.tagKeywords(c))) {
                    if (b.tryAdd(c, tag, List.of())) tagsAdded++;
                    break;
                }
            }
        }

        for (String ingredient : seenIngredients) {
            String simplified = TextUtils.simplify(ingredient);
            if (simplified.length() < 3) continue;
            if (!b.owns(ingredient) && b.tryAdd(FacetCategory.INGREDIENT, ingredient, List.of())) {
                ingredientsAdded++;
            }
            for (String word : simplified.split(" ")) {
                if (!isIngredientWord(word, base.stopwords())) continue;
                if (!b.owns(word) && b.tryAdd(FacetCategory.INGREDIENT, word, List.of())) {
                    ingredientsAdded++;
                }
            }
        }

        log.info("Lexicon augmented from {} recipes: {} tag values, {} ingredient values",
                recipes.size(), tagsAdded, ingredientsAdded);
        return b.build();
    }

    /**
     * A keyword claims a tag when it equals the tag or appears in it as a whole hyphen
     * or space separated part, e.g. {@code american} claims {@code north-american} but
     * {@code rice} does not claim {@code licorice}.
     */
    static boolean matchesKeyword(String tag, List<String> keywords) {
        String padded = "-" + tag.replace(' ', '-') + "-";
        for (String k : keywords) {
            if (padded.contains("-" + k.replace(' ', '-') + "-")) return true;
        }
        return false;
    }

    private static boolean isIngredientWord(String word, Set<String> stopwords) {
        if (word.length() < 3) return false;
        if (stopwords.contains(word)) return false;
        for (int i = 0; i < word.length(); i++) {
            if (!Character.isLetter(word.charAt(i))) return false;
        }
        return true;
    }
}
