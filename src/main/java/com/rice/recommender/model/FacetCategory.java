package com.rice.recommender.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of query dimensions the recommender understands.
 *
 * <p>Declaration order is the extraction and display order. Only the tag-backed
 * categories (cuisine, diet, meal type) support semantic fallback; ingredients are
 * matched lexically only and time constraints come from patterns.
 */
public enum FacetCategory {
    CUISINE("cuisine", true),
    DIET("diet", true),
    MEAL_TYPE("meal_type", true),
    TIME_CONSTRAINT("time_constraint", false),
    INGREDIENT("ingredient", false);

    private final String key;
    private final boolean semantic;

    FacetCategory(String key, boolean semantic) {
        this.key = key;
        this.semantic = semantic;
    }

    /** Stable lowercase key used in JSON (lexicon file, HTTP responses). */
    public String key() { return key; }

    public boolean supportsSemanticFallback() { return semantic; }

    /** Whether recipes satisfy this category through their tags (as opposed to ingredients or time). */
    public boolean isTagBacked() {
        return this == CUISINE || this == DIET || this == MEAL_TYPE;
    }

    public static Optional<FacetCategory> fromKey(String key) {
        if (key == null) return Optional.empty();
        String k = key.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (FacetCategory c : values()) {
            if (c.key.equals(k) || c.name().equalsIgnoreCase(k)) return Optional.of(c);
        }
        // Accept the plural / legacy spellings used in older lexicon files
        if (k.equals("ingredients")) return Optional.of(INGREDIENT);
        if (k.equals("dietary")) return Optional.of(DIET);
        return Optional.empty();
    }
}
