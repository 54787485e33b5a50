package com.rice.recommender.model;

import java.util.*;

/**
 * A dataset recipe. Immutable once constructed.
 *
 * <p>Tags and ingredients are lowercased, trimmed and deduplicated in first-seen order
 * so that index lookups can use exact string equality.
 */
public final class Recipe {
    private final String id;
    private final String title;
    private final String description;
    private final List<String> tags;
    private final List<String> ingredients;
    private final int timeMinutes;

    public Recipe(String id, String title, String description, Collection<String> tags,
                  Collection<String> ingredients, int timeMinutes) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = title == null ? "" : title.trim();
        this.description = description == null ? "" : description.trim();
        this.tags = canonicalize(tags);
        this.ingredients = canonicalize(ingredients);
        this.timeMinutes = Math.max(0, timeMinutes);
    }

    private static List<String> canonicalize(Collection<String> values) {
        if (values == null || values.isEmpty()) return List.of();
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String v : values) {
            if (v == null) continue;
            String t = v.trim().toLowerCase(Locale.ROOT);
            if (!t.isEmpty()) out.add(t);
        }
        return List.copyOf(out);
    }

    public String getId() { return id; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public List<String> getTags() { return tags; }
    public List<String> getIngredients() { return ingredients; }
    public int getTimeMinutes() { return timeMinutes; }

    /** Text used for description embeddings. */
    public String embeddingText() {
        if (description.isEmpty()) return title;
        return title + ". " + description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Recipe r)) return false;
        return id.equals(r.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Recipe{" + id + ", '" + title + "', " + timeMinutes + " min}";
    }
}
