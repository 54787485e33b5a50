package com.rice.recommender.service;

import com.rice.recommender.model.RecommendationResult;
import com.rice.recommender.util.TextUtils;

import java.util.List;

/**
 * Plain-text rendering of recommendations for the console and the text endpoint.
 */
public class RecipeFormatter {
    static final int MAX_INGREDIENTS = 5;
    static final int MAX_TAGS = 4;
    static final String NO_DESCRIPTION = "No description available";
    static final String NO_TAGS = "No tags available";
    private static final String RULE = "─".repeat(50);

    public String format(RecommendationResult result) {
        if (result == null || result.isNoMatches() || result.getItems().isEmpty()) {
            return RecommendationResult.NO_MATCH_MESSAGE;
        }
        StringBuilder sb = new StringBuilder();
        List<RecommendationResult.Item> items = result.getItems();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) sb.append('\n');
            sb.append(formatItem(items.get(i), i + 1));
        }
        return sb.toString();
    }

    public String formatItem(RecommendationResult.Item item, int rank) {
        return "\n" + rank + ". " + TextUtils.titleCase(item.getTitle()) + "\n"
                + "Cooking Time: " + formatMinutes(item.getTimeMinutes()) + "\n"
                + "Tags: " + formatTags(item.getTags()) + "\n"
                + "Main Ingredients: " + formatIngredients(item.getIngredients()) + "\n"
                + "Description: " + formatDescription(item.getDescription()) + "\n"
                + RULE;
    }

    /** "45 minutes" below an hour, "2h 5m" from an hour up. */
    static String formatMinutes(int minutes) {
        if (minutes < 60) return minutes + " minutes";
        return (minutes / 60) + "h " + (minutes % 60) + "m";
    }

    static String formatIngredients(List<String> ingredients) {
        if (ingredients == null || ingredients.isEmpty()) return "";
        String head = String.join(", ", ingredients.subList(0, Math.min(MAX_INGREDIENTS, ingredients.size())));
        if (ingredients.size() > MAX_INGREDIENTS) {
            head += " (and " + (ingredients.size() - MAX_INGREDIENTS) + " more)";
        }
        return head;
    }

    static String formatTags(List<String> tags) {
        if (tags == null || tags.isEmpty()) return NO_TAGS;
        return String.join(" • ", tags.subList(0, Math.min(MAX_TAGS, tags.size())));
    }

    static String formatDescription(String description) {
        if (description == null || description.isBlank() || description.equalsIgnoreCase("nan")) {
            return NO_DESCRIPTION;
        }
        return description;
    }
}
