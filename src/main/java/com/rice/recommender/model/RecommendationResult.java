package com.rice.recommender.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecommendationResult {
    public static final String NO_MATCH_MESSAGE = "Sorry, I couldn't find any recipes matching your request.";

    /** Which ordering produced the list. */
    public enum Ordering {
        /** Hard-filtered by extracted facets. */
        FACETS,
        /** Unconstrained query ranked by description similarity. */
        SEMANTIC,
        /** Unconstrained query without usable embeddings, ranked by tag popularity. */
        POPULARITY
    }

    private String query;
    private List<String> tokens;
    private QueryIntent intent;
    private Ordering ordering;
    private List<Item> items = new ArrayList<>();
    private boolean noMatches;
    private String message;

    public String getQuery() { return query; }
    public void setQuery(String query) { this.query = query; }
    public List<String> getTokens() { return tokens; }
    public void setTokens(List<String> tokens) { this.tokens = tokens; }
    public QueryIntent getIntent() { return intent; }
    public void setIntent(QueryIntent intent) { this.intent = intent; }
    public Ordering getOrdering() { return ordering; }
    public void setOrdering(Ordering ordering) { this.ordering = ordering; }
    public List<Item> getItems() { return items; }
    public void setItems(List<Item> items) { this.items = items; }
    public boolean isNoMatches() { return noMatches; }
    public void setNoMatches(boolean noMatches) { this.noMatches = noMatches; }
    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    /** Output record for one recommended recipe, with the rationale fields of its match. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Item {
        private String id;
        private String title;
        private int timeMinutes;
        private List<String> tags;
        private List<String> ingredients;
        private String description;
        private int score;
        private List<String> matchedFacets;
        private double similarity;

        public static Item of(Recipe recipe, ScoredMatch match) {
            Item item = new Item();
            item.id = recipe.getId();
            item.title = recipe.getTitle();
            item.timeMinutes = recipe.getTimeMinutes();
            item.tags = recipe.getTags();
            item.ingredients = recipe.getIngredients();
            item.description = recipe.getDescription();
            item.score = match.score();
            List<String> facets = new ArrayList<>();
            for (FacetCategory c : FacetCategory.values()) {
                if (match.matchedFacets().contains(c)) facets.add(c.key());
            }
            item.matchedFacets = facets;
            item.similarity = match.similarity();
            return item;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }
        public int getTimeMinutes() { return timeMinutes; }
        public void setTimeMinutes(int timeMinutes) { this.timeMinutes = timeMinutes; }
        public List<String> getTags() { return tags; }
        public void setTags(List<String> tags) { this.tags = tags; }
        public List<String> getIngredients() { return ingredients; }
        public void setIngredients(List<String> ingredients) { this.ingredients = ingredients; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public int getScore() { return score; }
        public void setScore(int score) { this.score = score; }
        public List<String> getMatchedFacets() { return matchedFacets; }
        public void setMatchedFacets(List<String> matchedFacets) { this.matchedFacets = matchedFacets; }
        public double getSimilarity() { return similarity; }
        public void setSimilarity(double similarity) { this.similarity = similarity; }
    }
}
