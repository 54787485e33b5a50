package com.rice.recommender.model;

import java.util.Set;

/**
 * One ranked candidate. {@code similarity} is the query/description cosine used as the first
 * tie-break (0 when embeddings are unavailable); {@code position} is the dataset order.
 */
public record ScoredMatch(String recipeId, int score, Set<FacetCategory> matchedFacets, double similarity, int position) {
}
