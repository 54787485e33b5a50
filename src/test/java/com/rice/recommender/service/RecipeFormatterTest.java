package com.rice.recommender.service;

import com.rice.recommender.model.FacetCategory;
import com.rice.recommender.model.Recipe;
import com.rice.recommender.model.RecommendationResult;
import com.rice.recommender.model.ScoredMatch;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class RecipeFormatterTest {
    private final RecipeFormatter formatter = new RecipeFormatter();

    private static RecommendationResult.Item item(Recipe recipe) {
        return RecommendationResult.Item.of(recipe, new ScoredMatch(recipe.getId(), 1, Set.of(FacetCategory.CUISINE), 0.0, 0));
    }

    @Test
    public void formatsOneRecipe() {
        Recipe recipe = new Recipe("1", "sesame chicken stir fry", "a weeknight stir fry.",
                List.of("asian", "chinese", "main-dish", "easy", "30-minutes-or-less"),
                List.of("chicken", "soy sauce", "garlic", "ginger", "broccoli", "sesame oil", "rice"), 25);
        String text = formatter.formatItem(item(recipe), 1);
        assertTrue(text.contains("1. Sesame Chicken Stir Fry\n"));
        assertTrue(text.contains("Cooking Time: 25 minutes\n"));
        assertTrue(text.contains("Tags: asian • chinese • main-dish • easy\n"));
        assertTrue(text.contains("Main Ingredients: chicken, soy sauce, garlic, ginger, broccoli (and 2 more)\n"));
        assertTrue(text.contains("Description: a weeknight stir fry.\n"));
        assertTrue(text.endsWith("─".repeat(50)));
    }

    @Test
    public void formatsHoursAndMinutes() {
        assertEquals("45 minutes", RecipeFormatter.formatMinutes(45));
        assertEquals("1h 0m", RecipeFormatter.formatMinutes(60));
        assertEquals("8h 5m", RecipeFormatter.formatMinutes(485));
    }

    @Test
    public void fallsBackForMissingFields() {
        assertEquals("No tags available", RecipeFormatter.formatTags(List.of()));
        assertEquals("No description available", RecipeFormatter.formatDescription(""));
        assertEquals("No description available", RecipeFormatter.formatDescription("nan"));
        assertEquals("eggs, milk", RecipeFormatter.formatIngredients(List.of("eggs", "milk")));
    }

    @Test
    public void numbersEachRecipe() {
        RecommendationResult result = new RecommendationResult();
        result.setItems(List.of(
                item(new Recipe("1", "a", "", List.of(), List.of(), 5)),
                item(new Recipe("2", "b", "", List.of(), List.of(), 5))));
        String text = formatter.format(result);
        assertTrue(text.contains("1. A\n"));
        assertTrue(text.contains("2. B\n"));
    }

    @Test
    public void noMatchRendersMessage() {
        RecommendationResult result = new RecommendationResult();
        result.setNoMatches(true);
        assertEquals(RecommendationResult.NO_MATCH_MESSAGE, formatter.format(result));
        assertEquals(RecommendationResult.NO_MATCH_MESSAGE, formatter.format(null));
    }
}
