package com.rice.recommender.service.lexicon;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rice.recommender.TestData;
import com.rice.recommender.model.FacetCategory;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class LexiconLoaderTest {
    private final LexiconLoader loader = new LexiconLoader(new ObjectMapper());

    private Lexicon load(String json) throws IOException {
        return loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void bundledLexiconCoversEveryCategory() {
        Lexicon lexicon = TestData.bundledLexicon();
        for (FacetCategory c : FacetCategory.values()) {
            assertTrue(lexicon.size(c) > 0, "no values for " + c.key());
        }
        assertEquals(Optional.of("quick"), lexicon.lookup(FacetCategory.TIME_CONSTRAINT, "fast"));
        assertEquals(Optional.of("desserts"), lexicon.lookup(FacetCategory.MEAL_TYPE, "dessert"));
        assertEquals(Optional.of("gluten-free"), lexicon.lookup(FacetCategory.DIET, "gluten free"));
        assertTrue(lexicon.fillerPhrases().contains("give me"));
        assertTrue(lexicon.fillerPhrases().contains("i d like"));
    }

    @Test
    public void readsCategoriesReferencesAndKeywords() throws IOException {
        Lexicon lexicon = load("""
                {
                  "fillerPhrases": ["show me"],
                  "stopwords": ["with"],
                  "categories": {
                    "cuisine": {"italian": ["italy"]},
                    "ingredients": {"chicken": []}
                  },
                  "references": {"cuisine": {"italian": "food from italy"}},
                  "tagKeywords": {"dietary": ["vegan"]},
                  "comment": "unknown fields are ignored"
                }
                """);
        assertEquals(Optional.of("italian"), lexicon.lookup(FacetCategory.CUISINE, "italy"));
        assertEquals(Optional.of("chicken"), lexicon.lookup(FacetCategory.INGREDIENT, "chicken"));
        assertEquals("food from italy", lexicon.referencePhrase(FacetCategory.CUISINE, "italian"));
        assertEquals(1, lexicon.tagKeywords(FacetCategory.DIET).size());
        assertTrue(lexicon.stopwords().contains("with"));
    }

    @Test
    public void skipsUnknownCategories() throws IOException {
        Lexicon lexicon = load("{\"categories\": {\"mood\": {\"happy\": []}, \"diet\": {\"vegan\": []}}}");
        assertEquals(1, lexicon.size(FacetCategory.DIET));
        assertTrue(lexicon.categoryOf("happy").isEmpty());
    }

    @Test
    public void rejectsValueInTwoCategories() {
        assertThrows(IllegalArgumentException.class, () -> load(
                "{\"categories\": {\"ingredient\": {\"pasta\": []}, \"meal_type\": {\"pasta\": []}}}"));
    }

    @Test
    public void malformedJsonIsAnIoError() {
        IOException ex = assertThrows(IOException.class, () -> load("{ not json"));
        assertTrue(ex.getMessage().contains("lexicon"));
    }
}
