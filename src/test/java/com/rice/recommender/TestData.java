package com.rice.recommender;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rice.recommender.model.Recipe;
import com.rice.recommender.service.embedding.Embedder;
import com.rice.recommender.service.embedding.EmbeddingUnavailableException;
import com.rice.recommender.service.index.RecipeCsvLoader;
import com.rice.recommender.service.lexicon.Lexicon;
import com.rice.recommender.service.lexicon.LexiconAugmenter;
import com.rice.recommender.service.lexicon.LexiconLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Shared fixtures: the bundled lexicon and sample dataset, plus embedder stubs. */
public final class TestData {
    private TestData() {}

    public static Lexicon bundledLexicon() {
        try (InputStream in = TestData.class.getResourceAsStream("/lexicon.json")) {
            return new LexiconLoader(new ObjectMapper()).load(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static List<Recipe> sampleRecipes() {
        try (InputStream in = TestData.class.getResourceAsStream("/data/recipes.csv")) {
            return new RecipeCsvLoader().load(in, "data/recipes.csv");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Lexicon augmentedLexicon() {
        return new LexiconAugmenter().augment(bundledLexicon(), sampleRecipes());
    }

    public static Recipe recipe(String id, int minutes, List<String> tags, List<String> ingredients) {
        return new Recipe(id, "recipe " + id, "", tags, ingredients, minutes);
    }

    /** Returns fixed vectors for known texts and a zero vector for anything else. */
    public static class TableEmbedder implements Embedder {
        private final int dimension;
        private final Map<String, float[]> table = new HashMap<>();
        public int calls;

        public TableEmbedder(int dimension) {
            this.dimension = dimension;
        }

        public TableEmbedder put(String text, float... vector) {
            table.put(text, vector);
            return this;
        }

        @Override
        public float[] embed(String text) {
            calls++;
            float[] v = table.get(text);
            return v != null ? v : new float[dimension];
        }

        @Override
        public int dimension() { return dimension; }

        @Override
        public boolean isEnabled() { return true; }
    }

    /** Enabled embedder whose every call fails. */
    public static class FailingEmbedder implements Embedder {
        public int calls;

        @Override
        public float[] embed(String text) {
            calls++;
            throw new EmbeddingUnavailableException("model offline");
        }

        @Override
        public int dimension() { return 4; }

        @Override
        public boolean isEnabled() { return true; }
    }
}
