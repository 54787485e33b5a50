package com.rice.recommender.service.index;

import com.rice.recommender.model.Recipe;
import com.rice.recommender.service.embedding.Embedder;
import com.rice.recommender.service.embedding.EmbeddingUnavailableException;
import com.rice.recommender.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Read-only, in-memory view of the recipe dataset.
 *
 * <p>Recipes keep their dataset order (their position is the final tie-break). Lookup maps
 * go from a tag, or an ingredient term, to the positions of the recipes carrying it.
 * Ingredient terms are each full ingredient string plus every one to three word run of
 * it, so "chicken" and "chicken breast" both find "boneless chicken breast".
 * Description vectors are present only when an enabled embedder succeeded for every recipe.
 */
public final class RecipeIndex {
    private static final Logger log = LoggerFactory.getLogger(RecipeIndex.class);
    private static final int MAX_TERM_WORDS = 3;

    private final List<Recipe> recipes;
    private final Map<String, Integer> positionsById;
    private final Map<String, Set<Integer>> byTag;
    private final Map<String, Set<Integer>> byIngredientTerm;
    private final Map<String, Integer> tagFrequency;
    private final float[][] vectors;

    private RecipeIndex(List<Recipe> recipes, float[][] vectors) {
        this.recipes = List.copyOf(recipes);
        Map<String, Integer> ids = new HashMap<>();
        Map<String, Set<Integer>> tags = new HashMap<>();
        Map<String, Set<Integer>> terms = new HashMap<>();
        Map<String, Integer> freq = new HashMap<>();
        for (int i = 0; i < this.recipes.size(); i++) {
            Recipe r = this.recipes.get(i);
            if (ids.putIfAbsent(r.getId(), i) != null) {
                log.warn("Duplicate recipe id '{}' at position {}; lookups by id return the first", r.getId(), i);
            }
            for (String tag : r.getTags()) {
                tags.computeIfAbsent(tag, k -> new LinkedHashSet<>()).add(i);
                freq.merge(tag, 1, Integer::sum);
            }
            for (String term : ingredientTerms(r)) {
                terms.computeIfAbsent(term, k -> new LinkedHashSet<>()).add(i);
            }
        }
        this.positionsById = Collections.unmodifiableMap(ids);
        this.byTag = freeze(tags);
        this.byIngredientTerm = freeze(terms);
        this.tagFrequency = Collections.unmodifiableMap(freq);
        this.vectors = vectors;
    }

    public static RecipeIndex empty() {
        return new RecipeIndex(List.of(), null);
    }

    public static RecipeIndex build(List<Recipe> recipes) {
        return new RecipeIndex(recipes, null);
    }

    /**
     * Builds the index and, when {@code embedder} is enabled, embeds every recipe's title and
     * description. Any embedding failure leaves the index without vectors.
     */
    public static RecipeIndex build(List<Recipe> recipes, Embedder embedder) {
        if (embedder == null || !embedder.isEnabled() || recipes.isEmpty()) {
            return new RecipeIndex(recipes, null);
        }
        long t0 = System.currentTimeMillis();
        float[][] vectors = new float[recipes.size()][];
        try {
            for (int i = 0; i < recipes.size(); i++) {
                vectors[i] = embedder.embed(recipes.get(i).embeddingText());
            }
        } catch (EmbeddingUnavailableException e) {
            log.warn("Description embeddings unavailable, semantic ranking disabled: {}", e.getMessage());
            return new RecipeIndex(recipes, null);
        }
        log.info("Embedded {} recipe descriptions with {} in {} ms",
                recipes.size(), embedder.getName(), System.currentTimeMillis() - t0);
        return new RecipeIndex(recipes, vectors);
    }

    public int size() { return recipes.size(); }

    public boolean isEmpty() { return recipes.isEmpty(); }

    public List<Recipe> recipes() { return recipes; }

    public Recipe get(int position) { return recipes.get(position); }

    public Optional<Recipe> byId(String id) {
        Integer pos = positionsById.get(id);
        return pos == null ? Optional.empty() : Optional.of(recipes.get(pos));
    }

    /** Positions of recipes tagged {@code tag}, in dataset order. */
    public Set<Integer> withTag(String tag) {
        return byTag.getOrDefault(tag, Set.of());
    }

    /** Positions of recipes with an ingredient term equal to {@code term}, in dataset order. */
    public Set<Integer> withIngredient(String term) {
        return byIngredientTerm.getOrDefault(term, Set.of());
    }

    public Set<String> tags() {
        return byTag.keySet();
    }

    public int tagFrequency(String tag) {
        return tagFrequency.getOrDefault(tag, 0);
    }

    /** Sum of dataset-wide frequencies of the recipe's tags; higher means more typical. */
    public int popularity(int position) {
        int sum = 0;
        for (String tag : recipes.get(position).getTags()) sum += tagFrequency(tag);
        return sum;
    }

    public boolean hasVectors() {
        return vectors != null;
    }

    public Optional<float[]> vector(int position) {
        return vectors == null ? Optional.empty() : Optional.ofNullable(vectors[position]);
    }

    static Set<String> ingredientTerms(Recipe recipe) {
        Set<String> terms = new LinkedHashSet<>();
        for (String ingredient : recipe.getIngredients()) {
            terms.add(ingredient);
            String simplified = TextUtils.simplify(ingredient);
            if (simplified.isEmpty()) continue;
            terms.add(simplified);
            String[] words = simplified.split(" ");
            for (int n = 1; n <= Math.min(MAX_TERM_WORDS, words.length); n++) {
                for (int i = 0; i + n <= words.length; i++) {
                    terms.add(String.join(" ", Arrays.asList(words).subList(i, i + n)));
                }
            }
        }
        return terms;
    }

    private static Map<String, Set<Integer>> freeze(Map<String, Set<Integer>> in) {
        Map<String, Set<Integer>> out = new HashMap<>();
        for (Map.Entry<String, Set<Integer>> e : in.entrySet()) {
            out.put(e.getKey(), Collections.unmodifiableSet(e.getValue()));
        }
        return Collections.unmodifiableMap(out);
    }
}
