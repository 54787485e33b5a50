package com.rice.recommender.service.ranking;

import com.rice.recommender.TestData;
import com.rice.recommender.model.FacetCategory;
import com.rice.recommender.model.QueryIntent;
import com.rice.recommender.model.RecommendationResult.Ordering;
import com.rice.recommender.model.Recipe;
import com.rice.recommender.model.ScoredMatch;
import com.rice.recommender.model.TimeBound;
import com.rice.recommender.service.embedding.DisabledEmbedder;
import com.rice.recommender.service.index.RecipeIndex;
import com.rice.recommender.service.lexicon.Lexicon;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class RankingEngineTest {
    private static final List<Recipe> RECIPES = List.of(
            TestData.recipe("r0", 25, List.of("asian", "main-dish"), List.of("chicken breast", "soy sauce")),
            TestData.recipe("r1", 40, List.of("asian", "thai"), List.of("chicken thighs")),
            TestData.recipe("r2", 20, List.of("asian", "vegetarian"), List.of("rice", "eggs")),
            TestData.recipe("r3", 45, List.of("desserts", "vegan"), List.of("apples")),
            TestData.recipe("r4", 10, List.of("desserts", "vegan"), List.of("bananas")),
            TestData.recipe("r5", 10, List.of("desserts", "vegan"), List.of("cocoa")),
            TestData.recipe("r6", 30, List.of("italian"), List.of("chicken")));
    private static final RecipeIndex INDEX = RecipeIndex.build(RECIPES);

    private final RankingEngine all = new RankingEngine(MatchMode.ALL, new DisabledEmbedder());

    private static List<String> ids(List<ScoredMatch> matches) {
        return matches.stream().map(ScoredMatch::recipeId).collect(Collectors.toList());
    }

    private static QueryIntent asianChicken() {
        return QueryIntent.builder()
                .add(FacetCategory.CUISINE, "asian")
                .add(FacetCategory.INGREDIENT, "chicken")
                .build();
    }

    @Test
    public void everyResultSatisfiesEveryFacet() {
        List<ScoredMatch> matches = all.rank(asianChicken(), INDEX, 10);
        assertEquals(List.of("r0", "r1"), ids(matches));
        for (ScoredMatch m : matches) {
            assertEquals(2, m.score());
            assertEquals(Set.of(FacetCategory.CUISINE, FacetCategory.INGREDIENT), m.matchedFacets());
        }
    }

    @Test
    public void timeBoundIsAHardFilter() {
        QueryIntent intent = QueryIntent.builder()
                .addTime("quick", TimeBound.atMost(30))
                .add(FacetCategory.DIET, "vegan")
                .add(FacetCategory.MEAL_TYPE, "desserts")
                .build();
        // r3 is a vegan dessert but takes 45 minutes; r4 and r5 tie on time so dataset order decides
        assertEquals(List.of("r4", "r5"), ids(all.rank(intent, INDEX, 3)));
    }

    @Test
    public void addingAConstraintNeverGrowsTheResult() {
        QueryIntent asian = QueryIntent.builder().add(FacetCategory.CUISINE, "asian").build();
        List<String> broad = ids(all.rank(asian, INDEX, 10));
        List<String> narrow = ids(all.rank(asianChicken(), INDEX, 10));
        assertEquals(List.of("r2", "r0", "r1"), broad);
        assertTrue(narrow.size() <= broad.size());
        assertTrue(broad.containsAll(narrow));
    }

    @Test
    public void multipleValuesInOneCategoryAreAlternatives() {
        QueryIntent intent = QueryIntent.builder()
                .add(FacetCategory.CUISINE, "thai")
                .add(FacetCategory.CUISINE, "italian")
                .build();
        assertEquals(List.of("r6", "r1"), ids(all.rank(intent, INDEX, 10)));
    }

    @Test
    public void anyModeRanksPartialMatchesBelowFullOnes() {
        RankingEngine any = new RankingEngine(MatchMode.ANY, new DisabledEmbedder());
        List<ScoredMatch> matches = any.rank(asianChicken(), INDEX, 10);
        assertEquals(List.of("r0", "r1", "r2", "r6"), ids(matches));
        assertEquals(List.of(2, 2, 1, 1), matches.stream().map(ScoredMatch::score).collect(Collectors.toList()));
    }

    @Test
    public void truncatesToTopN() {
        QueryIntent asian = QueryIntent.builder().add(FacetCategory.CUISINE, "asian").build();
        assertEquals(List.of("r2"), ids(all.rank(asian, INDEX, 1)));
        assertTrue(all.rank(asian, INDEX, 0).isEmpty());
    }

    @Test
    public void noMatchYieldsEmptyList() {
        QueryIntent mexican = QueryIntent.builder().add(FacetCategory.CUISINE, "mexican").build();
        assertTrue(all.rank(mexican, INDEX, 3).isEmpty());

        QueryIntent impossible = QueryIntent.builder()
                .addTime("slow", TimeBound.atLeast(60))
                .addTime("quick", TimeBound.atMost(30))
                .build();
        assertTrue(all.rank(impossible, INDEX, 3).isEmpty());
    }

    @Test
    public void unconstrainedWithoutVectorsUsesPopularity() {
        RankingEngine.Ranking ranking = all.rank(QueryIntent.unconstrained(), INDEX, 3, "anything");
        assertEquals(Ordering.POPULARITY, ranking.ordering());
        assertEquals(List.of("r3", "r4", "r5"), ids(ranking.matches()));
    }

    @Test
    public void unconstrainedWithVectorsUsesSimilarity() {
        TestData.TableEmbedder embedder = new TestData.TableEmbedder(2)
                .put("recipe r6", 1f, 0f)
                .put("recipe r1", 0.5f, 0.5f)
                .put("italian chicken", 1f, 0f);
        RecipeIndex index = RecipeIndex.build(RECIPES, embedder);
        RankingEngine engine = new RankingEngine(MatchMode.ALL, embedder);

        RankingEngine.Ranking ranking = engine.rank(QueryIntent.unconstrained(), index, 3, "italian chicken");
        assertEquals(Ordering.SEMANTIC, ranking.ordering());
        assertEquals(List.of("r6", "r1", "r0"), ids(ranking.matches()));

        // Empty query text cannot be embedded
        assertEquals(Ordering.POPULARITY, engine.rank(QueryIntent.unconstrained(), index, 3, "").ordering());
    }

    @Test
    public void similarityBreaksScoreTies() {
        TestData.TableEmbedder embedder = new TestData.TableEmbedder(2)
                .put("recipe r2", 0f, 1f)
                .put("veggie asian", 0f, 1f);
        RecipeIndex index = RecipeIndex.build(RECIPES, embedder);
        RankingEngine engine = new RankingEngine(MatchMode.ALL, embedder);
        QueryIntent asian = QueryIntent.builder().add(FacetCategory.CUISINE, "asian").build();

        RankingEngine.Ranking ranking = engine.rank(asian, index, 3, "veggie asian");
        assertEquals(Ordering.FACETS, ranking.ordering());
        assertEquals(List.of("r2", "r0", "r1"), ids(ranking.matches()));
        assertTrue(ranking.matches().get(0).similarity() > 0.99);
    }

    @Test
    public void failingQueryEmbeddingFallsBackToPopularity() {
        RecipeIndex index = RecipeIndex.build(RECIPES, new TestData.TableEmbedder(2));
        RankingEngine engine = new RankingEngine(MatchMode.ALL, new TestData.FailingEmbedder());
        RankingEngine.Ranking ranking = engine.rank(QueryIntent.unconstrained(), index, 3, "dinner ideas");
        assertEquals(Ordering.POPULARITY, ranking.ordering());
        assertEquals(3, ranking.matches().size());
    }

    @Test
    public void emptyIndexAlwaysYieldsEmptyList() {
        assertTrue(all.rank(asianChicken(), RecipeIndex.empty(), 3).isEmpty());
        assertTrue(all.rank(QueryIntent.unconstrained(), RecipeIndex.empty(), 3).isEmpty());
    }

    @Test
    public void requestedValuesMatchThroughTheirSurfaceForms() {
        List<Recipe> recipes = List.of(
                TestData.recipe("t0", 20, List.of("italian"), List.of("tomato sauce")),
                TestData.recipe("t1", 30, List.of("creole"), List.of("rice")),
                TestData.recipe("t2", 15, List.of("cajun"), List.of("tomatoes")));
        RecipeIndex index = RecipeIndex.build(recipes);
        Lexicon lexicon = Lexicon.builder()
                .add(FacetCategory.INGREDIENT, "tomatoes", List.of("tomato"))
                .add(FacetCategory.CUISINE, "cajun", List.of("creole"))
                .build();
        RankingEngine engine = new RankingEngine(MatchMode.ALL, new DisabledEmbedder(), lexicon);

        QueryIntent tomatoes = QueryIntent.builder().add(FacetCategory.INGREDIENT, "tomatoes").build();
        assertEquals(List.of("t2", "t0"), ids(engine.rank(tomatoes, index, 3)));
        assertEquals(List.of("t2"), ids(all.rank(tomatoes, index, 3)), "no lexicon, exact values only");

        QueryIntent cajun = QueryIntent.builder().add(FacetCategory.CUISINE, "cajun").build();
        assertEquals(List.of("t2", "t1"), ids(engine.rank(cajun, index, 3)));
    }
}
