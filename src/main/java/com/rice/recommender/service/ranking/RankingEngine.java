package com.rice.recommender.service.ranking;

import com.rice.recommender.model.FacetCategory;
import com.rice.recommender.model.QueryIntent;
import com.rice.recommender.model.RecommendationResult.Ordering;
import com.rice.recommender.model.Recipe;
import com.rice.recommender.model.ScoredMatch;
import com.rice.recommender.model.TimeBound;
import com.rice.recommender.service.embedding.Embedder;
import com.rice.recommender.service.embedding.EmbeddingUnavailableException;
import com.rice.recommender.service.embedding.VectorMath;
import com.rice.recommender.service.index.RecipeIndex;
import com.rice.recommender.service.lexicon.Lexicon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Scores indexed recipes against a {@link QueryIntent} and returns the top matches.
 *
 * <p>Each constrained category a recipe satisfies adds one point. Tag-backed categories
 * match when one of the recipe's tags equals a requested value, ingredients when a
 * requested value is one of the recipe's ingredient terms, and time when the recipe's
 * minutes fall inside the {@link TimeBound}. A requested value also matches through its
 * lexicon surface forms, so {@code tomatoes} finds a recipe listing "tomato sauce". With {@link MatchMode#ALL} only recipes that
 * satisfy every constrained category survive; with {@link MatchMode#ANY} only score 0 is
 * dropped.
 *
 * <p>Order: score desc, query/description similarity desc, minutes asc, dataset position asc.
 * An unconstrained intent is ranked by similarity to the query text when description
 * vectors exist and the query embeds, otherwise by tag popularity.
 */
public class RankingEngine {
    private static final Logger log = LoggerFactory.getLogger(RankingEngine.class);

    /** Matches plus the ordering that produced them. */
    public record Ranking(List<ScoredMatch> matches, Ordering ordering) {}

    private final MatchMode mode;
    private final Embedder embedder;
    private final Lexicon lexicon;

    public RankingEngine(MatchMode mode, Embedder embedder) {
        this(mode, embedder, Lexicon.empty());
    }

    public RankingEngine(MatchMode mode, Embedder embedder, Lexicon lexicon) {
        this.mode = mode == null ? MatchMode.ALL : mode;
        this.embedder = embedder;
        this.lexicon = lexicon == null ? Lexicon.empty() : lexicon;
    }

    public MatchMode mode() { return mode; }

    /** Ranking without a query text: facet scoring, or popularity when unconstrained. */
    public List<ScoredMatch> rank(QueryIntent intent, RecipeIndex index, int topN) {
        return rank(intent, index, topN, null).matches();
    }

    /**
     * @param queryText normalized query text used for similarity tie-breaks and
     *                  unconstrained semantic ordering, may be null
     */
    public Ranking rank(QueryIntent intent, RecipeIndex index, int topN, String queryText) {
        QueryIntent effective = intent == null ? QueryIntent.unconstrained() : intent;
        if (index == null || index.isEmpty() || topN <= 0) {
            return new Ranking(List.of(), effective.isUnconstrained() ? Ordering.POPULARITY : Ordering.FACETS);
        }
        float[] queryVector = embedQuery(index, queryText);
        if (effective.isUnconstrained()) {
            return queryVector != null
                    ? new Ranking(bySimilarity(index, queryVector, topN), Ordering.SEMANTIC)
                    : new Ranking(byPopularity(index, topN), Ordering.POPULARITY);
        }
        return new Ranking(byFacets(effective, index, queryVector, topN), Ordering.FACETS);
    }

    private List<ScoredMatch> byFacets(QueryIntent intent, RecipeIndex index, float[] queryVector, int topN) {
        // Positions matching each set-backed category (any requested value)
        Map<FacetCategory, Set<Integer>> matching = new EnumMap<>(FacetCategory.class);
        for (FacetCategory c : intent.constrainedCategories()) {
            if (c == FacetCategory.TIME_CONSTRAINT) continue;
            Set<Integer> positions = new HashSet<>();
            for (String term : matchTerms(c, intent.values(c))) {
                positions.addAll(c.isTagBacked() ? index.withTag(term) : index.withIngredient(term));
            }
            matching.put(c, positions);
        }
        TimeBound bound = intent.isConstrained(FacetCategory.TIME_CONSTRAINT) ? intent.getTimeBound() : null;
        int required = intent.constrainedCategories().size();

        List<ScoredMatch> scored = new ArrayList<>();
        for (int pos : candidates(index, matching)) {
            Recipe r = index.get(pos);
            Set<FacetCategory> matched = EnumSet.noneOf(FacetCategory.class);
            for (Map.Entry<FacetCategory, Set<Integer>> e : matching.entrySet()) {
                if (e.getValue().contains(pos)) matched.add(e.getKey());
            }
            if (bound != null && bound.satisfiedBy(r.getTimeMinutes())) {
                matched.add(FacetCategory.TIME_CONSTRAINT);
            }
            int score = matched.size();
            if (score == 0 || (mode == MatchMode.ALL && score < required)) continue;
            scored.add(new ScoredMatch(r.getId(), score, Collections.unmodifiableSet(matched),
                    similarity(index, pos, queryVector), pos));
        }
        scored.sort(Comparator.comparingInt(ScoredMatch::score).reversed()
                .thenComparing(Comparator.comparingDouble(ScoredMatch::similarity).reversed())
                .thenComparingInt((ScoredMatch m) -> index.get(m.position()).getTimeMinutes())
                .thenComparingInt(ScoredMatch::position));
        log.debug("Facet ranking ({}): {} of {} recipes qualified", mode, scored.size(), index.size());
        return truncate(scored, topN);
    }

    /** Requested values plus every surface form the lexicon files under them. */
    private Set<String> matchTerms(FacetCategory category, Set<String> values) {
        Set<String> terms = new LinkedHashSet<>(values);
        for (String value : values) {
            terms.addAll(lexicon.synonymsOf(category, value));
        }
        return terms;
    }

    /** In ALL mode the smallest category set bounds the candidates; otherwise every recipe is scored. */
    private Collection<Integer> candidates(RecipeIndex index, Map<FacetCategory, Set<Integer>> matching) {
        if (mode == MatchMode.ALL && !matching.isEmpty()) {
            Set<Integer> smallest = null;
            for (Set<Integer> s : matching.values()) {
                if (smallest == null || s.size() < smallest.size()) smallest = s;
            }
            List<Integer> out = new ArrayList<>(smallest);
            Collections.sort(out);
            return out;
        }
        List<Integer> all = new ArrayList<>(index.size());
        for (int i = 0; i < index.size(); i++) all.add(i);
        return all;
    }

    private List<ScoredMatch> bySimilarity(RecipeIndex index, float[] queryVector, int topN) {
        List<ScoredMatch> out = new ArrayList<>(index.size());
        for (int i = 0; i < index.size(); i++) {
            out.add(new ScoredMatch(index.get(i).getId(), 0, Set.of(), similarity(index, i, queryVector), i));
        }
        out.sort(Comparator.comparingDouble(ScoredMatch::similarity).reversed()
                .thenComparingInt(ScoredMatch::position));
        return truncate(out, topN);
    }

    private List<ScoredMatch> byPopularity(RecipeIndex index, int topN) {
        Integer[] order = new Integer[index.size()];
        int[] popularity = new int[index.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
            popularity[i] = index.popularity(i);
        }
        Arrays.sort(order, Comparator.comparingInt((Integer i) -> popularity[i]).reversed()
                .thenComparingInt(i -> i));
        List<ScoredMatch> out = new ArrayList<>(Math.min(topN, order.length));
        for (int k = 0; k < order.length && out.size() < topN; k++) {
            int pos = order[k];
            out.add(new ScoredMatch(index.get(pos).getId(), 0, Set.of(), 0.0, pos));
        }
        return out;
    }

    private float[] embedQuery(RecipeIndex index, String queryText) {
        if (queryText == null || queryText.isBlank() || !index.hasVectors()
                || embedder == null || !embedder.isEnabled()) {
            return null;
        }
        try {
            return embedder.embed(queryText);
        } catch (EmbeddingUnavailableException e) {
            log.warn("Query embedding unavailable, similarity ordering disabled: {}", e.getMessage());
            return null;
        }
    }

    private static double similarity(RecipeIndex index, int position, float[] queryVector) {
        if (queryVector == null) return 0.0;
        Optional<float[]> v = index.vector(position);
        if (v.isEmpty()) return 0.0;
        try {
            return VectorMath.cosine(queryVector, v.get());
        } catch (IllegalArgumentException e) {
            log.debug("Skipping similarity for position {}: {}", position, e.getMessage());
            return 0.0;
        }
    }

    private static List<ScoredMatch> truncate(List<ScoredMatch> in, int topN) {
        return in.size() <= topN ? List.copyOf(in) : List.copyOf(in.subList(0, topN));
    }
}
