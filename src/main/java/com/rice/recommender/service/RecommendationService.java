package com.rice.recommender.service;

import com.rice.recommender.model.QueryIntent;
import com.rice.recommender.model.Recipe;
import com.rice.recommender.model.RecommendationResult;
import com.rice.recommender.model.ScoredMatch;
import com.rice.recommender.service.index.RecipeIndex;
import com.rice.recommender.service.intent.IntentExtractor;
import com.rice.recommender.service.intent.TextNormalizer;
import com.rice.recommender.service.ranking.RankingEngine;
import com.rice.recommender.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Request-level entry point: normalize, extract, rank, and package the result.
 * Stateless apart from the shared read-only components it is built from.
 */
public class RecommendationService {
    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);
    private static final int LOGGED_QUERY_CHARS = 50;

    private final TextNormalizer normalizer;
    private final IntentExtractor extractor;
    private final RankingEngine rankingEngine;
    private final RecipeIndex index;
    private final int defaultTopN;

    public RecommendationService(TextNormalizer normalizer, IntentExtractor extractor, RankingEngine rankingEngine,
                                 RecipeIndex index, int defaultTopN) {
        this.normalizer = normalizer;
        this.extractor = extractor;
        this.rankingEngine = rankingEngine;
        this.index = index;
        this.defaultTopN = defaultTopN;
    }

    public RecommendationResult recommend(String query) {
        return recommend(query, null);
    }

    /** @param topN result size, {@code null} for the configured default */
    public RecommendationResult recommend(String query, Integer topN) {
        int n = topN == null ? defaultTopN : topN;
        log.info("Recommend q='{}' topN={}", TextUtils.abbreviate(query, LOGGED_QUERY_CHARS), n);

        List<String> tokens = normalizer.normalize(query);
        QueryIntent intent = extractor.extract(tokens);
        RankingEngine.Ranking ranking = rankingEngine.rank(intent, index, n, String.join(" ", tokens));

        List<RecommendationResult.Item> items = new ArrayList<>(ranking.matches().size());
        for (ScoredMatch m : ranking.matches()) {
            Recipe recipe = index.get(m.position());
            items.add(RecommendationResult.Item.of(recipe, m));
        }

        RecommendationResult result = new RecommendationResult();
        result.setQuery(query);
        result.setTokens(tokens);
        result.setIntent(intent);
        result.setOrdering(ranking.ordering());
        result.setItems(items);
        result.setNoMatches(items.isEmpty());
        if (items.isEmpty()) {
            result.setMessage(RecommendationResult.NO_MATCH_MESSAGE);
            log.info("No recipes matched intent {}", intent);
        } else {
            log.info("Returning {} recommendations ordered by {}", items.size(), ranking.ordering());
        }
        return result;
    }

    /** Tokens and intent only, no ranking. */
    public QueryIntent extractIntent(String query) {
        return extractor.extract(normalizer.normalize(query));
    }

    public List<String> normalize(String query) {
        return normalizer.normalize(query);
    }

    public RecipeIndex index() {
        return index;
    }
}
