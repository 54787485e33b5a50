package com.rice.recommender.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rice.recommender.model.Recipe;
import com.rice.recommender.service.RecipeFormatter;
import com.rice.recommender.service.RecommendationService;
import com.rice.recommender.service.embedding.DisabledEmbedder;
import com.rice.recommender.service.embedding.Embedder;
import com.rice.recommender.service.embedding.HashingEmbedder;
import com.rice.recommender.service.embedding.OpenAiEmbedder;
import com.rice.recommender.service.index.RecipeCsvLoader;
import com.rice.recommender.service.index.RecipeIndex;
import com.rice.recommender.service.intent.IntentExtractor;
import com.rice.recommender.service.intent.TextNormalizer;
import com.rice.recommender.service.lexicon.Lexicon;
import com.rice.recommender.service.lexicon.LexiconAugmenter;
import com.rice.recommender.service.lexicon.LexiconLoader;
import com.rice.recommender.service.ranking.RankingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;

/**
 * Wires the recommendation pipeline. All beans are built once at startup and are
 * read-only afterwards; a missing or malformed dataset or lexicon fails the boot.
 */
@Configuration
public class RecommenderConfig {
    private static final Logger log = LoggerFactory.getLogger(RecommenderConfig.class);

    @Bean
    public Embedder embedder(EmbeddingProperties properties, ObjectMapper mapper) {
        String provider = properties.getProvider() == null ? "none" : properties.getProvider().trim().toLowerCase(Locale.ROOT);
        Embedder embedder = switch (provider) {
            case "openai" -> new OpenAiEmbedder(properties, mapper);
            case "local" -> new HashingEmbedder(properties.getLocalDim());
            case "none", "" -> new DisabledEmbedder();
            default -> throw new IllegalStateException("Unknown embedding.provider '" + properties.getProvider()
                    + "', expected openai, local or none");
        };
        log.info("Embedding provider: {} (enabled={})", embedder.getName(), embedder.isEnabled());
        return embedder;
    }

    @Bean
    public RecipeIndex recipeIndex(RecommenderProperties properties, ResourceLoader resourceLoader, Embedder embedder) {
        List<Recipe> recipes = loadRecipes(properties, resourceLoader);
        return properties.isEmbedDescriptions() ? RecipeIndex.build(recipes, embedder) : RecipeIndex.build(recipes);
    }

    private static List<Recipe> loadRecipes(RecommenderProperties properties, ResourceLoader resourceLoader) {
        Resource resource = resourceLoader.getResource(properties.getDatasetPath());
        if (!resource.exists()) {
            throw new IllegalStateException("Recipe dataset not found at " + properties.getDatasetPath());
        }
        try (InputStream in = resource.getInputStream()) {
            return new RecipeCsvLoader().load(in, properties.getDatasetPath());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read recipe dataset " + properties.getDatasetPath(), e);
        }
    }

    @Bean
    public Lexicon lexicon(RecommenderProperties properties, ResourceLoader resourceLoader,
                           ObjectMapper mapper, RecipeIndex recipeIndex) {
        Resource resource = resourceLoader.getResource(properties.getLexiconPath());
        if (!resource.exists()) {
            throw new IllegalStateException("Lexicon not found at " + properties.getLexiconPath());
        }
        Lexicon base;
        try (InputStream in = resource.getInputStream()) {
            base = new LexiconLoader(mapper).load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read lexicon " + properties.getLexiconPath(), e);
        }
        return properties.isAugmentLexicon() ? new LexiconAugmenter().augment(base, recipeIndex.recipes()) : base;
    }

    @Bean
    public TextNormalizer textNormalizer(Lexicon lexicon) {
        return new TextNormalizer(lexicon);
    }

    @Bean
    public IntentExtractor intentExtractor(RecommenderProperties properties, Lexicon lexicon, Embedder embedder) {
        return IntentExtractor.standard(lexicon, embedder, properties.getSemanticThreshold(),
                properties.getQuickCeilingMinutes(), properties.getSlowFloorMinutes());
    }

    @Bean
    public RankingEngine rankingEngine(RecommenderProperties properties, Embedder embedder, Lexicon lexicon) {
        return new RankingEngine(properties.getMatchMode(), embedder, lexicon);
    }

    @Bean
    public RecommendationService recommendationService(RecommenderProperties properties, TextNormalizer normalizer,
                                                       IntentExtractor extractor, RankingEngine rankingEngine,
                                                       RecipeIndex recipeIndex) {
        return new RecommendationService(normalizer, extractor, rankingEngine, recipeIndex, properties.getTopN());
    }

    @Bean
    public RecipeFormatter recipeFormatter() {
        return new RecipeFormatter();
    }
}
