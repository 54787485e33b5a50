package com.rice.recommender.controller;

import com.rice.recommender.dto.RecommendDtos;
import com.rice.recommender.model.QueryIntent;
import com.rice.recommender.model.RecommendationResult;
import com.rice.recommender.service.RecipeFormatter;
import com.rice.recommender.service.RecommendationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@Tag(name = "recommend")
public class RecommendationController {
    private final RecommendationService recommendationService;
    private final RecipeFormatter formatter;

    public RecommendationController(RecommendationService recommendationService, RecipeFormatter formatter) {
        this.recommendationService = recommendationService;
        this.formatter = formatter;
    }

    /**
     * Ranked recipes for a free-text request. A blank query is valid and returns the
     * most typical recipes; no match is reported with {@code noMatches=true}, not an error.
     */
    @Operation(summary = "Recommend recipes for a free-text request")
    @PostMapping("/recommend")
    public Mono<RecommendationResult> recommend(@Valid @RequestBody RecommendDtos.RecommendRequestBody body) {
        return Mono.fromCallable(() -> recommendationService.recommend(body.getQ(), body.getTopN()));
    }

    @Operation(summary = "Recommend recipes and render them as plain text")
    @PostMapping(value = "/recommend/text", produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<String> recommendText(@Valid @RequestBody RecommendDtos.RecommendRequestBody body) {
        return Mono.fromCallable(() -> formatter.format(recommendationService.recommend(body.getQ(), body.getTopN())));
    }

    @Operation(summary = "Show the tokens and facets extracted from a request")
    @PostMapping("/intent")
    public Mono<RecommendDtos.IntentResponseBody> intent(@Valid @RequestBody RecommendDtos.IntentRequestBody body) {
        return Mono.fromCallable(() -> {
            List<String> tokens = recommendationService.normalize(body.getQ());
            QueryIntent intent = recommendationService.extractIntent(body.getQ());
            return new RecommendDtos.IntentResponseBody(body.getQ(), tokens, intent);
        });
    }
}
