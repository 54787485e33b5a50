package com.rice.recommender.controller;

import com.rice.recommender.service.embedding.Embedder;
import com.rice.recommender.service.index.RecipeIndex;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {
    private final RecipeIndex recipeIndex;
    private final Embedder embedder;

    public HealthController(RecipeIndex recipeIndex, Embedder embedder) {
        this.recipeIndex = recipeIndex;
        this.embedder = embedder;
    }

    @GetMapping("/healthz")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", Boolean.TRUE);
        body.put("recipes", recipeIndex.size());
        body.put("embedder", embedder.isEnabled() ? embedder.getName() : "disabled");
        body.put("vectors", recipeIndex.hasVectors());
        return Mono.just(ResponseEntity.ok(body));
    }
}
