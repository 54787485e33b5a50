package com.rice.recommender.service.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rice.recommender.config.EmbeddingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.*;

/**
 * Embedding generator using the OpenAI embeddings API.
 * Caches results in-memory during process lifetime to reduce cost.
 */
public class OpenAiEmbedder implements Embedder {
    private static final Logger log = LoggerFactory.getLogger(OpenAiEmbedder.class);

    private final ObjectMapper mapper;
    private final HttpClient http;
    private final EmbeddingProperties properties;
    private final String apiKey;

    private final Map<String, float[]> cache;

    public OpenAiEmbedder(EmbeddingProperties properties, ObjectMapper mapper) {
        this(properties, mapper, HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(100, properties.getTimeoutMs())))
                .build());
    }

    OpenAiEmbedder(EmbeddingProperties properties, ObjectMapper mapper, HttpClient http) {
        this.properties = properties;
        this.mapper = mapper;
        this.http = http;
        String configured = properties.getApiKey();
        this.apiKey = configured != null && !configured.isBlank() ? configured : System.getenv("OPENAI_API_KEY");
        int maxEntries = Math.max(1, properties.getCacheSize());
        this.cache = Collections.synchronizedMap(new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, float[]> eldest) {
                return this.size() > maxEntries;
            }
        });
    }

    @Override
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public int dimension() { return properties.getDim(); }

    @Override
    public float[] embed(String text) {
        if (!isEnabled()) throw new EmbeddingUnavailableException("OPENAI_API_KEY is not set");
        if (text == null) text = "";
        String key = properties.getModel() + "\n" + text;
        float[] cached = cache.get(key);
        if (cached != null) return cached;
        try {
            long t0 = System.currentTimeMillis();
            Map<String, Object> req = new LinkedHashMap<>();
            req.put("model", properties.getModel());
            req.put("input", text);
            String body = mapper.writeValueAsString(req);
            HttpRequest httpReq = HttpRequest.newBuilder()
                    .uri(URI.create(properties.getApiUrl()))
                    .timeout(Duration.ofMillis(Math.max(100, properties.getTimeoutMs())))
                    .header("Authorization", "Bearer " + apiKey)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                    .build();
            HttpResponse<String> resp = http.send(httpReq, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (resp.statusCode() >= 300) {
                log.warn("Embedding API error status {}: {}", resp.statusCode(), resp.body());
                throw new EmbeddingUnavailableException("embedding API returned status " + resp.statusCode());
            }
            JsonNode data = mapper.readTree(resp.body()).path("data");
            if (!data.isArray() || data.isEmpty()) {
                throw new EmbeddingUnavailableException("embedding API returned no data");
            }
            JsonNode values = data.get(0).path("embedding");
            if (!values.isArray() || values.isEmpty()) {
                throw new EmbeddingUnavailableException("embedding API returned an empty vector");
            }
            float[] out = new float[values.size()];
            for (int i = 0; i < values.size(); i++) out[i] = (float) values.get(i).asDouble();
            cache.put(key, out);
            long dt = System.currentTimeMillis() - t0;
            log.debug("Embedding generated: model={} dim={} chars={} ms={}", properties.getModel(), out.length, text.length(), dt);
            return out;
        } catch (EmbeddingUnavailableException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingUnavailableException("embedding call interrupted", e);
        } catch (Exception e) {
            log.warn("Embedding error: {}", e.toString());
            throw new EmbeddingUnavailableException("embedding call failed: " + e.getMessage(), e);
        }
    }
}
