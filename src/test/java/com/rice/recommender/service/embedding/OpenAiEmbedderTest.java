package com.rice.recommender.service.embedding;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rice.recommender.config.EmbeddingProperties;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class OpenAiEmbedderTest {
    private HttpServer server;
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger status = new AtomicInteger(200);
    private final AtomicReference<String> lastAuth = new AtomicReference<>();
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> response = new AtomicReference<>("{\"data\":[{\"embedding\":[0.25,-0.5,1.0]}]}");

    @BeforeEach
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/embeddings", exchange -> {
            calls.incrementAndGet();
            lastAuth.set(exchange.getRequestHeaders().getFirst("Authorization"));
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] out = (status.get() == 200
                    ? response.get()
                    : "{\"error\":{\"message\":\"boom\"}}").getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status.get(), out.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(out);
            }
        });
        server.start();
    }

    @AfterEach
    public void stop() {
        server.stop(0);
    }

    private OpenAiEmbedder embedder(String apiKey) {
        EmbeddingProperties props = new EmbeddingProperties();
        props.setApiUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/v1/embeddings");
        props.setApiKey(apiKey);
        props.setDim(3);
        props.setTimeoutMs(2000);
        return new OpenAiEmbedder(props, new ObjectMapper());
    }

    @Test
    public void parsesVectorAndCachesIt() {
        OpenAiEmbedder embedder = embedder("test-key");
        float[] v = embedder.embed("vegan dessert");
        assertArrayEquals(new float[]{0.25f, -0.5f, 1.0f}, v);
        assertEquals("Bearer test-key", lastAuth.get());
        assertTrue(lastBody.get().contains("\"input\":\"vegan dessert\""));
        assertTrue(lastBody.get().contains("\"model\":\"text-embedding-3-small\""));

        embedder.embed("vegan dessert");
        assertEquals(1, calls.get());
        embedder.embed("something else");
        assertEquals(2, calls.get());
    }

    @Test
    public void errorStatusIsUnavailable() {
        status.set(500);
        OpenAiEmbedder embedder = embedder("test-key");
        assertThrows(EmbeddingUnavailableException.class, () -> embedder.embed("quick dinner"));
    }

    @Test
    public void responsesWithoutAVectorAreUnavailable() {
        OpenAiEmbedder embedder = embedder("test-key");
        response.set("{\"data\":[]}");
        assertThrows(EmbeddingUnavailableException.class, () -> embedder.embed("no data"));
        response.set("{\"data\":[{\"embedding\":[]}]}");
        assertThrows(EmbeddingUnavailableException.class, () -> embedder.embed("empty vector"));
        response.set("{\"object\":\"list\"}");
        assertThrows(EmbeddingUnavailableException.class, () -> embedder.embed("missing field"));
        assertEquals(3, calls.get());
    }

    @Test
    public void missingKeyDisablesEmbedder() {
        assumeTrue(System.getenv("OPENAI_API_KEY") == null, "OPENAI_API_KEY is set in this environment");
        OpenAiEmbedder embedder = embedder(null);
        assertFalse(embedder.isEnabled());
        assertThrows(EmbeddingUnavailableException.class, () -> embedder.embed("anything"));
        assertEquals(0, calls.get());
    }
}
