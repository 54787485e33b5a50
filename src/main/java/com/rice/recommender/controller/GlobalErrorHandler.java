package com.rice.recommender.controller;

import com.rice.recommender.service.embedding.EmbeddingUnavailableException;
import com.rice.recommender.service.index.DatasetFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Error bodies for the recommendation API. Every body carries {@code error} and the
 * request {@code path}:
 * <ul>
 *   <li>{@code bad_request} (400) for unreadable bodies and out-of-range fields, with one
 *       {@code details} entry per rejected field</li>
 *   <li>{@code embedding_unavailable} (503) when an embedding failure escapes the pipeline</li>
 *   <li>{@code dataset_error} (500) when the recipe data cannot be read</li>
 *   <li>{@code server_error} (500) otherwise</li>
 * </ul>
 * A query that matches nothing is not an error and never reaches this class.
 */
@RestControllerAdvice
public class GlobalErrorHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalErrorHandler.class);

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleBind(WebExchangeBindException ex, ServerWebExchange exchange) {
        List<Map<String, Object>> details = ex.getFieldErrors().stream().map(err -> {
            Map<String, Object> d = new LinkedHashMap<>();
            d.put("field", err.getField());
            d.put("rejected", err.getRejectedValue());
            d.put("message", err.getDefaultMessage());
            return d;
        }).collect(Collectors.toList());
        log.warn("Rejected recommendation request on {}: {}", path(exchange), details);
        Map<String, Object> body = body("bad_request", exchange);
        body.put("details", details);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInput(ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("Unreadable request body on {}: {}", path(exchange), ex.getReason());
        Map<String, Object> body = body("bad_request", exchange);
        body.put("reason", ex.getReason());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(EmbeddingUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleEmbedding(EmbeddingUnavailableException ex, ServerWebExchange exchange) {
        log.warn("Embedding model unavailable while serving {}: {}", path(exchange), ex.getMessage());
        Map<String, Object> body = body("embedding_unavailable", exchange);
        body.put("message", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(DatasetFormatException.class)
    public ResponseEntity<Map<String, Object>> handleDataset(DatasetFormatException ex, ServerWebExchange exchange) {
        log.error("Recipe dataset error while serving {}", path(exchange), ex);
        Map<String, Object> body = body("dataset_error", exchange);
        body.put("message", ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleOther(Exception ex, ServerWebExchange exchange) {
        log.error("Unhandled error while serving {}", path(exchange), ex);
        Map<String, Object> body = body("server_error", exchange);
        body.put("exception", ex.getClass().getSimpleName());
        body.put("message", ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private static Map<String, Object> body(String error, ServerWebExchange exchange) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("path", path(exchange));
        return body;
    }

    private static String path(ServerWebExchange exchange) {
        return exchange == null ? null : exchange.getRequest().getPath().value();
    }
}
