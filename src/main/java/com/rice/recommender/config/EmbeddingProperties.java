package com.rice.recommender.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Embedding model configuration.
 *
 * Properties are prefixed with "embedding" in application.yml.
 */
@ConfigurationProperties(prefix = "embedding")
public class EmbeddingProperties {
    /** Which embedder to wire: openai, local (feature hashing) or none */
    private String provider = "local";
    /** OpenAI embeddings endpoint */
    private String apiUrl = "https://api.openai.com/v1/embeddings";
    /** API key; falls back to the OPENAI_API_KEY environment variable when blank */
    private String apiKey;
    /** Embedding model name, e.g. text-embedding-3-small */
    private String model = "text-embedding-3-small";
    /** Embedding vector dimension. text-embedding-3-small = 1536 */
    private int dim = 1536;
    /** Vector dimension for the local hashing embedder */
    private int localDim = 512;
    /** Max cached embeddings kept for the process lifetime */
    private int cacheSize = 5000;
    /** HTTP timeout for a single embedding call (ms) */
    private int timeoutMs = 5000;

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }

    public String getApiUrl() { return apiUrl; }
    public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public int getDim() { return dim; }
    public void setDim(int dim) { this.dim = dim; }

    public int getLocalDim() { return localDim; }
    public void setLocalDim(int localDim) { this.localDim = localDim; }

    public int getCacheSize() { return cacheSize; }
    public void setCacheSize(int cacheSize) { this.cacheSize = cacheSize; }

    public int getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(int timeoutMs) { this.timeoutMs = timeoutMs; }
}
