package com.codesearch.embedding;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codesearch.runtime.ConfigurationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

public class OpenAiEmbeddingProvider implements EmbeddingProvider {
    public static final String NAME = "openai";

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final int dimension;
    private final Logger log;

    public OpenAiEmbeddingProvider(OkHttpClient httpClient, String baseUrl, String apiKey, String model, int dimension) {
        this(httpClient, baseUrl, apiKey, model, dimension, LoggerFactory.getLogger(OpenAiEmbeddingProvider.class));
    }

    OpenAiEmbeddingProvider(OkHttpClient httpClient,
            String baseUrl,
            String apiKey,
            String model,
            int dimension,
            Logger log) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("OpenAI API key required when using OpenAI embeddings");
        }
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.model = model;
        this.dimension = dimension;
        this.log = log;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        try {
            String payload = mapper.writeValueAsString(Map.of("model", model, "input", texts));
            Request request = new Request.Builder()
                    .url(baseUrl + "/v1/embeddings")
                    .header("Authorization", "Bearer " + apiKey)
                    .post(RequestBody.create(payload, JSON))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful() || response.body() == null) {
                    throw new EmbeddingException("OpenAI embeddings request failed with status " + response.code());
                }
                JsonNode data = mapper.readTree(response.body().string()).path("data");
                if (!data.isArray() || data.size() != texts.size()) {
                    throw new EmbeddingException("OpenAI embeddings response returned "
                            + data.size() + " vectors for " + texts.size() + " inputs");
                }
                float[][] ordered = new float[texts.size()][];
                for (JsonNode item : data) {
                    int index = item.path("index").asInt(-1);
                    if (index < 0 || index >= ordered.length) {
                        throw new EmbeddingException("OpenAI embeddings response has invalid index " + index);
                    }
                    if (ordered[index] != null) {
                        throw new EmbeddingException("OpenAI embeddings response repeats index " + index);
                    }
                    JsonNode vectorNode = item.path("embedding");
                    float[] vector = new float[vectorNode.size()];
                    for (int i = 0; i < vectorNode.size(); i++) {
                        vector[i] = (float) vectorNode.get(i).asDouble();
                    }
                    ordered[index] = vector;
                }
                log.debug("Embedded {} texts with model={}", texts.size(), model);
                return List.of(ordered);
            }
        } catch (IOException e) {
            throw new EmbeddingException("OpenAI embeddings request failed: " + e.getMessage(), e);
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ProviderInfo describe() {
        return new ProviderInfo(NAME, model, baseUrl, true, null, List.of());
    }
}
