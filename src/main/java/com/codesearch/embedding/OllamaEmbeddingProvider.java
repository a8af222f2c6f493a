package com.codesearch.embedding;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

public class OllamaEmbeddingProvider implements EmbeddingProvider {
    public static final String NAME = "ollama";
    public static final int DEFAULT_DIMENSION = 384;

    private static final MediaType JSON = MediaType.parse("application/json");
    private static final int PREVIEW_LENGTH = 50;

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String host;
    private final String model;
    private final int dimension;
    private final Logger log;

    public OllamaEmbeddingProvider(OkHttpClient httpClient, String host, String model, int dimension) {
        this(httpClient, host, model, dimension, LoggerFactory.getLogger(OllamaEmbeddingProvider.class));
    }

    OllamaEmbeddingProvider(OkHttpClient httpClient, String host, String model, int dimension, Logger log) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.host = stripTrailingSlash(host);
        this.model = model;
        this.dimension = dimension;
        this.log = log;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        List<float[]> embeddings = new ArrayList<>(texts.size());
        for (String text : texts) {
            embeddings.add(embedOne(text));
        }
        return embeddings;
    }

    private float[] embedOne(String text) {
        try {
            String payload = mapper.writeValueAsString(Map.of("model", model, "prompt", text));
            Request request = new Request.Builder()
                    .url(host + "/api/embeddings")
                    .post(RequestBody.create(payload, JSON))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful() || response.body() == null) {
                    log.warn("Ollama embedding request failed status={} text={}...", response.code(), preview(text));
                    return new float[dimension];
                }
                JsonNode vectorNode = mapper.readTree(response.body().string()).path("embedding");
                if (!vectorNode.isArray()) {
                    log.warn("Ollama embedding response had no embedding array text={}...", preview(text));
                    return new float[dimension];
                }
                float[] out = new float[vectorNode.size()];
                for (int i = 0; i < vectorNode.size(); i++) {
                    out[i] = (float) vectorNode.get(i).asDouble();
                }
                return out;
            }
        } catch (IOException e) {
            log.warn("Error generating embedding for text: {}...", preview(text), e);
            return new float[dimension];
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
        HttpUrl tagsUrl = HttpUrl.parse(host + "/api/tags");
        if (tagsUrl == null) {
            return new ProviderInfo(NAME, model, host, null, ProviderInfo.Connection.ERROR, List.of());
        }
        Request request = new Request.Builder().url(tagsUrl).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                return new ProviderInfo(NAME, model, host, null, ProviderInfo.Connection.FAILED, List.of());
            }
            List<String> models = new ArrayList<>();
            for (JsonNode node : mapper.readTree(response.body().string()).path("models")) {
                String modelName = node.path("name").asText("");
                if (!modelName.isBlank()) {
                    models.add(modelName);
                }
            }
            return new ProviderInfo(NAME, model, host, null, ProviderInfo.Connection.CONNECTED, models);
        } catch (IOException e) {
            log.debug("Ollama probe failed host={}", host, e);
            return new ProviderInfo(NAME, model, host, null, ProviderInfo.Connection.ERROR, List.of());
        }
    }

    private static String preview(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH);
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
