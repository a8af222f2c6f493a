package com.codesearch.embedding;

import java.util.Locale;

import com.codesearch.runtime.AppConfig;
import com.codesearch.runtime.ConfigurationException;

import okhttp3.OkHttpClient;

public final class EmbeddingProviders {
    private EmbeddingProviders() {
    }

    public static EmbeddingProvider create(AppConfig.EmbeddingConfig config, OkHttpClient httpClient) {
        String provider = config.getProvider() == null ? OllamaEmbeddingProvider.NAME : config.getProvider();
        switch (provider.toLowerCase(Locale.ROOT)) {
            case OllamaEmbeddingProvider.NAME:
                return new OllamaEmbeddingProvider(
                        httpClient,
                        config.getOllama().getHost(),
                        config.getOllama().getModel(),
                        config.getOllama().getDimension());
            case OpenAiEmbeddingProvider.NAME:
                return new OpenAiEmbeddingProvider(
                        httpClient,
                        config.getOpenai().getBaseUrl(),
                        config.getOpenai().getApiKey(),
                        config.getOpenai().getModel(),
                        config.getOpenai().getDimension());
            default:
                throw new ConfigurationException("Unknown embedding provider: " + provider + " (expected ollama or openai)");
        }
    }
}
