package com.codesearch.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Deterministic bag-of-words embeddings for tests that must not reach a model server. */
public class HashingEmbeddingProvider implements EmbeddingProvider {
    private final int dimension;

    public HashingEmbeddingProvider(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embedOne(text));
        }
        return vectors;
    }

    private float[] embedOne(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (token.isBlank()) {
                continue;
            }
            vector[Math.floorMod(token.hashCode(), dimension)] += 1f;
        }
        float norm = 0f;
        for (float v : vector) {
            norm += v * v;
        }
        norm = (float) Math.sqrt(norm);
        if (norm > 0f) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] /= norm;
            }
        }
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String name() {
        return "hashing";
    }

    @Override
    public ProviderInfo describe() {
        return new ProviderInfo(name(), "hashing-" + dimension, null, null, ProviderInfo.Connection.CONNECTED, List.of());
    }
}
