package com.codesearch.store;

import com.codesearch.embedding.EmbeddingProvider;

public interface VectorStore {
    /**
     * Returns the named collection, creating it on first use. Documents added to or queried
     * against the collection are embedded with {@code embeddingProvider}.
     */
    VectorCollection createOrGetCollection(String name, EmbeddingProvider embeddingProvider);

    /** Human readable location, used in health and startup output. */
    String location();
}
