package com.codesearch.store;

import java.util.List;
import java.util.Set;

import com.codesearch.embedding.EmbeddingProvider;

/**
 * Resolves the shared collection on first use and keeps it. A failed resolution is retried on the
 * next call, so the process can start before the store is reachable.
 */
public class LazyCollection implements VectorCollection {
    private final VectorStore store;
    private final String name;
    private final EmbeddingProvider embeddingProvider;
    private volatile VectorCollection delegate;

    public LazyCollection(VectorStore store, String name, EmbeddingProvider embeddingProvider) {
        this.store = store;
        this.name = name;
        this.embeddingProvider = embeddingProvider;
    }

    private VectorCollection delegate() {
        VectorCollection current = delegate;
        if (current == null) {
            synchronized (this) {
                current = delegate;
                if (current == null) {
                    current = store.createOrGetCollection(name, embeddingProvider);
                    delegate = current;
                }
            }
        }
        return current;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void add(List<String> ids, List<String> documents, List<ChunkMetadata> metadatas) {
        delegate().add(ids, documents, metadatas);
    }

    @Override
    public List<StoredRecord> get(WhereFilter filter, int limit, Set<Include> include) {
        return delegate().get(filter, limit, include);
    }

    @Override
    public List<QueryMatch> query(String queryText, int limit, WhereFilter filter) {
        return delegate().query(queryText, limit, filter);
    }
}
