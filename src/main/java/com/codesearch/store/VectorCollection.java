package com.codesearch.store;

import java.util.List;
import java.util.Set;

public interface VectorCollection {
    String name();

    /**
     * Writes the parallel lists as one batch. A record whose id already exists replaces the
     * stored one.
     */
    void add(List<String> ids, List<String> documents, List<ChunkMetadata> metadatas);

    /**
     * Returns up to {@code limit} records matching {@code filter}, or any records when the filter
     * is null. Order is whatever the store returns.
     */
    List<StoredRecord> get(WhereFilter filter, int limit, Set<Include> include);

    /** Nearest records to {@code queryText}, closest first. */
    List<QueryMatch> query(String queryText, int limit, WhereFilter filter);
}
