package com.codesearch.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codesearch.embedding.EmbeddingProvider;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * In-process vector store. Distances are cosine distances ({@code 1 - cosine}). When a
 * persistence path is set, every collection is written to that JSON file after each add and read
 * back on first access.
 */
public class LocalJsonVectorStore implements VectorStore {
    private final Path persistencePath;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, LocalCollection> collections = new LinkedHashMap<>();
    private final Logger log;
    private Map<String, List<IndexedRecord>> persisted;

    public LocalJsonVectorStore() {
        this(null);
    }

    public LocalJsonVectorStore(Path persistencePath) {
        this(persistencePath, LoggerFactory.getLogger(LocalJsonVectorStore.class));
    }

    LocalJsonVectorStore(Path persistencePath, Logger log) {
        this.persistencePath = persistencePath;
        this.log = log;
    }

    @Override
    public synchronized VectorCollection createOrGetCollection(String name, EmbeddingProvider embeddingProvider) {
        LocalCollection existing = collections.get(name);
        if (existing != null) {
            return existing;
        }
        LocalCollection collection = new LocalCollection(name, embeddingProvider);
        for (IndexedRecord record : loadPersisted().getOrDefault(name, List.of())) {
            collection.records.put(record.id(), record);
        }
        collections.put(name, collection);
        log.debug("Opened local collection {} with {} records", name, collection.records.size());
        return collection;
    }

    @Override
    public String location() {
        return persistencePath == null ? "in-memory" : persistencePath.toAbsolutePath().normalize().toString();
    }

    private Map<String, List<IndexedRecord>> loadPersisted() {
        if (persisted != null) {
            return persisted;
        }
        persisted = new LinkedHashMap<>();
        if (persistencePath == null || !Files.exists(persistencePath)) {
            return persisted;
        }
        try {
            persisted = objectMapper.readValue(persistencePath.toFile(),
                    new TypeReference<LinkedHashMap<String, List<IndexedRecord>>>() {
                    });
        } catch (IOException e) {
            throw new VectorStoreException("Unable to read local vector store " + persistencePath, e);
        }
        return persisted;
    }

    private synchronized void save() {
        if (persistencePath == null) {
            return;
        }
        Map<String, List<IndexedRecord>> snapshot = new LinkedHashMap<>(loadPersisted());
        for (LocalCollection collection : collections.values()) {
            snapshot.put(collection.name, new ArrayList<>(collection.records.values()));
        }
        try {
            if (persistencePath.getParent() != null) {
                Files.createDirectories(persistencePath.getParent());
            }
            objectMapper.writeValue(persistencePath.toFile(), snapshot);
        } catch (IOException e) {
            throw new VectorStoreException("Unable to write local vector store " + persistencePath, e);
        }
    }

    private final class LocalCollection implements VectorCollection {
        private final String name;
        private final EmbeddingProvider embeddingProvider;
        private final Map<String, IndexedRecord> records = new LinkedHashMap<>();

        private LocalCollection(String name, EmbeddingProvider embeddingProvider) {
            this.name = name;
            this.embeddingProvider = embeddingProvider;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void add(List<String> ids, List<String> documents, List<ChunkMetadata> metadatas) {
            if (ids.size() != documents.size() || ids.size() != metadatas.size()) {
                throw new IllegalArgumentException("ids, documents and metadatas must have the same size");
            }
            List<float[]> embeddings = embeddingProvider.embed(documents);
            if (embeddings.size() != ids.size()) {
                throw new VectorStoreException("Embedding provider returned " + embeddings.size()
                        + " vectors for " + ids.size() + " documents");
            }
            synchronized (LocalJsonVectorStore.this) {
                Map<String, IndexedRecord> replaced = new LinkedHashMap<>();
                for (int i = 0; i < ids.size(); i++) {
                    IndexedRecord previous = records.put(ids.get(i), new IndexedRecord(
                            ids.get(i),
                            documents.get(i),
                            metadatas.get(i).toMap(),
                            embeddings.get(i)));
                    replaced.putIfAbsent(ids.get(i), previous);
                }
                try {
                    save();
                } catch (VectorStoreException e) {
                    // a batch that was not persisted must not be visible either
                    replaced.forEach((id, previous) -> {
                        if (previous == null) {
                            records.remove(id);
                        } else {
                            records.put(id, previous);
                        }
                    });
                    throw e;
                }
            }
        }

        @Override
        public List<StoredRecord> get(WhereFilter filter, int limit, Set<Include> include) {
            List<StoredRecord> out = new ArrayList<>();
            synchronized (LocalJsonVectorStore.this) {
                for (IndexedRecord record : records.values()) {
                    if (out.size() >= limit) {
                        break;
                    }
                    ChunkMetadata metadata = readMetadata(record);
                    if (metadata == null || (filter != null && !filter.matches(metadata))) {
                        continue;
                    }
                    out.add(new StoredRecord(
                            record.id(),
                            include.contains(Include.DOCUMENTS) ? record.document() : null,
                            include.contains(Include.METADATAS) ? metadata : ChunkMetadata.empty()));
                }
            }
            return out;
        }

        @Override
        public List<QueryMatch> query(String queryText, int limit, WhereFilter filter) {
            float[] queryEmbedding = embeddingProvider.embed(List.of(queryText)).get(0);
            List<QueryMatch> matches = new ArrayList<>();
            synchronized (LocalJsonVectorStore.this) {
                for (IndexedRecord record : records.values()) {
                    ChunkMetadata metadata = readMetadata(record);
                    if (metadata == null || (filter != null && !filter.matches(metadata))) {
                        continue;
                    }
                    double distance = 1.0 - cosine(queryEmbedding, record.embedding());
                    matches.add(new QueryMatch(record.id(), record.document(), metadata, distance));
                }
            }
            return matches.stream()
                    .sorted(Comparator.comparingDouble(QueryMatch::distance))
                    .limit(limit)
                    .toList();
        }

        private ChunkMetadata readMetadata(IndexedRecord record) {
            try {
                return ChunkMetadata.fromMap(record.metadata());
            } catch (MalformedRecordException e) {
                log.warn("Skipping malformed record {} in collection {}: {}", record.id(), name, e.getMessage());
                return null;
            }
        }
    }

    private static float cosine(float[] a, float[] b) {
        int len = Math.min(a.length, b.length);
        float dot = 0f;
        float aNorm = 0f;
        float bNorm = 0f;
        for (int i = 0; i < len; i++) {
            dot += a[i] * b[i];
            aNorm += a[i] * a[i];
            bNorm += b[i] * b[i];
        }
        if (aNorm == 0f || bNorm == 0f) {
            return 0f;
        }
        return (float) (dot / Math.sqrt(aNorm * bNorm));
    }

    public record IndexedRecord(String id, String document, Map<String, Object> metadata, float[] embedding) {
    }
}
