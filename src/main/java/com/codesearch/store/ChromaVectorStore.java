package com.codesearch.store;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codesearch.embedding.EmbeddingProvider;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Client for the Chroma REST API (v1). Embeddings are computed on this side with the collection's
 * {@link EmbeddingProvider} and sent with every write and query.
 */
public class ChromaVectorStore implements VectorStore {
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String baseUrl;
    private final Logger log;

    public ChromaVectorStore(OkHttpClient httpClient, String host, int port) {
        this(httpClient, "http://" + host + ":" + port, LoggerFactory.getLogger(ChromaVectorStore.class));
    }

    ChromaVectorStore(OkHttpClient httpClient, String baseUrl, Logger log) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.log = log;
    }

    @Override
    public VectorCollection createOrGetCollection(String name, EmbeddingProvider embeddingProvider) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("get_or_create", true);
        JsonNode response = post("/api/v1/collections", body);
        String id = response.path("id").asText("");
        if (id.isBlank()) {
            throw new VectorStoreException("Chroma did not return an id for collection " + name);
        }
        log.info("Using Chroma collection {} id={}", name, id);
        return new ChromaCollection(id, name, embeddingProvider);
    }

    @Override
    public String location() {
        return baseUrl;
    }

    public boolean heartbeat() {
        Request request = new Request.Builder().url(baseUrl + "/api/v1/heartbeat").get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            return response.isSuccessful();
        } catch (IOException e) {
            log.debug("Chroma heartbeat failed at {}", baseUrl, e);
            return false;
        }
    }

    private JsonNode post(String path, Object body) {
        try {
            String payload = mapper.writeValueAsString(body);
            Request request = new Request.Builder()
                    .url(baseUrl + path)
                    .post(RequestBody.create(payload, JSON))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                String text = response.body() == null ? "" : response.body().string();
                if (!response.isSuccessful()) {
                    throw new VectorStoreException("Chroma request " + path + " failed with status "
                            + response.code() + ": " + text);
                }
                return text.isBlank() ? mapper.createObjectNode() : mapper.readTree(text);
            }
        } catch (IOException e) {
            throw new VectorStoreException("Chroma request " + path + " failed: " + e.getMessage(), e);
        }
    }

    private final class ChromaCollection implements VectorCollection {
        private final String id;
        private final String name;
        private final EmbeddingProvider embeddingProvider;

        private ChromaCollection(String id, String name, EmbeddingProvider embeddingProvider) {
            this.id = id;
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
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("ids", ids);
            body.put("embeddings", embeddings);
            body.put("documents", documents);
            body.put("metadatas", metadatas.stream().map(ChunkMetadata::toMap).toList());
            post(collectionPath("/upsert"), body);
        }

        @Override
        public List<StoredRecord> get(WhereFilter filter, int limit, Set<Include> include) {
            Map<String, Object> body = new LinkedHashMap<>();
            if (filter != null) {
                body.put("where", filter.toClause());
            }
            body.put("limit", limit);
            body.put("include", include.stream().map(Include::wireName).toList());
            JsonNode response = post(collectionPath("/get"), body);

            JsonNode ids = response.path("ids");
            JsonNode documents = response.path("documents");
            JsonNode metadatas = response.path("metadatas");
            List<StoredRecord> records = new ArrayList<>();
            for (int i = 0; i < ids.size(); i++) {
                String recordId = ids.get(i).asText();
                ChunkMetadata metadata = readMetadata(recordId, metadatas.path(i));
                if (metadata == null) {
                    continue;
                }
                records.add(new StoredRecord(recordId, textOrNull(documents.path(i)), metadata));
            }
            return records;
        }

        @Override
        public List<QueryMatch> query(String queryText, int limit, WhereFilter filter) {
            float[] queryEmbedding = embeddingProvider.embed(List.of(queryText)).get(0);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("query_embeddings", List.of(queryEmbedding));
            body.put("n_results", limit);
            if (filter != null) {
                body.put("where", filter.toClause());
            }
            body.put("include", List.of("documents", "metadatas", "distances"));
            JsonNode response = post(collectionPath("/query"), body);

            JsonNode ids = response.path("ids").path(0);
            JsonNode documents = response.path("documents").path(0);
            JsonNode metadatas = response.path("metadatas").path(0);
            JsonNode distances = response.path("distances").path(0);
            List<QueryMatch> matches = new ArrayList<>();
            for (int i = 0; i < ids.size(); i++) {
                String recordId = ids.get(i).asText();
                ChunkMetadata metadata = readMetadata(recordId, metadatas.path(i));
                if (metadata == null) {
                    continue;
                }
                matches.add(new QueryMatch(recordId, textOrNull(documents.path(i)), metadata,
                        distances.path(i).asDouble(0.0)));
            }
            return matches;
        }

        private String collectionPath(String suffix) {
            return "/api/v1/collections/" + id + suffix;
        }

        private ChunkMetadata readMetadata(String recordId, JsonNode node) {
            if (node.isMissingNode() || node.isNull()) {
                return ChunkMetadata.empty();
            }
            try {
                return ChunkMetadata.fromMap(mapper.convertValue(node, METADATA_TYPE));
            } catch (MalformedRecordException e) {
                log.warn("Skipping malformed record {} in collection {}: {}", recordId, name, e.getMessage());
                return null;
            }
        }

        private String textOrNull(JsonNode node) {
            return node.isMissingNode() || node.isNull() ? null : node.asText();
        }
    }
}
