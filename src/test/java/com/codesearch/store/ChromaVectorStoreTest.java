package com.codesearch.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.codesearch.LogCapture;
import com.codesearch.embedding.HashingEmbeddingProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.qos.logback.classic.Level;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

class ChromaVectorStoreTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final LogCapture logs = new LogCapture();
    private MockWebServer server;
    private ChromaVectorStore store;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        store = new ChromaVectorStore(new OkHttpClient(), server.url("/").toString(), logs.logger());
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void shouldGetOrCreateCollectionByName() throws Exception {
        server.enqueue(json("{\"id\":\"c-123\",\"name\":\"code\"}"));

        VectorCollection collection = store.createOrGetCollection("code", new HashingEmbeddingProvider(8));

        RecordedRequest request = server.takeRequest();
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertEquals("/api/v1/collections", request.getPath());
        assertEquals("code", body.path("name").asText());
        assertTrue(body.path("get_or_create").asBoolean());
        assertEquals("code", collection.name());
    }

    @Test
    void shouldUpsertDocumentsWithClientSideEmbeddings() throws Exception {
        VectorCollection collection = openCollection();
        server.enqueue(json("true"));

        collection.add(List.of("demo_chunk_0"), List.of("def main(): pass"),
                List.of(new ChunkMetadata("main.py", "py", 0, "demo", "Demo", "/w/demo", "local", "t")));

        RecordedRequest request = server.takeRequest();
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertEquals("/api/v1/collections/c-123/upsert", request.getPath());
        assertEquals("demo_chunk_0", body.path("ids").path(0).asText());
        assertEquals(8, body.path("embeddings").path(0).size());
        assertEquals("main.py", body.path("metadatas").path(0).path("file_path").asText());
        assertEquals(0, body.path("metadatas").path(0).path("chunk_index").asInt(-1));
    }

    @Test
    void shouldParseNestedQueryResponse() throws Exception {
        VectorCollection collection = openCollection();
        server.enqueue(json("{\"ids\":[[\"r1\",\"r2\"]],"
                + "\"documents\":[[\"first\",\"second\"]],"
                + "\"metadatas\":[[{\"file_path\":\"a.py\",\"project_id\":\"demo\"},{\"owner\":\"x\"}]],"
                + "\"distances\":[[0.25,0.5]]}"));

        List<QueryMatch> matches = collection.query("parser", 5, WhereFilter.eq(MetadataField.PROJECT_ID, "demo"));

        RecordedRequest request = server.takeRequest();
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertEquals("/api/v1/collections/c-123/query", request.getPath());
        assertEquals(5, body.path("n_results").asInt());
        assertEquals("demo", body.path("where").path("project_id").path("$eq").asText());
        assertEquals(1, matches.size());
        assertEquals("r1", matches.get(0).id());
        assertEquals(0.25, matches.get(0).distance(), 1e-9);
        assertEquals("a.py", matches.get(0).metadata().filePath());
        assertTrue(logs.contains(Level.WARN, "Skipping malformed record r2"));
    }

    @Test
    void shouldSendFilterLimitAndIncludeOnGet() throws Exception {
        VectorCollection collection = openCollection();
        server.enqueue(json("{\"ids\":[\"r1\"],\"documents\":null,\"metadatas\":[{\"project_id\":\"demo\",\"chunk_index\":4}]}"));

        List<StoredRecord> records = collection.get(null, 100000, EnumSet.of(Include.METADATAS));

        JsonNode body = mapper.readTree(server.takeRequest().getBody().readUtf8());
        assertFalse(body.has("where"));
        assertEquals(100000, body.path("limit").asInt());
        assertEquals("metadatas", body.path("include").path(0).asText());
        assertEquals(1, records.size());
        assertEquals(4, records.get(0).metadata().chunkIndex());
    }

    @Test
    void shouldFailOnErrorStatus() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        VectorStoreException error = assertThrows(VectorStoreException.class,
                () -> store.createOrGetCollection("code", new HashingEmbeddingProvider(8)));

        assertTrue(error.getMessage().contains("500"));
    }

    @Test
    void shouldReportHeartbeat() throws Exception {
        server.enqueue(json("{\"nanosecond heartbeat\":1}"));
        assertTrue(store.heartbeat());

        server.shutdown();
        assertFalse(store.heartbeat());
    }

    private VectorCollection openCollection() throws Exception {
        server.enqueue(json("{\"id\":\"c-123\",\"name\":\"code\"}"));
        VectorCollection collection = store.createOrGetCollection("code", new HashingEmbeddingProvider(8));
        server.takeRequest();
        return collection;
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
