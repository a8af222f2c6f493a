package com.codesearch.embedding;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.codesearch.LogCapture;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.qos.logback.classic.Level;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

class OllamaEmbeddingProviderTest {
    private final LogCapture logs = new LogCapture();
    private MockWebServer server;
    private OllamaEmbeddingProvider provider;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        provider = new OllamaEmbeddingProvider(new OkHttpClient(), server.url("/").toString(), "nomic-embed-text", 384,
                logs.logger());
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void shouldRequestOneEmbeddingPerTextInOrder() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"embedding\":[0.1,0.2,0.3]}"));
        server.enqueue(new MockResponse().setBody("{\"embedding\":[0.4,0.5,0.6]}"));

        List<float[]> vectors = provider.embed(List.of("first", "second"));

        assertEquals(2, vectors.size());
        assertArrayEquals(new float[] { 0.1f, 0.2f, 0.3f }, vectors.get(0));
        assertArrayEquals(new float[] { 0.4f, 0.5f, 0.6f }, vectors.get(1));
        RecordedRequest request = server.takeRequest();
        JsonNode body = new ObjectMapper().readTree(request.getBody().readUtf8());
        assertEquals("/api/embeddings", request.getPath());
        assertEquals("nomic-embed-text", body.path("model").asText());
        assertEquals("first", body.path("prompt").asText());
        assertEquals("second", new ObjectMapper().readTree(server.takeRequest().getBody().readUtf8()).path("prompt").asText());
    }

    @Test
    void shouldSubstituteZeroVectorOnErrorStatus() {
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setBody("{\"embedding\":[1.0]}"));

        List<float[]> vectors = provider.embed(List.of("x".repeat(80), "ok"));

        assertEquals(384, vectors.get(0).length);
        for (float value : vectors.get(0)) {
            assertEquals(0f, value);
        }
        assertArrayEquals(new float[] { 1.0f }, vectors.get(1));
        assertTrue(logs.contains(Level.WARN, "x".repeat(50) + "..."));
        assertFalse(logs.contains(Level.WARN, "x".repeat(51)));
    }

    @Test
    void shouldSubstituteZeroVectorWhenEndpointIsUnreachable() throws Exception {
        server.shutdown();

        float[] vector = provider.embed(List.of("def parse(): pass")).get(0);

        assertEquals(384, vector.length);
        assertTrue(logs.contains(Level.WARN, "Error generating embedding for text: def parse(): pass..."));
    }

    @Test
    void shouldSubstituteZeroVectorWhenResponseHasNoEmbedding() {
        server.enqueue(new MockResponse().setBody("{\"error\":\"model not found\"}"));

        assertEquals(384, provider.embed(List.of("text")).get(0).length);
    }

    @Test
    void shouldDescribeReachableServerWithModels() {
        server.enqueue(new MockResponse().setBody("{\"models\":[{\"name\":\"nomic-embed-text:latest\"},{\"name\":\"llama3\"}]}"));

        ProviderInfo info = provider.describe();

        assertEquals("ollama", info.provider());
        assertEquals("nomic-embed-text", info.model());
        assertEquals(ProviderInfo.Connection.CONNECTED, info.connection());
        assertNull(info.apiKeyConfigured());
        assertEquals(List.of("nomic-embed-text:latest", "llama3"), info.availableModels());
    }

    @Test
    void shouldDescribeUnreachableServer() throws Exception {
        server.shutdown();

        ProviderInfo info = provider.describe();

        assertEquals(ProviderInfo.Connection.ERROR, info.connection());
        assertTrue(info.availableModels().isEmpty());
    }

    @Test
    void shouldDescribeServerAnsweringWithErrorStatusAsFailed() {
        server.enqueue(new MockResponse().setResponseCode(503));

        ProviderInfo info = provider.describe();

        assertEquals(ProviderInfo.Connection.FAILED, info.connection());
        assertTrue(info.availableModels().isEmpty());
    }
}
