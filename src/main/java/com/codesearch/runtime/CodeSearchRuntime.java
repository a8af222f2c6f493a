package com.codesearch.runtime;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codesearch.embedding.EmbeddingProvider;
import com.codesearch.embedding.EmbeddingProviders;
import com.codesearch.ingest.BatchIngestor;
import com.codesearch.ingest.FileDiscoverer;
import com.codesearch.ingest.IndexingService;
import com.codesearch.ingest.PatternMatcher;
import com.codesearch.ingest.StreamingChunker;
import com.codesearch.query.ProjectRegistry;
import com.codesearch.query.QueryEngine;
import com.codesearch.store.ChromaVectorStore;
import com.codesearch.store.LazyCollection;
import com.codesearch.store.LocalJsonVectorStore;
import com.codesearch.store.VectorCollection;
import com.codesearch.store.VectorStore;
import com.codesearch.tools.CodeSearchTools;
import com.codesearch.transport.McpToolBridge;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.OkHttpClient;

/**
 * Builds the component graph from an {@link AppConfig}. Construction fails with a
 * {@link ConfigurationException} when the configuration cannot produce a working engine.
 */
public class CodeSearchRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CodeSearchRuntime.class);

    private final AppConfig config;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final EmbeddingProvider embeddingProvider;
    private final VectorStore vectorStore;
    private final VectorCollection collection;
    private final CodeSearchTools tools;

    public CodeSearchRuntime(AppConfig config) {
        this(config, new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(config.getEmbedding().getConnectTimeoutMs()))
                .readTimeout(Duration.ofMillis(config.getEmbedding().getReadTimeoutMs()))
                .build());
    }

    CodeSearchRuntime(AppConfig config, OkHttpClient httpClient) {
        this(config, httpClient, EmbeddingProviders.create(config.getEmbedding(), httpClient), null);
    }

    public CodeSearchRuntime(AppConfig config, OkHttpClient httpClient, EmbeddingProvider embeddingProvider, VectorStore vectorStore) {
        this.config = config;
        this.httpClient = httpClient;
        this.embeddingProvider = embeddingProvider;
        this.vectorStore = vectorStore == null ? createStore(config.getStore(), httpClient) : vectorStore;
        this.collection = new LazyCollection(this.vectorStore, config.getStore().getCollectionName(), embeddingProvider);

        AppConfig.IndexingConfig indexing = config.getIndexing();
        IndexingService indexingService = new IndexingService(
                collection,
                new FileDiscoverer(new PatternMatcher()),
                new StreamingChunker(indexing.getMaxChunkSize(), indexing.getMaxLineLength()),
                new BatchIngestor(indexing.getBatchSize()));
        this.tools = new CodeSearchTools(
                indexingService,
                new QueryEngine(collection),
                new ProjectRegistry(collection, indexing.getProjectScanLimit()),
                embeddingProvider);

        log.info("Embedding provider: {}", embeddingProvider.name());
        log.info("Vector store: {} collection={}", this.vectorStore.location(), collection.name());
    }

    static VectorStore createStore(AppConfig.StoreConfig store, OkHttpClient httpClient) {
        String type = store.getType() == null ? "chroma" : store.getType().toLowerCase(Locale.ROOT);
        switch (type) {
            case "chroma":
                return new ChromaVectorStore(httpClient, store.getChromaHost(), store.getChromaPort());
            case "local":
                return new LocalJsonVectorStore(store.getLocalPath() == null || store.getLocalPath().isBlank()
                        ? null
                        : Path.of(store.getLocalPath()));
            case "memory":
                return new LocalJsonVectorStore();
            default:
                throw new ConfigurationException("Unknown vector store type: " + store.getType()
                        + " (expected chroma, local or memory)");
        }
    }

    public CodeSearchTools tools() {
        return tools;
    }

    public McpToolBridge mcpBridge() {
        return new McpToolBridge(tools, config.getServer().getName(), config.getServer().getVersion());
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public EmbeddingProvider embeddingProvider() {
        return embeddingProvider;
    }

    public AppConfig config() {
        return config;
    }

    public Map<String, Object> healthDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("service", config.getServer().getName());
        details.put("version", config.getServer().getVersion());
        details.put("embedding_provider", embeddingProvider.name());
        details.put("vector_store", vectorStore.location());
        details.put("collection", collection.name());
        return details;
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }
}
