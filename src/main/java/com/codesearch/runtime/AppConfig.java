package com.codesearch.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private StoreConfig store = new StoreConfig();
    private IndexingConfig indexing = new IndexingConfig();
    private ServerConfig server = new ServerConfig();

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store == null ? new StoreConfig() : store;
    }

    public IndexingConfig getIndexing() {
        return indexing;
    }

    public void setIndexing(IndexingConfig indexing) {
        this.indexing = indexing == null ? new IndexingConfig() : indexing;
    }

    public ServerConfig getServer() {
        return server;
    }

    public void setServer(ServerConfig server) {
        this.server = server == null ? new ServerConfig() : server;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String provider = "ollama";
        private int connectTimeoutMs = 10_000;
        private int readTimeoutMs = 60_000;
        private OllamaConfig ollama = new OllamaConfig();
        private OpenAiConfig openai = new OpenAiConfig();

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public int getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public int getReadTimeoutMs() {
            return readTimeoutMs;
        }

        public void setReadTimeoutMs(int readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
        }

        public OllamaConfig getOllama() {
            return ollama;
        }

        public void setOllama(OllamaConfig ollama) {
            this.ollama = ollama == null ? new OllamaConfig() : ollama;
        }

        public OpenAiConfig getOpenai() {
            return openai;
        }

        public void setOpenai(OpenAiConfig openai) {
            this.openai = openai == null ? new OpenAiConfig() : openai;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OllamaConfig {
        private String host = "http://localhost:11434";
        private String model = "nomic-embed-text";
        private int dimension = 384;

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OpenAiConfig {
        private String apiKey;
        private String baseUrl = "https://api.openai.com";
        private String model = "text-embedding-3-small";
        private int dimension = 1536;

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        private String type = "chroma";
        private String collectionName = "company_codebase_384d-new";
        private String chromaHost = "localhost";
        private int chromaPort = 8000;
        private String localPath = ".codesearch/vector-store.json";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getCollectionName() {
            return collectionName;
        }

        public void setCollectionName(String collectionName) {
            this.collectionName = collectionName;
        }

        public String getChromaHost() {
            return chromaHost;
        }

        public void setChromaHost(String chromaHost) {
            this.chromaHost = chromaHost;
        }

        public int getChromaPort() {
            return chromaPort;
        }

        public void setChromaPort(int chromaPort) {
            this.chromaPort = chromaPort;
        }

        public String getLocalPath() {
            return localPath;
        }

        public void setLocalPath(String localPath) {
            this.localPath = localPath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexingConfig {
        private int maxChunkSize = 1500;
        private int maxLineLength = 10_000;
        private int batchSize = 100;
        private int projectScanLimit = 100_000;

        public int getMaxChunkSize() {
            return maxChunkSize;
        }

        public void setMaxChunkSize(int maxChunkSize) {
            this.maxChunkSize = maxChunkSize;
        }

        public int getMaxLineLength() {
            return maxLineLength;
        }

        public void setMaxLineLength(int maxLineLength) {
            this.maxLineLength = maxLineLength;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getProjectScanLimit() {
            return projectScanLimit;
        }

        public void setProjectScanLimit(int projectScanLimit) {
            this.projectScanLimit = projectScanLimit;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ServerConfig {
        private String name = "enterprise-code-search";
        private String version = "1.0.0";
        private String host = "0.0.0.0";
        private int port = 3001;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }
    }
}
