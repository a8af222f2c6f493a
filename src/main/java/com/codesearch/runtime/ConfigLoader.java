package com.codesearch.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads {@link AppConfig} from an optional YAML file, then lets environment variables override
 * individual values.
 */
public class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    private final Map<String, String> environment;

    public ConfigLoader() {
        this(System.getenv());
    }

    public ConfigLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    public AppConfig load(Path configPath) {
        AppConfig config = readFile(configPath);
        applyEnvironment(config);
        validate(config);
        return config;
    }

    private AppConfig readFile(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.debug("No config file at {}, using defaults", configPath);
            return new AppConfig();
        }
        try {
            AppConfig config = mapper.readValue(configPath.toFile(), AppConfig.class);
            return config == null ? new AppConfig() : config;
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read config file " + configPath + ": " + e.getMessage(), e);
        }
    }

    void applyEnvironment(AppConfig config) {
        AppConfig.EmbeddingConfig embedding = config.getEmbedding();
        AppConfig.StoreConfig store = config.getStore();
        override("EMBEDDING_PROVIDER", embedding::setProvider);
        override("OPENAI_API_KEY", embedding.getOpenai()::setApiKey);
        override("OPENAI_MODEL", embedding.getOpenai()::setModel);
        override("OPENAI_BASE_URL", embedding.getOpenai()::setBaseUrl);
        override("OLLAMA_HOST", embedding.getOllama()::setHost);
        override("OLLAMA_MODEL", embedding.getOllama()::setModel);
        override("VECTOR_STORE", store::setType);
        override("CHROMA_HOST", store::setChromaHost);
        overrideInt("CHROMA_PORT", store::setChromaPort);
        override("COLLECTION_NAME", store::setCollectionName);
        override("LOCAL_STORE_PATH", store::setLocalPath);
        overrideInt("SERVER_PORT", config.getServer()::setPort);
    }

    private void override(String name, Consumer<String> setter) {
        String value = environment.get(name);
        if (value != null && !value.isBlank()) {
            setter.accept(value.trim());
        }
    }

    private void overrideInt(String name, Consumer<Integer> setter) {
        String value = environment.get(name);
        if (value == null || value.isBlank()) {
            return;
        }
        try {
            setter.accept(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Environment variable " + name + " must be an integer but was: " + value, e);
        }
    }

    private static void validate(AppConfig config) {
        AppConfig.IndexingConfig indexing = config.getIndexing();
        requirePositive("indexing.maxChunkSize", indexing.getMaxChunkSize());
        requirePositive("indexing.maxLineLength", indexing.getMaxLineLength());
        requirePositive("indexing.batchSize", indexing.getBatchSize());
        requirePositive("indexing.projectScanLimit", indexing.getProjectScanLimit());
        String collection = config.getStore().getCollectionName();
        if (collection == null || collection.isBlank()) {
            throw new ConfigurationException("store.collectionName must not be blank");
        }
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw new ConfigurationException(key + " must be positive but was " + value);
        }
    }
}
