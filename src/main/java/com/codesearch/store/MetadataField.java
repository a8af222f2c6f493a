package com.codesearch.store;

import java.util.Arrays;
import java.util.Optional;

public enum MetadataField {
    FILE_PATH("file_path"),
    FILE_TYPE("file_type"),
    CHUNK_INDEX("chunk_index"),
    PROJECT_ID("project_id"),
    PROJECT_NAME("project_name"),
    PROJECT_PATH("project_path"),
    SOURCE_TYPE("source_type"),
    INDEXED_AT("indexed_at");

    private final String key;

    MetadataField(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<MetadataField> fromKey(String key) {
        return Arrays.stream(values())
                .filter(field -> field.key.equals(key))
                .findFirst();
    }
}
