package com.codesearch.store;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Metadata persisted next to every chunk document. Every field may be absent on read; records
 * written by the indexer always carry all of them.
 */
public record ChunkMetadata(
        String filePath,
        String fileType,
        Integer chunkIndex,
        String projectId,
        String projectName,
        String projectPath,
        String sourceType,
        String indexedAt) {

    public static ChunkMetadata empty() {
        return new ChunkMetadata(null, null, null, null, null, null, null, null);
    }

    public int chunkIndexOrZero() {
        return chunkIndex == null ? 0 : chunkIndex;
    }

    public Object value(MetadataField field) {
        switch (field) {
            case FILE_PATH:
                return filePath;
            case FILE_TYPE:
                return fileType;
            case CHUNK_INDEX:
                return chunkIndex;
            case PROJECT_ID:
                return projectId;
            case PROJECT_NAME:
                return projectName;
            case PROJECT_PATH:
                return projectPath;
            case SOURCE_TYPE:
                return sourceType;
            case INDEXED_AT:
                return indexedAt;
            default:
                throw new IllegalArgumentException("Unsupported metadata field: " + field);
        }
    }

    public Map<String, Object> toMap() {
        Map<String, Object> values = new LinkedHashMap<>();
        for (MetadataField field : MetadataField.values()) {
            Object value = value(field);
            if (value != null) {
                values.put(field.key(), value);
            }
        }
        return values;
    }

    public static ChunkMetadata fromMap(Map<String, ?> values) {
        if (values == null) {
            return empty();
        }
        Map<MetadataField, Object> typed = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            Optional<MetadataField> field = MetadataField.fromKey(entry.getKey());
            if (field.isEmpty()) {
                throw new MalformedRecordException("Unknown metadata key: " + entry.getKey());
            }
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            typed.put(field.get(), field.get() == MetadataField.CHUNK_INDEX
                    ? toChunkIndex(value)
                    : toText(field.get(), value));
        }
        return new ChunkMetadata(
                (String) typed.get(MetadataField.FILE_PATH),
                (String) typed.get(MetadataField.FILE_TYPE),
                (Integer) typed.get(MetadataField.CHUNK_INDEX),
                (String) typed.get(MetadataField.PROJECT_ID),
                (String) typed.get(MetadataField.PROJECT_NAME),
                (String) typed.get(MetadataField.PROJECT_PATH),
                (String) typed.get(MetadataField.SOURCE_TYPE),
                (String) typed.get(MetadataField.INDEXED_AT));
    }

    private static Integer toChunkIndex(Object value) {
        if (!(value instanceof Number)) {
            throw new MalformedRecordException("chunk_index must be a number but was: " + value);
        }
        Number number = (Number) value;
        if (number.doubleValue() != Math.rint(number.doubleValue())) {
            throw new MalformedRecordException("chunk_index must be an integer but was: " + value);
        }
        return number.intValue();
    }

    private static String toText(MetadataField field, Object value) {
        if (!(value instanceof String)) {
            throw new MalformedRecordException(field.key() + " must be a string but was: " + value);
        }
        return (String) value;
    }
}
