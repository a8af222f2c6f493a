package com.codesearch.store;

public record StoredRecord(String id, String document, ChunkMetadata metadata) {
}
