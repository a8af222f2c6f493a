package com.codesearch.store;

public record QueryMatch(String id, String document, ChunkMetadata metadata, double distance) {
}
