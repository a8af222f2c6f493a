package com.codesearch.ingest;

public record Chunk(String content, String filePath, String fileType, int chunkIndex) {
}
