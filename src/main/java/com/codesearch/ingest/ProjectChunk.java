package com.codesearch.ingest;

import com.codesearch.store.ChunkMetadata;

/** A chunk tagged with the metadata of the indexing run that produced it. */
public record ProjectChunk(String content, ChunkMetadata metadata) {

    public static ProjectChunk of(Chunk chunk,
            String projectId,
            String projectName,
            String projectPath,
            String sourceType,
            String indexedAt) {
        return new ProjectChunk(chunk.content(), new ChunkMetadata(
                chunk.filePath(),
                chunk.fileType(),
                chunk.chunkIndex(),
                projectId,
                projectName,
                projectPath,
                sourceType,
                indexedAt));
    }
}
