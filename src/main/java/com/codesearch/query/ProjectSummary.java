package com.codesearch.query;

public record ProjectSummary(
        String projectId,
        String projectName,
        String projectPath,
        String sourceType,
        String indexedAt,
        int chunkCount) {

    ProjectSummary withOneMoreChunk() {
        return new ProjectSummary(projectId, projectName, projectPath, sourceType, indexedAt, chunkCount + 1);
    }
}
