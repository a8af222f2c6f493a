package com.codesearch.ingest;

public record IndexingReport(
        String projectId,
        String projectName,
        String projectPath,
        int filesDiscovered,
        int filesProcessed,
        int filesFailed,
        int chunksCreated) {
}
