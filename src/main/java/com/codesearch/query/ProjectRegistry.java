package com.codesearch.query;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codesearch.store.ChunkMetadata;
import com.codesearch.store.Include;
import com.codesearch.store.StoredRecord;
import com.codesearch.store.VectorCollection;

/**
 * Read-only project view computed from stored metadata. Display fields come from the first record
 * seen for a project, in whatever order the store returns records.
 */
public class ProjectRegistry {
    public static final int DEFAULT_SCAN_LIMIT = 100_000;

    private final VectorCollection collection;
    private final int scanLimit;
    private final Logger log;

    public ProjectRegistry(VectorCollection collection, int scanLimit) {
        this(collection, scanLimit, LoggerFactory.getLogger(ProjectRegistry.class));
    }

    ProjectRegistry(VectorCollection collection, int scanLimit, Logger log) {
        this.collection = collection;
        this.scanLimit = scanLimit;
        this.log = log;
    }

    public ProjectListing listProjects() {
        List<StoredRecord> records = collection.get(null, scanLimit, EnumSet.of(Include.METADATAS));
        if (records.size() >= scanLimit) {
            log.warn("Project scan reached the limit of {} records; chunk counts may be incomplete", scanLimit);
        }
        Map<String, ProjectSummary> projects = new LinkedHashMap<>();
        for (StoredRecord record : records) {
            ChunkMetadata metadata = record.metadata();
            if (metadata == null || metadata.projectId() == null || metadata.projectId().isEmpty()) {
                continue;
            }
            projects.merge(metadata.projectId(),
                    new ProjectSummary(
                            metadata.projectId(),
                            metadata.projectName(),
                            metadata.projectPath(),
                            metadata.sourceType(),
                            metadata.indexedAt(),
                            1),
                    (existing, ignored) -> existing.withOneMoreChunk());
        }
        return new ProjectListing(records.size(), new ArrayList<>(projects.values()));
    }
}
