package com.codesearch.ingest;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codesearch.store.ChunkMetadata;
import com.codesearch.store.VectorCollection;

public class BatchIngestor {
    public static final int DEFAULT_BATCH_SIZE = 100;

    private final int batchSize;
    private final Logger log;

    public BatchIngestor() {
        this(DEFAULT_BATCH_SIZE);
    }

    public BatchIngestor(int batchSize) {
        this(batchSize, LoggerFactory.getLogger(BatchIngestor.class));
    }

    BatchIngestor(int batchSize, Logger log) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.batchSize = batchSize;
        this.log = log;
    }

    /**
     * Writes {@code chunks} in contiguous batches, one batch at a time. Ids are
     * {@code {projectId}_chunk_{n}} where n is the chunk's position in {@code chunks}, so a re-run
     * overwrites records by position and never removes records beyond the new run's length.
     *
     * @return number of records written
     * @throws IngestionException on the first failed batch; earlier batches remain stored
     */
    public int ingest(VectorCollection collection, List<ProjectChunk> chunks, String projectId) {
        int totalBatches = (chunks.size() + batchSize - 1) / batchSize;
        log.info("Storing {} chunks for project {} in {} batches", chunks.size(), projectId, totalBatches);

        int stored = 0;
        for (int offset = 0; offset < chunks.size(); offset += batchSize) {
            List<ProjectChunk> batch = chunks.subList(offset, Math.min(chunks.size(), offset + batchSize));
            List<String> ids = new ArrayList<>(batch.size());
            List<String> documents = new ArrayList<>(batch.size());
            List<ChunkMetadata> metadatas = new ArrayList<>(batch.size());
            for (int k = 0; k < batch.size(); k++) {
                ids.add(ProjectIds.recordId(projectId, offset + k));
                documents.add(batch.get(k).content());
                metadatas.add(batch.get(k).metadata());
            }

            int batchNumber = offset / batchSize + 1;
            try {
                collection.add(ids, documents, metadatas);
            } catch (RuntimeException e) {
                log.error("Error storing batch {}/{} for project {}", batchNumber, totalBatches, projectId, e);
                throw new IngestionException("Failed to store batch " + batchNumber + "/" + totalBatches
                        + " for project " + projectId + ": " + e.getMessage(), stored, e);
            }
            stored += batch.size();
            log.info("Stored batch {}/{}", batchNumber, totalBatches);
        }
        return stored;
    }
}
