package com.codesearch.ingest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codesearch.store.VectorCollection;

public class IndexingService {
    static final String SOURCE_TYPE_LOCAL = "local";

    private final VectorCollection collection;
    private final FileDiscoverer fileDiscoverer;
    private final StreamingChunker chunker;
    private final BatchIngestor batchIngestor;
    private final Clock clock;
    private final Logger log;
    private final ConcurrentMap<String, ProjectLock> projectLocks = new ConcurrentHashMap<>();

    public IndexingService(VectorCollection collection,
            FileDiscoverer fileDiscoverer,
            StreamingChunker chunker,
            BatchIngestor batchIngestor) {
        this(collection, fileDiscoverer, chunker, batchIngestor, Clock.systemUTC(),
                LoggerFactory.getLogger(IndexingService.class));
    }

    IndexingService(VectorCollection collection,
            FileDiscoverer fileDiscoverer,
            StreamingChunker chunker,
            BatchIngestor batchIngestor,
            Clock clock,
            Logger log) {
        this.collection = collection;
        this.fileDiscoverer = fileDiscoverer;
        this.chunker = chunker;
        this.batchIngestor = batchIngestor;
        this.clock = clock;
        this.log = log;
    }

    /**
     * Indexes one local directory into the shared collection. Runs for the same project id are
     * serialized; runs for different projects may overlap.
     *
     * @throws IllegalArgumentException when the path is missing or not a directory, before anything
     *                                  is read or written
     * @throws IngestionException       when a batch write fails; earlier batches stay stored
     */
    public IndexingReport index(IndexRequest request) {
        if (request.projectName() == null || request.projectName().isBlank()) {
            throw new IllegalArgumentException("project_name is required");
        }
        Path root = validateProjectPath(request.projectPath());
        String projectId = ProjectIds.sanitize(request.projectName());

        ProjectLock lock = acquire(projectId);
        if (lock.isLocked()) {
            log.info("Waiting for running indexing of project {} to finish", projectId);
        }
        lock.lock();
        try {
            return indexDirectory(root, request, projectId);
        } finally {
            lock.unlock();
            release(projectId);
        }
    }

    private ProjectLock acquire(String projectId) {
        return projectLocks.compute(projectId, (id, existing) -> {
            ProjectLock lock = existing == null ? new ProjectLock() : existing;
            lock.users++;
            return lock;
        });
    }

    private void release(String projectId) {
        projectLocks.computeIfPresent(projectId, (id, existing) -> --existing.users == 0 ? null : existing);
    }

    int trackedProjectLocks() {
        return projectLocks.size();
    }

    private IndexingReport indexDirectory(Path root, IndexRequest request, String projectId) {
        String projectPath = request.projectPath().toString();
        String indexedAt = clock.instant().toString();
        List<Path> files = fileDiscoverer.discover(root,
                request.effectiveIncludePatterns(),
                request.effectiveExcludePatterns());
        log.info("Indexing project {} ({}) from {}: {} files selected", request.projectName(), projectId, root, files.size());

        List<ProjectChunk> chunks = new ArrayList<>();
        int processed = 0;
        int failed = 0;
        for (Path file : files) {
            String relative = FileDiscoverer.relativePath(root, file);
            String fileType = StreamingChunker.fileType(file);
            try (ChunkStream stream = chunker.chunk(file, relative, fileType)) {
                log.debug("Processing file: {} ({} bytes)", relative, Files.size(file));
                List<ProjectChunk> fileChunks = new ArrayList<>();
                while (stream.hasNext()) {
                    fileChunks.add(ProjectChunk.of(stream.next(), projectId, request.projectName(), projectPath,
                            SOURCE_TYPE_LOCAL, indexedAt));
                }
                chunks.addAll(fileChunks);
                processed++;
            } catch (IOException | UncheckedIOException e) {
                failed++;
                log.warn("Error processing file {}: {}", relative, e.getMessage());
            }
        }

        if (!chunks.isEmpty()) {
            batchIngestor.ingest(collection, chunks, projectId);
        }
        log.info("Indexed project {}: processed={} failed={} chunks={}", projectId, processed, failed, chunks.size());
        return new IndexingReport(projectId, request.projectName(), projectPath, files.size(), processed, failed,
                chunks.size());
    }

    private static Path validateProjectPath(Path projectPath) {
        if (projectPath == null) {
            throw new IllegalArgumentException("project_path is required");
        }
        if (!Files.exists(projectPath)) {
            throw new IllegalArgumentException("Cannot access project path: " + projectPath);
        }
        if (!Files.isDirectory(projectPath)) {
            throw new IllegalArgumentException("Path is not a directory: " + projectPath);
        }
        return projectPath.toAbsolutePath().normalize();
    }

    /** Entries are dropped once no run holds or waits for the lock. */
    private static final class ProjectLock extends ReentrantLock {
        private static final long serialVersionUID = 1L;

        // only read or written inside ConcurrentMap.compute for the owning key
        private int users;
    }
}
