package com.codesearch.query;

import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codesearch.store.ChunkMetadata;
import com.codesearch.store.Include;
import com.codesearch.store.MetadataField;
import com.codesearch.store.QueryMatch;
import com.codesearch.store.StoredRecord;
import com.codesearch.store.VectorCollection;
import com.codesearch.store.WhereFilter;

/**
 * Runs searches against the shared collection and renders the matches as markdown. Result order
 * is the store's order.
 */
public class QueryEngine {
    public static final int DEFAULT_LIMIT = 10;
    static final int FILE_CHUNK_LIMIT = 100_000;

    private static final String RESULT_SEPARATOR = "\n---\n\n";

    private final VectorCollection collection;
    private final Logger log;

    public QueryEngine(VectorCollection collection) {
        this(collection, LoggerFactory.getLogger(QueryEngine.class));
    }

    QueryEngine(VectorCollection collection, Logger log) {
        this.collection = collection;
        this.log = log;
    }

    public String search(String query, int limit, String projectFilter) {
        requireText(query, "query");
        requirePositive(limit);
        WhereFilter filter = projectFilter == null || projectFilter.isBlank()
                ? null
                : WhereFilter.eq(MetadataField.PROJECT_ID, projectFilter);
        List<QueryMatch> matches = collection.query(query, limit, filter);
        log.debug("search query=\"{}\" limit={} projectFilter={} matches={}", query, limit, projectFilter, matches.size());
        if (matches.isEmpty()) {
            return "No results found for your query.";
        }
        String formatted = formatMatches(matches, false);
        return "Found " + matches.size() + " results for: \"" + query + "\"\n\n" + formatted;
    }

    public String searchByFileType(String fileType, String query, int limit) {
        requireText(fileType, "file_type");
        requirePositive(limit);
        String queryText = query == null || query.isBlank() ? fileType : query;
        List<QueryMatch> matches = collection.query(queryText, limit, WhereFilter.eq(MetadataField.FILE_TYPE, fileType));
        log.debug("searchByFileType fileType={} query=\"{}\" limit={} matches={}", fileType, queryText, limit, matches.size());
        if (matches.isEmpty()) {
            return "No results found for file type: " + fileType;
        }
        String formatted = formatMatches(matches, true);
        return "Found " + matches.size() + " results for file type \"" + fileType + "\":\n\n" + formatted;
    }

    /**
     * Rebuilds a file from its stored chunks, ordered by chunk index with a missing index read as 0.
     */
    public String getFileContent(String filePath) {
        requireText(filePath, "file_path");
        List<StoredRecord> records = collection.get(
                WhereFilter.eq(MetadataField.FILE_PATH, filePath),
                FILE_CHUNK_LIMIT,
                EnumSet.of(Include.DOCUMENTS, Include.METADATAS));
        if (records.isEmpty()) {
            return "File not found: " + filePath;
        }
        List<StoredRecord> ordered = records.stream()
                .sorted(Comparator.comparingInt(record -> record.metadata().chunkIndexOrZero()))
                .toList();
        String content = ordered.stream()
                .map(record -> record.document() == null ? "" : record.document())
                .collect(Collectors.joining("\n"));
        ChunkMetadata first = ordered.get(0).metadata();
        return "# File: " + filePath + "\n"
                + "**Project:** " + first.projectName() + "\n"
                + "**Type:** " + first.fileType() + "\n"
                + "**Chunks:** " + ordered.size() + "\n\n"
                + "```" + first.fileType() + "\n" + content + "\n```\n";
    }

    private static String formatMatches(List<QueryMatch> matches, boolean includeType) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < matches.size(); i++) {
            QueryMatch match = matches.get(i);
            ChunkMetadata metadata = match.metadata();
            if (i > 0) {
                builder.append(RESULT_SEPARATOR);
            }
            builder.append("## Result ").append(i + 1)
                    .append(" (Similarity: ").append(formatSimilarity(match.distance())).append(")\n")
                    .append("**File:** ").append(metadata.filePath()).append('\n')
                    .append("**Project:** ").append(metadata.projectName()).append('\n');
            if (includeType) {
                builder.append("**Type:** ").append(metadata.fileType()).append('\n');
            }
            builder.append('\n')
                    .append("```").append(metadata.fileType()).append('\n')
                    .append(match.document()).append('\n')
                    .append("```\n");
        }
        return builder.toString();
    }

    /** {@code 1 - distance} with three decimals; not clamped, so it can be negative. */
    static String formatSimilarity(double distance) {
        return String.format(Locale.ROOT, "%.3f", 1.0 - distance);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }

    private static void requirePositive(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1 but was " + limit);
        }
    }
}
