package com.codesearch.ingest;

import java.util.Locale;

public final class ProjectIds {
    private ProjectIds() {
    }

    /**
     * Lowercases the name and replaces every character outside {@code [a-z0-9]} with '_'. Distinct
     * names may map to the same id.
     */
    public static String sanitize(String projectName) {
        return projectName.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "_");
    }

    public static String recordId(String projectId, int sequenceNumber) {
        return projectId + "_chunk_" + sequenceNumber;
    }
}
