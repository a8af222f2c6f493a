package com.codesearch.ingest;

import java.nio.file.Path;
import java.util.List;

/**
 * Pattern lists are optional; null selects {@link DefaultPatterns}.
 */
public record IndexRequest(Path projectPath, String projectName, List<String> includePatterns, List<String> excludePatterns) {

    public IndexRequest(Path projectPath, String projectName) {
        this(projectPath, projectName, null, null);
    }

    public List<String> effectiveIncludePatterns() {
        return includePatterns == null ? DefaultPatterns.INCLUDE : includePatterns;
    }

    public List<String> effectiveExcludePatterns() {
        return excludePatterns == null ? DefaultPatterns.EXCLUDE : excludePatterns;
    }
}
