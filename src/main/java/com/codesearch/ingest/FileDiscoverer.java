package com.codesearch.ingest;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FileDiscoverer {
    private final PatternMatcher patternMatcher;
    private final Logger log;

    public FileDiscoverer(PatternMatcher patternMatcher) {
        this(patternMatcher, LoggerFactory.getLogger(FileDiscoverer.class));
    }

    FileDiscoverer(PatternMatcher patternMatcher, Logger log) {
        this.patternMatcher = patternMatcher;
        this.log = log;
    }

    /**
     * Walks {@code root} depth-first and returns the absolute paths of files that pass the include
     * and exclude rules, in directory enumeration order. An empty include list admits every file.
     */
    public List<Path> discover(Path root, List<String> includePatterns, List<String> excludePatterns) {
        Path absoluteRoot = root.toAbsolutePath().normalize();
        List<Path> files = new ArrayList<>();
        traverse(absoluteRoot, absoluteRoot, includePatterns, excludePatterns, files);
        return files;
    }

    private void traverse(Path root,
            Path directory,
            List<String> includePatterns,
            List<String> excludePatterns,
            List<Path> files) {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            for (Path entry : entries) {
                String relative = relativePath(root, entry);
                if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    if (patternMatcher.matchesAny(relative, excludePatterns)) {
                        log.debug("Pruning excluded directory {}", relative);
                        continue;
                    }
                    traverse(root, entry, includePatterns, excludePatterns, files);
                } else {
                    boolean included = includePatterns.isEmpty() || patternMatcher.matchesAny(relative, includePatterns);
                    if (included && !patternMatcher.matchesAny(relative, excludePatterns)) {
                        files.add(entry);
                    }
                }
            }
        } catch (IOException | DirectoryIteratorException | SecurityException e) {
            log.warn("Error reading directory {}: {}", directory, e.getMessage());
        }
    }

    static String relativePath(Path root, Path entry) {
        return root.relativize(entry).toString().replace('\\', '/');
    }
}
