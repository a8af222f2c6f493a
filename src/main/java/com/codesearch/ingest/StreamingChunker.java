package com.codesearch.ingest;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class StreamingChunker {
    public static final int DEFAULT_MAX_CHUNK_SIZE = 1500;
    public static final int DEFAULT_MAX_LINE_LENGTH = 10_000;

    private final int maxChunkSize;
    private final int maxLineLength;
    private final Logger log;

    public StreamingChunker() {
        this(DEFAULT_MAX_CHUNK_SIZE, DEFAULT_MAX_LINE_LENGTH);
    }

    public StreamingChunker(int maxChunkSize, int maxLineLength) {
        this(maxChunkSize, maxLineLength, LoggerFactory.getLogger(StreamingChunker.class));
    }

    StreamingChunker(int maxChunkSize, int maxLineLength, Logger log) {
        if (maxChunkSize <= 0 || maxLineLength <= 0) {
            throw new IllegalArgumentException("maxChunkSize and maxLineLength must be positive");
        }
        this.maxChunkSize = maxChunkSize;
        this.maxLineLength = maxLineLength;
        this.log = log;
    }

    /**
     * Opens {@code file} and returns a lazy chunk sequence over its lines. Every call reads the
     * file from the start; the caller owns the returned stream and must close it.
     */
    public ChunkStream chunk(Path file, String relativePath, String fileType) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(
                Files.newInputStream(file),
                StandardCharsets.UTF_8.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPLACE)
                        .onUnmappableCharacter(CodingErrorAction.REPLACE)));
        return new ChunkStream(reader, relativePath, fileType, maxChunkSize, maxLineLength, log);
    }

    public static String fileType(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return "txt";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "txt";
        }
        return name.substring(dot + 1);
    }
}
