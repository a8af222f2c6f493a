package com.codesearch.ingest;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

import org.slf4j.Logger;

/**
 * Lazily turns the lines of one file into chunks. Not restartable; read failures surface as
 * {@link UncheckedIOException} from {@link #hasNext()} or {@link #next()}.
 */
public class ChunkStream implements Iterator<Chunk>, AutoCloseable {
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final BufferedReader reader;
    private final String relativePath;
    private final String fileType;
    private final int maxChunkSize;
    private final int maxLineLength;
    private final Logger log;

    private final StringBuilder buffer = new StringBuilder();
    private Chunk pending;
    private int chunkIndex;
    private int lineNumber;
    private boolean exhausted;

    ChunkStream(BufferedReader reader,
            String relativePath,
            String fileType,
            int maxChunkSize,
            int maxLineLength,
            Logger log) {
        this.reader = reader;
        this.relativePath = relativePath;
        this.fileType = fileType;
        this.maxChunkSize = maxChunkSize;
        this.maxLineLength = maxLineLength;
        this.log = log;
    }

    @Override
    public boolean hasNext() {
        if (pending == null && !exhausted) {
            pending = advance();
        }
        return pending != null;
    }

    @Override
    public Chunk next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more chunks for " + relativePath);
        }
        Chunk chunk = pending;
        pending = null;
        return chunk;
    }

    private Chunk advance() {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (lineNumber == 1 && !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
                    line = line.substring(1);
                }
                if (line.length() > maxLineLength) {
                    log.debug("Skipping very long line {} ({} chars) in {}", lineNumber, line.length(), relativePath);
                    continue;
                }
                if (buffer.length() > 0 && buffer.length() + 1 + line.length() > maxChunkSize) {
                    Chunk completed = emit();
                    buffer.append(line);
                    if (completed != null) {
                        return completed;
                    }
                } else {
                    if (buffer.length() > 0) {
                        buffer.append('\n');
                    }
                    buffer.append(line);
                }
            }
            exhausted = true;
            Chunk last = emit();
            log.debug("Finished processing {}: {} lines, {} chunks", relativePath, lineNumber, chunkIndex);
            return last;
        } catch (IOException e) {
            exhausted = true;
            throw new UncheckedIOException("Error reading " + relativePath + " at line " + (lineNumber + 1), e);
        }
    }

    private Chunk emit() {
        String content = trim(buffer);
        buffer.setLength(0);
        if (content.isEmpty()) {
            return null;
        }
        return new Chunk(content, relativePath, fileType, chunkIndex++);
    }

    /** Trims Unicode whitespace, no-break spaces and byte order marks from both ends. */
    static String trim(CharSequence text) {
        int start = 0;
        int end = text.length();
        while (start < end && isTrimmable(text.charAt(start))) {
            start++;
        }
        while (end > start && isTrimmable(text.charAt(end - 1))) {
            end--;
        }
        return text.subSequence(start, end).toString();
    }

    private static boolean isTrimmable(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == BYTE_ORDER_MARK;
    }

    public int linesRead() {
        return lineNumber;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
