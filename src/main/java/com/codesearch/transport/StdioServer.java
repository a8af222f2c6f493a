package com.codesearch.transport;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CountDownLatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;

/**
 * Serves the tools over newline-delimited JSON-RPC on a pair of streams. {@link #run()} blocks
 * until the input reaches end of stream. Nothing but protocol messages is written to the output.
 */
public class StdioServer {
    private static final Logger log = LoggerFactory.getLogger(StdioServer.class);

    private final McpToolBridge bridge;
    private final InputStream input;
    private final OutputStream output;

    public StdioServer(McpToolBridge bridge, InputStream input, OutputStream output) {
        this.bridge = bridge;
        this.input = input;
        this.output = output;
    }

    public void run() throws InterruptedException {
        CountDownLatch inputClosed = new CountDownLatch(1);
        StdioServerTransportProvider transport = new StdioServerTransportProvider(
                McpJsonMapper.createDefault(), new EndOfStreamSignal(input, inputClosed), output);
        McpSyncServer server = bridge.serve(transport);
        log.info("Code search tool server running on stdio");
        try {
            inputClosed.await();
            log.info("stdin closed, stopping stdio server");
        } finally {
            server.closeGracefully();
        }
    }

    /** Counts the latch down once a read reports end of stream or fails. */
    private static final class EndOfStreamSignal extends FilterInputStream {
        private final CountDownLatch latch;

        private EndOfStreamSignal(InputStream in, CountDownLatch latch) {
            super(in);
            this.latch = latch;
        }

        @Override
        public int read() throws IOException {
            try {
                int value = super.read();
                if (value < 0) {
                    latch.countDown();
                }
                return value;
            } catch (IOException e) {
                latch.countDown();
                throw e;
            }
        }

        @Override
        public int read(byte[] buffer, int offset, int length) throws IOException {
            try {
                int count = super.read(buffer, offset, length);
                if (count < 0) {
                    latch.countDown();
                }
                return count;
            } catch (IOException e) {
                latch.countDown();
                throw e;
            }
        }

        @Override
        public void close() throws IOException {
            latch.countDown();
            super.close();
        }
    }
}
