package com.codesearch.embedding;

import java.util.List;

/**
 * Snapshot of a provider's configuration. {@code apiKeyConfigured} is only set for hosted
 * providers, {@code connection} and {@code availableModels} only for providers that probe a
 * local endpoint.
 */
public record ProviderInfo(
        String provider,
        String model,
        String host,
        Boolean apiKeyConfigured,
        Connection connection,
        List<String> availableModels) {

    public enum Connection {
        CONNECTED,
        /** The endpoint answered with a non-2xx status. */
        FAILED,
        /** The request itself failed (refused, timed out, bad URL). */
        ERROR
    }
}
