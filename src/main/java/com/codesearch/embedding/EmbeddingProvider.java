package com.codesearch.embedding;

import java.util.List;

public interface EmbeddingProvider {
    /**
     * Returns one vector per input text, in input order.
     */
    List<float[]> embed(List<String> texts);

    int dimension();

    String name();

    ProviderInfo describe();
}
