package com.codesearch.store;

public enum Include {
    DOCUMENTS("documents"),
    METADATAS("metadatas");

    private final String wireName;

    Include(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
