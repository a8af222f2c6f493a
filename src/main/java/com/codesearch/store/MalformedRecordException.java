package com.codesearch.store;

public class MalformedRecordException extends VectorStoreException {
    public MalformedRecordException(String message) {
        super(message);
    }
}
