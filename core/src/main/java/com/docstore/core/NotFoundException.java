package com.docstore.core;

/**
 * A single-record lookup matched zero documents.
 */
public class NotFoundException extends DocumentStoreException {
    public NotFoundException(String message) {
        super(message);
    }
}
