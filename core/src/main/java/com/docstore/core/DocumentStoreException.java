package com.docstore.core;

/**
 * Base type for every failure raised by a {@link DocumentStore}.
 */
public class DocumentStoreException extends RuntimeException {
    public DocumentStoreException(String message) {
        super(message);
    }

    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
