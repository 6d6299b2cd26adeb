package com.docstore.core;

/**
 * Caller supplied bytes that are not a JSON object.
 */
public class MalformedPayloadException extends DocumentStoreException {
    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
