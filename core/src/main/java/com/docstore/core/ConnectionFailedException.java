package com.docstore.core;

/**
 * The initial dial or ping of the database server did not succeed.
 */
public class ConnectionFailedException extends DocumentStoreException {
    private final String uri;

    public ConnectionFailedException(String uri, String message, Throwable cause) {
        super(message, cause);
        this.uri = uri;
    }

    public String getUri() {
        return uri;
    }
}
