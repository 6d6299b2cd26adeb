package com.docstore.core;

/**
 * The underlying driver call failed: network, deadline, cancellation or a
 * server-side rejection. The original failure is kept as the cause.
 */
public class StoreOperationFailedException extends DocumentStoreException {
    private final String operation;

    public StoreOperationFailedException(String operation, Throwable cause) {
        super(operation + " failed: " + cause.getMessage(), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
