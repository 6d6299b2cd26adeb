package com.docstore.core;

/**
 * A multi-record read failed part way through. Partial results are discarded.
 */
public class CursorIterationException extends DocumentStoreException {
    private final int documentsRead;

    public CursorIterationException(int documentsRead, String message, Throwable cause) {
        super(message, cause);
        this.documentsRead = documentsRead;
    }

    /**
     * @return how many documents were decoded before the failure
     */
    public int getDocumentsRead() {
        return documentsRead;
    }
}
