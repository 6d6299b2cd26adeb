package com.docstore.core;

import java.util.Optional;

/**
 * Outcome counts reported by the driver for a delete or update, copied as-is.
 * Counts that do not apply to the operation are zero.
 */
public record WriteSummary(
        boolean acknowledged,
        long matchedCount,
        long modifiedCount,
        long deletedCount,
        Optional<DocumentValue> upsertedId
) {
    public static WriteSummary deleted(boolean acknowledged, long deletedCount) {
        return new WriteSummary(acknowledged, 0, 0, deletedCount, Optional.empty());
    }

    public static WriteSummary updated(boolean acknowledged, long matchedCount, long modifiedCount,
                                       Optional<DocumentValue> upsertedId) {
        return new WriteSummary(acknowledged, matchedCount, modifiedCount, 0, upsertedId);
    }
}
