package com.docstore.core;

import java.util.List;

/**
 * JSON-in, document-out CRUD against a single configured collection.
 *
 * <p>Every operation runs under a context derived from the caller's, bounded by
 * the store's configured timeout. JSON arguments must be objects; anything else
 * fails with {@link MalformedPayloadException} before the server is contacted.
 * Driver failures surface as {@link StoreOperationFailedException}. Nothing is
 * retried.
 */
public interface DocumentStore extends AutoCloseable {

    void connect();

    void disconnect();

    boolean isConnected();

    Identifier insertOne(OperationContext ctx, byte[] json);

    /**
     * @throws NotFoundException if nothing matches {@code filter}
     */
    StoreDocument findOne(OperationContext ctx, byte[] filter);

    /**
     * @throws NotFoundException if no document has this identifier
     */
    StoreDocument findById(OperationContext ctx, Identifier id);

    /**
     * @return every match, in server order; empty when nothing matches
     * @throws CursorIterationException if reading the results fails part way
     */
    List<StoreDocument> findManyFilterJson(OperationContext ctx, byte[] filter);

    /**
     * Same as {@link #findManyFilterJson} for a filter built in code.
     */
    List<StoreDocument> findManyFilterDocument(OperationContext ctx, StoreDocument filter);

    WriteSummary deleteOne(OperationContext ctx, byte[] filter);

    /**
     * Deletes every document matching {@code filter}.
     */
    WriteSummary deleteAll(OperationContext ctx, byte[] filter);

    /**
     * @param update an update document such as {@code {"$set": {"age": 45}}}
     */
    WriteSummary updateById(OperationContext ctx, Identifier id, byte[] update);

    WriteSummary updateOne(OperationContext ctx, byte[] filter, byte[] update);

    WriteSummary updateMany(OperationContext ctx, byte[] filter, byte[] update);

    default Identifier insertOne(byte[] json) {
        return insertOne(OperationContext.background(), json);
    }

    default StoreDocument findOne(byte[] filter) {
        return findOne(OperationContext.background(), filter);
    }

    default StoreDocument findById(Identifier id) {
        return findById(OperationContext.background(), id);
    }

    default List<StoreDocument> findManyFilterJson(byte[] filter) {
        return findManyFilterJson(OperationContext.background(), filter);
    }

    default List<StoreDocument> findManyFilterDocument(StoreDocument filter) {
        return findManyFilterDocument(OperationContext.background(), filter);
    }

    default WriteSummary deleteOne(byte[] filter) {
        return deleteOne(OperationContext.background(), filter);
    }

    default WriteSummary deleteAll(byte[] filter) {
        return deleteAll(OperationContext.background(), filter);
    }

    default WriteSummary updateById(Identifier id, byte[] update) {
        return updateById(OperationContext.background(), id, update);
    }

    default WriteSummary updateOne(byte[] filter, byte[] update) {
        return updateOne(OperationContext.background(), filter, update);
    }

    default WriteSummary updateMany(byte[] filter, byte[] update) {
        return updateMany(OperationContext.background(), filter, update);
    }

    @Override
    default void close() {
        disconnect();
    }
}
