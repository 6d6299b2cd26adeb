package com.docstore.repositories.mongo;

import com.docstore.core.ConfigurationException;
import com.docstore.core.ConnectionFailedException;
import com.docstore.core.CursorIterationException;
import com.docstore.core.DocumentStore;
import com.docstore.core.DocumentValue;
import com.docstore.core.Identifier;
import com.docstore.core.JsonDocuments;
import com.docstore.core.MalformedPayloadException;
import com.docstore.core.NotFoundException;
import com.docstore.core.OperationContext;
import com.docstore.core.StoreDocument;
import com.docstore.core.StoreOperationFailedException;
import com.docstore.core.WriteSummary;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.model.Filters;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.InsertOneResult;
import com.mongodb.client.result.UpdateResult;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static com.docstore.repositories.mongo.Converters.fromBson;
import static com.docstore.repositories.mongo.Converters.toBson;

/**
 * {@link DocumentStore} backed by a single MongoDB collection.
 *
 * <p>The constructor dials the server and pings it, so a store that was built
 * successfully is connected. {@link #disconnect()} closes the client and
 * {@link #connect()} dials again. Operations on a disconnected store throw
 * {@link IllegalStateException}; an operation already under way when another
 * thread disconnects fails with {@link StoreOperationFailedException}.
 *
 * <p>Each driver call runs on a worker thread while the caller waits at most
 * until its context's deadline. Cancelling the caller's context interrupts the
 * call in flight. A write that was already sent may still be applied by the
 * server.
 *
 * <p>Instances are safe to share between threads: operations only read the
 * configuration and go through the driver's pooled client.
 */
public class MongoDocumentStore implements DocumentStore {
    private static final String ID_FIELD = "_id";
    private static final AtomicInteger WORKERS = new AtomicInteger();
    private static final ThreadFactory WORKER_FACTORY = runnable -> {
        Thread thread = new Thread(runnable, "docstore-mongo-" + WORKERS.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    };

    private final MongoConfig config;
    private final Logger logger;
    private final Function<MongoClientSettings, MongoClient> clientFactory;
    private final ExecutorService workers = Executors.newCachedThreadPool(WORKER_FACTORY);
    private volatile MongoClient client;

    public MongoDocumentStore(MongoConfig config) {
        this(config, LoggerFactory.getLogger(MongoDocumentStore.class));
    }

    public MongoDocumentStore(MongoConfig config, Logger logger) {
        this(config, logger, MongoClients::create);
    }

    MongoDocumentStore(MongoConfig config, Logger logger, Function<MongoClientSettings, MongoClient> clientFactory) {
        this.config = Objects.requireNonNull(config, "config");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
        this.client = dial();
    }

    public MongoConfig config() {
        return config;
    }

    @Override
    public synchronized void connect() {
        if (client == null) {
            client = dial();
        }
    }

    @Override
    public synchronized void disconnect() {
        MongoClient current = client;
        if (current != null) {
            client = null;
            current.close();
            logger.info("Disconnected from {}/{}", config.db(), config.collection());
        }
    }

    @Override
    public boolean isConnected() {
        return client != null;
    }

    @Override
    public Identifier insertOne(OperationContext ctx, byte[] json) {
        try (OperationContext local = ctx.child(config.timeout())) {
            StoreDocument payload = JsonDocuments.parse(json);
            DocumentValue id = payload.get(ID_FIELD).orElse(null);
            if (id != null && !(id instanceof DocumentValue.Id)) {
                throw new MalformedPayloadException(ID_FIELD + " must be an object id, got " + id);
            }
            Document document = convert(payload);
            logger.debug("insertOne document: {}", document);

            InsertOneResult result = dispatch(local, "insertOne", collection -> collection.insertOne(document));
            BsonValue insertedId = result.getInsertedId();
            ObjectId objectId = insertedId != null ? insertedId.asObjectId().getValue() : document.getObjectId(ID_FIELD);
            logger.debug("insertOne assigned {}", objectId);
            return Converters.toIdentifier(objectId);
        }
    }

    @Override
    public StoreDocument findOne(OperationContext ctx, byte[] filter) {
        try (OperationContext local = ctx.child(config.timeout())) {
            Document query = convert(JsonDocuments.parse(filter));
            return first(local, "findOne", query);
        }
    }

    @Override
    public StoreDocument findById(OperationContext ctx, Identifier id) {
        Objects.requireNonNull(id, "id");
        try (OperationContext local = ctx.child(config.timeout())) {
            return first(local, "findById", Filters.eq(ID_FIELD, Converters.toObjectId(id)));
        }
    }

    @Override
    public List<StoreDocument> findManyFilterJson(OperationContext ctx, byte[] filter) {
        try (OperationContext local = ctx.child(config.timeout())) {
            Document query = convert(JsonDocuments.parse(filter));
            return walk(local, "findManyFilterJson", query);
        }
    }

    @Override
    public List<StoreDocument> findManyFilterDocument(OperationContext ctx, StoreDocument filter) {
        if (filter == null) {
            throw new MalformedPayloadException("filter is required");
        }
        try (OperationContext local = ctx.child(config.timeout())) {
            return walk(local, "findManyFilterDocument", convert(filter));
        }
    }

    /**
     * Finds every document matching a filter built with the driver's own
     * builders, such as {@link Filters}.
     */
    public List<StoreDocument> findManyFilterBson(OperationContext ctx, Bson filter) {
        if (filter == null) {
            throw new MalformedPayloadException("filter is required");
        }
        try (OperationContext local = ctx.child(config.timeout())) {
            return walk(local, "findManyFilterBson", filter);
        }
    }

    public List<StoreDocument> findManyFilterBson(Bson filter) {
        return findManyFilterBson(OperationContext.background(), filter);
    }

    @Override
    public WriteSummary deleteOne(OperationContext ctx, byte[] filter) {
        try (OperationContext local = ctx.child(config.timeout())) {
            Document query = convert(JsonDocuments.parse(filter));
            return summarizeDelete(dispatch(local, "deleteOne", collection -> collection.deleteOne(query)));
        }
    }

    @Override
    public WriteSummary deleteAll(OperationContext ctx, byte[] filter) {
        try (OperationContext local = ctx.child(config.timeout())) {
            Document query = convert(JsonDocuments.parse(filter));
            return summarizeDelete(dispatch(local, "deleteAll", collection -> collection.deleteMany(query)));
        }
    }

    @Override
    public WriteSummary updateById(OperationContext ctx, Identifier id, byte[] update) {
        Objects.requireNonNull(id, "id");
        try (OperationContext local = ctx.child(config.timeout())) {
            Document changes = convert(JsonDocuments.parse(update));
            Bson query = Filters.eq(ID_FIELD, Converters.toObjectId(id));
            return summarizeUpdate(dispatch(local, "updateById", collection -> collection.updateOne(query, changes)));
        }
    }

    @Override
    public WriteSummary updateOne(OperationContext ctx, byte[] filter, byte[] update) {
        try (OperationContext local = ctx.child(config.timeout())) {
            Document query = convert(JsonDocuments.parse(filter));
            Document changes = convert(JsonDocuments.parse(update));
            return summarizeUpdate(dispatch(local, "updateOne", collection -> collection.updateOne(query, changes)));
        }
    }

    @Override
    public WriteSummary updateMany(OperationContext ctx, byte[] filter, byte[] update) {
        try (OperationContext local = ctx.child(config.timeout())) {
            Document query = convert(JsonDocuments.parse(filter));
            Document changes = convert(JsonDocuments.parse(update));
            return summarizeUpdate(dispatch(local, "updateMany", collection -> collection.updateMany(query, changes)));
        }
    }

    MongoClientSettings settings() {
        ConnectionString connectionString;
        try {
            connectionString = new ConnectionString(config.uri());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("uri", e.getMessage());
        }
        int millis = (int) Math.min(Integer.MAX_VALUE, config.timeout().toMillis());
        return MongoClientSettings.builder()
                .applyConnectionString(connectionString)
                .applyToClusterSettings(builder -> builder
                        .serverSelectionTimeout(millis, TimeUnit.MILLISECONDS))
                .applyToSocketSettings(builder -> builder
                        .connectTimeout(millis, TimeUnit.MILLISECONDS)
                        .readTimeout(millis, TimeUnit.MILLISECONDS))
                .build();
    }

    private MongoClient dial() {
        MongoClientSettings settings = settings();
        List<String> hosts = settings.getClusterSettings().getHosts().stream().map(Object::toString).toList();

        MongoClient created;
        try {
            created = clientFactory.apply(settings);
        } catch (MongoException | IllegalArgumentException e) {
            throw new ConnectionFailedException(config.uri(), "could not create client for " + hosts, e);
        }

        try {
            created.getDatabase("admin").runCommand(new Document("ping", 1));
        } catch (MongoException e) {
            logger.error("Database at {} did not respond to ping", hosts, e);
            created.close();
            throw new ConnectionFailedException(config.uri(), "database at " + hosts + " did not respond to ping", e);
        }

        logger.info("Connected to {} using {}/{}", hosts, config.db(), config.collection());
        return created;
    }

    private MongoCollection<Document> collection() {
        MongoClient current = client;
        if (current == null) {
            throw new IllegalStateException("store is disconnected");
        }
        return current.getDatabase(config.db()).getCollection(config.collection());
    }

    private Document convert(StoreDocument document) {
        try {
            return toBson(document);
        } catch (IllegalArgumentException e) {
            throw new MalformedPayloadException("payload cannot be stored: " + e.getMessage(), e);
        }
    }

    private <T> T dispatch(OperationContext ctx, String operation, Function<MongoCollection<Document>, T> call) {
        MongoCollection<Document> collection = collection();
        try {
            ctx.ensureActive(operation);
            Future<T> pending = workers.submit(() -> call.apply(collection));
            ctx.onCancel(() -> pending.cancel(true));
            return await(ctx, operation, pending);
        } catch (MongoException | IllegalArgumentException | IllegalStateException
                 | OperationContext.DeadlineExceededException e) {
            // IllegalStateException here comes from a client closed by a concurrent disconnect()
            throw new StoreOperationFailedException(operation, e);
        }
    }

    private static <T> T await(OperationContext ctx, String operation, Future<T> pending) {
        try {
            Optional<Duration> remaining = ctx.remaining();
            if (remaining.isEmpty()) {
                return pending.get();
            }
            return pending.get(remaining.get().toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new OperationContext.DeadlineExceededException(operation + " exceeded its deadline");
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException(operation + " interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new StoreOperationFailedException(operation, cause);
        }
    }

    private StoreDocument first(OperationContext ctx, String operation, Bson query) {
        logger.debug("{} filter: {}", operation, query);
        Document found = dispatch(ctx, operation, collection -> collection.find(query)
                .maxTime(maxTimeMillis(ctx), TimeUnit.MILLISECONDS)
                .first());
        if (found == null) {
            throw new NotFoundException(operation + ": no document matches " + query);
        }
        return fromBson(found);
    }

    private List<StoreDocument> walk(OperationContext ctx, String operation, Bson query) {
        logger.debug("{} filter: {}", operation, query);
        MongoCursor<Document> cursor = dispatch(ctx, operation, collection -> collection.find(query)
                .maxTime(maxTimeMillis(ctx), TimeUnit.MILLISECONDS)
                .iterator());

        List<StoreDocument> results = new ArrayList<>();
        try (cursor) {
            while (cursor.hasNext()) {
                ctx.ensureActive(operation);
                results.add(fromBson(cursor.next()));
            }
        } catch (RuntimeException e) {
            throw new CursorIterationException(results.size(),
                    operation + ": cursor failed after " + results.size() + " documents", e);
        }

        logger.debug("{} found {} documents", operation, results.size());
        return results;
    }

    private long maxTimeMillis(OperationContext ctx) {
        Duration remaining = ctx.remaining().orElse(config.timeout());
        // maxTime(0) means no limit
        return Math.max(1, remaining.toMillis());
    }

    private static WriteSummary summarizeDelete(DeleteResult result) {
        if (!result.wasAcknowledged()) {
            return WriteSummary.deleted(false, 0);
        }
        return WriteSummary.deleted(true, result.getDeletedCount());
    }

    private static WriteSummary summarizeUpdate(UpdateResult result) {
        if (!result.wasAcknowledged()) {
            return WriteSummary.updated(false, 0, 0, Optional.empty());
        }
        return WriteSummary.updated(true, result.getMatchedCount(), result.getModifiedCount(),
                Converters.upsertedId(result.getUpsertedId()));
    }
}
