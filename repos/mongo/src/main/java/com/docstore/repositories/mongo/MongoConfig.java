package com.docstore.repositories.mongo;

import com.docstore.core.ConfigurationException;
import com.docstore.core.StorageConfig;

import java.time.Duration;
import java.util.Map;

/**
 * Where the store lives and how long each operation may take.
 *
 * @param uri        connection string, {@code mongodb://} or {@code mongodb+srv://}
 * @param db         database name
 * @param collection collection every operation runs against
 * @param timeout    per-operation deadline
 */
public record MongoConfig(
        String uri,
        String db,
        String collection,
        Duration timeout
) implements StorageConfig {
    public static final String TYPE = "mongo";

    public MongoConfig {
        if (uri == null || uri.isBlank()) {
            throw new ConfigurationException("uri", "MongoDB URI is required");
        }
        if (!uri.startsWith("mongodb://") && !uri.startsWith("mongodb+srv://")) {
            throw new ConfigurationException("uri", "URI must start with mongodb:// or mongodb+srv://");
        }
        if (db == null || db.isBlank()) {
            throw new ConfigurationException("db", "database name is required");
        }
        if (collection == null || collection.isBlank()) {
            throw new ConfigurationException("collection", "collection name is required");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new ConfigurationException("timeout", "timeout must be positive, got " + timeout);
        }
    }

    @Override
    public String type() {
        return TYPE;
    }

    public static MongoConfig defaults() {
        return builder().build();
    }

    /**
     * Reads {@code MONGO_URI}, {@code MONGO_DB}, {@code MONGO_COLLECTION} and
     * {@code MONGO_TIMEOUT_SECONDS}, falling back to {@link #defaults()} for any that are unset
     * or empty.
     */
    public static MongoConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static MongoConfig fromEnv(Map<String, String> env) {
        Builder builder = builder();
        String uri = env.get("MONGO_URI");
        if (isSet(uri)) {
            builder.uri(uri);
        }
        String db = env.get("MONGO_DB");
        if (isSet(db)) {
            builder.db(db);
        }
        String collection = env.get("MONGO_COLLECTION");
        if (isSet(collection)) {
            builder.collection(collection);
        }
        String timeout = env.get("MONGO_TIMEOUT_SECONDS");
        if (isSet(timeout)) {
            try {
                builder.timeoutSeconds(Long.parseLong(timeout.trim()));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("timeout", "MONGO_TIMEOUT_SECONDS is not a number: " + timeout);
            }
        }
        return builder.build();
    }

    private static boolean isSet(String value) {
        return value != null && !value.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String uri = "mongodb://localhost:27017";
        private String db = "testing";
        private String collection = "persons";
        private Duration timeout = Duration.ofSeconds(3);

        public Builder uri(String uri) {
            this.uri = uri;
            return this;
        }

        public Builder db(String db) {
            this.db = db;
            return this;
        }

        public Builder collection(String collection) {
            this.collection = collection;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder timeoutSeconds(long seconds) {
            this.timeout = Duration.ofSeconds(seconds);
            return this;
        }

        public MongoConfig build() {
            return new MongoConfig(uri, db, collection, timeout);
        }
    }
}
