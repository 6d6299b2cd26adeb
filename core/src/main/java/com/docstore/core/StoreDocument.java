package com.docstore.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One record: an immutable mapping from field name to {@link DocumentValue}.
 *
 * <p>Fields keep the order they were added in, but equality ignores it.
 */
public final class StoreDocument {
    private static final StoreDocument EMPTY = new StoreDocument(Collections.emptyMap());

    private final Map<String, DocumentValue> fields;

    private StoreDocument(Map<String, DocumentValue> fields) {
        this.fields = fields;
    }

    public static StoreDocument empty() {
        return EMPTY;
    }

    public static StoreDocument of(Map<?, ?> map) {
        Builder builder = builder();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String)) {
                throw new IllegalArgumentException("field names must be strings, got: " + entry.getKey());
            }
            builder.put((String) entry.getKey(), DocumentValue.of(entry.getValue()));
        }
        return builder.build();
    }

    /**
     * Convenience for literal documents: {@code StoreDocument.of("name", "john", "age", 44)}.
     */
    public static StoreDocument of(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("expected an even number of arguments");
        }
        Builder builder = builder();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            builder.put((String) keysAndValues[i], DocumentValue.of(keysAndValues[i + 1]));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<DocumentValue> get(String field) {
        return Optional.ofNullable(fields.get(field));
    }

    public boolean containsKey(String field) {
        return fields.containsKey(field);
    }

    public Set<String> keySet() {
        return fields.keySet();
    }

    /**
     * @return the fields in insertion order
     */
    public List<Map.Entry<String, DocumentValue>> fields() {
        return new ArrayList<>(fields.entrySet());
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public StoreDocument with(String field, DocumentValue value) {
        return builder().putAll(this).put(field, value).build();
    }

    /**
     * @return a mutable copy holding plain Java values, nested documents as maps
     */
    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, DocumentValue> entry : fields.entrySet()) {
            result.put(entry.getKey(), entry.getValue().unwrap());
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StoreDocument && fields.equals(((StoreDocument) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }

    public static final class Builder {
        private final Map<String, DocumentValue> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String field, DocumentValue value) {
            if (field == null) {
                throw new IllegalArgumentException("field name must not be null");
            }
            fields.put(field, value == null ? DocumentValue.NULL : value);
            return this;
        }

        public Builder put(String field, Object value) {
            return put(field, DocumentValue.of(value));
        }

        public Builder putAll(StoreDocument document) {
            fields.putAll(document.fields);
            return this;
        }

        public StoreDocument build() {
            return new StoreDocument(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
        }
    }
}
