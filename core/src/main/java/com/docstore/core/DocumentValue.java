package com.docstore.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The value held by one field of a {@link StoreDocument}.
 *
 * <p>Callers that need to handle every kind of value use {@link #accept(Visitor)}
 * rather than casting.
 */
public interface DocumentValue {

    <R> R accept(Visitor<R> visitor);

    /**
     * @return the plain Java form of this value (String, Number, Boolean, null,
     * Map, List, Identifier, Instant or byte[])
     */
    Object unwrap();

    interface Visitor<R> {
        R text(String value);

        R numeric(Number value);

        R bool(boolean value);

        R nullValue();

        R nested(StoreDocument value);

        R sequence(List<DocumentValue> values);

        R id(Identifier value);

        R timestamp(Instant value);

        R bytes(byte[] value);
    }

    Null NULL = new Null();

    static DocumentValue of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof DocumentValue) {
            return (DocumentValue) value;
        }
        if (value instanceof String) {
            return new Text((String) value);
        }
        if (value instanceof Number) {
            return new Numeric((Number) value);
        }
        if (value instanceof Boolean) {
            return new Bool((Boolean) value);
        }
        if (value instanceof StoreDocument) {
            return new Nested((StoreDocument) value);
        }
        if (value instanceof Map) {
            return new Nested(StoreDocument.of((Map<?, ?>) value));
        }
        if (value instanceof Collection) {
            List<DocumentValue> values = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                values.add(of(item));
            }
            return new Sequence(values);
        }
        if (value instanceof Identifier) {
            return new Id((Identifier) value);
        }
        if (value instanceof Instant) {
            return new Timestamp((Instant) value);
        }
        if (value instanceof Date) {
            return new Timestamp(((Date) value).toInstant());
        }
        if (value instanceof byte[]) {
            return new Bytes((byte[]) value);
        }
        throw new IllegalArgumentException("unsupported value type: " + value.getClass().getName());
    }

    record Text(String value) implements DocumentValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.text(value);
        }

        @Override
        public Object unwrap() {
            return value;
        }
    }

    /**
     * A number. Two numerics are equal when they denote the same quantity,
     * so {@code 44}, {@code 44L} and {@code 44.0} compare equal.
     */
    record Numeric(Number value) implements DocumentValue {
        public Numeric {
            Objects.requireNonNull(value, "value");
        }

        public long longValue() {
            return value.longValue();
        }

        public double doubleValue() {
            return value.doubleValue();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.numeric(value);
        }

        @Override
        public Object unwrap() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Numeric)) {
                return false;
            }
            Object mine = normalized();
            Object theirs = ((Numeric) o).normalized();
            if (mine instanceof BigDecimal && theirs instanceof BigDecimal) {
                return ((BigDecimal) mine).compareTo((BigDecimal) theirs) == 0;
            }
            return mine.equals(theirs);
        }

        @Override
        public int hashCode() {
            return normalized().hashCode();
        }

        private Object normalized() {
            if ((value instanceof Double || value instanceof Float) && !Double.isFinite(value.doubleValue())) {
                return value.doubleValue();
            }
            if (value instanceof BigDecimal) {
                return normalize((BigDecimal) value);
            }
            if (value instanceof BigInteger) {
                return normalize(new BigDecimal((BigInteger) value));
            }
            return normalize(new BigDecimal(value.toString()));
        }

        private static BigDecimal normalize(BigDecimal decimal) {
            BigDecimal stripped = decimal.stripTrailingZeros();
            return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
        }
    }

    record Bool(boolean value) implements DocumentValue {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.bool(value);
        }

        @Override
        public Object unwrap() {
            return value;
        }
    }

    final class Null implements DocumentValue {
        private Null() {
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.nullValue();
        }

        @Override
        public Object unwrap() {
            return null;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    record Nested(StoreDocument value) implements DocumentValue {
        public Nested {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.nested(value);
        }

        @Override
        public Object unwrap() {
            return value.toMap();
        }
    }

    record Sequence(List<DocumentValue> values) implements DocumentValue {
        public Sequence {
            values = List.copyOf(values);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.sequence(values);
        }

        @Override
        public Object unwrap() {
            List<Object> result = new ArrayList<>(values.size());
            for (DocumentValue value : values) {
                result.add(value.unwrap());
            }
            return result;
        }
    }

    record Id(Identifier value) implements DocumentValue {
        public Id {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.id(value);
        }

        @Override
        public Object unwrap() {
            return value;
        }
    }

    record Timestamp(Instant value) implements DocumentValue {
        public Timestamp {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.timestamp(value);
        }

        @Override
        public Object unwrap() {
            return value;
        }
    }

    record Bytes(byte[] value) implements DocumentValue {
        public Bytes {
            value = value.clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.bytes(value.clone());
        }

        @Override
        public Object unwrap() {
            return value.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bytes && Arrays.equals(value, ((Bytes) o).value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "Bytes[" + Base64.getEncoder().encodeToString(value) + "]";
        }
    }
}
