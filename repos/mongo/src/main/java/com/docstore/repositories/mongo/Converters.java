package com.docstore.repositories.mongo;

import com.docstore.core.DocumentValue;
import com.docstore.core.Identifier;
import com.docstore.core.StoreDocument;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface Converters {
    static Document toBson(StoreDocument document) {
        Document doc = new Document();
        for (Map.Entry<String, DocumentValue> field : document.fields()) {
            doc.put(field.getKey(), field.getValue().accept(BsonWriter.INSTANCE));
        }
        return doc;
    }

    static StoreDocument fromBson(Document doc) {
        StoreDocument.Builder builder = StoreDocument.builder();
        for (Map.Entry<String, Object> entry : doc.entrySet()) {
            builder.put(entry.getKey(), fromBsonValue(entry.getValue()));
        }
        return builder.build();
    }

    static DocumentValue fromBsonValue(Object value) {
        if (value == null) {
            return DocumentValue.NULL;
        }
        if (value instanceof Document) {
            return new DocumentValue.Nested(fromBson((Document) value));
        }
        if (value instanceof Map) {
            return new DocumentValue.Nested(fromBson(new Document(castMap((Map<?, ?>) value))));
        }
        if (value instanceof Collection) {
            List<DocumentValue> values = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                values.add(fromBsonValue(item));
            }
            return new DocumentValue.Sequence(values);
        }
        if (value instanceof ObjectId) {
            return new DocumentValue.Id(toIdentifier((ObjectId) value));
        }
        if (value instanceof Date) {
            return new DocumentValue.Timestamp(((Date) value).toInstant());
        }
        if (value instanceof Decimal128) {
            return new DocumentValue.Numeric(((Decimal128) value).bigDecimalValue());
        }
        if (value instanceof Binary) {
            return new DocumentValue.Bytes(((Binary) value).getData());
        }
        if (value instanceof String || value instanceof Number || value instanceof Boolean
                || value instanceof byte[]) {
            return DocumentValue.of(value);
        }
        return new DocumentValue.Text(value.toString());
    }

    static Optional<DocumentValue> upsertedId(BsonValue value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value.isObjectId()) {
            return Optional.of(new DocumentValue.Id(toIdentifier(value.asObjectId().getValue())));
        }
        if (value.isString()) {
            return Optional.of(new DocumentValue.Text(value.asString().getValue()));
        }
        if (value.isInt32()) {
            return Optional.of(new DocumentValue.Numeric(value.asInt32().getValue()));
        }
        if (value.isInt64()) {
            return Optional.of(new DocumentValue.Numeric(value.asInt64().getValue()));
        }
        return Optional.of(new DocumentValue.Text(value.toString()));
    }

    static Identifier toIdentifier(ObjectId objectId) {
        return Identifier.of(objectId.toByteArray());
    }

    static ObjectId toObjectId(Identifier identifier) {
        return new ObjectId(identifier.toBytes());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Map<?, ?> map) {
        return (Map<String, Object>) map;
    }

    final class BsonWriter implements DocumentValue.Visitor<Object> {
        static final BsonWriter INSTANCE = new BsonWriter();

        private BsonWriter() {
        }

        @Override
        public Object text(String value) {
            return value;
        }

        @Override
        public Object numeric(Number value) {
            if (value instanceof BigDecimal) {
                return new Decimal128((BigDecimal) value);
            }
            if (value instanceof BigInteger) {
                return new Decimal128(new BigDecimal((BigInteger) value));
            }
            return value;
        }

        @Override
        public Object bool(boolean value) {
            return value;
        }

        @Override
        public Object nullValue() {
            return null;
        }

        @Override
        public Object nested(StoreDocument value) {
            return toBson(value);
        }

        @Override
        public Object sequence(List<DocumentValue> values) {
            List<Object> result = new ArrayList<>(values.size());
            for (DocumentValue value : values) {
                result.add(value.accept(this));
            }
            return result;
        }

        @Override
        public Object id(Identifier value) {
            return toObjectId(value);
        }

        @Override
        public Object timestamp(Instant value) {
            return Date.from(value);
        }

        @Override
        public Object bytes(byte[] value) {
            return new Binary(value);
        }
    }
}
