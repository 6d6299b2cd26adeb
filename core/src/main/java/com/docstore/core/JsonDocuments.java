package com.docstore.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Conversion between JSON text and {@link StoreDocument}.
 *
 * <p>Two extended-JSON forms are understood so that server types survive a
 * trip through JSON: {@code {"$oid": "<24 hex>"}} for identifiers and
 * {@code {"$date": "<ISO-8601>"}} (or epoch millis) for timestamps.
 */
public final class JsonDocuments {
    static final String OID = "$oid";
    static final String DATE = "$date";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonDocuments() {
    }

    /**
     * Decodes a JSON object.
     *
     * @throws MalformedPayloadException if the bytes are not valid JSON or the
     *                                   top level is not an object
     */
    public static StoreDocument parse(byte[] json) {
        if (json == null || json.length == 0) {
            throw new MalformedPayloadException("payload is empty");
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("payload is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedPayloadException("payload could not be read: " + e.getMessage(), e);
        }

        if (root == null || !root.isObject()) {
            String kind = root == null || root.isMissingNode() ? "nothing" : root.getNodeType().name().toLowerCase();
            throw new MalformedPayloadException("payload must be a JSON object, got " + kind);
        }
        return toDocument((ObjectNode) root);
    }

    public static StoreDocument parse(String json) {
        return parse(json == null ? null : json.getBytes(StandardCharsets.UTF_8));
    }

    public static byte[] toJson(StoreDocument document) {
        try {
            return MAPPER.writeValueAsBytes(toNode(document));
        } catch (JsonProcessingException e) {
            // A tree built from DocumentValues is always writable.
            throw new IllegalStateException("failed to render document", e);
        }
    }

    public static String toJsonString(StoreDocument document) {
        return new String(toJson(document), StandardCharsets.UTF_8);
    }

    private static StoreDocument toDocument(ObjectNode node) {
        StoreDocument.Builder builder = StoreDocument.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            builder.put(field.getKey(), toValue(field.getValue()));
        }
        return builder.build();
    }

    private static DocumentValue toValue(JsonNode node) {
        if (node.isObject()) {
            DocumentValue extended = extendedValue((ObjectNode) node);
            return extended != null ? extended : new DocumentValue.Nested(toDocument((ObjectNode) node));
        }
        if (node.isArray()) {
            List<DocumentValue> values = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                values.add(toValue(item));
            }
            return new DocumentValue.Sequence(values);
        }
        if (node.isTextual()) {
            return new DocumentValue.Text(node.textValue());
        }
        if (node.isIntegralNumber()) {
            if (node.canConvertToInt()) {
                return new DocumentValue.Numeric(node.intValue());
            }
            if (node.canConvertToLong()) {
                return new DocumentValue.Numeric(node.longValue());
            }
            return new DocumentValue.Numeric(node.bigIntegerValue());
        }
        if (node.isNumber()) {
            return new DocumentValue.Numeric(node.doubleValue());
        }
        if (node.isBoolean()) {
            return new DocumentValue.Bool(node.booleanValue());
        }
        return DocumentValue.NULL;
    }

    private static DocumentValue extendedValue(ObjectNode node) {
        if (node.size() != 1) {
            return null;
        }
        JsonNode oid = node.get(OID);
        if (oid != null && oid.isTextual() && Identifier.isValid(oid.textValue())) {
            return new DocumentValue.Id(Identifier.fromHex(oid.textValue()));
        }
        JsonNode date = node.get(DATE);
        if (date != null && date.isIntegralNumber()) {
            return new DocumentValue.Timestamp(Instant.ofEpochMilli(date.longValue()));
        }
        if (date != null && date.isTextual()) {
            try {
                return new DocumentValue.Timestamp(Instant.parse(date.textValue()));
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }

    private static ObjectNode toNode(StoreDocument document) {
        ObjectNode node = NODES.objectNode();
        for (Map.Entry<String, DocumentValue> field : document.fields()) {
            node.set(field.getKey(), field.getValue().accept(NODE_WRITER));
        }
        return node;
    }

    private static final DocumentValue.Visitor<JsonNode> NODE_WRITER = new DocumentValue.Visitor<>() {
        @Override
        public JsonNode text(String value) {
            return NODES.textNode(value);
        }

        @Override
        public JsonNode numeric(Number value) {
            if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                return NODES.numberNode(value.intValue());
            }
            if (value instanceof Long) {
                return NODES.numberNode(value.longValue());
            }
            if (value instanceof BigInteger) {
                return NODES.numberNode((BigInteger) value);
            }
            if (value instanceof BigDecimal) {
                return NODES.numberNode((BigDecimal) value);
            }
            return NODES.numberNode(value.doubleValue());
        }

        @Override
        public JsonNode bool(boolean value) {
            return NODES.booleanNode(value);
        }

        @Override
        public JsonNode nullValue() {
            return NODES.nullNode();
        }

        @Override
        public JsonNode nested(StoreDocument value) {
            return toNode(value);
        }

        @Override
        public JsonNode sequence(List<DocumentValue> values) {
            ArrayNode array = NODES.arrayNode();
            for (DocumentValue value : values) {
                array.add(value.accept(this));
            }
            return array;
        }

        @Override
        public JsonNode id(Identifier value) {
            return NODES.objectNode().put(OID, value.toHex());
        }

        @Override
        public JsonNode timestamp(Instant value) {
            return NODES.objectNode().put(DATE, value.toString());
        }

        @Override
        public JsonNode bytes(byte[] value) {
            return NODES.textNode(Base64.getEncoder().encodeToString(value));
        }
    };
}
