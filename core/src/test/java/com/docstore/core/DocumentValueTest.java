package com.docstore.core;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DocumentValueTest {

    @Test
    void numericsShouldCompareByQuantity() {
        DocumentValue.Numeric integer = new DocumentValue.Numeric(44);

        assertEquals(integer, new DocumentValue.Numeric(44L));
        assertEquals(integer, new DocumentValue.Numeric(44.0));
        assertEquals(integer, new DocumentValue.Numeric(new BigDecimal("44.000")));
        assertEquals(integer, new DocumentValue.Numeric(BigInteger.valueOf(44)));
        assertEquals(integer.hashCode(), new DocumentValue.Numeric(44.0).hashCode());
        assertNotEquals(integer, new DocumentValue.Numeric(44.5));
        assertNotEquals(new DocumentValue.Numeric(Double.NaN), integer);
    }

    @Test
    void plainValuesShouldMapToVariants() {
        Identifier id = Identifier.fromHex("5d678d799139918d230cfd41");
        Instant at = Instant.parse("2020-01-01T00:00:00Z");

        assertEquals(DocumentValue.NULL, DocumentValue.of(null));
        assertEquals(new DocumentValue.Text("a"), DocumentValue.of("a"));
        assertEquals(new DocumentValue.Bool(true), DocumentValue.of(true));
        assertEquals(new DocumentValue.Id(id), DocumentValue.of(id));
        assertEquals(new DocumentValue.Timestamp(at), DocumentValue.of(at));
        assertEquals(new DocumentValue.Timestamp(at), DocumentValue.of(Date.from(at)));
        assertEquals(new DocumentValue.Bytes(new byte[]{1}), DocumentValue.of(new byte[]{1}));
        assertEquals(new DocumentValue.Nested(StoreDocument.of("k", 1)), DocumentValue.of(Map.of("k", 1)));
        assertEquals(new DocumentValue.Sequence(List.of(new DocumentValue.Numeric(1), DocumentValue.NULL)),
                DocumentValue.of(Arrays.asList(1, null)));
        assertThrows(IllegalArgumentException.class, () -> DocumentValue.of(new Object()));
    }

    @Test
    void visitorShouldSeeEveryVariant() {
        DocumentValue.Visitor<String> names = new DocumentValue.Visitor<>() {
            public String text(String value) { return "text"; }
            public String numeric(Number value) { return "numeric"; }
            public String bool(boolean value) { return "bool"; }
            public String nullValue() { return "null"; }
            public String nested(StoreDocument value) { return "nested"; }
            public String sequence(List<DocumentValue> values) { return "sequence"; }
            public String id(Identifier value) { return "id"; }
            public String timestamp(Instant value) { return "timestamp"; }
            public String bytes(byte[] value) { return "bytes"; }
        };

        List<DocumentValue> values = List.of(
                new DocumentValue.Text("a"), new DocumentValue.Numeric(1), new DocumentValue.Bool(false),
                DocumentValue.NULL, new DocumentValue.Nested(StoreDocument.empty()),
                new DocumentValue.Sequence(List.of()), new DocumentValue.Id(Identifier.fromHex("5d678d799139918d230cfd41")),
                new DocumentValue.Timestamp(Instant.EPOCH), new DocumentValue.Bytes(new byte[0]));

        assertEquals(List.of("text", "numeric", "bool", "null", "nested", "sequence", "id", "timestamp", "bytes"),
                values.stream().map(value -> value.accept(names)).toList());
    }

    @Test
    void bytesShouldBeCopiedOnTheWayInAndOut() {
        byte[] raw = {1, 2, 3};
        DocumentValue.Bytes bytes = new DocumentValue.Bytes(raw);

        raw[0] = 9;
        bytes.value()[1] = 9;

        assertArrayEquals(new byte[]{1, 2, 3}, bytes.value());
    }
}
