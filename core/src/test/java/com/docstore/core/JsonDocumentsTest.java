package com.docstore.core;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonDocumentsTest {

    @Test
    void objectsShouldParseWithFieldOrderPreserved() {
        StoreDocument document = JsonDocuments.parse("{\"Name\":\"john\",\"Age\":44,\"Tags\":[\"a\",true,null]}");

        assertEquals(List.of("Name", "Age", "Tags"), List.copyOf(document.keySet()));
        assertEquals(new DocumentValue.Text("john"), document.get("Name").orElseThrow());
        assertEquals(new DocumentValue.Numeric(44), document.get("Age").orElseThrow());
        assertEquals(new DocumentValue.Sequence(List.of(
                new DocumentValue.Text("a"), new DocumentValue.Bool(true), DocumentValue.NULL)),
                document.get("Tags").orElseThrow());
    }

    @Test
    void numbersShouldKeepTheirWidth() {
        StoreDocument document = JsonDocuments.parse(
                "{\"i\":1,\"l\":5000000000,\"b\":123456789012345678901234567890,\"d\":1.5}");

        assertInstanceOf(Integer.class, document.get("i").orElseThrow().unwrap());
        assertInstanceOf(Long.class, document.get("l").orElseThrow().unwrap());
        assertEquals(new BigInteger("123456789012345678901234567890"), document.get("b").orElseThrow().unwrap());
        assertEquals(1.5, document.get("d").orElseThrow().unwrap());
    }

    @Test
    void extendedJsonShouldBecomeTypedValues() {
        StoreDocument document = JsonDocuments.parse(
                "{\"_id\":{\"$oid\":\"5d678d799139918d230cfd41\"},"
                        + "\"born\":{\"$date\":\"1980-02-03T04:05:06Z\"},"
                        + "\"seen\":{\"$date\":0}}");

        assertEquals(new DocumentValue.Id(Identifier.fromHex("5d678d799139918d230cfd41")),
                document.get("_id").orElseThrow());
        assertEquals(new DocumentValue.Timestamp(Instant.parse("1980-02-03T04:05:06Z")),
                document.get("born").orElseThrow());
        assertEquals(new DocumentValue.Timestamp(Instant.EPOCH), document.get("seen").orElseThrow());
    }

    @Test
    void lookalikesOfExtendedJsonShouldStayNested() {
        StoreDocument document = JsonDocuments.parse(
                "{\"a\":{\"$oid\":\"nothex\"},\"b\":{\"$date\":\"yesterday\"},\"c\":{\"$oid\":\"5d678d799139918d230cfd41\",\"x\":1}}");

        assertInstanceOf(DocumentValue.Nested.class, document.get("a").orElseThrow());
        assertInstanceOf(DocumentValue.Nested.class, document.get("b").orElseThrow());
        assertInstanceOf(DocumentValue.Nested.class, document.get("c").orElseThrow());
    }

    @Test
    void renderingShouldParseBackToTheSameDocument() {
        StoreDocument original = StoreDocument.builder()
                .put("_id", new DocumentValue.Id(Identifier.fromHex("5d678d799139918d230cfd41")))
                .put("Name", "john")
                .put("Age", 44)
                .put("born", new DocumentValue.Timestamp(Instant.parse("1980-02-03T04:05:06Z")))
                .put("address", StoreDocument.of("city", "Cluj", "zip", null))
                .build();

        assertEquals(original, JsonDocuments.parse(JsonDocuments.toJson(original)));
    }

    @Test
    void idsShouldRenderAsExtendedJson() {
        StoreDocument document = StoreDocument.of("_id", Identifier.fromHex("5d678d799139918d230cfd41"));

        assertEquals("{\"_id\":{\"$oid\":\"5d678d799139918d230cfd41\"}}", JsonDocuments.toJsonString(document));
    }

    @Test
    void malformedInputShouldBeRejected() {
        List<String> inputs = List.of("", "   ", "not json", "{\"Name\":", "[1,2]", "\"text\"", "42", "null",
                "{\"a\":1} {\"b\":2}");
        for (String input : inputs) {
            assertThrows(MalformedPayloadException.class, () -> JsonDocuments.parse(input), input);
        }
        assertThrows(MalformedPayloadException.class, () -> JsonDocuments.parse((byte[]) null));
        assertThrows(MalformedPayloadException.class,
                () -> JsonDocuments.parse(new byte[]{(byte) 0xC3, (byte) 0x28}));
    }

    @Test
    void invalidJsonShouldKeepTheParserError() {
        MalformedPayloadException e = assertThrows(MalformedPayloadException.class,
                () -> JsonDocuments.parse("{\"Name\":".getBytes(StandardCharsets.UTF_8)));

        assertNotNull(e.getCause());
    }
}
