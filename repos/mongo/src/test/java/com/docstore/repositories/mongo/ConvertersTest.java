package com.docstore.repositories.mongo;

import com.docstore.core.DocumentValue;
import com.docstore.core.Identifier;
import com.docstore.core.StoreDocument;
import org.bson.BsonInt64;
import org.bson.BsonObjectId;
import org.bson.BsonString;
import org.bson.Document;
import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.bson.types.MinKey;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ConvertersTest {

    @Test
    void nestedDocumentsShouldBecomeBsonDocuments() {
        StoreDocument document = StoreDocument.of(
                "name", "john",
                "address", StoreDocument.of("city", "Cluj"),
                "tags", List.of("a", 1));

        Document bson = Converters.toBson(document);

        assertEquals("john", bson.getString("name"));
        assertEquals("Cluj", bson.get("address", Document.class).getString("city"));
        assertEquals(Arrays.asList("a", 1), bson.get("tags"));
    }

    @Test
    void driverTypesShouldMapToTheirVariants() {
        ObjectId objectId = new ObjectId();
        Date born = Date.from(Instant.parse("1980-02-03T04:05:06Z"));
        Document bson = new Document("_id", objectId)
                .append("born", born)
                .append("price", new Decimal128(new BigDecimal("12.50")))
                .append("blob", new Binary(new byte[]{1, 2, 3}))
                .append("missing", null)
                .append("sub", new Document("a", 1L));

        StoreDocument document = Converters.fromBson(bson);

        assertEquals(new DocumentValue.Id(Converters.toIdentifier(objectId)), document.get("_id").orElseThrow());
        assertEquals(new DocumentValue.Timestamp(born.toInstant()), document.get("born").orElseThrow());
        assertEquals(new DocumentValue.Numeric(new BigDecimal("12.5")), document.get("price").orElseThrow());
        assertEquals(new DocumentValue.Bytes(new byte[]{1, 2, 3}), document.get("blob").orElseThrow());
        assertEquals(DocumentValue.NULL, document.get("missing").orElseThrow());
        assertEquals(new DocumentValue.Nested(StoreDocument.of("a", 1L)), document.get("sub").orElseThrow());
    }

    @Test
    void unknownDriverTypesShouldFallBackToText() {
        StoreDocument document = Converters.fromBson(new Document("min", new MinKey()));

        assertInstanceOf(DocumentValue.Text.class, document.get("min").orElseThrow());
    }

    @Test
    void identifiersShouldConvertBothWays() {
        ObjectId objectId = new ObjectId("5d678d799139918d230cfd41");

        Identifier id = Converters.toIdentifier(objectId);

        assertEquals("5d678d799139918d230cfd41", id.toHex());
        assertEquals(objectId, Converters.toObjectId(id));
    }

    @Test
    void typedValuesShouldBeWrittenAsDriverTypes() {
        Identifier id = Identifier.fromHex("5d678d799139918d230cfd41");
        Instant at = Instant.parse("2020-01-01T00:00:00Z");
        StoreDocument document = StoreDocument.builder()
                .put("_id", new DocumentValue.Id(id))
                .put("at", new DocumentValue.Timestamp(at))
                .put("amount", new DocumentValue.Numeric(new BigDecimal("1.25")))
                .build();

        Document bson = Converters.toBson(document);

        assertEquals(new ObjectId("5d678d799139918d230cfd41"), bson.getObjectId("_id"));
        assertEquals(Date.from(at), bson.getDate("at"));
        assertEquals(new Decimal128(new BigDecimal("1.25")), bson.get("amount"));
    }

    @Test
    void upsertedIdsShouldBeCopied() {
        ObjectId objectId = new ObjectId();

        assertEquals(Optional.empty(), Converters.upsertedId(null));
        assertEquals(Optional.of(new DocumentValue.Id(Converters.toIdentifier(objectId))),
                Converters.upsertedId(new BsonObjectId(objectId)));
        assertEquals(Optional.of(new DocumentValue.Text("key")), Converters.upsertedId(new BsonString("key")));
        assertEquals(Optional.of(new DocumentValue.Numeric(7L)), Converters.upsertedId(new BsonInt64(7)));
    }
}
