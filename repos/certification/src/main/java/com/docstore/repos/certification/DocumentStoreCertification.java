package com.docstore.repos.certification;

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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link DocumentStore} must show. Implementations extend this
 * class and point {@link #store} at an empty collection in {@link #init()}.
 */
public abstract class DocumentStoreCertification {
    protected static final String JOHN = "{\"Name\":\"john\",\"Gender\":\"male\",\"Age\":44}";
    protected static final String MARY = "{\"Name\":\"mary\",\"Gender\":\"female\",\"Age\":44}";
    protected static final String ANNA = "{\"Name\":\"anna\",\"Gender\":\"female\",\"Age\":31}";

    private static final List<String> MALFORMED = List.of(
            "",
            "   ",
            "[1, 2, 3]",
            "\"john\"",
            "44",
            "null",
            "{\"Name\": \"john\"",
            "{\"Name\": \"john\"} {}",
            "not json at all");

    protected DocumentStore store;

    public abstract void init();

    @BeforeEach
    public void setUp() throws Exception {
        init();
    }

    protected static byte[] json(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    protected Identifier insert(String payload) {
        Identifier id = store.insertOne(json(payload));
        assertNotNull(id);
        return id;
    }

    protected int count(String filter) {
        return store.findManyFilterJson(json(filter)).size();
    }

    @Test
    public void insertOneShouldReturnAServerAssignedIdentifier() {
        Identifier john = insert(JOHN);
        Identifier mary = insert(MARY);

        assertEquals(24, john.toHex().length());
        assertNotEquals(john, mary);
    }

    @Test
    public void findByIdShouldReturnTheInsertedFields() {
        Identifier id = insert(JOHN);

        StoreDocument found = store.findById(id);

        assertEquals(new DocumentValue.Numeric(44), found.get("Age").orElseThrow());
        assertEquals(new DocumentValue.Text("john"), found.get("Name").orElseThrow());
        assertEquals(new DocumentValue.Text("male"), found.get("Gender").orElseThrow());
        assertEquals(new DocumentValue.Id(id), found.get("_id").orElseThrow());
    }

    @Test
    public void foundDocumentShouldRenderBackToTheInsertedJson() {
        Identifier id = insert(JOHN);

        StoreDocument found = store.findById(id);
        StoreDocument rendered = JsonDocuments.parse(JsonDocuments.toJson(found));

        assertEquals(found, rendered);
        StoreDocument withoutId = StoreDocument.builder()
                .put("Name", rendered.get("Name").orElseThrow())
                .put("Gender", rendered.get("Gender").orElseThrow())
                .put("Age", rendered.get("Age").orElseThrow())
                .build();
        assertEquals(JsonDocuments.parse(JOHN), withoutId);
    }

    @Test
    public void nestedDocumentsAndArraysShouldSurviveTheTrip() {
        Identifier id = insert("{\"Name\":\"nested\",\"address\":{\"city\":\"Cluj\",\"zip\":400000},"
                + "\"tags\":[\"a\",\"b\",1,true,null]}");

        StoreDocument found = store.findById(id);

        StoreDocument address = ((DocumentValue.Nested) found.get("address").orElseThrow()).value();
        assertEquals(new DocumentValue.Text("Cluj"), address.get("city").orElseThrow());
        assertEquals(new DocumentValue.Numeric(400000), address.get("zip").orElseThrow());
        List<DocumentValue> tags = ((DocumentValue.Sequence) found.get("tags").orElseThrow()).values();
        assertEquals(5, tags.size());
        assertEquals(DocumentValue.NULL, tags.get(4));
    }

    @Test
    public void findOneShouldReturnAMatchingDocument() {
        insert(JOHN);
        insert(ANNA);

        StoreDocument found = store.findOne(json("{\"Name\":\"anna\"}"));

        assertEquals(new DocumentValue.Numeric(31), found.get("Age").orElseThrow());
    }

    @Test
    public void findOneShouldThrowNotFoundWhenNothingMatches() {
        insert(JOHN);

        assertThrows(NotFoundException.class, () -> store.findOne(json("{\"Name\":\"nobody\"}")));
    }

    @Test
    public void findByIdShouldThrowNotFoundForAnUnknownIdentifier() {
        insert(JOHN);

        assertThrows(NotFoundException.class,
                () -> store.findById(Identifier.fromHex("000000000000000000000000")));
    }

    @Test
    public void findManyShouldReturnEveryMatch() {
        insert(JOHN);
        insert(MARY);
        insert(MARY);
        insert(ANNA);

        List<StoreDocument> found = store.findManyFilterJson(json("{\"Age\":44}"));

        assertEquals(3, found.size());
        for (StoreDocument document : found) {
            assertEquals(new DocumentValue.Numeric(44), document.get("Age").orElseThrow());
        }
    }

    @Test
    public void findManyShouldSupportOperatorFilters() {
        insert(JOHN);
        insert(ANNA);

        assertEquals(1, count("{\"Age\":{\"$lt\":40}}"));
        assertEquals(2, count("{\"Age\":{\"$gte\":31}}"));
        assertEquals(1, count("{\"Name\":{\"$eq\":\"john\"}}"));
    }

    @Test
    public void findManyShouldMatchIdentifiersGivenAsExtendedJson() {
        Identifier id = insert(JOHN);
        insert(MARY);

        List<StoreDocument> found = store.findManyFilterJson(json("{\"_id\":{\"$oid\":\"" + id.toHex() + "\"}}"));

        assertEquals(1, found.size());
        assertEquals(new DocumentValue.Text("john"), found.get(0).get("Name").orElseThrow());
    }

    @Test
    public void findManyShouldReturnAnEmptyListWhenNothingMatches() {
        insert(JOHN);

        List<StoreDocument> found = store.findManyFilterJson(json("{\"Name\":\"nobody\"}"));

        assertNotNull(found);
        assertTrue(found.isEmpty());
    }

    @Test
    public void findManyWithAPrebuiltFilterShouldMatchLikeJson() {
        insert(JOHN);
        insert(MARY);
        insert(ANNA);

        List<StoreDocument> found = store.findManyFilterDocument(StoreDocument.of("Gender", "female"));

        assertEquals(2, found.size());
    }

    @Test
    public void deleteOneShouldRemoveExactlyOneMatch() {
        insert(MARY);
        insert(MARY);
        insert(MARY);
        insert(JOHN);

        WriteSummary summary = store.deleteOne(json("{\"Name\":\"mary\"}"));

        assertEquals(1, summary.deletedCount());
        assertEquals(2, count("{\"Name\":\"mary\"}"));
        assertEquals(1, count("{\"Name\":\"john\"}"));
    }

    @Test
    public void deleteAllShouldRemoveEveryMatch() {
        insert(MARY);
        insert(MARY);
        insert(JOHN);

        WriteSummary summary = store.deleteAll(json("{\"Name\":\"mary\"}"));

        assertEquals(2, summary.deletedCount());
        assertEquals(0, count("{\"Name\":\"mary\"}"));
        assertEquals(1, count("{\"Name\":\"john\"}"));
    }

    @Test
    public void deleteShouldReportZeroWhenNothingMatches() {
        insert(JOHN);

        assertEquals(0, store.deleteOne(json("{\"Name\":\"nobody\"}")).deletedCount());
        assertEquals(0, store.deleteAll(json("{\"Name\":\"nobody\"}")).deletedCount());
    }

    @Test
    public void updateByIdShouldOnlyChangeTheSetFields() {
        Identifier id = insert(JOHN);
        insert(MARY);

        WriteSummary summary = store.updateById(id, json("{\"$set\":{\"Age\":45,\"City\":\"Iasi\"}}"));

        assertEquals(1, summary.matchedCount());
        assertEquals(1, summary.modifiedCount());
        StoreDocument updated = store.findById(id);
        assertEquals(new DocumentValue.Numeric(45), updated.get("Age").orElseThrow());
        assertEquals(new DocumentValue.Text("Iasi"), updated.get("City").orElseThrow());
        assertEquals(new DocumentValue.Text("john"), updated.get("Name").orElseThrow());
        assertEquals(new DocumentValue.Text("male"), updated.get("Gender").orElseThrow());
        assertEquals(1, count("{\"Name\":\"mary\",\"Age\":44}"));
    }

    @Test
    public void updateByIdShouldMatchNothingForAnUnknownIdentifier() {
        insert(JOHN);

        WriteSummary summary = store.updateById(Identifier.fromHex("000000000000000000000000"),
                json("{\"$set\":{\"Age\":45}}"));

        assertEquals(0, summary.matchedCount());
        assertEquals(0, summary.modifiedCount());
    }

    @Test
    public void updateOneShouldChangeASingleMatch() {
        insert(MARY);
        insert(MARY);

        WriteSummary summary = store.updateOne(json("{\"Name\":\"mary\"}"), json("{\"$set\":{\"Age\":50}}"));

        assertEquals(1, summary.matchedCount());
        assertEquals(1, summary.modifiedCount());
        assertEquals(1, count("{\"Name\":\"mary\",\"Age\":50}"));
        assertEquals(1, count("{\"Name\":\"mary\",\"Age\":44}"));
    }

    @Test
    public void updateManyShouldChangeEveryMatch() {
        insert(MARY);
        insert(MARY);
        insert(JOHN);

        WriteSummary summary = store.updateMany(json("{\"Gender\":\"female\"}"), json("{\"$inc\":{\"Age\":1}}"));

        assertEquals(2, summary.matchedCount());
        assertEquals(2, summary.modifiedCount());
        assertEquals(2, count("{\"Name\":\"mary\",\"Age\":45}"));
        assertEquals(1, count("{\"Name\":\"john\",\"Age\":44}"));
    }

    @Test
    public void everyJsonOperationShouldRejectMalformedPayloads() {
        Identifier id = insert(JOHN);
        byte[] filter = json("{\"Name\":\"john\"}");
        byte[] update = json("{\"$set\":{\"Age\":1}}");

        for (String text : MALFORMED) {
            byte[] bad = json(text);
            List<Executable> calls = List.of(
                    () -> store.insertOne(bad),
                    () -> store.findOne(bad),
                    () -> store.findManyFilterJson(bad),
                    () -> store.deleteOne(bad),
                    () -> store.deleteAll(bad),
                    () -> store.updateById(id, bad),
                    () -> store.updateOne(bad, update),
                    () -> store.updateOne(filter, bad),
                    () -> store.updateMany(bad, update),
                    () -> store.updateMany(filter, bad));
            for (Executable call : calls) {
                assertThrows(MalformedPayloadException.class, call, "payload: " + text);
            }
        }

        StoreDocument untouched = store.findById(id);
        assertEquals(new DocumentValue.Numeric(44), untouched.get("Age").orElseThrow());
        assertEquals(1, count("{}"));
    }

    @Test
    public void nullPayloadShouldBeMalformed() {
        assertThrows(MalformedPayloadException.class, () -> store.insertOne((byte[]) null));
        assertThrows(MalformedPayloadException.class, () -> store.findManyFilterDocument((StoreDocument) null));
    }

    @Test
    public void aCancelledContextShouldFailWithoutWriting() {
        OperationContext ctx = OperationContext.withTimeout(Duration.ofMinutes(1));
        ctx.cancel();

        StoreOperationFailedException e = assertThrows(StoreOperationFailedException.class,
                () -> store.insertOne(ctx, json(JOHN)));

        assertInstanceOf(CancellationException.class, e.getCause());
        assertEquals("insertOne", e.getOperation());
        assertEquals(0, count("{}"));
    }

    @Test
    public void anExpiredDeadlineShouldFailAsATimeout() {
        insert(JOHN);
        OperationContext ctx = OperationContext.withDeadline(Instant.now().minusSeconds(1));

        StoreOperationFailedException e = assertThrows(StoreOperationFailedException.class,
                () -> store.findOne(ctx, json("{\"Name\":\"john\"}")));

        assertInstanceOf(TimeoutException.class, e.getCause().getCause());
    }

    @Test
    public void malformedPayloadShouldWinOverAnExpiredDeadline() {
        OperationContext ctx = OperationContext.withDeadline(Instant.now().minusSeconds(1));

        assertThrows(MalformedPayloadException.class, () -> store.insertOne(ctx, json("[]")));
    }

    @Test
    public void aLiveCallerContextShouldNotBeCancelledByAnOperation() {
        OperationContext ctx = OperationContext.withTimeout(Duration.ofMinutes(1));

        store.insertOne(ctx, json(JOHN));
        store.findManyFilterJson(ctx, json("{}"));

        assertFalse(ctx.isCancelled());
        assertEquals(1, store.findManyFilterJson(ctx, json("{}")).size());
    }

    @Test
    public void concurrentCallersShouldShareOneStore() throws Exception {
        int threads = 8;
        int perThread = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<List<Identifier>>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    List<Identifier> ids = new ArrayList<>();
                    for (int i = 0; i < perThread; i++) {
                        ids.add(store.insertOne(json(MARY)));
                    }
                    return ids;
                }));
            }

            Set<Identifier> all = new HashSet<>();
            for (Future<List<Identifier>> future : futures) {
                all.addAll(future.get());
            }
            assertEquals(threads * perThread, all.size());
            assertEquals(threads * perThread, count("{\"Name\":\"mary\"}"));
        } finally {
            executor.shutdownNow();
        }
    }
}
