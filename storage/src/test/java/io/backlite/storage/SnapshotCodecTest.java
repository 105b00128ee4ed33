// file: storage/src/test/java/io/backlite/storage/SnapshotCodecTest.java
package io.backlite.storage;

import io.backlite.core.FailureKind;
import io.backlite.core.MaintenanceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotCodecTest {

    private static final Instant T = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir Path dir;

    private SnapshotCodec codec(DurableDatastore store) {
        return new SnapshotCodec(store, Clock.fixed(T, ZoneOffset.UTC));
    }

    private static MaintenanceException decodeFailure(SnapshotCodec codec, String json) {
        return assertThrows(MaintenanceException.class,
                () -> codec.decode(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void encode_lists_every_registered_collection_in_order() {
        var store = TestStores.datastore(dir);
        store.put("orders", Map.of("_id", "o1", "total", 12));

        var doc = codec(store).encode();

        assertEquals(1, doc.schemaVersion());
        assertEquals(T, doc.generatedAt());
        assertEquals(TestStores.COLLECTIONS, List.copyOf(doc.collections().keySet()));
        assertTrue(doc.collection("items").isEmpty());
        assertEquals("o1", doc.collection("orders").get(0).get("_id"));
    }

    @Test
    void decoded_bytes_equal_the_encoded_document() {
        var store = TestStores.datastore(dir);
        store.put("customers", Map.of("_id", "c1", "name", "Ada", "tags", List.of("vip")));
        var codec = codec(store);
        var doc = codec.encode();

        var back = codec.decode(codec.toBytes(doc));

        assertEquals(doc, back);
    }

    @Test
    void output_is_pretty_printed_with_iso_timestamp() {
        var codec = codec(TestStores.datastore(dir));
        String text = new String(codec.toBytes(codec.encode()), StandardCharsets.UTF_8);

        assertTrue(text.contains("\"generatedAt\" : \"2024-05-01T10:00:00Z\""), text);
        assertTrue(text.indexOf("schemaVersion") < text.indexOf("collections"));
    }

    @Test
    void structural_problems_are_malformed() {
        var codec = codec(TestStores.datastore(dir));

        assertEquals(FailureKind.MALFORMED_DOCUMENT, decodeFailure(codec, "{not json").kind());
        assertEquals(FailureKind.MALFORMED_DOCUMENT, decodeFailure(codec, "[1,2]").kind());
        assertEquals(FailureKind.MALFORMED_DOCUMENT, decodeFailure(codec, "").kind());
        assertEquals(FailureKind.MALFORMED_DOCUMENT, decodeFailure(codec,
                "{\"schemaVersion\":\"1\",\"generatedAt\":\"2024-01-01T00:00:00Z\",\"collections\":{}}").kind());
        assertEquals(FailureKind.MALFORMED_DOCUMENT, decodeFailure(codec,
                "{\"schemaVersion\":0,\"generatedAt\":\"2024-01-01T00:00:00Z\",\"collections\":{}}").kind());
        assertEquals(FailureKind.MALFORMED_DOCUMENT, decodeFailure(codec,
                "{\"schemaVersion\":1,\"generatedAt\":\"yesterday\",\"collections\":{}}").kind());
        assertEquals(FailureKind.MALFORMED_DOCUMENT, decodeFailure(codec,
                "{\"schemaVersion\":1,\"generatedAt\":\"2024-01-01T00:00:00Z\",\"collections\":[]}").kind());
        assertEquals(FailureKind.MALFORMED_DOCUMENT, decodeFailure(codec,
                "{\"schemaVersion\":1,\"generatedAt\":\"2024-01-01T00:00:00Z\",\"collections\":{\"items\":{}}}").kind());
        assertEquals(FailureKind.MALFORMED_DOCUMENT, decodeFailure(codec,
                "{\"schemaVersion\":1,\"generatedAt\":\"2024-01-01T00:00:00Z\",\"collections\":{\"items\":[1]}}").kind());
    }

    @Test
    void newer_schema_version_is_unsupported() {
        var codec = codec(TestStores.datastore(dir));

        var ex = decodeFailure(codec,
                "{\"schemaVersion\":2,\"generatedAt\":\"2024-01-01T00:00:00Z\",\"collections\":{}}");

        assertEquals(FailureKind.UNSUPPORTED_VERSION, ex.kind());
    }

    @Test
    void unknown_top_level_keys_are_tolerated() {
        var codec = codec(TestStores.datastore(dir));

        var doc = codec.decode(("{\"schemaVersion\":1,\"generatedAt\":\"2024-01-01T02:00:00+02:00\","
                + "\"exportedBy\":\"ops\",\"collections\":{\"items\":[{\"_id\":\"a\"}]}}")
                .getBytes(StandardCharsets.UTF_8));

        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), doc.generatedAt());
        assertEquals(1, doc.recordCount());
    }

    @Test
    void content_after_the_document_is_malformed() {
        var codec = codec(TestStores.datastore(dir));
        String first = "{\"schemaVersion\":1,\"generatedAt\":\"2024-01-01T00:00:00Z\",\"collections\":{\"items\":[]}}";
        String second = "{\"schemaVersion\":1,\"generatedAt\":\"2024-01-01T00:00:00Z\",\"collections\":{\"items\":[{\"_id\":\"a\"}]}}";

        assertEquals(FailureKind.MALFORMED_DOCUMENT, decodeFailure(codec, first + second).kind());
        assertEquals(FailureKind.MALFORMED_DOCUMENT, decodeFailure(codec, first + " garbage").kind());
        assertEquals(1, codec.decode((first + "\n  ").getBytes(StandardCharsets.UTF_8)).schemaVersion());
    }

    @Test
    void empty_or_missing_input_is_malformed() {
        var codec = codec(TestStores.datastore(dir));

        assertEquals(FailureKind.MALFORMED_DOCUMENT,
                assertThrows(MaintenanceException.class, () -> codec.decode(null)).kind());
        assertEquals(FailureKind.MALFORMED_DOCUMENT,
                assertThrows(MaintenanceException.class, () -> codec.decode(new byte[0])).kind());
        assertEquals(FailureKind.MALFORMED_DOCUMENT, decodeFailure(codec, "   ").kind());
    }
}
