// file: storage/src/main/java/io/backlite/storage/SnapshotCodec.java
package io.backlite.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import io.backlite.core.MaintenanceException;
import io.backlite.core.SnapshotDocument;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between the live datastore, {@link SnapshotDocument}, and the JSON
 * backup format.
 * <p>
 * Wire format (UTF-8 JSON object):
 * <pre>
 *   {
 *     "schemaVersion": 1,
 *     "generatedAt": "2024-05-01T10:00:00Z",
 *     "collections": {
 *       "items":     [ { "_id": "...", ... }, ... ],
 *       "customers": [ ... ]
 *     }
 *   }
 * </pre>
 * Unknown top-level keys are tolerated on decode.
 */
public final class SnapshotCodec {
    public static final int SUPPORTED_SCHEMA_VERSION = SnapshotDocument.CURRENT_SCHEMA_VERSION;

    private final Datastore datastore;
    private final Clock clock;
    private final ObjectMapper json = Mappers.json();
    // anything after the root object makes the upload malformed
    private final ObjectReader strictReader = json.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    public SnapshotCodec(Datastore datastore, Clock clock) {
        this.datastore = datastore;
        this.clock = clock;
    }

    /**
     * Capture every registered collection, in registered order, from one
     * consistent datastore view.
     *
     * @throws MaintenanceException STORAGE_FAILURE if the datastore cannot be read
     */
    public SnapshotDocument encode() {
        Map<String, List<Map<String, Object>>> view;
        try {
            view = datastore.view();
        } catch (RuntimeException e) {
            throw MaintenanceException.storageFailure("could not read the datastore", e);
        }
        Map<String, List<Map<String, Object>>> ordered = new LinkedHashMap<>();
        for (String name : datastore.collections()) {
            List<Map<String, Object>> records = view.get(name);
            if (records == null) {
                throw MaintenanceException.storageFailure("collection '" + name + "' missing from datastore view", null);
            }
            ordered.put(name, records);
        }
        return new SnapshotDocument(SUPPORTED_SCHEMA_VERSION, clock.instant(), ordered);
    }

    /**
     * Parse and structurally validate a backup document.
     *
     * @throws MaintenanceException MALFORMED_DOCUMENT or UNSUPPORTED_VERSION
     */
    public SnapshotDocument decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw MaintenanceException.malformed("document is empty");
        }
        JsonNode root;
        try {
            root = strictReader.readTree(bytes);
        } catch (JsonProcessingException e) {
            throw MaintenanceException.malformed("document is not valid JSON: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw MaintenanceException.malformed("document could not be read: " + e.getMessage());
        }
        if (root == null || !root.isObject()) {
            throw MaintenanceException.malformed("document root must be a JSON object");
        }

        JsonNode versionNode = root.get("schemaVersion");
        if (versionNode == null || !versionNode.isIntegralNumber() || !versionNode.canConvertToInt()) {
            throw MaintenanceException.malformed("schemaVersion must be an integer");
        }
        int version = versionNode.intValue();
        checkVersion(version);

        JsonNode generatedNode = root.get("generatedAt");
        if (generatedNode == null || !generatedNode.isTextual()) {
            throw MaintenanceException.malformed("generatedAt must be an ISO-8601 timestamp string");
        }
        Instant generatedAt = parseInstant(generatedNode.textValue());

        JsonNode collectionsNode = root.get("collections");
        if (collectionsNode == null || !collectionsNode.isObject()) {
            throw MaintenanceException.malformed("collections must be a JSON object");
        }

        Map<String, List<Map<String, Object>>> collections = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = collectionsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode array = field.getValue();
            if (!array.isArray()) {
                throw MaintenanceException.malformed("collection '" + field.getKey() + "' must be an array");
            }
            List<Map<String, Object>> records = new ArrayList<>(array.size());
            for (int i = 0; i < array.size(); i++) {
                JsonNode element = array.get(i);
                if (!element.isObject()) {
                    throw MaintenanceException.malformed(
                            "collection '" + field.getKey() + "' element " + i + " must be a JSON object");
                }
                records.add(json.convertValue(element, Mappers.RECORD_TYPE));
            }
            collections.put(field.getKey(), records);
        }
        return new SnapshotDocument(version, generatedAt, collections);
    }

    /** Pretty-printed UTF-8 JSON, keys in wire order. */
    public byte[] toBytes(SnapshotDocument document) {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("schemaVersion", document.schemaVersion());
        wire.put("generatedAt", document.generatedAt());
        wire.put("collections", document.collections());
        try {
            return json.writerWithDefaultPrettyPrinter().writeValueAsBytes(wire);
        } catch (JsonProcessingException e) {
            throw MaintenanceException.storageFailure("could not serialize backup document", e);
        }
    }

    /**
     * Structural rules a typed document must still satisfy before it may be applied.
     *
     * @throws MaintenanceException MALFORMED_DOCUMENT or UNSUPPORTED_VERSION
     */
    public static void validate(SnapshotDocument document) {
        checkVersion(document.schemaVersion());
        for (Map.Entry<String, List<Map<String, Object>>> e : document.collections().entrySet()) {
            if (e.getKey() == null || e.getKey().isBlank()) {
                throw MaintenanceException.malformed("collection names must not be blank");
            }
            for (Map<String, Object> record : e.getValue()) {
                if (record == null) {
                    throw MaintenanceException.malformed("collection '" + e.getKey() + "' holds a null record");
                }
            }
        }
    }

    private static void checkVersion(int version) {
        if (version < 1) {
            throw MaintenanceException.malformed("schemaVersion must be >= 1 (got " + version + ")");
        }
        if (version > SUPPORTED_SCHEMA_VERSION) {
            throw MaintenanceException.unsupportedVersion(version, SUPPORTED_SCHEMA_VERSION);
        }
    }

    private static Instant parseInstant(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException notInstant) {
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException e) {
                throw MaintenanceException.malformed("generatedAt is not an ISO-8601 timestamp: " + text);
            }
        }
    }
}
