// file: core/src/main/java/io/backlite/core/SnapshotDocument.java
package io.backlite.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory form of a backup document.
 * <p>
 * Collections keep their insertion order, which is the registered order when the
 * document was produced by an encoder. Records are plain JSON-shaped maps and may
 * contain null values, so they are wrapped rather than copied with {@code Map.copyOf}.
 * Nested values are not deep-copied; callers must treat them as read-only.
 */
public record SnapshotDocument(
        int schemaVersion,
        Instant generatedAt,
        Map<String, List<Map<String, Object>>> collections
) {
    public static final int CURRENT_SCHEMA_VERSION = 1;

    public SnapshotDocument {
        Objects.requireNonNull(generatedAt, "generatedAt");
        Objects.requireNonNull(collections, "collections");
        Map<String, List<Map<String, Object>>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<Map<String, Object>>> e : collections.entrySet()) {
            List<Map<String, Object>> records = new ArrayList<>(e.getValue().size());
            for (Map<String, Object> record : e.getValue()) {
                records.add(Collections.unmodifiableMap(record));
            }
            copy.put(e.getKey(), Collections.unmodifiableList(records));
        }
        collections = Collections.unmodifiableMap(copy);
    }

    /** Records of one collection, or an empty list when the document does not carry it. */
    public List<Map<String, Object>> collection(String name) {
        return collections.getOrDefault(name, List.of());
    }

    public int recordCount() {
        int n = 0;
        for (List<Map<String, Object>> records : collections.values()) {
            n += records.size();
        }
        return n;
    }
}
