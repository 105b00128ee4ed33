// file: core/src/main/java/io/backlite/core/RestoreReport.java
package io.backlite.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of a completed restore.
 *
 * @param replaced           record count now present in each registered collection
 * @param ignoredCollections collections present in the document but not registered
 */
public record RestoreReport(
        Instant restoredAt,
        int schemaVersion,
        Map<String, Integer> replaced,
        List<String> ignoredCollections
) {
    public RestoreReport {
        replaced = Collections.unmodifiableMap(new LinkedHashMap<>(replaced));
        ignoredCollections = List.copyOf(ignoredCollections);
    }
}
