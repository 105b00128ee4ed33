// file: core/src/main/java/io/backlite/core/WipeReport.java
package io.backlite.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of a completed wipe.
 *
 * @param cleared        records removed from each emptied collection
 * @param preserved      registered collections that were left as they were
 * @param backupsDeleted stored backups removed along with their artifacts
 */
public record WipeReport(
        Instant wipedAt,
        Map<String, Integer> cleared,
        List<String> preserved,
        int backupsDeleted
) {
    public WipeReport {
        cleared = Collections.unmodifiableMap(new LinkedHashMap<>(cleared));
        preserved = List.copyOf(preserved);
    }
}
