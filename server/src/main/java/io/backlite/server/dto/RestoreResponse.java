// file: server/src/main/java/io/backlite/server/dto/RestoreResponse.java
package io.backlite.server.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Body of a successful restore.
 * Example:
 *   {
 *     "message": "restore completed",
 *     "restoredAt": "2024-05-01T10:05:00Z",
 *     "schemaVersion": 1,
 *     "replaced": { "items": 12, "customers": 3 },
 *     "ignoredCollections": [ "legacyReports" ]
 *   }
 */
public class RestoreResponse {
    public String message;
    public Instant restoredAt;
    public int schemaVersion;
    public Map<String, Integer> replaced;
    public List<String> ignoredCollections;
}
