// file: server/src/main/java/io/backlite/server/dto/WipeResponse.java
package io.backlite.server.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Body of a successful wipe.
 * Example:
 *   {
 *     "message": "all data has been wiped",
 *     "wipedAt": "2024-05-01T10:05:00Z",
 *     "cleared": { "items": 12, "systemLogs": 40 },
 *     "preserved": [ "settings", "users" ],
 *     "backupsDeleted": 3
 *   }
 */
public class WipeResponse {
    public String message;
    public Instant wipedAt;
    public Map<String, Integer> cleared;
    public List<String> preserved;
    public int backupsDeleted;
}
