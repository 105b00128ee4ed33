// file: server/src/main/java/io/backlite/server/dto/BackupRecordResponse.java
package io.backlite.server.dto;

import java.time.Instant;

/**
 * One backup history row.
 * Example:
 *   {
 *     "id": "5d0c...",
 *     "filename": "backup-2024-05-01T10-00-00Z.json",
 *     "sizeBytes": 2048,
 *     "source": "manual",
 *     "createdBy": "alice",
 *     "createdAt": "2024-05-01T10:00:00Z"
 *   }
 */
public class BackupRecordResponse {
    public String id;
    public String filename;
    public long sizeBytes;
    public String source;      // "manual" | "auto"
    public String createdBy;
    public Instant createdAt;
}
