// file: core/src/main/java/io/backlite/core/BackupRecord.java
package io.backlite.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Metadata row for one stored backup artifact.
 *
 * @param id        opaque unique identifier, also names the artifact on disk
 * @param filename  human-readable download name, e.g. "backup-2024-01-01T00-00-00Z.json"
 * @param sizeBytes exact length of the stored artifact
 */
public record BackupRecord(
        String id,
        String filename,
        long sizeBytes,
        BackupSource source,
        String createdBy,
        Instant createdAt
) {
    public BackupRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(createdBy, "createdBy");
        Objects.requireNonNull(createdAt, "createdAt");
        if (sizeBytes < 0) throw new IllegalArgumentException("sizeBytes must be >= 0");
    }

    /** e.g. "backup-2024-05-01T10-00-00-123Z.json", or "auto-backup-..." for scheduled runs. */
    public static String filenameFor(BackupSource source, Instant at) {
        String stamp = at.toString().replace(':', '-').replace('.', '-');
        return (source == BackupSource.AUTO ? "auto-backup-" : "backup-") + stamp + ".json";
    }
}
