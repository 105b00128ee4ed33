// file: server/src/main/java/io/backlite/server/maintenance/Download.java
package io.backlite.server.maintenance;

import io.backlite.core.BackupRecord;

/** A stored artifact together with its history record. */
public record Download(BackupRecord record, byte[] bytes) {
}
