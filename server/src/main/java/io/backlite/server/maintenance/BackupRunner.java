// file: server/src/main/java/io/backlite/server/maintenance/BackupRunner.java
package io.backlite.server.maintenance;

import io.backlite.core.BackupRecord;
import io.backlite.core.BackupSource;
import io.backlite.core.RetentionPolicy;
import io.backlite.core.SnapshotDocument;
import io.backlite.storage.BackupStore;
import io.backlite.storage.SnapshotCodec;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The single path that produces a stored backup, shared by manual requests,
 * "trigger now" and scheduled runs.
 * <p>
 * Encoding and storing happen under one hold of the maintenance lock, so a
 * backup never captures a half-applied restore. Retention runs afterwards; if
 * it fails the new backup still stands.
 */
public final class BackupRunner {
    private static final Logger log = Logger.getLogger(BackupRunner.class.getName());

    private final SnapshotCodec codec;
    private final BackupStore store;
    private final RetentionPolicy retention;

    public BackupRunner(SnapshotCodec codec, BackupStore store, RetentionPolicy retention) {
        this.codec = codec;
        this.store = store;
        this.retention = retention == null ? new RetentionPolicy(0, null) : retention;
    }

    public BackupRecord run(BackupSource source, String actor) {
        BackupRecord created = store.lock().callExclusive(() -> {
            SnapshotDocument document = codec.encode();
            return store.create(document, source, actor);
        });
        if (!retention.isUnlimited()) {
            try {
                List<BackupRecord> pruned = store.retentionPrune(retention);
                if (!pruned.isEmpty()) {
                    log.fine(() -> "retention removed " + pruned.size() + " backup(s) after " + created.id());
                }
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "retention failed after backup " + created.id(), e);
            }
        }
        return created;
    }
}
