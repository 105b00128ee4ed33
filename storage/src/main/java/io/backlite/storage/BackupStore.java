// file: storage/src/main/java/io/backlite/storage/BackupStore.java
package io.backlite.storage;

import io.backlite.core.BackupRecord;
import io.backlite.core.BackupSource;
import io.backlite.core.HistoryPage;
import io.backlite.core.RetentionPolicy;
import io.backlite.core.SnapshotDocument;

import java.util.List;

/**
 * Durable catalog of backup artifacts plus their history.
 * <p>
 * A record is listed only once its artifact is fully durable. Lookups of an
 * unknown id fail with NOT_FOUND; I/O problems fail with STORAGE_FAILURE
 * (both as {@link io.backlite.core.MaintenanceException}).
 */
public interface BackupStore {

    /** Serialize, persist and publish a new backup. */
    BackupRecord create(SnapshotDocument document, BackupSource source, String createdBy);

    /**
     * One page of history, newest first.
     *
     * @param page     1-based page number
     * @param pageSize records per page
     * @throws IllegalArgumentException if either argument is &lt; 1
     */
    HistoryPage list(int page, int pageSize);

    /** Exact bytes of a stored artifact. */
    byte[] fetch(String id);

    BackupRecord find(String id);

    /** Remove the history record and its artifact. */
    BackupRecord delete(String id);

    /** @return the records removed, newest first */
    List<BackupRecord> retentionPrune(RetentionPolicy policy);

    /**
     * Remove every history record and artifact.
     *
     * @return the records removed, newest first
     */
    List<BackupRecord> clear();

    /** Lock shared with restore; held by {@link #create}. */
    MaintenanceLock lock();
}
