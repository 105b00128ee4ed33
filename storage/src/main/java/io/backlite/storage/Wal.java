// file: storage/src/main/java/io/backlite/storage/Wal.java
package io.backlite.storage;

/**
 * Write-ahead log for datastore mutations.
 * <p>
 * Contract:
 *  - append() is atomic at record granularity: a record is either fully on
 *    disk and replayed, or treated as absent.
 *  - append() fsyncs before returning.
 *  - A failed append leaves the log as it was before the call.
 */
public interface Wal extends AutoCloseable {

    /** Append one framed record (from {@link WalRecordCodec}) and fsync it. */
    void append(byte[] serializedRecord);

    /** Start a new segment once the current one is over its size threshold. */
    void rotateIfNeeded();

    /**
     * Drop every segment. Called right after a checkpoint that covers all
     * records appended so far.
     */
    void reset();

    /** Sequential reader over all segments, oldest first. */
    WalReader openReader();

    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (header stripped), or null at the end of the
         *         log or at the first torn/corrupt record
         */
        byte[] next();
    }
}
