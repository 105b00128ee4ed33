// file: storage/src/main/java/io/backlite/storage/CheckpointPolicy.java
package io.backlite.storage;

/**
 * Checkpoint after every N mutations.
 * <p>
 * Bounds WAL replay length on restart. Callers hold the datastore monitor, so
 * the counter needs no extra synchronization.
 */
public final class CheckpointPolicy {
    public static final int DEFAULT_EVERY_OPS = 1000;

    private final int everyOps;
    private int sinceLast;

    public CheckpointPolicy(int everyOps) {
        if (everyOps <= 0) throw new IllegalArgumentException("everyOps must be > 0");
        this.everyOps = everyOps;
    }

    /** Count one durable mutation. @return true when a checkpoint is due */
    boolean recordMutation() {
        return ++sinceLast >= everyOps;
    }

    void checkpointed() {
        sinceLast = 0;
    }
}
