// file: storage/src/test/java/io/backlite/storage/TestStores.java
package io.backlite.storage;

import java.nio.file.Path;
import java.util.List;

/** Wiring helpers shared by storage tests. */
final class TestStores {
    static final List<String> COLLECTIONS = List.of("items", "customers", "orders", "users", "systemLogs");

    private TestStores() {
    }

    static DurableDatastore datastore(Path dir) {
        return datastore(dir, CheckpointPolicy.DEFAULT_EVERY_OPS);
    }

    static DurableDatastore datastore(Path dir, int checkpointEvery) {
        return new DurableDatastore(COLLECTIONS,
                new FileWal(dir.resolve("wal"), 1L << 60),
                new FileCheckpointer(dir.resolve("checkpoints")),
                new CheckpointPolicy(checkpointEvery));
    }
}
