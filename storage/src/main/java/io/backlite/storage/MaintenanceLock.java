// file: storage/src/main/java/io/backlite/storage/MaintenanceLock.java
package io.backlite.storage;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Process-wide mutual exclusion for backup creation and restore.
 * <p>
 * Fair, so a waiting restore is not starved by a stream of backups. Reentrant,
 * so a caller already holding it (encode + create) can call into the store.
 * Reads (history, download, settings) never take it.
 */
public final class MaintenanceLock {
    private final ReentrantLock lock = new ReentrantLock(true);

    public <T> T callExclusive(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runExclusive(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }
}
