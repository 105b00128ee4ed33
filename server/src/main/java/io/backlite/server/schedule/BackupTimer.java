// file: server/src/main/java/io/backlite/server/schedule/BackupTimer.java
package io.backlite.server.schedule;

import java.time.Duration;

/** One-shot timer used by the scheduler. Tests substitute a manually driven one. */
public interface BackupTimer extends AutoCloseable {

    Scheduled schedule(Runnable task, Duration delay);

    @Override
    void close();

    interface Scheduled {
        void cancel();
    }
}
