// file: server/src/main/java/io/backlite/server/schedule/ExecutorBackupTimer.java
package io.backlite.server.schedule;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link BackupTimer} on a single daemon thread named "auto-backup".
 * One thread means scheduled runs never overlap each other.
 */
public final class ExecutorBackupTimer implements BackupTimer {
    private final ScheduledExecutorService exec;

    public ExecutorBackupTimer() {
        this.exec = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "auto-backup");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public Scheduled schedule(Runnable task, Duration delay) {
        long millis = Math.max(0L, delay.toMillis());
        ScheduledFuture<?> f = exec.schedule(task, millis, TimeUnit.MILLISECONDS);
        return () -> f.cancel(false);
    }

    @Override
    public void close() {
        exec.shutdownNow();
    }
}
