// file: server/src/test/java/io/backlite/server/schedule/AutoBackupSchedulerTest.java
package io.backlite.server.schedule;

import io.backlite.core.AutoBackupSettings;
import io.backlite.core.BackupRecord;
import io.backlite.core.BackupSource;
import io.backlite.core.FailureKind;
import io.backlite.core.HistoryPage;
import io.backlite.core.IntervalUnit;
import io.backlite.core.MaintenanceException;
import io.backlite.core.RetentionPolicy;
import io.backlite.core.SnapshotDocument;
import io.backlite.server.audit.AuditTrail;
import io.backlite.server.maintenance.BackupRunner;
import io.backlite.server.testutil.ManualTimer;
import io.backlite.server.testutil.MutableClock;
import io.backlite.server.testutil.TestStack;
import io.backlite.storage.BackupStore;
import io.backlite.storage.FileSettingsStore;
import io.backlite.storage.MaintenanceLock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static io.backlite.server.testutil.TestStack.T0;
import static org.junit.jupiter.api.Assertions.*;

class AutoBackupSchedulerTest {

    @TempDir
    Path dir;

    @Test
    void runs_every_interval_without_drift() throws Exception {
        try (var stack = new TestStack(dir)) {
            stack.seed();
            stack.scheduler.start();
            AutoBackupSettings s = stack.scheduler.update(true, 24, IntervalUnit.HOURS);
            assertEquals(T0.plus(Duration.ofHours(24)), s.nextRunAt());
            assertEquals(AutoBackupScheduler.State.ARMED, stack.scheduler.state());

            stack.clock.advance(Duration.ofHours(24));
            assertEquals(1, stack.timer.runDue());

            s = stack.scheduler.settings();
            assertEquals(T0.plus(Duration.ofHours(24)), s.lastRunAt());
            assertEquals(T0.plus(Duration.ofHours(48)), s.nextRunAt());

            // wake up five minutes late: the grid still holds
            stack.clock.advance(Duration.ofHours(24).plusMinutes(5));
            assertEquals(1, stack.timer.runDue());
            s = stack.scheduler.settings();
            assertEquals(T0.plus(Duration.ofHours(48)), s.lastRunAt());
            assertEquals(T0.plus(Duration.ofHours(72)), s.nextRunAt());

            HistoryPage page = stack.backups.list(1, 10);
            assertEquals(2, page.total());
            for (BackupRecord r : page.records()) {
                assertEquals(BackupSource.AUTO, r.source());
                assertEquals(AutoBackupScheduler.SYSTEM_ACTOR, r.createdBy());
                assertTrue(r.filename().startsWith("auto-backup-"));
            }
            assertTrue(stack.auditActions().contains(AuditTrail.AUTO_BACKUP_RUN));
        }
    }

    @Test
    void nothing_fires_before_next_run_at() throws Exception {
        try (var stack = new TestStack(dir)) {
            stack.scheduler.update(true, 2, IntervalUnit.DAYS);

            stack.clock.advance(Duration.ofHours(47).plusMinutes(59));
            assertEquals(0, stack.timer.runDue());
            assertEquals(0, stack.backups.list(1, 5).total());
        }
    }

    @Test
    void disabling_cancels_the_pending_run() throws Exception {
        try (var stack = new TestStack(dir)) {
            stack.scheduler.update(true, 1, IntervalUnit.HOURS);
            assertEquals(1, stack.timer.pendingCount());

            AutoBackupSettings s = stack.scheduler.update(false, null, null);

            assertFalse(s.enabled());
            assertNull(s.nextRunAt());
            assertEquals(AutoBackupScheduler.State.DISABLED, stack.scheduler.state());
            assertEquals(0, stack.timer.pendingCount());

            stack.clock.advance(Duration.ofDays(3));
            assertEquals(0, stack.timer.runDue());
            assertEquals(0, stack.backups.list(1, 5).total());
        }
    }

    @Test
    void changing_the_interval_rearms_from_now() throws Exception {
        try (var stack = new TestStack(dir)) {
            stack.scheduler.update(true, 24, IntervalUnit.HOURS);
            stack.clock.advance(Duration.ofHours(5));

            AutoBackupSettings s = stack.scheduler.update(null, 1, IntervalUnit.WEEKS);

            assertEquals(T0.plus(Duration.ofHours(5)).plus(Duration.ofDays(7)), s.nextRunAt());
            assertEquals(1, stack.timer.pendingCount());
            assertEquals(s.nextRunAt(), stack.timer.nextDue());
        }
    }

    @Test
    void invalid_settings_change_nothing() throws Exception {
        try (var stack = new TestStack(dir)) {
            AutoBackupSettings before = stack.scheduler.update(true, 6, IntervalUnit.HOURS);

            MaintenanceException e = assertThrows(MaintenanceException.class,
                    () -> stack.scheduler.update(true, 0, IntervalUnit.HOURS));

            assertEquals(FailureKind.INVALID_SETTINGS, e.kind());
            assertEquals(before, stack.scheduler.settings());
            assertEquals(before, stack.settingsStore.load());
        }
    }

    @Test
    void trigger_now_leaves_the_schedule_alone() throws Exception {
        try (var stack = new TestStack(dir)) {
            stack.seed();
            AutoBackupSettings armed = stack.scheduler.update(true, 12, IntervalUnit.HOURS);
            stack.clock.advance(Duration.ofHours(1));

            BackupRecord rec = stack.scheduler.triggerNow("alice");

            assertEquals(BackupSource.AUTO, rec.source());
            assertEquals("alice", rec.createdBy());
            assertEquals(armed.nextRunAt(), stack.scheduler.settings().nextRunAt());
            assertNull(stack.scheduler.settings().lastRunAt());
            assertEquals(1, stack.timer.pendingCount());
        }
    }

    @Test
    void settings_are_persisted_on_every_change() throws Exception {
        try (var stack = new TestStack(dir)) {
            stack.scheduler.update(true, 3, IntervalUnit.DAYS);
            var reloaded = new FileSettingsStore(dir.resolve("settings").resolve("auto-backup.json")).load();
            assertEquals(stack.scheduler.settings(), reloaded);

            stack.clock.advance(Duration.ofDays(3));
            stack.timer.runDue();
            reloaded = new FileSettingsStore(dir.resolve("settings").resolve("auto-backup.json")).load();
            assertEquals(T0.plus(Duration.ofDays(3)), reloaded.lastRunAt());
            assertEquals(T0.plus(Duration.ofDays(6)), reloaded.nextRunAt());
        }
    }

    @Test
    void missed_run_is_caught_up_once_after_restart() throws Exception {
        try (var stack = new TestStack(dir)) {
            stack.scheduler.update(true, 24, IntervalUnit.HOURS);
        }
        try (var restarted = new TestStack(dir)) {
            restarted.clock.set(T0.plus(Duration.ofHours(50)));
            restarted.scheduler.start();

            assertEquals(1, restarted.timer.runDue());

            AutoBackupSettings s = restarted.scheduler.settings();
            assertEquals(T0.plus(Duration.ofHours(24)), s.lastRunAt());
            assertEquals(T0.plus(Duration.ofHours(72)), s.nextRunAt());
            assertEquals(1, restarted.backups.list(1, 5).total());
        }
    }

    @Test
    void start_after_an_early_update_keeps_a_single_timer() throws Exception {
        try (var stack = new TestStack(dir)) {
            stack.scheduler.update(true, 24, IntervalUnit.HOURS);
            stack.scheduler.start();
            stack.scheduler.start();

            assertEquals(1, stack.timer.pendingCount());

            stack.clock.advance(Duration.ofHours(24));
            assertEquals(1, stack.timer.runDue());
            assertEquals(1, stack.backups.list(1, 5).total());
            assertEquals(1, stack.timer.pendingCount());
            assertEquals(T0.plus(Duration.ofHours(48)), stack.scheduler.settings().nextRunAt());
        }
    }

    @Test
    void disabled_schedule_stays_idle_after_restart() throws Exception {
        try (var stack = new TestStack(dir)) {
            stack.scheduler.start();
            assertEquals(AutoBackupScheduler.State.DISABLED, stack.scheduler.state());
            assertEquals(0, stack.timer.pendingCount());
            assertEquals(AutoBackupSettings.defaults(), stack.scheduler.settings());
        }
    }

    @Test
    void failed_run_keeps_the_schedule_armed() throws Exception {
        var clock = new MutableClock(T0);
        var timer = new ManualTimer(clock);
        var attempts = new AtomicInteger();
        var settingsStore = new FileSettingsStore(dir.resolve("auto-backup.json"));
        try (var stack = new TestStack(dir.resolve("live"))) {
            var runner = new BackupRunner(stack.codec, new FailingBackupStore(attempts), null);
            try (var scheduler = new AutoBackupScheduler(settingsStore, runner, timer, clock, AuditTrail.noop())) {
                scheduler.update(true, 1, IntervalUnit.HOURS);

                clock.advance(Duration.ofHours(1));
                assertEquals(1, timer.runDue());

                assertEquals(1, attempts.get());
                assertEquals(AutoBackupScheduler.State.ARMED, scheduler.state());
                assertEquals(T0.plus(Duration.ofHours(2)), scheduler.settings().nextRunAt());
                assertEquals(1, timer.pendingCount());
            }
        }
    }

    @Test
    void close_stops_the_timer() throws Exception {
        try (var stack = new TestStack(dir)) {
            stack.scheduler.update(true, 1, IntervalUnit.HOURS);
            stack.scheduler.close();
            assertTrue(stack.timer.isClosed());
            assertEquals(0, stack.timer.pendingCount());
        }
    }

    /** Store whose create always fails with a storage error. */
    private static final class FailingBackupStore implements BackupStore {
        private final MaintenanceLock lock = new MaintenanceLock();
        private final AtomicInteger attempts;

        FailingBackupStore(AtomicInteger attempts) {
            this.attempts = attempts;
        }

        @Override
        public BackupRecord create(SnapshotDocument document, BackupSource source, String createdBy) {
            attempts.incrementAndGet();
            throw MaintenanceException.storageFailure("disk full", null);
        }

        @Override
        public HistoryPage list(int page, int pageSize) {
            return new HistoryPage(List.of(), 0, page, pageSize);
        }

        @Override
        public byte[] fetch(String id) {
            throw MaintenanceException.notFound(id);
        }

        @Override
        public BackupRecord find(String id) {
            throw MaintenanceException.notFound(id);
        }

        @Override
        public BackupRecord delete(String id) {
            throw MaintenanceException.notFound(id);
        }

        @Override
        public List<BackupRecord> retentionPrune(RetentionPolicy policy) {
            return List.of();
        }

        @Override
        public List<BackupRecord> clear() {
            return List.of();
        }

        @Override
        public MaintenanceLock lock() {
            return lock;
        }
    }
}
