// file: server/src/main/java/io/backlite/server/schedule/AutoBackupScheduler.java
package io.backlite.server.schedule;

import io.backlite.core.AutoBackupSettings;
import io.backlite.core.BackupRecord;
import io.backlite.core.BackupSource;
import io.backlite.core.IntervalUnit;
import io.backlite.server.audit.AuditTrail;
import io.backlite.server.maintenance.BackupRunner;
import io.backlite.storage.SettingsStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic auto-backup.
 * <p>
 * States:
 * <pre>
 *   DISABLED --enable--> ARMED --timer fires--> RUNNING --done--> ARMED
 *      ^                   |                       |
 *      +-----disable-------+          (disable while running: DISABLED when done)
 * </pre>
 * Rules:
 *  - Enabling (or changing the interval while enabled) sets nextRunAt = now + interval.
 *  - A run planned for P records lastRunAt = P and moves nextRunAt to the first
 *    point of the grid P + k * interval that lies after the completion time.
 *  - A failed run is logged and the schedule stays armed.
 *  - {@link #triggerNow} runs a backup immediately and leaves the schedule alone.
 *  - On {@link #start()}, a nextRunAt in the past causes one catch-up run.
 *  - Every transition is persisted through the {@link SettingsStore}.
 * <p>
 * A generation counter invalidates timer callbacks that were scheduled before
 * the latest reconfiguration.
 */
public final class AutoBackupScheduler implements AutoCloseable {
    public static final String SYSTEM_ACTOR = "system";

    public enum State { DISABLED, ARMED, RUNNING }

    private static final Logger log = Logger.getLogger(AutoBackupScheduler.class.getName());

    private final SettingsStore settingsStore;
    private final BackupRunner runner;
    private final BackupTimer timer;
    private final Clock clock;
    private final AuditTrail audit;

    // guarded by this
    private AutoBackupSettings settings;
    private State state = State.DISABLED;
    private BackupTimer.Scheduled pending;
    private long generation;

    public AutoBackupScheduler(SettingsStore settingsStore,
                               BackupRunner runner,
                               BackupTimer timer,
                               Clock clock,
                               AuditTrail audit) {
        this.settingsStore = settingsStore;
        this.runner = runner;
        this.timer = timer;
        this.clock = clock;
        this.audit = audit;
        this.settings = settingsStore.load();
    }

    /**
     * Resume from the current settings. Any timer armed earlier (for example by an
     * update that arrived first) is replaced, so exactly one timer stays pending.
     */
    public synchronized void start() {
        cancelPending();
        generation++;
        if (!settings.enabled()) {
            if (state != State.RUNNING) state = State.DISABLED;
            log.info("auto-backup disabled");
            return;
        }
        if (settings.nextRunAt() == null) {
            settings = settings.armedFrom(clock.instant());
            persist(settings);
        }
        Instant next = settings.nextRunAt();
        if (!next.isAfter(clock.instant())) {
            log.info("auto-backup missed its run planned for " + next + "; catching up now");
        } else {
            log.info("auto-backup armed, next run at " + next);
        }
        arm(next);
    }

    public synchronized AutoBackupSettings settings() {
        return settings;
    }

    public synchronized State state() {
        return state;
    }

    /**
     * Apply a settings change. Null arguments keep the current value.
     *
     * @throws io.backlite.core.MaintenanceException INVALID_SETTINGS (nothing changes) or
     *                                               STORAGE_FAILURE if the settings cannot be persisted
     */
    public synchronized AutoBackupSettings update(Boolean enabled, Integer intervalValue, IntervalUnit intervalUnit) {
        boolean en = enabled != null ? enabled : settings.enabled();
        int value = intervalValue != null ? intervalValue : settings.intervalValue();
        IntervalUnit unit = intervalUnit != null ? intervalUnit : settings.intervalUnit();

        AutoBackupSettings next = new AutoBackupSettings(en, value, unit, settings.lastRunAt(), null);
        if (en) {
            next = next.armedFrom(clock.instant());
        }
        persist(next);

        cancelPending();
        generation++;
        settings = next;
        if (en) {
            arm(next.nextRunAt());
        } else if (state != State.RUNNING) {
            state = State.DISABLED;
        }
        log.info(() -> "auto-backup settings changed: " + describe(settings));
        return settings;
    }

    /** Run a backup now, outside the schedule. nextRunAt is not changed. */
    public BackupRecord triggerNow(String actor) {
        BackupRecord rec = runner.run(BackupSource.AUTO, actor);
        log.info("auto-backup triggered manually by " + actor + ": " + rec.filename());
        return rec;
    }

    @Override
    public synchronized void close() {
        cancelPending();
        generation++;
        timer.close();
    }

    // ---------- internals ----------

    private void arm(Instant at) {
        Duration delay = Duration.between(clock.instant(), at);
        if (delay.isNegative()) delay = Duration.ZERO;
        long gen = generation;
        pending = timer.schedule(() -> fire(gen, at), delay);
        if (state != State.RUNNING) state = State.ARMED;
    }

    private void fire(long gen, Instant plannedAt) {
        synchronized (this) {
            if (gen != generation) return;
            if (state == State.RUNNING) {
                // the previous run is still going; completeRun re-arms
                pending = null;
                return;
            }
            if (clock.instant().isBefore(plannedAt)) {
                // woke up early (clock adjusted); wait for the planned time
                arm(plannedAt);
                return;
            }
            pending = null;
            state = State.RUNNING;
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("plannedAt", plannedAt.toString());
        try {
            BackupRecord rec = runner.run(BackupSource.AUTO, SYSTEM_ACTOR);
            log.info("scheduled backup created: " + rec.filename());
            metadata.put("backupId", rec.id());
            audit.record(AuditTrail.AUTO_BACKUP_RUN, SYSTEM_ACTOR, rec.filename(), metadata);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "scheduled backup planned for " + plannedAt + " failed; schedule stays armed", e);
        } finally {
            completeRun(gen, plannedAt);
        }
    }

    private synchronized void completeRun(long gen, Instant plannedAt) {
        AutoBackupSettings next = gen == generation
                ? settings.completedRun(plannedAt, clock.instant())
                : settings.withLastRunAt(plannedAt);
        settings = next;
        try {
            persist(next);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "could not persist auto-backup settings after run", e);
        }
        if (!next.enabled()) {
            state = State.DISABLED;
        } else if (gen == generation) {
            state = State.ARMED;
            arm(next.nextRunAt());
        } else {
            // reconfigured while running; update() armed the new schedule
            state = State.ARMED;
            if (pending == null) arm(next.nextRunAt());
        }
    }

    private void cancelPending() {
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
    }

    private void persist(AutoBackupSettings s) {
        settingsStore.save(s);
    }

    private static String describe(AutoBackupSettings s) {
        return s.enabled()
                ? "enabled every " + s.intervalValue() + " " + s.intervalUnit().wireName() + ", next at " + s.nextRunAt()
                : "disabled";
    }
}
