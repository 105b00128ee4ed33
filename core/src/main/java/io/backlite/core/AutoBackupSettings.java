// file: core/src/main/java/io/backlite/core/AutoBackupSettings.java
package io.backlite.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Persisted auto-backup configuration plus the scheduler's bookkeeping.
 * <p>
 * Invariants:
 *  - intervalValue is within [1, {@link #MAX_INTERVAL_VALUE}],
 *  - nextRunAt is null whenever the schedule is disabled.
 * <p>
 * Transitions return new instances; the scheduler owns the current value.
 */
public record AutoBackupSettings(
        boolean enabled,
        int intervalValue,
        IntervalUnit intervalUnit,
        Instant lastRunAt,
        Instant nextRunAt
) {
    public static final int DEFAULT_INTERVAL_VALUE = 24;
    public static final IntervalUnit DEFAULT_INTERVAL_UNIT = IntervalUnit.HOURS;
    public static final int MAX_INTERVAL_VALUE = 10_000;

    public AutoBackupSettings {
        if (intervalUnit == null) {
            throw MaintenanceException.invalidSettings("intervalUnit must be one of: hours, days, weeks");
        }
        if (intervalValue < 1 || intervalValue > MAX_INTERVAL_VALUE) {
            throw MaintenanceException.invalidSettings(
                    "intervalValue must be between 1 and " + MAX_INTERVAL_VALUE + " (got " + intervalValue + ")");
        }
        if (!enabled) {
            nextRunAt = null;
        }
    }

    /** Disabled, every 24 hours, never run. */
    public static AutoBackupSettings defaults() {
        return new AutoBackupSettings(false, DEFAULT_INTERVAL_VALUE, DEFAULT_INTERVAL_UNIT, null, null);
    }

    public Duration interval() {
        return intervalUnit.times(intervalValue);
    }

    /** Enabled, with the next run one interval after {@code now}. */
    public AutoBackupSettings armedFrom(Instant now) {
        return new AutoBackupSettings(true, intervalValue, intervalUnit, lastRunAt, now.plus(interval()));
    }

    public AutoBackupSettings disarmed() {
        return new AutoBackupSettings(false, intervalValue, intervalUnit, lastRunAt, null);
    }

    public AutoBackupSettings withLastRunAt(Instant plannedAt) {
        return new AutoBackupSettings(enabled, intervalValue, intervalUnit, plannedAt, nextRunAt);
    }

    /**
     * Record a run that was planned for {@code plannedAt} and finished at {@code now}.
     * <p>
     * The next run stays on the grid plannedAt + k * interval, using the first
     * grid point strictly after {@code now}, so late or missed runs never drift
     * the schedule and never pile up.
     */
    public AutoBackupSettings completedRun(Instant plannedAt, Instant now) {
        Objects.requireNonNull(plannedAt, "plannedAt");
        Objects.requireNonNull(now, "now");
        if (!enabled) {
            return withLastRunAt(plannedAt);
        }
        Duration step = interval();
        Instant next = plannedAt.plus(step);
        if (!next.isAfter(now)) {
            long behind = Duration.between(next, now).toMillis() / step.toMillis() + 1;
            next = next.plus(step.multipliedBy(behind));
        }
        return new AutoBackupSettings(true, intervalValue, intervalUnit, plannedAt, next);
    }
}
