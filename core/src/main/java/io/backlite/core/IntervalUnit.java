// file: core/src/main/java/io/backlite/core/IntervalUnit.java
package io.backlite.core;

import java.time.Duration;
import java.util.Locale;

/** Unit of the auto-backup interval. Conversions are exact, calendar effects are ignored. */
public enum IntervalUnit {
    HOURS,
    DAYS,
    WEEKS;

    public Duration times(int value) {
        return switch (this) {
            case HOURS -> Duration.ofHours(value);
            case DAYS -> Duration.ofDays(value);
            case WEEKS -> Duration.ofDays(7L * value);
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse "hours" | "days" | "weeks" (case-insensitive).
     *
     * @throws IllegalArgumentException for anything else
     */
    public static IntervalUnit fromWire(String value) {
        if (value == null) throw new IllegalArgumentException("interval unit must not be null");
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "hours" -> HOURS;
            case "days" -> DAYS;
            case "weeks" -> WEEKS;
            default -> throw new IllegalArgumentException(
                    "interval unit must be one of: hours, days, weeks (got '" + value + "')");
        };
    }
}
