// file: core/src/main/java/io/backlite/core/BackupSource.java
package io.backlite.core;

import java.util.Locale;

/** Who produced a backup: an operator request or the auto-backup scheduler. */
public enum BackupSource {
    MANUAL,
    AUTO;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BackupSource fromWire(String value) {
        if (value == null) throw new IllegalArgumentException("backup source must not be null");
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "manual" -> MANUAL;
            case "auto" -> AUTO;
            default -> throw new IllegalArgumentException("unknown backup source: " + value);
        };
    }
}
