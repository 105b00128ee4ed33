// file: storage/src/main/java/io/backlite/storage/FileSettingsStore.java
package io.backlite.storage;

import io.backlite.core.AutoBackupSettings;
import io.backlite.core.IntervalUnit;
import io.backlite.core.MaintenanceException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Settings persisted as one small JSON file, e.g.:
 * <pre>
 *   {
 *     "autoBackupEnabled": true,
 *     "autoBackupIntervalValue": 24,
 *     "autoBackupIntervalUnit": "hours",
 *     "lastRunAt": "2024-05-01T00:00:00Z",
 *     "nextRunAt": "2024-05-02T00:00:00Z"
 *   }
 * </pre>
 */
public final class FileSettingsStore implements SettingsStore {
    private final Path file;

    public FileSettingsStore(Path file) {
        this.file = file;
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            AtomicFiles.sweepTemporaries(file.toAbsolutePath().getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("could not prepare settings directory for " + file, e);
        }
    }

    @Override
    public synchronized AutoBackupSettings load() {
        if (!Files.exists(file)) return AutoBackupSettings.defaults();
        SettingsFile s;
        try {
            s = Mappers.json().readValue(file.toFile(), SettingsFile.class);
        } catch (IOException e) {
            throw new UncheckedIOException("settings file " + file + " is unreadable", e);
        }
        IntervalUnit unit = s.autoBackupIntervalUnit == null
                ? AutoBackupSettings.DEFAULT_INTERVAL_UNIT
                : IntervalUnit.fromWire(s.autoBackupIntervalUnit);
        int value = s.autoBackupIntervalValue == null
                ? AutoBackupSettings.DEFAULT_INTERVAL_VALUE
                : s.autoBackupIntervalValue;
        return new AutoBackupSettings(s.autoBackupEnabled, value, unit, s.lastRunAt, s.nextRunAt);
    }

    @Override
    public synchronized void save(AutoBackupSettings settings) {
        var s = new SettingsFile();
        s.autoBackupEnabled = settings.enabled();
        s.autoBackupIntervalValue = settings.intervalValue();
        s.autoBackupIntervalUnit = settings.intervalUnit().wireName();
        s.lastRunAt = settings.lastRunAt();
        s.nextRunAt = settings.nextRunAt();
        try {
            AtomicFiles.write(file, Mappers.json().writerWithDefaultPrettyPrinter().writeValueAsBytes(s));
        } catch (IOException e) {
            throw MaintenanceException.storageFailure("could not persist auto-backup settings", e);
        }
    }

    static final class SettingsFile {
        public boolean autoBackupEnabled;
        public Integer autoBackupIntervalValue;
        public String autoBackupIntervalUnit;
        public Instant lastRunAt;
        public Instant nextRunAt;
    }
}
