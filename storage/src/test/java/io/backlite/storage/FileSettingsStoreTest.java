// file: storage/src/test/java/io/backlite/storage/FileSettingsStoreTest.java
package io.backlite.storage;

import io.backlite.core.AutoBackupSettings;
import io.backlite.core.IntervalUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class FileSettingsStoreTest {

    @TempDir Path dir;

    @Test
    void missing_file_yields_defaults() {
        var store = new FileSettingsStore(dir.resolve("settings/auto-backup.json"));
        assertEquals(AutoBackupSettings.defaults(), store.load());
    }

    @Test
    void saved_settings_are_loaded_back() throws Exception {
        Path file = dir.resolve("settings/auto-backup.json");
        var store = new FileSettingsStore(file);
        var settings = new AutoBackupSettings(true, 2, IntervalUnit.WEEKS,
                Instant.parse("2024-05-01T00:00:00Z"), Instant.parse("2024-05-15T00:00:00Z"));

        store.save(settings);

        assertEquals(settings, new FileSettingsStore(file).load());
        assertTrue(Files.readString(file).contains("\"autoBackupIntervalUnit\" : \"weeks\""));
    }
}
