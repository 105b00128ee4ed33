// file: storage/src/main/java/io/backlite/storage/SettingsStore.java
package io.backlite.storage;

import io.backlite.core.AutoBackupSettings;

/** Durable home of the auto-backup settings. */
public interface SettingsStore {

    /** @return stored settings, or {@link AutoBackupSettings#defaults()} when none were saved */
    AutoBackupSettings load();

    /** @throws io.backlite.core.MaintenanceException STORAGE_FAILURE when the write fails */
    void save(AutoBackupSettings settings);
}
