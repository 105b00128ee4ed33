// file: server/src/main/java/io/backlite/server/maintenance/MaintenanceGateway.java
package io.backlite.server.maintenance;

import io.backlite.core.AutoBackupSettings;
import io.backlite.core.BackupRecord;
import io.backlite.core.BackupSource;
import io.backlite.core.FailureKind;
import io.backlite.core.HistoryPage;
import io.backlite.core.IntervalUnit;
import io.backlite.core.MaintenanceException;
import io.backlite.core.Outcome;
import io.backlite.core.RestoreReport;
import io.backlite.core.SnapshotDocument;
import io.backlite.core.WipeReport;
import io.backlite.server.audit.AuditTrail;
import io.backlite.server.restore.RestoreExecutor;
import io.backlite.server.schedule.AutoBackupScheduler;
import io.backlite.server.users.UserAdministration;
import io.backlite.storage.BackupStore;
import io.backlite.storage.SnapshotCodec;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single entry point for maintenance requests.
 * <p>
 * Every operation returns an {@link Outcome}; nothing escapes as an exception.
 * Mapping of internal failures:
 *  - {@link MaintenanceException}      -> its own kind
 *  - {@link IllegalArgumentException}  -> VALIDATION_FAILED
 *  - any other RuntimeException        -> STORAGE_FAILURE (logged with stack trace)
 * <p>
 * Successful state-changing operations are written to the audit trail after
 * the operation (and its lock) has completed.
 */
public final class MaintenanceGateway {
    private static final Logger log = Logger.getLogger(MaintenanceGateway.class.getName());
    static final Set<String> WIPE_KEEPS = Set.of(UserAdministration.COLLECTION, "settings");

    private final SnapshotCodec codec;
    private final BackupStore store;
    private final BackupRunner runner;
    private final RestoreExecutor restorer;
    private final AutoBackupScheduler scheduler;
    private final UserAdministration users;
    private final AuditTrail audit;
    private final Clock clock;

    public MaintenanceGateway(SnapshotCodec codec,
                              BackupStore store,
                              BackupRunner runner,
                              RestoreExecutor restorer,
                              AutoBackupScheduler scheduler,
                              UserAdministration users,
                              AuditTrail audit,
                              Clock clock) {
        this.codec = codec;
        this.store = store;
        this.runner = runner;
        this.restorer = restorer;
        this.scheduler = scheduler;
        this.users = users;
        this.audit = audit;
        this.clock = clock;
    }

    /** Encode the live datastore for download without storing it. */
    public Outcome<byte[]> export(String actor) {
        return attempt("export", () -> {
            SnapshotDocument doc = codec.encode();
            byte[] bytes = codec.toBytes(doc);
            audit.record(AuditTrail.BACKUP_EXPORTED, actor, "export",
                    Map.of("records", doc.recordCount(), "sizeBytes", bytes.length));
            return bytes;
        });
    }

    public Outcome<BackupRecord> createManualBackup(String actor) {
        return attempt("create backup", () -> {
            BackupRecord rec = runner.run(BackupSource.MANUAL, actor);
            audit.record(AuditTrail.BACKUP_CREATED, actor, rec.filename(), backupMetadata(rec));
            return rec;
        });
    }

    public Outcome<BackupRecord> triggerAutoBackup(String actor) {
        return attempt("trigger auto-backup", () -> {
            BackupRecord rec = scheduler.triggerNow(actor);
            audit.record(AuditTrail.AUTO_BACKUP_TRIGGERED, actor, rec.filename(), backupMetadata(rec));
            return rec;
        });
    }

    public Outcome<AutoBackupSettings> settings() {
        return attempt("read settings", scheduler::settings);
    }

    public Outcome<AutoBackupSettings> updateSettings(SettingsUpdate update, String actor) {
        return attempt("update settings", () -> {
            if (update == null) throw MaintenanceException.invalidSettings("settings body is required");
            IntervalUnit unit = null;
            if (update.intervalUnit() != null) {
                try {
                    unit = IntervalUnit.fromWire(update.intervalUnit());
                } catch (IllegalArgumentException e) {
                    throw MaintenanceException.invalidSettings(e.getMessage());
                }
            }
            AutoBackupSettings applied = scheduler.update(update.enabled(), update.intervalValue(), unit);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("enabled", applied.enabled());
            metadata.put("intervalValue", applied.intervalValue());
            metadata.put("intervalUnit", applied.intervalUnit().wireName());
            audit.record(AuditTrail.AUTO_BACKUP_SETTINGS_CHANGED, actor, "auto-backup", metadata);
            return applied;
        });
    }

    public Outcome<HistoryPage> history(int page, int pageSize) {
        return attempt("list history", () -> store.list(page, pageSize));
    }

    public Outcome<Download> download(String id) {
        return attempt("download", () -> {
            BackupRecord rec = store.find(id);
            return new Download(rec, store.fetch(id));
        });
    }

    public Outcome<BackupRecord> deleteBackup(String id, String actor) {
        return attempt("delete backup", () -> {
            BackupRecord rec = store.delete(id);
            audit.record(AuditTrail.BACKUP_DELETED, actor, rec.filename(), backupMetadata(rec));
            return rec;
        });
    }

    /**
     * Replace all live data with an uploaded document.
     * <p>
     * Without {@code confirmed} nothing is parsed and nothing changes.
     */
    public Outcome<RestoreReport> uploadAndRestore(byte[] documentBytes, boolean confirmed, String actor) {
        if (!confirmed) {
            MaintenanceException e = MaintenanceException.confirmationRequired();
            return Outcome.failure(e.kind(), e.getMessage());
        }
        return attempt("restore", () -> {
            SnapshotDocument doc = codec.decode(documentBytes);
            RestoreReport report = restorer.restore(doc);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("schemaVersion", report.schemaVersion());
            metadata.put("generatedAt", doc.generatedAt().toString());
            metadata.put("replaced", report.replaced());
            metadata.put("ignoredCollections", report.ignoredCollections());
            audit.record(AuditTrail.BACKUP_RESTORED, actor, "upload", metadata);
            return report;
        });
    }

    /**
     * Empty the business collections and the audit log and delete every stored backup.
     * User accounts and the settings collection survive so the system stays administrable.
     * <p>
     * Without {@code confirmed} nothing changes.
     */
    public Outcome<WipeReport> wipe(boolean confirmed, String actor) {
        if (!confirmed) {
            MaintenanceException e = MaintenanceException.confirmationRequired();
            return Outcome.failure(e.kind(), e.getMessage());
        }
        return attempt("wipe", () -> {
            WipeReport report = store.lock().callExclusive(() -> {
                Map<String, Integer> cleared = restorer.clearExcept(WIPE_KEEPS);
                int backups = store.clear().size();
                return new WipeReport(clock.instant(), cleared, List.copyOf(new TreeSet<>(WIPE_KEEPS)), backups);
            });
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("action", "complete_wipe");
            metadata.put("cleared", report.cleared());
            metadata.put("backupsDeleted", report.backupsDeleted());
            audit.record(AuditTrail.SYSTEM_WIPE, actor, "", metadata);
            log.warning("all data wiped by " + actor + ": " + report.cleared() + ", "
                    + report.backupsDeleted() + " backup(s) deleted");
            return report;
        });
    }

    public Outcome<Map<String, Object>> changeUserRole(String userId, String role, String actor) {
        return attempt("change user role", () -> users.changeRole(userId, role, actor));
    }

    public Outcome<Map<String, Object>> changeUserStatus(String userId, Boolean active, String actor) {
        return attempt("change user status", () -> {
            if (active == null) throw MaintenanceException.validationFailed("isActive must be true or false");
            return users.changeStatus(userId, active, actor);
        });
    }

    // ---------- helpers ----------

    private static Map<String, Object> backupMetadata(BackupRecord rec) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("backupId", rec.id());
        m.put("sizeBytes", rec.sizeBytes());
        m.put("source", rec.source().wireName());
        return m;
    }

    private static <T> Outcome<T> attempt(String operation, Supplier<T> action) {
        try {
            return Outcome.success(action.get());
        } catch (MaintenanceException e) {
            if (e.kind() == FailureKind.STORAGE_FAILURE) {
                log.log(Level.WARNING, operation + " failed", e);
            } else {
                log.fine(() -> operation + " rejected: " + e.kind().code() + " " + e.getMessage());
            }
            return Outcome.failure(e.kind(), e.getMessage());
        } catch (IllegalArgumentException e) {
            log.fine(() -> operation + " rejected: " + e.getMessage());
            return Outcome.failure(FailureKind.VALIDATION_FAILED, e.getMessage());
        } catch (RuntimeException e) {
            log.log(Level.WARNING, operation + " failed unexpectedly", e);
            return Outcome.failure(FailureKind.STORAGE_FAILURE, operation + " failed: " + e.getMessage());
        }
    }
}
