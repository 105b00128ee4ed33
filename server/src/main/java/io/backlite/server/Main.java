// file: server/src/main/java/io/backlite/server/Main.java
package io.backlite.server;

import io.backlite.core.RetentionPolicy;
import io.backlite.server.audit.AuditTrail;
import io.backlite.server.audit.DatastoreAuditTrail;
import io.backlite.server.maintenance.BackupRunner;
import io.backlite.server.maintenance.MaintenanceGateway;
import io.backlite.server.restore.RestoreExecutor;
import io.backlite.server.schedule.AutoBackupScheduler;
import io.backlite.server.schedule.ExecutorBackupTimer;
import io.backlite.server.users.UserAdministration;
import io.backlite.storage.*;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a backlite server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Wire storage (WAL, checkpoints, datastore, backup store, settings store).
 *  - Wire restore, scheduler, user administration and the maintenance gateway.
 *  - Start the HTTP server and resume the auto-backup schedule.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        configureLogging();
        var cfg = ServerConfig.fromArgs(args);
        Clock clock = Clock.systemUTC();

        // ------ Storage layer ------
        var wal = new FileWal(cfg.walDir(), cfg.walRotateBytes());
        var datastore = new DurableDatastore(
                cfg.collections(),
                wal,
                new FileCheckpointer(cfg.checkpointDir()),
                new CheckpointPolicy(cfg.checkpointEvery()));
        var lock = new MaintenanceLock();
        var codec = new SnapshotCodec(datastore, clock);
        var backups = new FileBackupStore(cfg.backupDir(), codec, clock, lock);
        var settings = new FileSettingsStore(cfg.settingsFile());

        // ------ Maintenance services ------
        AuditTrail audit = new DatastoreAuditTrail(datastore, clock);
        RetentionPolicy retention = cfg.retainLatest() > 0 ? RetentionPolicy.keepLatest(cfg.retainLatest()) : null;
        var runner = new BackupRunner(codec, backups, retention);
        var restorer = new RestoreExecutor(datastore, lock, cfg.restorePolicy(), clock);
        var scheduler = new AutoBackupScheduler(settings, runner, new ExecutorBackupTimer(), clock, audit);
        var users = new UserAdministration(datastore, lock, audit);
        var gateway = new MaintenanceGateway(codec, backups, runner, restorer, scheduler, users, audit, clock);

        // ------ HTTP layer ------
        var web = new WebServer(cfg.httpPort(), gateway, cfg.maxUploadBytes(), clock);
        scheduler.start();
        web.start();

        log.info(String.format("backlite listening on http://localhost:%d (data: %s, %d collections)",
                cfg.httpPort(), cfg.dataDir().toAbsolutePath(), cfg.collections().size()));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                scheduler.close();
                web.stop();
                datastore.close();
            } catch (Exception e) {
                log.log(Level.WARNING, "error during shutdown", e);
            }
        }, "backlite-shutdown"));
    }

    /** Load logging.properties from the classpath unless -Djava.util.logging.config.file is set. */
    private static void configureLogging() throws IOException {
        if (System.getProperty("java.util.logging.config.file") != null) return;
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        }
    }
}
