// file: server/src/main/java/io/backlite/server/audit/DatastoreAuditTrail.java
package io.backlite.server.audit;

import io.backlite.storage.Datastore;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes audit entries into the {@code systemLogs} collection:
 * <pre>
 *   { "_id": "...", "action": "BACKUP_CREATED", "actor": "alice",
 *     "target": "backup-2024-...json", "metadata": {...}, "createdAt": "2024-..." }
 * </pre>
 * Because the entries live in the datastore they are part of every backup and
 * are replaced by a restore, like any other collection.
 */
public final class DatastoreAuditTrail implements AuditTrail {
    public static final String COLLECTION = "systemLogs";

    private static final Logger log = Logger.getLogger(DatastoreAuditTrail.class.getName());

    private final Datastore datastore;
    private final Clock clock;
    private final boolean enabled;

    public DatastoreAuditTrail(Datastore datastore, Clock clock) {
        this.datastore = datastore;
        this.clock = clock;
        this.enabled = datastore.collections().contains(COLLECTION);
        if (!enabled) {
            log.warning("collection '" + COLLECTION + "' is not registered; audit entries are only logged");
        }
    }

    @Override
    public void record(String action, String actor, String target, Map<String, Object> metadata) {
        log.info(() -> String.format("audit %s by %s on %s", action, actor, target));
        if (!enabled) return;

        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("action", action);
        entry.put("actor", actor);
        entry.put("target", target);
        entry.put("metadata", metadata == null ? Map.of() : metadata);
        entry.put("createdAt", clock.instant().toString());
        try {
            datastore.put(COLLECTION, entry);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "could not persist audit entry " + action, e);
        }
    }
}
