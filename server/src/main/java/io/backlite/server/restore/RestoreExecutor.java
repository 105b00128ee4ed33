// file: server/src/main/java/io/backlite/server/restore/RestoreExecutor.java
package io.backlite.server.restore;

import io.backlite.core.MaintenanceException;
import io.backlite.core.RestoreReport;
import io.backlite.core.SnapshotDocument;
import io.backlite.storage.Datastore;
import io.backlite.storage.MaintenanceLock;
import io.backlite.storage.ReplaceTransaction;
import io.backlite.storage.SnapshotCodec;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies a backup document to the live datastore, all or nothing.
 * <p>
 * Steps:
 *  1) Validate the whole document first (structure, policy, record ids). Nothing is touched on failure.
 *  2) Under the maintenance lock, stage every registered collection into one
 *     replace transaction (collections absent from the document are staged empty)
 *     and commit it.
 * A staging or commit failure discards the transaction, leaving the previous data in place.
 */
public final class RestoreExecutor {
    private static final Logger log = Logger.getLogger(RestoreExecutor.class.getName());

    private final Datastore datastore;
    private final MaintenanceLock lock;
    private final RestorePolicy policy;
    private final Clock clock;

    public RestoreExecutor(Datastore datastore, MaintenanceLock lock, RestorePolicy policy, Clock clock) {
        this.datastore = datastore;
        this.lock = lock;
        this.policy = policy;
        this.clock = clock;
    }

    /**
     * @throws MaintenanceException VALIDATION_FAILED before any change, or
     *                              STORAGE_FAILURE when the commit could not be made durable
     */
    public RestoreReport restore(SnapshotDocument document) {
        List<String> ignored = validate(document);
        return lock.callExclusive(() -> apply(document, ignored));
    }

    /**
     * Empty every registered collection except {@code keep}, in one replace transaction.
     *
     * @return records removed per emptied collection
     * @throws MaintenanceException STORAGE_FAILURE when the commit could not be made durable
     */
    public Map<String, Integer> clearExcept(Set<String> keep) {
        return lock.callExclusive(() -> {
            Map<String, Integer> cleared = new LinkedHashMap<>();
            try (ReplaceTransaction tx = datastore.beginReplace()) {
                for (String name : datastore.collections()) {
                    List<Map<String, Object>> current = datastore.read(name);
                    if (keep.contains(name)) {
                        tx.stage(name, current);
                    } else {
                        cleared.put(name, current.size());
                    }
                }
                tx.commit();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "wipe failed; live data left unchanged", e);
                throw MaintenanceException.storageFailure("wipe could not be committed; live data unchanged", e);
            }
            log.info(() -> "wipe committed: " + cleared);
            return cleared;
        });
    }

    private List<String> validate(SnapshotDocument document) {
        if (document == null) throw MaintenanceException.validationFailed("no document to restore");
        try {
            SnapshotCodec.validate(document);
        } catch (MaintenanceException e) {
            throw MaintenanceException.validationFailed(e.getMessage());
        }

        Set<String> known = new HashSet<>(datastore.collections());
        List<String> ignored = new ArrayList<>();
        for (Map.Entry<String, List<Map<String, Object>>> e : document.collections().entrySet()) {
            String name = e.getKey();
            if (!known.contains(name)) {
                if (policy.rejects(name)) {
                    throw MaintenanceException.validationFailed("document contains unknown collection '" + name + "'");
                }
                ignored.add(name);
                continue;
            }
            checkIds(name, e.getValue());
        }
        return ignored;
    }

    private static void checkIds(String collection, List<Map<String, Object>> records) {
        Set<String> ids = new HashSet<>();
        for (Map<String, Object> record : records) {
            Object id = record.get(Datastore.ID_FIELD);
            if (id == null) continue;
            if (!(id instanceof String s) || s.isBlank()) {
                throw MaintenanceException.validationFailed(
                        "collection '" + collection + "' has a record whose " + Datastore.ID_FIELD + " is not a string");
            }
            if (!ids.add(s)) {
                throw MaintenanceException.validationFailed(
                        "collection '" + collection + "' repeats " + Datastore.ID_FIELD + " '" + s + "'");
            }
        }
    }

    private RestoreReport apply(SnapshotDocument document, List<String> ignored) {
        Map<String, Integer> replaced = new LinkedHashMap<>();
        log.info(() -> "restore started: " + document.recordCount() + " record(s), generated at " + document.generatedAt());
        try (ReplaceTransaction tx = datastore.beginReplace()) {
            for (String name : datastore.collections()) {
                List<Map<String, Object>> records = document.collection(name);
                tx.stage(name, records);
                replaced.put(name, records.size());
            }
            tx.commit();
        } catch (IllegalArgumentException e) {
            throw MaintenanceException.validationFailed(e.getMessage());
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "restore failed; live data left unchanged", e);
            throw MaintenanceException.storageFailure("restore could not be committed; live data unchanged", e);
        }
        if (!ignored.isEmpty()) {
            log.info("restore ignored unregistered collection(s) " + ignored);
        }
        log.info(() -> "restore committed: " + replaced);
        return new RestoreReport(clock.instant(), document.schemaVersion(), replaced, ignored);
    }
}
