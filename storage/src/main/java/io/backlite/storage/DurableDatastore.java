// file: storage/src/main/java/io/backlite/storage/DurableDatastore.java
package io.backlite.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable document datastore backed by a WAL and periodic checkpoints.
 * <p>
 * Responsibilities:
 *  - Keep every registered collection in memory: _id -> record, insertion ordered.
 *  - On write:
 *      1) Frame the mutation as a WAL record.
 *      2) Append + fsync.
 *      3) Apply to memory.
 *      4) Rotate the WAL segment and checkpoint on thresholds.
 *  - On replace: build a shadow copy off to the side, log it as a single
 *    REPLACE_ALL record, then swap it in. A crash before the append leaves the
 *    old data; after it, recovery replays the whole replacement.
 *  - On startup: load the latest checkpoint, then replay the WAL.
 * <p>
 * All state is guarded by this object's monitor. Records handed out are
 * unmodifiable at the top level; nested values must be treated as read-only.
 */
public class DurableDatastore implements Datastore, AutoCloseable {
    private static final Logger log = Logger.getLogger(DurableDatastore.class.getName());

    private final List<String> collections;
    private final Wal wal;
    private final Checkpointer checkpoints;
    private final CheckpointPolicy checkpointPolicy;

    private Map<String, LinkedHashMap<String, Map<String, Object>>> mem;

    public DurableDatastore(List<String> collections, Wal wal, Checkpointer checkpoints, CheckpointPolicy policy) {
        if (collections == null || collections.isEmpty()) {
            throw new IllegalArgumentException("at least one collection must be registered");
        }
        Set<String> seen = new HashSet<>();
        for (String name : collections) {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("collection names must not be blank");
            if (!seen.add(name)) throw new IllegalArgumentException("duplicate collection name: " + name);
        }
        this.collections = List.copyOf(collections);
        this.wal = wal;
        this.checkpoints = checkpoints;
        this.checkpointPolicy = policy;
        this.mem = emptyState();
        recover();
    }

    @Override
    public List<String> collections() {
        return collections;
    }

    @Override
    public synchronized Map<String, Object> put(String collection, Map<String, ?> record) {
        requireKnown(collection);
        Map<String, Object> normalized = Mappers.normalize(record);
        String id = assignId(normalized);

        wal.append(WalRecordCodec.put(collection, id, normalized));

        Map<String, Object> stored = Collections.unmodifiableMap(normalized);
        mem.get(collection).put(id, stored);
        afterMutation();
        return stored;
    }

    @Override
    public synchronized boolean delete(String collection, String id) {
        requireKnown(collection);
        if (!mem.get(collection).containsKey(id)) return false;

        wal.append(WalRecordCodec.delete(collection, id));

        mem.get(collection).remove(id);
        afterMutation();
        return true;
    }

    @Override
    public synchronized Optional<Map<String, Object>> find(String collection, String id) {
        requireKnown(collection);
        return Optional.ofNullable(mem.get(collection).get(id));
    }

    @Override
    public synchronized List<Map<String, Object>> read(String collection) {
        requireKnown(collection);
        return List.copyOf(mem.get(collection).values());
    }

    @Override
    public synchronized Map<String, List<Map<String, Object>>> view() {
        Map<String, List<Map<String, Object>>> out = new LinkedHashMap<>();
        for (String name : collections) {
            out.put(name, List.copyOf(mem.get(name).values()));
        }
        return Collections.unmodifiableMap(out);
    }

    @Override
    public ReplaceTransaction beginReplace() {
        return new StagedReplace();
    }

    /** Write a checkpoint now and drop the WAL segments it covers. */
    public synchronized void checkpoint() {
        String id = checkpoints.write(view());
        wal.reset();
        checkpointPolicy.checkpointed();
        log.fine(() -> "checkpoint " + id + " written");
    }

    @Override
    public synchronized void close() throws Exception {
        wal.close();
    }

    // ---------- internals ----------

    private void afterMutation() {
        wal.rotateIfNeeded();
        if (checkpointPolicy.recordMutation()) {
            checkpointQuietly();
        }
    }

    /**
     * The mutation that triggered this is already durable in the WAL, so a
     * failed checkpoint only postpones log truncation.
     */
    private void checkpointQuietly() {
        try {
            checkpoint();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "checkpoint failed; WAL keeps all records until the next attempt", e);
        }
    }

    private void recover() {
        int seeded = 0;
        Checkpointer.Loaded loaded = checkpoints.loadLatest();
        if (loaded != null && loaded.collections() != null) {
            mem = stateFrom(loaded.collections(), "checkpoint " + loaded.id());
            seeded = countRecords(mem);
        }

        int replayed = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                apply(WalRecordCodec.decode(payload));
                replayed++;
            }
        } catch (Exception e) {
            throw new IllegalStateException("datastore recovery failed", e);
        }
        log.info(String.format("datastore recovered: %d record(s) from checkpoint, %d WAL record(s) replayed",
                seeded, replayed));
    }

    private void apply(WalRecordCodec.Entry e) {
        switch (e.op()) {
            case PUT -> {
                var target = mem.get(e.collection());
                if (target == null) {
                    log.warning("WAL names unregistered collection '" + e.collection() + "'; record skipped");
                } else {
                    target.put(e.id(), Collections.unmodifiableMap(e.record()));
                }
            }
            case DELETE -> {
                var target = mem.get(e.collection());
                if (target != null) target.remove(e.id());
            }
            case REPLACE_ALL -> mem = stateFrom(e.state(), "WAL replace");
        }
    }

    private Map<String, LinkedHashMap<String, Map<String, Object>>> stateFrom(
            Map<String, List<Map<String, Object>>> source, String origin) {
        Map<String, LinkedHashMap<String, Map<String, Object>>> state = emptyState();
        for (Map.Entry<String, List<Map<String, Object>>> e : source.entrySet()) {
            var target = state.get(e.getKey());
            if (target == null) {
                log.warning(origin + " holds unregistered collection '" + e.getKey() + "'; ignored");
                continue;
            }
            for (Map<String, Object> record : e.getValue()) {
                target.put(String.valueOf(record.get(ID_FIELD)), Collections.unmodifiableMap(record));
            }
        }
        return state;
    }

    private Map<String, LinkedHashMap<String, Map<String, Object>>> emptyState() {
        Map<String, LinkedHashMap<String, Map<String, Object>>> state = new LinkedHashMap<>();
        for (String name : collections) {
            state.put(name, new LinkedHashMap<>());
        }
        return state;
    }

    private void requireKnown(String collection) {
        if (!mem.containsKey(collection)) {
            throw new IllegalArgumentException("unknown collection: " + collection);
        }
    }

    private static String assignId(Map<String, Object> normalized) {
        Object id = normalized.get(ID_FIELD);
        if (id == null) {
            String generated = UUID.randomUUID().toString();
            normalized.put(ID_FIELD, generated);
            return generated;
        }
        if (!(id instanceof String s) || s.isBlank()) {
            throw new IllegalArgumentException(ID_FIELD + " must be a non-blank string");
        }
        return s;
    }

    private static int countRecords(Map<String, LinkedHashMap<String, Map<String, Object>>> state) {
        int n = 0;
        for (var c : state.values()) n += c.size();
        return n;
    }

    /** Shadow copy that becomes the live state on commit. */
    private final class StagedReplace implements ReplaceTransaction {
        private final Map<String, LinkedHashMap<String, Map<String, Object>>> shadow = emptyState();
        private final Set<String> staged = new HashSet<>();
        private boolean finished;

        @Override
        public void stage(String collection, List<? extends Map<String, ?>> records) {
            ensureOpen();
            var target = shadow.get(collection);
            if (target == null) throw new IllegalArgumentException("unknown collection: " + collection);
            if (!staged.add(collection)) throw new IllegalStateException("collection already staged: " + collection);

            for (Map<String, ?> record : records) {
                Map<String, Object> normalized = Mappers.normalize(record);
                String id = assignId(normalized);
                if (target.put(id, Collections.unmodifiableMap(normalized)) != null) {
                    throw new IllegalArgumentException("duplicate " + ID_FIELD + " '" + id + "' in " + collection);
                }
            }
        }

        @Override
        public void commit() {
            ensureOpen();
            finished = true;
            synchronized (DurableDatastore.this) {
                Map<String, List<Map<String, Object>>> state = new LinkedHashMap<>();
                for (var e : shadow.entrySet()) {
                    state.put(e.getKey(), new ArrayList<>(e.getValue().values()));
                }
                wal.append(WalRecordCodec.replaceAll(state));
                mem = shadow;
                log.info(() -> "datastore replaced: " + countRecords(shadow) + " record(s) across "
                        + shadow.size() + " collection(s)");
                // a replace record can be large; fold it into a checkpoint right away
                checkpointQuietly();
            }
        }

        @Override
        public void close() {
            if (!finished) {
                finished = true;
                log.fine("datastore replace discarded before commit");
            }
        }

        private void ensureOpen() {
            if (finished) throw new IllegalStateException("replace transaction already finished");
        }
    }
}
