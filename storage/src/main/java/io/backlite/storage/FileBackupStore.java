// file: storage/src/main/java/io/backlite/storage/FileBackupStore.java
package io.backlite.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.backlite.core.BackupRecord;
import io.backlite.core.BackupSource;
import io.backlite.core.HistoryPage;
import io.backlite.core.MaintenanceException;
import io.backlite.core.RetentionPolicy;
import io.backlite.core.SnapshotDocument;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Backup store on the local filesystem.
 * <p>
 * Layout under {@code root}:
 * <pre>
 *   artifacts/&lt;id&gt;.json   one pretty-printed backup document per backup
 *   history.json            index of every published backup
 * </pre>
 * Create protocol:
 *  1) write the artifact atomically (tmp + fsync + ATOMIC_MOVE),
 *  2) rewrite history.json atomically with the new record first,
 *  3) publish the new immutable history list to readers.
 * A failure in step 1 or 2 removes the artifact again, so history never names
 * a missing or partial file. Readers see a volatile snapshot and never block.
 * <p>
 * On startup leftover temp files and artifacts no history record points to are deleted.
 */
public final class FileBackupStore implements BackupStore {
    private static final Logger log = Logger.getLogger(FileBackupStore.class.getName());

    static final String ARTIFACTS_DIR = "artifacts";
    static final String INDEX_FILE = "history.json";
    private static final int INDEX_VERSION = 1;
    private static final Comparator<BackupRecord> NEWEST_FIRST =
            Comparator.comparing(BackupRecord::createdAt).reversed();

    private final Path artifacts;
    private final Path indexFile;
    private final SnapshotCodec codec;
    private final Clock clock;
    private final MaintenanceLock lock;
    private final ObjectMapper json = Mappers.json();

    private volatile List<BackupRecord> history;

    public FileBackupStore(Path root, SnapshotCodec codec, Clock clock, MaintenanceLock lock) {
        this.artifacts = root.resolve(ARTIFACTS_DIR);
        this.indexFile = root.resolve(INDEX_FILE);
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lock = Objects.requireNonNull(lock, "lock");
        try {
            Files.createDirectories(artifacts);
            AtomicFiles.sweepTemporaries(root);
            AtomicFiles.sweepTemporaries(artifacts);
            this.history = loadIndex();
            removeOrphans();
        } catch (IOException e) {
            throw new UncheckedIOException("could not open backup store at " + root, e);
        }
        log.info("backup store opened with " + history.size() + " backup(s)");
    }

    @Override
    public BackupRecord create(SnapshotDocument document, BackupSource source, String createdBy) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(source, "source");
        if (createdBy == null || createdBy.isBlank()) throw new IllegalArgumentException("createdBy must not be blank");

        return lock.callExclusive(() -> {
            Instant now = clock.instant();
            String id = UUID.randomUUID().toString();
            byte[] bytes = codec.toBytes(document);
            Path artifact = artifactPath(id);
            try {
                AtomicFiles.write(artifact, bytes);
            } catch (IOException e) {
                throw MaintenanceException.storageFailure("could not write backup artifact", e);
            }

            var record = new BackupRecord(id, BackupRecord.filenameFor(source, now), bytes.length, source, createdBy, now);
            List<BackupRecord> next = new ArrayList<>(history.size() + 1);
            next.add(record);
            next.addAll(history);
            next.sort(NEWEST_FIRST);
            try {
                writeIndex(next);
            } catch (IOException e) {
                AtomicFiles.deleteQuietly(artifact);
                throw MaintenanceException.storageFailure("could not update backup history", e);
            }
            history = List.copyOf(next);
            log.info(String.format("backup %s created (%s, %d bytes, source=%s, by=%s)",
                    id, record.filename(), record.sizeBytes(), source.wireName(), createdBy));
            return record;
        });
    }

    @Override
    public HistoryPage list(int page, int pageSize) {
        if (page < 1) throw new IllegalArgumentException("page must be >= 1");
        if (pageSize < 1) throw new IllegalArgumentException("pageSize must be >= 1");
        List<BackupRecord> snapshot = history;
        long from = (long) (page - 1) * pageSize;
        if (from >= snapshot.size()) {
            return new HistoryPage(List.of(), snapshot.size(), page, pageSize);
        }
        int to = (int) Math.min(from + pageSize, snapshot.size());
        return new HistoryPage(snapshot.subList((int) from, to), snapshot.size(), page, pageSize);
    }

    @Override
    public byte[] fetch(String id) {
        find(id);
        try {
            return Files.readAllBytes(artifactPath(id));
        } catch (NoSuchFileException e) {
            throw MaintenanceException.notFound("artifact for backup " + id + " is missing");
        } catch (IOException e) {
            throw MaintenanceException.storageFailure("could not read backup " + id, e);
        }
    }

    @Override
    public BackupRecord find(String id) {
        for (BackupRecord r : history) {
            if (r.id().equals(id)) return r;
        }
        throw MaintenanceException.notFound("no backup with id " + id);
    }

    @Override
    public BackupRecord delete(String id) {
        return lock.callExclusive(() -> {
            BackupRecord target = find(id);
            List<BackupRecord> next = new ArrayList<>(history);
            next.remove(target);
            publish(next, "could not update backup history");
            AtomicFiles.deleteQuietly(artifactPath(id));
            log.info("backup " + id + " deleted");
            return target;
        });
    }

    @Override
    public List<BackupRecord> retentionPrune(RetentionPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        return lock.callExclusive(() -> {
            List<BackupRecord> expired = policy.expired(history, clock.instant());
            if (expired.isEmpty()) return List.of();
            List<BackupRecord> next = new ArrayList<>(history);
            next.removeAll(expired);
            publish(next, "could not update backup history during retention");
            for (BackupRecord r : expired) {
                AtomicFiles.deleteQuietly(artifactPath(r.id()));
            }
            log.info("retention pruned " + expired.size() + " backup(s)");
            return expired;
        });
    }

    @Override
    public List<BackupRecord> clear() {
        return lock.callExclusive(() -> {
            List<BackupRecord> removed = history;
            publish(List.of(), "could not clear backup history");
            for (BackupRecord r : removed) {
                AtomicFiles.deleteQuietly(artifactPath(r.id()));
            }
            log.info("cleared " + removed.size() + " backup(s)");
            return removed;
        });
    }

    @Override
    public MaintenanceLock lock() {
        return lock;
    }

    // ---------- internals ----------

    private void publish(List<BackupRecord> next, String failureMessage) {
        try {
            writeIndex(next);
        } catch (IOException e) {
            throw MaintenanceException.storageFailure(failureMessage, e);
        }
        history = List.copyOf(next);
    }

    private Path artifactPath(String id) {
        return artifacts.resolve(id + ".json");
    }

    private void writeIndex(List<BackupRecord> records) throws IOException {
        var file = new IndexFile();
        file.version = INDEX_VERSION;
        file.records = new ArrayList<>(records.size());
        for (BackupRecord r : records) {
            var e = new IndexEntry();
            e.id = r.id();
            e.filename = r.filename();
            e.sizeBytes = r.sizeBytes();
            e.source = r.source().wireName();
            e.createdBy = r.createdBy();
            e.createdAt = r.createdAt();
            file.records.add(e);
        }
        AtomicFiles.write(indexFile, json.writerWithDefaultPrettyPrinter().writeValueAsBytes(file));
    }

    private List<BackupRecord> loadIndex() throws IOException {
        if (!Files.exists(indexFile)) return List.of();
        IndexFile file;
        try {
            file = json.readValue(indexFile.toFile(), IndexFile.class);
        } catch (IOException e) {
            throw new IOException("backup history " + indexFile + " is unreadable", e);
        }
        List<BackupRecord> out = new ArrayList<>();
        if (file.records != null) {
            for (IndexEntry e : file.records) {
                out.add(new BackupRecord(e.id, e.filename, e.sizeBytes,
                        BackupSource.fromWire(e.source), e.createdBy, e.createdAt));
            }
        }
        out.sort(NEWEST_FIRST);
        return List.copyOf(out);
    }

    private void removeOrphans() throws IOException {
        Set<String> known = new HashSet<>();
        for (BackupRecord r : history) known.add(r.id() + ".json");
        try (Stream<Path> files = Files.list(artifacts)) {
            for (Path p : (Iterable<Path>) files::iterator) {
                if (!known.contains(p.getFileName().toString())) {
                    log.info("removing unpublished backup artifact " + p.getFileName());
                    Files.deleteIfExists(p);
                }
            }
        }
    }

    /** On-disk shape of history.json. */
    static final class IndexFile {
        public int version;
        public List<IndexEntry> records;
    }

    static final class IndexEntry {
        public String id;
        public String filename;
        public long sizeBytes;
        public String source;
        public String createdBy;
        public Instant createdAt;
    }
}
