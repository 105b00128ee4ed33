// file: storage/src/main/java/io/backlite/storage/FileCheckpointer.java
package io.backlite.storage;

import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * JSON checkpoints, one file per checkpoint: "checkpoint-&lt;20-digit millis&gt;.json".
 * <p>
 * Written with {@link AtomicFiles} (tmp + fsync + ATOMIC_MOVE). Once a new
 * checkpoint is in place every older one is deleted, so the directory holds at
 * most one complete checkpoint plus, after a crash, a stray temp file that is
 * swept on startup.
 */
public final class FileCheckpointer implements Checkpointer {
    private static final Logger log = Logger.getLogger(FileCheckpointer.class.getName());
    private static final String PREFIX = "checkpoint-";
    private static final String SUFFIX = ".json";
    private static final TypeReference<Map<String, List<Map<String, Object>>>> STATE_TYPE = new TypeReference<>() {};

    private final Path dir;
    private long lastStamp;

    public FileCheckpointer(Path dir) {
        this.dir = dir;
        try {
            Files.createDirectories(dir);
            int swept = AtomicFiles.sweepTemporaries(dir);
            if (swept > 0) log.info("removed " + swept + " incomplete checkpoint file(s)");
        } catch (IOException e) {
            throw new UncheckedIOException("could not prepare checkpoint directory " + dir, e);
        }
    }

    @Override
    public synchronized String write(Map<String, List<Map<String, Object>>> collections) {
        lastStamp = Math.max(lastStamp + 1, System.currentTimeMillis());
        String name = String.format("%s%020d%s", PREFIX, lastStamp, SUFFIX);
        Path dst = dir.resolve(name);
        try {
            AtomicFiles.write(dst, Mappers.json().writeValueAsBytes(new LinkedHashMap<>(collections)));
            for (Path old : checkpoints()) {
                if (!old.equals(dst)) Files.deleteIfExists(old);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("checkpoint write failed", e);
        }
        return name;
    }

    @Override
    public Loaded loadLatest() {
        List<Path> all = checkpoints();
        if (all.isEmpty()) return null;
        Path latest = all.get(all.size() - 1);
        try {
            Map<String, List<Map<String, Object>>> data = Mappers.json().readValue(latest.toFile(), STATE_TYPE);
            return new Loaded(latest.getFileName().toString(), data);
        } catch (IOException e) {
            throw new UncheckedIOException("checkpoint " + latest.getFileName() + " is unreadable", e);
        }
    }

    private List<Path> checkpoints() {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith(PREFIX) && n.endsWith(SUFFIX);
                    })
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("could not list checkpoints in " + dir, e);
        }
    }
}
