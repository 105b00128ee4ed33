// file: storage/src/main/java/io/backlite/storage/AtomicFiles.java
package io.backlite.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * Write-then-rename helpers.
 * <p>
 * A file written through {@link #write(Path, byte[])} is either the complete new
 * content or the previous content: bytes go to "name.tmp" in the same directory,
 * are fsynced, then moved over the target with ATOMIC_MOVE.
 */
final class AtomicFiles {
    static final String TMP_SUFFIX = ".tmp";

    private static final Logger log = Logger.getLogger(AtomicFiles.class.getName());

    private AtomicFiles() {
    }

    static void write(Path target, byte[] bytes) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName().toString() + TMP_SUFFIX);
        try (FileChannel ch = FileChannel.open(tmp, CREATE, TRUNCATE_EXISTING, WRITE)) {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw e;
        }
        try {
            Files.move(tmp, target, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw e;
        }
    }

    /** Remove leftovers of interrupted writes. Returns how many were deleted. */
    static int sweepTemporaries(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) return 0;
        int removed = 0;
        try (Stream<Path> files = Files.list(dir)) {
            for (Path p : (Iterable<Path>) files::iterator) {
                if (p.getFileName().toString().endsWith(TMP_SUFFIX)) {
                    Files.deleteIfExists(p);
                    removed++;
                }
            }
        }
        return removed;
    }

    /** Best-effort delete for cleanup paths; a failure is logged, never thrown. */
    static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.log(Level.WARNING, "could not delete " + p, e);
        }
    }
}
