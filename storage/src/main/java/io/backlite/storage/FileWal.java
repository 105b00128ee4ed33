// file: storage/src/main/java/io/backlite/storage/FileWal.java
package io.backlite.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * Segmented, file-backed WAL.
 * <p>
 * Layout: one directory of segments named "00000001.log", "00000002.log", ...
 * Each segment is a sequence of frames produced by {@link WalRecordCodec}.
 * <p>
 * Properties:
 *  - On construction the newest segment is opened for append. A torn tail left
 *    by a crash is cut off first, so new records never land behind garbage.
 *  - append() writes the frame, then force(true). If the write fails the
 *    segment is truncated back to its previous length.
 *  - rotateIfNeeded() opens the next segment once the current one has grown
 *    past rotateBytes.
 *  - reset() deletes every segment and starts over with the next index; the
 *    datastore calls it only after a checkpoint covering everything.
 *  - The reader walks all segments in order and stops at the first frame that
 *    fails magic/version/length/CRC validation.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());
    private static final String SUFFIX = ".log";

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private int currentIndex;
    private long writtenInSegment;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("could not create WAL directory " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] serializedRecord) {
        long before = writtenInSegment;
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf, writtenInSegment + buf.position());
            }
            ch.force(true);
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            undoPartialWrite(before, e);
            throw new UncheckedIOException("WAL append failed", e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        try {
            ch.close();
            openSegment(currentIndex + 1);
        } catch (IOException e) {
            throw new UncheckedIOException("WAL rotation failed", e);
        }
    }

    @Override
    public synchronized void reset() {
        try {
            ch.close();
            int next = currentIndex + 1;
            for (Path seg : segments()) {
                Files.deleteIfExists(seg);
            }
            openSegment(next);
            log.fine(() -> "WAL reset, now writing segment " + segmentName(next));
        } catch (IOException e) {
            throw new UncheckedIOException("WAL reset failed", e);
        }
    }

    @Override
    public WalReader openReader() {
        return new Reader(segments());
    }

    @Override
    public synchronized void close() throws IOException {
        if (ch != null) ch.close();
    }

    private void openNewestOrCreate() {
        List<Path> existing = segments();
        int index = existing.isEmpty() ? 1 : indexOf(existing.get(existing.size() - 1));
        try {
            openSegment(index);
            long valid = validLength(ch);
            if (valid < ch.size()) {
                log.warning(String.format("WAL segment %s has a torn tail; truncating %d -> %d bytes",
                        segmentName(index), ch.size(), valid));
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
        } catch (IOException e) {
            throw new UncheckedIOException("could not open WAL segment", e);
        }
    }

    private void openSegment(int index) throws IOException {
        currentIndex = index;
        ch = FileChannel.open(dir.resolve(segmentName(index)), CREATE, WRITE, READ);
        writtenInSegment = ch.size();
    }

    private void undoPartialWrite(long before, IOException cause) {
        try {
            ch.truncate(before);
            ch.force(true);
        } catch (IOException again) {
            cause.addSuppressed(again);
            log.log(Level.SEVERE, "WAL could not roll back a failed append; segment may hold a torn record", again);
        }
    }

    private List<Path> segments() {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("could not list WAL segments in " + dir, e);
        }
    }

    private static String segmentName(int index) {
        return String.format("%08d%s", index, SUFFIX);
    }

    private static int indexOf(Path segment) {
        String name = segment.getFileName().toString();
        return Integer.parseInt(name.substring(0, name.length() - SUFFIX.length()));
    }

    /** Byte offset just past the last valid frame. */
    private static long validLength(FileChannel ch) throws IOException {
        long pos = 0;
        for (byte[] payload; (payload = readFrame(ch, pos)) != null; ) {
            pos += WalRecordCodec.HEADER_BYTES + payload.length;
        }
        return pos;
    }

    /** @return payload at {@code pos}, or null if the frame there is absent, truncated or corrupt */
    private static byte[] readFrame(FileChannel ch, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(WalRecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        int read = ch.read(hdr, pos);
        if (read < WalRecordCodec.HEADER_BYTES) return null;
        hdr.flip();
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != WalRecordCodec.MAGIC || ver != WalRecordCodec.VERSION || len < 0) return null;
        if (pos + WalRecordCodec.HEADER_BYTES + len > ch.size()) return null;
        ByteBuffer payload = ByteBuffer.allocate(len);
        long at = pos + WalRecordCodec.HEADER_BYTES;
        while (payload.hasRemaining()) {
            int n = ch.read(payload, at + payload.position());
            if (n < 0) return null;
        }
        byte[] bytes = payload.array();
        if (WalRecordCodec.crc32(bytes) != crc) return null;
        return bytes;
    }

    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segmentIdx = -1;
        private FileChannel ch;
        private long pos;
        private boolean stopped;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            if (stopped) return null;
            try {
                while (true) {
                    if (ch == null && !advance()) return null;
                    byte[] payload = readFrame(ch, pos);
                    if (payload != null) {
                        pos += WalRecordCodec.HEADER_BYTES + payload.length;
                        return payload;
                    }
                    if (pos < ch.size()) {
                        log.warning("WAL replay stopped at corrupt record in "
                                + segments.get(segmentIdx).getFileName() + " offset " + pos);
                        stopped = true;
                        return null;
                    }
                    ch.close();
                    ch = null;
                }
            } catch (IOException e) {
                throw new UncheckedIOException("WAL read failed", e);
            }
        }

        private boolean advance() throws IOException {
            segmentIdx++;
            if (segmentIdx >= segments.size()) return false;
            ch = FileChannel.open(segments.get(segmentIdx), READ);
            pos = 0;
            return true;
        }

        @Override
        public void close() throws IOException {
            if (ch != null) ch.close();
        }
    }
}
