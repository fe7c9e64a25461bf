// file: src/main/java/io/envkeeper/storage/FileWal.java
package io.envkeeper.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL that appends framed records to numbered segment files
 * ("00000001.log", "00000002.log", ...).
 * <p>
 * Properties:
 *  - On construction it creates the directory, opens the newest segment and
 *    cuts off a torn tail left by a crash, so later appends are never hidden
 *    behind garbage.
 *  - append() writes and force(true)s.
 *  - rotateIfNeeded() moves to the next segment once rotateBytes were written.
 *  - compact() moves to the next segment and deletes all older ones.
 *  - The reader walks all segments in order and stops at the first bad record.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());
    private static final String SUFFIX = ".log";

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] framedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(framedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
            writtenInSegment += framedRecord.length;
        } catch (IOException e) {
            throw new UncheckedIOException("WAL append failed in " + current, e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        openNext();
    }

    @Override
    public synchronized void compact() {
        Path keep = openNext();
        for (Path seg : segments(dir)) {
            if (seg.equals(keep)) continue;
            try {
                Files.deleteIfExists(seg);
            } catch (IOException e) {
                throw new UncheckedIOException("failed to delete WAL segment " + seg, e);
            }
        }
    }

    @Override
    public WalReader openReader() {
        return new Reader(segments(dir));
    }

    @Override
    public synchronized void close() {
        try {
            if (ch != null && ch.isOpen()) ch.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Path openNext() {
        try {
            ch.close();
            int idx = indexOf(current) + 1;
            current = dir.resolve(String.format("%08d%s", idx, SUFFIX));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
            return current;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void openNewestOrCreate() {
        List<Path> segs = segments(dir);
        current = segs.isEmpty() ? dir.resolve("00000001" + SUFFIX) : segs.get(segs.size() - 1);
        try {
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            long valid = validLength(ch);
            if (valid < ch.size()) {
                log.warning(() -> "truncating torn tail of " + current + " at byte " + valid);
                ch.truncate(valid);
            }
            writtenInSegment = valid;
            ch.position(valid);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Length of the prefix of a segment made only of complete, CRC-valid records. */
    private static long validLength(FileChannel ch) throws IOException {
        long pos = 0;
        while (true) {
            byte[] rec = readRecord(ch, pos);
            if (rec == null) return pos;
            pos += RecordCodec.HEADER_BYTES + rec.length;
        }
    }

    /** Read one record at {@code pos}; null on EOF, short read, bad header or bad CRC. */
    private static byte[] readRecord(FileChannel ch, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        int read = ch.read(hdr, pos);
        if (read < RecordCodec.HEADER_BYTES) return null;
        hdr.flip();
        RecordCodec.Header h = RecordCodec.readHeader(hdr);
        if (h == null) return null;
        if (pos + RecordCodec.HEADER_BYTES + h.length() > ch.size()) return null;
        ByteBuffer payload = ByteBuffer.allocate(h.length());
        long at = pos + RecordCodec.HEADER_BYTES;
        while (payload.hasRemaining()) {
            int r = ch.read(payload, at + payload.position());
            if (r <= 0) return null;
        }
        byte[] bytes = payload.array();
        if (RecordCodec.crc32(bytes) != h.crc()) return null;
        return bytes;
    }

    private static int indexOf(Path segment) {
        String name = segment.getFileName().toString();
        return Integer.parseInt(name.substring(0, name.length() - SUFFIX.length()));
    }

    private static List<Path> segments(Path dir) {
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Sequential reader across segments, used during recovery. */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segIdx = -1;
        private FileChannel ch;
        private long pos;
        private boolean done;

        Reader(List<Path> segments) {
            this.segments = new ArrayList<>(segments);
        }

        @Override
        public byte[] next() {
            if (done) return null;
            try {
                while (true) {
                    if (ch == null) {
                        if (++segIdx >= segments.size()) {
                            done = true;
                            return null;
                        }
                        ch = FileChannel.open(segments.get(segIdx), READ);
                        pos = 0;
                    }
                    if (pos >= ch.size()) {
                        ch.close();
                        ch = null;
                        continue;
                    }
                    byte[] rec = readRecord(ch, pos);
                    if (rec == null) {
                        // corrupt or torn: nothing after this point is trusted
                        done = true;
                        return null;
                    }
                    pos += RecordCodec.HEADER_BYTES + rec.length;
                    return rec;
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        @Override
        public void close() {
            try {
                if (ch != null) ch.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
