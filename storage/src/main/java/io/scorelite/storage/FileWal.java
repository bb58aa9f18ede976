// file: src/main/java/io/scorelite/storage/FileWal.java
package io.scorelite.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;


/**
 * File-backed WAL that appends header+payload records to segment files.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - finds the newest segment (e.g. "00000001.log", "00000002.log", ...),
 *      - opens it for append.
 * <p>
 *  - append():
 *      - writes the bytes,
 *      - calls force(true) to fsync data and metadata,
 *      - tracks bytes written this segment.
 * <p>
 *  - rotateIfNeeded():
 *      - when written bytes >= rotateBytes, closes current segment and opens
 *        a new one with incremented index, resetting the counter.
 * <p>
 *  - Reader:
 *      - walks segments in name order from the requested one,
 *      - reads fixed-size header (11 bytes),
 *      - validates magic/version/length,
 *      - reads payload, validates CRC,
 *      - abandons a segment at its first truncated header/payload or bad CRC
 *        and moves on to the next one (a torn tail only ever ends a segment).
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
        try { Files.createDirectories(dir); } catch (IOException e) { throw new UncheckedIOException(e); }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] serializedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) ch.write(buf);
            ch.force(true); // fsync: metadata too, so new file appears durable after rotation
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            throw new UncheckedIOException("WAL append failed", e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        rotate();
    }

    @Override
    public synchronized String rotate() {
        try {
            ch.close();
            current = dir.resolve(segmentName(segmentIndex(current) + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
            return current.getFileName().toString();
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    @Override
    public WalReader openReader(String fromSegment) {
        List<Path> segs = segments().stream()
                .filter(p -> fromSegment == null || p.getFileName().toString().compareTo(fromSegment) >= 0)
                .toList();
        return new Reader(segs);
    }

    @Override
    public synchronized void deleteSegmentsBefore(String segment) {
        for (Path p : segments()) {
            if (p.getFileName().toString().compareTo(segment) < 0 && !p.equals(current)) {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    // an old segment that survives is only replayed again; the records are idempotent
                    log.warning("could not delete WAL segment " + p + ": " + e.getMessage());
                }
            }
        }
    }

    @Override
    public synchronized void close() throws IOException { if (ch != null) ch.close(); }

    /**
     * On startup:
     *  - If there are existing segments, open the newest one and position at the end.
     *  - If none, create "00000001.log".
     */
    private void openNewestOrCreate() {
        try {
            List<Path> segs = segments();
            current = segs.isEmpty() ? dir.resolve(segmentName(1)) : segs.get(segs.size() - 1);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = ch.size();
            ch.position(writtenInSegment);
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    private List<Path> segments() {
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .sorted()
                    .toList();
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    private static String segmentName(int index) {
        return String.format("%08d%s", index, SUFFIX);
    }

    private static int segmentIndex(Path seg) {
        return Integer.parseInt(seg.getFileName().toString().replace(SUFFIX, ""));
    }

    /**
     * Sequential reader over a fixed list of segments used during recovery.
     */
    private static final class Reader implements WalReader {
        private final List<Path> segs;
        private int segIdx = -1;
        private FileChannel ch;
        private long pos = 0;
        private boolean torn = false;

        Reader(List<Path> segs) {
            this.segs = segs;
        }

        @Override
        public byte[] next() {
            try {
                while (true) {
                    if (ch == null && !openNext()) return null;
                    ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
                    int read = ch.read(hdr, pos);
                    if (read <= 0) {                       // clean end of this segment
                        ch.close();
                        ch = null;
                        continue;
                    }
                    if (read < RecordCodec.HEADER_BYTES) { skipRest(); continue; } // truncated header at tail
                    hdr.flip();
                    short magic = hdr.getShort();
                    byte ver = hdr.get();
                    int len = hdr.getInt();
                    int crc = hdr.getInt();
                    if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) { skipRest(); continue; }
                    ByteBuffer payload = ByteBuffer.allocate(len);
                    int r2 = ch.read(payload, pos + RecordCodec.HEADER_BYTES);
                    if (r2 < len) { skipRest(); continue; } // truncated payload
                    byte[] bytes = payload.array();
                    if (RecordCodec.crc32(bytes) != crc) { skipRest(); continue; } // bad tail
                    pos += RecordCodec.HEADER_BYTES + len;
                    return bytes;
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        private boolean openNext() throws IOException {
            segIdx++;
            if (segIdx >= segs.size()) return false;
            ch = FileChannel.open(segs.get(segIdx), READ);
            pos = 0;
            return true;
        }

        private void skipRest() throws IOException {
            log.warning("ignoring torn WAL tail in " + segs.get(segIdx) + " at offset " + pos);
            torn = true;
            ch.close();
            ch = null;
        }

        @Override public boolean torn() { return torn; }

        @Override public void close() throws IOException { if (ch != null) ch.close(); }
    }
}
