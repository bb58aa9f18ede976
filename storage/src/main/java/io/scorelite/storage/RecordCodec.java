// file: src/main/java/io/scorelite/storage/RecordCodec.java
package io.scorelite.storage;

import io.scorelite.core.ObjectCodec;
import io.scorelite.core.ScoreHead;
import io.scorelite.core.ScoreId;
import io.scorelite.core.ScoreObject;
import io.scorelite.core.VersionEntry;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0x5C0E   (helps detect garbage)
 *     - version (1B)  = 1       (for future upgrades)
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes, little-endian)]
 *     - type: byte
 *     - OBJECT:  object bytes (int32 len + canonical encoding, see ObjectCodec)
 *     - HEAD:    owner, scoreName, snapshotHash, propertyHash (strings)
 *     - VERSION: owner, scoreName, version (int32), snapshotHash
 *     - COMMIT:  owner, scoreName, snapshotHash, propertyHash, version (int32);
 *                the new head and the version of its snapshot, applied together
 *     - DELETE:  owner, scoreName
 *   Strings are int32 len + UTF-8 bytes.
 * <p>
 * The header is validated by magic/version/length and CRC when reading.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0x5C0E;
    static final byte  VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    private static final byte TYPE_OBJECT = 1;
    private static final byte TYPE_HEAD = 2;
    private static final byte TYPE_VERSION = 3;
    private static final byte TYPE_COMMIT = 4;
    private static final byte TYPE_DELETE = 5;

    /** Decoded payload. */
    sealed interface LogRecord permits ObjectRecord, HeadRecord, VersionRecord, CommitRecord, DeleteRecord {}

    record ObjectRecord(ScoreObject object) implements LogRecord {}

    record HeadRecord(ScoreId id, ScoreHead head) implements LogRecord {}

    record VersionRecord(ScoreId id, VersionEntry entry) implements LogRecord {}

    record CommitRecord(ScoreId id, ScoreHead head, int version) implements LogRecord {
        VersionEntry entry() {
            return new VersionEntry(version, head.snapshotHash());
        }
    }

    record DeleteRecord(ScoreId id) implements LogRecord {}

    private RecordCodec() {
        // utility
    }

    static byte[] encodeObject(ScoreObject obj) {
        byte[] body = ObjectCodec.encode(obj);
        ByteBuffer b = payload(1 + 4 + body.length);
        b.put(TYPE_OBJECT);
        writeBytes(b, body);
        return frame(b.array());
    }

    static byte[] encodeHead(ScoreId id, ScoreHead head) {
        byte[][] s = utf8(id.owner(), id.scoreName(), head.snapshotHash(), head.propertyHash());
        ByteBuffer b = payload(1 + sizeOf(s));
        b.put(TYPE_HEAD);
        for (byte[] x : s) writeBytes(b, x);
        return frame(b.array());
    }

    static byte[] encodeVersion(ScoreId id, VersionEntry entry) {
        byte[][] s = utf8(id.owner(), id.scoreName(), entry.snapshotHash());
        ByteBuffer b = payload(1 + sizeOf(s) + 4);
        b.put(TYPE_VERSION);
        writeBytes(b, s[0]);
        writeBytes(b, s[1]);
        b.putInt(entry.version());
        writeBytes(b, s[2]);
        return frame(b.array());
    }

    static byte[] encodeCommit(ScoreId id, ScoreHead head, int version) {
        byte[][] s = utf8(id.owner(), id.scoreName(), head.snapshotHash(), head.propertyHash());
        ByteBuffer b = payload(1 + sizeOf(s) + 4);
        b.put(TYPE_COMMIT);
        for (byte[] x : s) writeBytes(b, x);
        b.putInt(version);
        return frame(b.array());
    }

    static byte[] encodeDelete(ScoreId id) {
        byte[][] s = utf8(id.owner(), id.scoreName());
        ByteBuffer b = payload(1 + sizeOf(s));
        b.put(TYPE_DELETE);
        for (byte[] x : s) writeBytes(b, x);
        return frame(b.array());
    }

    /** Decode a full payload (not including header). */
    static LogRecord decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        byte type = b.get();
        return switch (type) {
            case TYPE_OBJECT -> new ObjectRecord(ObjectCodec.decode(readBytes(b)));
            case TYPE_HEAD -> {
                ScoreId id = new ScoreId(readString(b), readString(b));
                yield new HeadRecord(id, new ScoreHead(readString(b), readString(b)));
            }
            case TYPE_VERSION -> {
                ScoreId id = new ScoreId(readString(b), readString(b));
                int version = b.getInt();
                yield new VersionRecord(id, new VersionEntry(version, readString(b)));
            }
            case TYPE_COMMIT -> {
                ScoreId id = new ScoreId(readString(b), readString(b));
                ScoreHead head = new ScoreHead(readString(b), readString(b));
                yield new CommitRecord(id, head, b.getInt());
            }
            case TYPE_DELETE -> new DeleteRecord(new ScoreId(readString(b), readString(b)));
            default -> throw new IllegalArgumentException("unknown record type: " + type);
        };
    }

    // ----------------- helpers -----------------

    /** Prefix a payload with its header. */
    private static byte[] frame(byte[] payload) {
        ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        header.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));

        byte[] out = new byte[HEADER_BYTES + payload.length];
        System.arraycopy(header.array(), 0, out, 0, HEADER_BYTES);
        System.arraycopy(payload, 0, out, HEADER_BYTES, payload.length);
        return out;
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue(); // CRC32 fits in unsigned int; Java int is fine for compare
    }

    private static ByteBuffer payload(int size) {
        return ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
    }

    private static byte[][] utf8(String... values) {
        byte[][] out = new byte[values.length][];
        for (int i = 0; i < values.length; i++) out[i] = values[i].getBytes(StandardCharsets.UTF_8);
        return out;
    }

    private static int sizeOf(byte[][] parts) {
        int size = 0;
        for (byte[] p : parts) size += 4 + p.length;
        return size;
    }

    private static void writeBytes(ByteBuffer b, byte[] data) {
        b.putInt(data.length).put(data);
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0 || len > b.remaining()) throw new IllegalArgumentException("bad length: " + len);
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }

    private static String readString(ByteBuffer b) {
        return new String(readBytes(b), StandardCharsets.UTF_8);
    }
}
