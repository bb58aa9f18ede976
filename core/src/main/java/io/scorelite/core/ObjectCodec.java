// file: src/main/java/io/scorelite/core/ObjectCodec.java
package io.scorelite.core;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical binary encoding of {@link ScoreObject}s.
 * <p>
 * Layout (big-endian):
 *   - tag:    1 byte, {@link ObjectKind#tag()}
 *   - fields: in a fixed per-kind order
 *       PAGE:       image, thumbnail, number
 *       SNAPSHOT:   parent, pageCount (int32), pageCount x page hash,
 *                   annotationCount (int32), annotationCount x annotation hash
 *       PROPERTY:   parent, title, description
 *       ANNOTATION: content
 * <p>
 * Strings are int32 length + UTF-8 bytes; an absent optional string is length -1.
 * The encoding is used both as hash input and as the stored form in the log,
 * so every path that hashes an object goes through {@link #encode(ScoreObject)}.
 */
public final class ObjectCodec {

    private ObjectCodec() {
        // utility
    }

    public static byte[] encode(ScoreObject obj) {
        // a COUNT part is written as the int32 size of the list that follows it
        List<byte[]> parts = new ArrayList<>();
        List<Integer> counts = new ArrayList<>();
        int size = 1;
        if (obj instanceof Page p) {
            size += add(parts, p.image());
            size += add(parts, p.thumbnail());
            size += add(parts, p.number());
        } else if (obj instanceof Snapshot s) {
            size += add(parts, s.parent());
            size += addList(parts, counts, s.pages());
            size += addList(parts, counts, s.annotations());
        } else if (obj instanceof Property p) {
            size += add(parts, p.parent());
            size += add(parts, p.title());
            size += add(parts, p.description());
        } else if (obj instanceof Annotation a) {
            size += add(parts, a.content());
        } else {
            throw new IllegalStateException("Unknown object type: " + obj);
        }

        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.BIG_ENDIAN);
        b.put(obj.kind().tag());
        int list = 0;
        for (byte[] part : parts) {
            if (part == COUNT) {
                b.putInt(counts.get(list++));
            } else {
                writeBytes(b, part);
            }
        }
        return b.array();
    }

    public static ScoreObject decode(byte[] bytes) {
        ByteBuffer b = ByteBuffer.wrap(bytes).order(ByteOrder.BIG_ENDIAN);
        ObjectKind kind = ObjectKind.fromTag(b.get());
        ScoreObject out = switch (kind) {
            case PAGE -> new Page(readRequired(b), readRequired(b), readRequired(b));
            case SNAPSHOT -> {
                String parent = readString(b);
                List<String> pages = readList(b);
                List<String> annotations = readList(b);
                yield new Snapshot(parent, pages, annotations);
            }
            case PROPERTY -> new Property(readString(b), readString(b), readString(b));
            case ANNOTATION -> new Annotation(readRequired(b));
        };
        if (b.hasRemaining()) {
            throw new IllegalArgumentException("trailing bytes after " + kind);
        }
        return out;
    }

    // ----------------- helpers -----------------

    private static final byte[] COUNT = new byte[0];

    private static int addList(List<byte[]> parts, List<Integer> counts, List<String> values) {
        parts.add(COUNT);
        counts.add(values.size());
        int size = 4;
        for (String v : values) size += add(parts, v);
        return size;
    }

    private static int add(List<byte[]> parts, String s) {
        byte[] bytes = s == null ? null : s.getBytes(StandardCharsets.UTF_8);
        parts.add(bytes);
        return 4 + (bytes == null ? 0 : bytes.length);
    }

    private static void writeBytes(ByteBuffer b, byte[] data) {
        if (data == null) { b.putInt(-1); return; }
        b.putInt(data.length).put(data);
    }

    private static String readString(ByteBuffer b) {
        int len = b.getInt();
        if (len == -1) return null;
        if (len < 0 || len > b.remaining()) throw new IllegalArgumentException("bad string length: " + len);
        byte[] out = new byte[len];
        b.get(out);
        return new String(out, StandardCharsets.UTF_8);
    }

    private static List<String> readList(ByteBuffer b) {
        int count = b.getInt();
        if (count < 0 || count > b.remaining() / 4) throw new IllegalArgumentException("bad list count: " + count);
        List<String> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) out.add(readRequired(b));
        return out;
    }

    private static String readRequired(ByteBuffer b) {
        String s = readString(b);
        if (s == null) throw new IllegalArgumentException("required field is absent");
        return s;
    }
}
