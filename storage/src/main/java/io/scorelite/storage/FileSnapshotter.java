// file: src/main/java/io/scorelite/storage/FileSnapshotter.java
package io.scorelite.storage;

import io.scorelite.core.ObjectCodec;
import io.scorelite.core.ScoreHead;
import io.scorelite.core.ScoreId;
import io.scorelite.core.ScoreObject;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Binary snapshot implementation backed by a single file per snapshot.
 * <p>
 * Format:
 *   walSegment:   string
 *   objectCount:  int32, then per object: int32 len + canonical bytes
 *   headCount:    int32, then per head: owner, scoreName, snapshotHash, propertyHash
 *   scoreCount:   int32, then per score: owner, scoreName,
 *                 int32 n, n x snapshotHash (version 1..n)
 *   strings are int32 len + UTF-8 bytes
 * <p>
 * Atomicity:
 *   - We write to "snapshot-<segment>.bin.tmp" first,
 *   - then move to "snapshot-<segment>.bin" using ATOMIC_MOVE.
 */
public final class FileSnapshotter implements Snapshotter {
    private final Path dir;

    public FileSnapshotter(Path dir) {
        this.dir = dir;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    @Override
    public String writeSnapshot(State state) {
        // named after the segment it precedes, so lexical order is creation order
        String name = "snapshot-" + state.walSegment().replace(".log", "") + ".bin";
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (var out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)))) {
            writeString(out, state.walSegment());

            out.writeInt(state.objects().size());
            for (ScoreObject obj : state.objects()) {
                byte[] b = ObjectCodec.encode(obj);
                out.writeInt(b.length);
                out.write(b);
            }

            out.writeInt(state.heads().size());
            for (Map.Entry<ScoreId, ScoreHead> e : state.heads().entrySet()) {
                writeString(out, e.getKey().owner());
                writeString(out, e.getKey().scoreName());
                writeString(out, e.getValue().snapshotHash());
                writeString(out, e.getValue().propertyHash());
            }

            out.writeInt(state.versions().size());
            for (Map.Entry<ScoreId, List<String>> e : state.versions().entrySet()) {
                writeString(out, e.getKey().owner());
                writeString(out, e.getKey().scoreName());
                out.writeInt(e.getValue().size());
                for (String h : e.getValue()) writeString(out, h);
            }
        } catch (IOException ex) { throw new UncheckedIOException(ex); }

        try { Files.move(tmp, dst, ATOMIC_MOVE); }
        catch (IOException e) { throw new UncheckedIOException(e); }

        deleteOlderThan(name);
        return dst.getFileName().toString();
    }

    @Override
    public LoadedSnapshot loadLatest() {
        Path snap;
        try (Stream<Path> files = Files.list(dir)) {
            snap = files
                    .filter(p -> p.getFileName().toString().startsWith("snapshot-"))
                    .filter(p -> p.getFileName().toString().endsWith(".bin"))
                    .sorted()
                    .reduce((a, b) -> b)
                    .orElse(null);
        } catch (IOException e) { throw new UncheckedIOException(e); }

        if (snap == null) return null;

        try (var in = new DataInputStream(new BufferedInputStream(Files.newInputStream(snap)))) {
            String walSegment = readString(in);

            int objectCount = in.readInt();
            List<ScoreObject> objects = new ArrayList<>(objectCount);
            for (int i = 0; i < objectCount; i++) {
                objects.add(ObjectCodec.decode(in.readNBytes(in.readInt())));
            }

            int headCount = in.readInt();
            Map<ScoreId, ScoreHead> heads = new HashMap<>(headCount * 2);
            for (int i = 0; i < headCount; i++) {
                ScoreId id = new ScoreId(readString(in), readString(in));
                heads.put(id, new ScoreHead(readString(in), readString(in)));
            }

            int scoreCount = in.readInt();
            Map<ScoreId, List<String>> versions = new HashMap<>(scoreCount * 2);
            for (int i = 0; i < scoreCount; i++) {
                ScoreId id = new ScoreId(readString(in), readString(in));
                int n = in.readInt();
                List<String> hashes = new ArrayList<>(n);
                for (int j = 0; j < n; j++) hashes.add(readString(in));
                versions.put(id, hashes);
            }
            return new LoadedSnapshot(snap.getFileName().toString(),
                    new State(walSegment, objects, heads, versions));
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    private void deleteOlderThan(String name) {
        try (Stream<Path> files = Files.list(dir)) {
            for (Path p : files.toList()) {
                String n = p.getFileName().toString();
                if (n.startsWith("snapshot-") && n.endsWith(".bin") && n.compareTo(name) < 0) {
                    Files.deleteIfExists(p);
                }
            }
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    private static void writeString(DataOutputStream out, String s) throws IOException {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(b.length);
        out.write(b);
    }

    private static String readString(DataInputStream in) throws IOException {
        int len = in.readInt();
        byte[] b = in.readNBytes(len);
        return new String(b, StandardCharsets.UTF_8);
    }
}
