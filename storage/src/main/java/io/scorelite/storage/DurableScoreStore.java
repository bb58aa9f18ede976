// file: src/main/java/io/scorelite/storage/DurableScoreStore.java
package io.scorelite.storage;

import io.scorelite.core.ScoreHead;
import io.scorelite.core.ScoreId;
import io.scorelite.core.ScoreObject;
import io.scorelite.core.VersionEntry;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Durable store for all three logical tables (objects, heads, versions) over one WAL.
 * <p>
 * Responsibilities:
 *  - Keep the live state in the in-memory stores (reads never touch disk or locks).
 *  - On write:
 *      1) Validate against memory (object absent, head CAS holds, ...).
 *      2) Serialize the mutation to a WAL record, append+fsync.
 *      3) Apply it to memory.
 *      4) Rotate WAL segment if needed.
 *      5) Possibly write a full snapshot and drop the segments it covers.
 * <p>
 *  - On startup:
 *      1) Load the latest snapshot (if any) into memory.
 *      2) Replay WAL records from the segment the snapshot names.
 * <p>
 * Replay is idempotent: objects are keyed by content, head records carry the
 * full new value, version records carry their number.
 * <p>
 * A commit is one COMMIT record holding the new head and its version number,
 * so a failed append leaves both the head and the version list untouched.
 */
public class DurableScoreStore implements ObjectStore, RefStore {
    private static final Logger log = Logger.getLogger(DurableScoreStore.class.getName());

    private final InMemoryObjectStore objects = new InMemoryObjectStore();
    private final InMemoryHeadStore heads = new InMemoryHeadStore();
    private final InMemoryVersionIndex versions = new InMemoryVersionIndex();

    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy snapPolicy;

    public DurableScoreStore(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.snaps = Objects.requireNonNull(snaps, "snaps");
        this.snapPolicy = Objects.requireNonNull(snapPolicy, "snapPolicy");
        recover();
    }

    // ---------------- objects ----------------

    @Override
    public synchronized String put(ScoreObject object) {
        String hash = object.hash();
        if (objects.contains(hash)) {
            return hash; // content already stored; nothing to log
        }
        wal.append(RecordCodec.encodeObject(object));
        objects.put(object);
        afterWrite();
        return hash;
    }

    @Override
    public Map<String, ScoreObject> getBatch(Set<String> hashes) {
        return objects.getBatch(hashes);
    }

    @Override
    public boolean contains(String hash) {
        return objects.contains(hash);
    }

    // ---------------- heads ----------------

    @Override
    public Optional<ScoreHead> get(ScoreId id) {
        return heads.get(id);
    }

    @Override
    public synchronized boolean createIfAbsent(ScoreId id, ScoreHead head) {
        if (heads.get(id).isPresent()) return false;
        wal.append(RecordCodec.encodeHead(id, head));
        heads.restore(id, head);
        afterWrite();
        return true;
    }

    @Override
    public synchronized boolean compareAndSet(ScoreId id, ScoreHead expected, ScoreHead next) {
        Optional<ScoreHead> current = heads.get(id);
        if (current.isEmpty() || !current.get().equals(expected)) return false;
        wal.append(RecordCodec.encodeHead(id, next));
        heads.restore(id, next);
        afterWrite();
        return true;
    }

    @Override
    public synchronized OptionalInt advance(ScoreId id, ScoreHead expected, ScoreHead next) {
        Optional<ScoreHead> current = heads.get(id);
        if (current.isEmpty() || !current.get().equals(expected)) return OptionalInt.empty();
        int version = versions.latestVersion(id).orElse(BASE_VERSION - 1) + 1;
        wal.append(RecordCodec.encodeCommit(id, next, version));
        versions.restore(id, new VersionEntry(version, next.snapshotHash()));
        heads.restore(id, next);
        afterWrite();
        return OptionalInt.of(version);
    }

    @Override
    public synchronized boolean delete(ScoreId id, ScoreHead expected) {
        Optional<ScoreHead> current = heads.get(id);
        if (current.isEmpty() || !current.get().equals(expected)) return false;
        wal.append(RecordCodec.encodeDelete(id));
        versions.drop(id);
        heads.drop(id);
        afterWrite();
        return true;
    }

    @Override
    public List<ScoreId> list(String owner) {
        return heads.list(owner);
    }

    // ---------------- versions ----------------

    @Override
    public synchronized int recordVersion(ScoreId id, String snapshotHash) {
        int next = versions.latestVersion(id).orElse(BASE_VERSION - 1) + 1;
        VersionEntry entry = new VersionEntry(next, snapshotHash);
        wal.append(RecordCodec.encodeVersion(id, entry));
        versions.restore(id, entry);
        afterWrite();
        return next;
    }

    @Override
    public String resolve(ScoreId id, String label) {
        return versions.resolve(id, label);
    }

    @Override
    public Iterable<VersionEntry> listVersions(ScoreId id) {
        return versions.listVersions(id);
    }

    @Override
    public OptionalInt latestVersion(ScoreId id) {
        return versions.latestVersion(id);
    }

    /** Force a snapshot now, regardless of the policy. */
    public synchronized String snapshotNow() {
        String segment = wal.rotate();
        String id = snaps.writeSnapshot(new Snapshotter.State(
                segment, objects.view().values(), heads.view(), versions.view()));
        wal.deleteSegmentsBefore(segment);
        log.info("wrote snapshot " + id + " (replay from " + segment + ")");
        return id;
    }

    // ---------------- internals ----------------

    private void afterWrite() {
        wal.rotateIfNeeded();
        if (snapPolicy.recordWrite()) {
            snapshotNow();
        }
    }

    /**
     * Recovery procedure called from constructor:
     *  1) Seed memory from the latest snapshot (if present).
     *  2) Replay WAL records in order from the snapshot's segment.
     */
    private void recover() {
        String fromSegment = null;
        Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
        if (loaded != null) {
            Snapshotter.State s = loaded.state();
            s.objects().forEach(objects::put);
            s.heads().forEach(heads::restore);
            s.versions().forEach((id, hashes) -> {
                for (int i = 0; i < hashes.size(); i++) {
                    versions.restore(id, new VersionEntry(i + BASE_VERSION, hashes.get(i)));
                }
            });
            fromSegment = s.walSegment();
            log.info("loaded snapshot " + loaded.id() + ": " + objects.size() + " objects, "
                    + s.heads().size() + " scores");
        }

        int replayed = 0;
        boolean torn;
        try (Wal.WalReader r = wal.openReader(fromSegment)) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                apply(RecordCodec.decode(payload));
                replayed++;
            }
            torn = r.torn();
        } catch (Exception e) {
            throw new IllegalStateException("Recovery failed", e);
        }
        if (torn) {
            // new records must not land behind the garbage in the current segment
            wal.rotate();
        }
        log.info("replayed " + replayed + " WAL records");
    }

    private void apply(RecordCodec.LogRecord rec) {
        if (rec instanceof RecordCodec.ObjectRecord o) {
            objects.put(o.object());
        } else if (rec instanceof RecordCodec.HeadRecord h) {
            heads.restore(h.id(), h.head());
        } else if (rec instanceof RecordCodec.VersionRecord v) {
            versions.restore(v.id(), v.entry());
        } else if (rec instanceof RecordCodec.CommitRecord c) {
            versions.restore(c.id(), c.entry());
            heads.restore(c.id(), c.head());
        } else if (rec instanceof RecordCodec.DeleteRecord d) {
            versions.drop(d.id());
            heads.drop(d.id());
        } else {
            throw new IllegalStateException("Unknown record type: " + rec);
        }
    }
}
