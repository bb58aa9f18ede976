package io.scorelite.storage;

import io.scorelite.core.Page;
import io.scorelite.core.Property;
import io.scorelite.core.ScoreHead;
import io.scorelite.core.ScoreId;
import io.scorelite.core.Snapshot;
import io.scorelite.core.VersionEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Head + version writes of the durable store: one log record per commit,
 * all-or-nothing on append failure, deletion across restart.
 */
class DurableScoreStoreCommitTest {

    @TempDir Path walDir;
    @TempDir Path snapDir;

    private static final ScoreId ID = ScoreId.of("u1", "s1");

    /** FileWal that fails every append once armed. */
    static final class FailingWal implements Wal {
        private final FileWal delegate;
        volatile boolean failing;

        FailingWal(FileWal delegate) {
            this.delegate = delegate;
        }

        @Override
        public void append(byte[] serializedRecord) {
            if (failing) throw new UncheckedIOException(new IOException("disk full"));
            delegate.append(serializedRecord);
        }

        @Override public void rotateIfNeeded() { delegate.rotateIfNeeded(); }
        @Override public String rotate() { return delegate.rotate(); }
        @Override public WalReader openReader(String fromSegment) { return delegate.openReader(fromSegment); }
        @Override public void deleteSegmentsBefore(String segment) { delegate.deleteSegmentsBefore(segment); }
        @Override public void close() throws IOException { delegate.close(); }
    }

    private DurableScoreStore open(Wal wal) {
        return new DurableScoreStore(wal, new FileSnapshotter(snapDir), new SnapshotPolicy(50_000));
    }

    private DurableScoreStore reopen() {
        return open(new FileWal(walDir, 1L << 60));
    }

    private static ScoreHead create(DurableScoreStore store) {
        ScoreHead head = new ScoreHead(store.put(Snapshot.root()), store.put(Property.root("Sonata", null)));
        assertTrue(store.createIfAbsent(ID, head));
        return head;
    }

    private static List<VersionEntry> versions(RefStore refs) {
        List<VersionEntry> out = new ArrayList<>();
        refs.listVersions(ID).forEach(out::add);
        return out;
    }

    @Test
    void failed_commit_append_moves_neither_head_nor_versions() {
        var wal = new FailingWal(new FileWal(walDir, 1L << 60));
        var store = open(wal);
        ScoreHead root = create(store);
        String page = store.put(new Page("img", "th", "1"));
        String snap = store.put(new Snapshot(root.snapshotHash(), List.of(page)));
        ScoreHead next = root.withSnapshot(snap);

        wal.failing = true;
        assertThrows(UncheckedIOException.class, () -> store.advance(ID, root, next));

        assertEquals(root, store.get(ID).orElseThrow());
        assertTrue(versions(store).isEmpty());
        assertTrue(store.latestVersion(ID).isEmpty());

        // the same write against the same parent goes through once the disk recovers
        wal.failing = false;
        assertEquals(OptionalInt.of(1), store.advance(ID, root, next));
        assertEquals(next, store.get(ID).orElseThrow());
    }

    @Test
    void commit_survives_restart_with_head_and_version() {
        var store = reopen();
        ScoreHead root = create(store);
        String snap = store.put(new Snapshot(root.snapshotHash(), List.of(store.put(new Page("img", "th", "1")))));
        ScoreHead next = root.withSnapshot(snap);
        assertEquals(OptionalInt.of(1), store.advance(ID, root, next));

        var again = reopen();
        assertEquals(next, again.get(ID).orElseThrow());
        assertEquals(List.of(new VersionEntry(1, snap)), versions(again));
    }

    @Test
    void advance_from_stale_head_is_refused_and_not_logged() {
        var store = reopen();
        ScoreHead root = create(store);
        ScoreHead stale = root.withSnapshot("0".repeat(64));

        assertTrue(store.advance(ID, stale, root.withSnapshot("1".repeat(64))).isEmpty());
        assertTrue(store.advance(ScoreId.of("u1", "nobody"), root, root).isEmpty());

        var again = reopen();
        assertEquals(root, again.get(ID).orElseThrow());
        assertTrue(versions(again).isEmpty());
    }

    @Test
    void deleted_score_stays_deleted_and_starts_over_when_recreated() {
        var store = reopen();
        ScoreHead root = create(store);
        String snap = store.put(new Snapshot(root.snapshotHash(), List.of(store.put(new Page("img", "th", "1")))));
        ScoreHead v1 = root.withSnapshot(snap);
        store.advance(ID, root, v1);

        assertFalse(store.delete(ID, root), "delete checks the expected head");
        assertTrue(store.delete(ID, v1));
        assertTrue(store.get(ID).isEmpty());
        assertTrue(store.contains(snap), "objects outlive the score");

        var again = reopen();
        assertTrue(again.get(ID).isEmpty());
        assertTrue(versions(again).isEmpty());
        assertTrue(again.list("u1").isEmpty());

        ScoreHead recreated = create(again);
        assertEquals(OptionalInt.of(1), again.advance(ID, recreated, recreated.withSnapshot(snap)));
    }
}
