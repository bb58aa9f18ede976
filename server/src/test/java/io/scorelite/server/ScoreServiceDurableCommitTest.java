package io.scorelite.server;

import io.scorelite.core.CommitOperation;
import io.scorelite.core.CommitRequest;
import io.scorelite.core.ScoreHistoryException.ConcurrencyConflict;
import io.scorelite.core.ScoreId;
import io.scorelite.storage.DurableScoreStore;
import io.scorelite.storage.FileSnapshotter;
import io.scorelite.storage.FileWal;
import io.scorelite.storage.SnapshotPolicy;
import io.scorelite.storage.Wal;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Commit path over the durable store when the log fails mid-commit.
 */
class ScoreServiceDurableCommitTest {

    private static final ScoreId ID = ScoreId.of("u1", "s1");

    @TempDir Path walDir;
    @TempDir Path snapDir;

    /** FileWal that lets a budget of appends through, then fails until the budget is reset. */
    static final class FlakyWal implements Wal {
        private final FileWal delegate;
        private final AtomicInteger budget = new AtomicInteger(Integer.MAX_VALUE);

        FlakyWal(FileWal delegate) {
            this.delegate = delegate;
        }

        void failAfter(int appends) { budget.set(appends); }

        void heal() { budget.set(Integer.MAX_VALUE); }

        @Override
        public void append(byte[] serializedRecord) {
            if (budget.getAndDecrement() <= 0) throw new UncheckedIOException(new IOException("disk full"));
            delegate.append(serializedRecord);
        }

        @Override public void rotateIfNeeded() { delegate.rotateIfNeeded(); }
        @Override public String rotate() { return delegate.rotate(); }
        @Override public WalReader openReader(String fromSegment) { return delegate.openReader(fromSegment); }
        @Override public void deleteSegmentsBefore(String segment) { delegate.deleteSegmentsBefore(segment); }
        @Override public void close() throws IOException { delegate.close(); }
    }

    private ScoreService service(DurableScoreStore store) {
        var locks = new ScoreLocks(2_000);
        return new ScoreService(store, store, locks, new PropertyService(store, store, locks), 16);
    }

    private DurableScoreStore open(Wal wal) {
        return new DurableScoreStore(wal, new FileSnapshotter(snapDir), new SnapshotPolicy(50_000));
    }

    @Test
    void commit_that_fails_to_log_leaves_head_and_versions_unchanged() {
        var wal = new FlakyWal(new FileWal(walDir, 1L << 60));
        var scores = service(open(wal));
        String root = scores.createScore(ID, "Sonata", null).headHash();
        var batch = CommitRequest.of(root, List.of(CommitOperation.addPage("img", "th", "1")));

        // page and snapshot objects reach the log, the head + version record does not
        wal.failAfter(2);
        assertThrows(UncheckedIOException.class, () -> scores.commit(ID, batch));

        var detail = scores.getScore(ID);
        assertEquals(root, detail.headHash());
        assertTrue(detail.versions().isEmpty());
        assertTrue(scores.getLatestPages(ID).isEmpty());

        // the caller was told the commit failed, so retrying on the same parent must work
        wal.heal();
        var r = scores.commit(ID, batch);
        assertEquals(1, r.version());
        assertThrows(ConcurrencyConflict.class, () -> scores.commit(ID, batch));

        var restarted = service(open(new FileWal(walDir, 1L << 60)));
        var after = restarted.getScore(ID);
        assertEquals(r.snapshotHash(), after.headHash());
        assertEquals(List.of("1"), after.versions());
    }
}
