// file: src/main/java/io/scorelite/storage/SnapshotPolicy.java
package io.scorelite.storage;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Snapshot policy that triggers a full snapshot after every N logged mutations.
 * <p>
 * Bounds worst-case recovery time by limiting WAL replay length.
 * Does not consider file size or time.
 */
public final class SnapshotPolicy {
    private final int everyOps;
    private final AtomicInteger sinceLast = new AtomicInteger();

    public SnapshotPolicy(int everyOps) {
        if (everyOps <= 0) throw new IllegalArgumentException("everyOps must be > 0");
        this.everyOps = everyOps;
    }

    /**
     * Call after each durable write.
     *
     * @return true when the threshold is hit; the counter restarts at zero.
     */
    public boolean recordWrite() {
        if (sinceLast.incrementAndGet() >= everyOps) {
            sinceLast.set(0);
            return true;
        }
        return false;
    }
}
