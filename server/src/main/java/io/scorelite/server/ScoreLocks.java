// file: server/src/main/java/io/scorelite/server/ScoreLocks.java
package io.scorelite.server;

import io.scorelite.core.ScoreHistoryException.ConcurrencyConflict;
import io.scorelite.core.ScoreId;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Per-score write serialization.
 * <p>
 * Responsibilities:
 *  - One {@link ReentrantLock} per (owner, scoreName); writers to different
 *    scores never contend.
 *  - Bounded wait: a writer that cannot get the lock within the timeout fails
 *    with {@link ConcurrencyConflict} instead of queuing forever.
 * <p>
 * Readers never come here.
 */
public final class ScoreLocks {
    private static final Logger log = Logger.getLogger(ScoreLocks.class.getName());

    private final ConcurrentHashMap<ScoreId, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final long timeoutMillis;

    public ScoreLocks(long timeoutMillis) {
        if (timeoutMillis < 0) throw new IllegalArgumentException("timeoutMillis must be >= 0");
        this.timeoutMillis = timeoutMillis;
    }

    /** Run {@code action} while holding the write lock of {@code id}. */
    public <T> T withLock(ScoreId id, Supplier<T> action) {
        Objects.requireNonNull(id, "id");
        ReentrantLock lock = locks.computeIfAbsent(id, k -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = lock.tryLock(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrencyConflict("interrupted while waiting for " + id);
        }
        if (!acquired) {
            log.fine(() -> "lock timeout after " + timeoutMillis + "ms on " + id);
            throw new ConcurrencyConflict("score is busy: " + id);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
