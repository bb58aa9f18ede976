// file: src/main/java/io/scorelite/storage/InMemoryRefStore.java
package io.scorelite.storage;

import io.scorelite.core.ScoreHead;
import io.scorelite.core.ScoreId;
import io.scorelite.core.VersionEntry;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Heads and versions kept in memory.
 * <p>
 * Writes take this store's monitor, so the head swap and the version append of
 * {@link #advance} happen as one step for every other writer. Reads stay
 * lock-free; the version is appended before the head moves, so a reader that
 * sees a new head also finds its version.
 */
public final class InMemoryRefStore implements RefStore {
    private final InMemoryHeadStore heads = new InMemoryHeadStore();
    private final InMemoryVersionIndex versions = new InMemoryVersionIndex();

    @Override
    public Optional<ScoreHead> get(ScoreId id) {
        return heads.get(id);
    }

    @Override
    public synchronized boolean createIfAbsent(ScoreId id, ScoreHead head) {
        return heads.createIfAbsent(id, head);
    }

    @Override
    public synchronized boolean compareAndSet(ScoreId id, ScoreHead expected, ScoreHead next) {
        return heads.compareAndSet(id, expected, next);
    }

    @Override
    public synchronized OptionalInt advance(ScoreId id, ScoreHead expected, ScoreHead next) {
        Objects.requireNonNull(expected, "expected");
        Objects.requireNonNull(next, "next");
        if (!expected.equals(heads.get(id).orElse(null))) return OptionalInt.empty();
        int version = versions.recordVersion(id, next.snapshotHash());
        heads.restore(id, next);
        return OptionalInt.of(version);
    }

    @Override
    public synchronized boolean delete(ScoreId id, ScoreHead expected) {
        Objects.requireNonNull(expected, "expected");
        if (!expected.equals(heads.get(id).orElse(null))) return false;
        heads.drop(id);
        versions.drop(id);
        return true;
    }

    @Override
    public List<ScoreId> list(String owner) {
        return heads.list(owner);
    }

    @Override
    public synchronized int recordVersion(ScoreId id, String snapshotHash) {
        return versions.recordVersion(id, snapshotHash);
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
}
