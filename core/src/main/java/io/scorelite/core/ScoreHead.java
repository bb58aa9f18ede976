package io.scorelite.core;

import java.util.Objects;

/**
 * The mutable "current" pointers of one score. Everything it names is immutable.
 * <p>
 * Value semantics matter: head stores compare-and-set on record equality.
 */
public record ScoreHead(String snapshotHash, String propertyHash) {

    public ScoreHead {
        Objects.requireNonNull(snapshotHash, "snapshotHash");
        Objects.requireNonNull(propertyHash, "propertyHash");
    }

    public ScoreHead withSnapshot(String hash) {
        return new ScoreHead(hash, propertyHash);
    }

    public ScoreHead withProperty(String hash) {
        return new ScoreHead(snapshotHash, hash);
    }
}
