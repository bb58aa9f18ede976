// file: src/main/java/io/scorelite/core/ScoreId.java
package io.scorelite.core;

import java.util.Objects;

/**
 * Identity of a score: (owner, scoreName), unique together.
 * <p>
 * The owner is an opaque id handed to us by whoever authenticated the caller;
 * nothing in this code base interprets it.
 */
public record ScoreId(String owner, String scoreName) implements Comparable<ScoreId> {

    public ScoreId {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(scoreName, "scoreName");
        if (owner.isBlank()) throw new IllegalArgumentException("owner must not be blank");
        if (scoreName.isBlank()) throw new IllegalArgumentException("scoreName must not be blank");
        if (owner.contains("/")) throw new IllegalArgumentException("owner must not contain '/'");
        if (scoreName.contains("/")) throw new IllegalArgumentException("scoreName must not contain '/'");
    }

    public static ScoreId of(String owner, String scoreName) {
        return new ScoreId(owner, scoreName);
    }

    @Override
    public int compareTo(ScoreId o) {
        int c = owner.compareTo(o.owner);
        return c != 0 ? c : scoreName.compareTo(o.scoreName);
    }

    /** Rendered as {@code owner/scoreName}. */
    @Override
    public String toString() {
        return owner + "/" + scoreName;
    }
}
