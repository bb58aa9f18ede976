// file: src/main/java/io/scorelite/storage/HeadStore.java
package io.scorelite.storage;

import io.scorelite.core.ScoreHead;
import io.scorelite.core.ScoreId;

import java.util.List;
import java.util.Optional;

/**
 * Durable mapping ScoreId -> current pointers. The only mutable state of the system.
 * <p>
 * Updates go through compare-and-set only, so "read head, validate parent,
 * write new head" cannot silently overwrite a concurrent writer, even one
 * running in another process against the same store.
 */
public interface HeadStore {

    Optional<ScoreHead> get(ScoreId id);

    /** @return false if the score already has a head. */
    boolean createIfAbsent(ScoreId id, ScoreHead head);

    /**
     * Replace the head only if it currently equals {@code expected}.
     *
     * @return true if swapped, false if the current head differs (or is absent)
     */
    boolean compareAndSet(ScoreId id, ScoreHead expected, ScoreHead next);

    /** Scores of one owner, sorted by score name. */
    List<ScoreId> list(String owner);
}
