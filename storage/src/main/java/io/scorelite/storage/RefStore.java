// file: src/main/java/io/scorelite/storage/RefStore.java
package io.scorelite.storage;

import io.scorelite.core.ScoreHead;
import io.scorelite.core.ScoreId;

import java.util.OptionalInt;

/**
 * Heads and versions of every score behind one store, so that a commit can
 * move the head and record its version as a single write.
 * <p>
 * Either both effects of {@link #advance} are visible, or neither is; a
 * failure (I/O, crash) leaves the previous head and version list in place.
 */
public interface RefStore extends HeadStore, VersionIndex {

    /**
     * Replace the head with {@code next} if it currently equals {@code expected}
     * and record {@code next.snapshotHash()} as the next version.
     *
     * @return the new version number, or empty if the current head differs (or is absent)
     */
    OptionalInt advance(ScoreId id, ScoreHead expected, ScoreHead next);

    /**
     * Remove the head and the version list of a score if the head currently
     * equals {@code expected}. Objects stay in the object store; a score created
     * again under the same id starts over at version {@link #BASE_VERSION}.
     *
     * @return false if the current head differs (or is absent)
     */
    boolean delete(ScoreId id, ScoreHead expected);
}
