// file: src/main/java/io/scorelite/storage/VersionIndex.java
package io.scorelite.storage;

import io.scorelite.core.ScoreHistoryException.VersionNotFound;
import io.scorelite.core.ScoreId;
import io.scorelite.core.VersionEntry;

import java.util.OptionalInt;

/**
 * Append-only map (scoreId, version number) -> snapshot hash.
 * <p>
 * Version numbers start at {@link #BASE_VERSION}, grow by one, never repeat.
 */
public interface VersionIndex {

    int BASE_VERSION = 1;

    /**
     * Allocate the next version number (max + 1, or {@link #BASE_VERSION}) and
     * append the mapping. Concurrent callers for one score are serialized.
     */
    int recordVersion(ScoreId id, String snapshotHash);

    /**
     * @param label decimal version number
     * @throws VersionNotFound if the label is absent or not a number
     */
    String resolve(ScoreId id, String label);

    /**
     * Versions in ascending order. Lazy and restartable: every iterator()
     * starts from version 1 and sees the entries present at that moment.
     */
    Iterable<VersionEntry> listVersions(ScoreId id);

    OptionalInt latestVersion(ScoreId id);
}
