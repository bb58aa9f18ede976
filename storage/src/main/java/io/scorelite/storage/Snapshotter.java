// file: src/main/java/io/scorelite/storage/Snapshotter.java
package io.scorelite.storage;

import io.scorelite.core.ScoreHead;
import io.scorelite.core.ScoreId;
import io.scorelite.core.ScoreObject;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is a full copy of the store state at some point in time, plus the
 * name of the first WAL segment written after it.
 * On restart:
 *  - we load the latest snapshot, then
 *  - replay WAL records from that segment on.
 */
public interface Snapshotter {

    /**
     * Persist a full copy of the current state.
     *
     * @return snapshot identifier (e.g., filename/path).
     */
    String writeSnapshot(State state);

    /** Load the latest snapshot if present, or null. */
    LoadedSnapshot loadLatest();

    /**
     * Full store state.
     *
     * @param walSegment first WAL segment not covered by this state
     * @param versions   score -> snapshot hashes, element i is version i + 1
     */
    record State(String walSegment,
                 Collection<ScoreObject> objects,
                 Map<ScoreId, ScoreHead> heads,
                 Map<ScoreId, List<String>> versions) {}

    /** Simple holder for snapshot id and its data */
    record LoadedSnapshot(String id, State state) {}
}
