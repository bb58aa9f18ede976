package io.scorelite.core;

import java.util.Objects;

/**
 * Durable, numbered alias for a historical snapshot hash.
 */
public record VersionEntry(int version, String snapshotHash) {

    public VersionEntry {
        if (version < 1) throw new IllegalArgumentException("version must be >= 1");
        Objects.requireNonNull(snapshotHash, "snapshotHash");
    }

    /** Human-facing label: the stringified version number. */
    public String label() {
        return Integer.toString(version);
    }
}
