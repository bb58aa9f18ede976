// file: src/main/java/io/scorelite/core/Snapshot.java
package io.scorelite.core;

import java.util.List;
import java.util.Objects;

/**
 * The content of a score at one point in history ("head" object).
 * <p>
 * Invariants:
 *  - pages is an ordered sequence of page hashes; order is part of the hash.
 *  - the same page hash may appear more than once.
 *  - annotations is an ordered sequence of annotation hashes, same rules.
 *  - parent is the previous snapshot hash, or null for the root snapshot.
 */
public record Snapshot(String parent, List<String> pages, List<String> annotations) implements ScoreObject {

    public Snapshot {
        pages = List.copyOf(Objects.requireNonNull(pages, "pages"));
        annotations = List.copyOf(Objects.requireNonNull(annotations, "annotations"));
    }

    /** Snapshot without annotations. */
    public Snapshot(String parent, List<String> pages) {
        this(parent, pages, List.of());
    }

    /** Empty root snapshot created with a new score. */
    public static Snapshot root() {
        return new Snapshot(null, List.of(), List.of());
    }

    @Override
    public ObjectKind kind() { return ObjectKind.SNAPSHOT; }
}
