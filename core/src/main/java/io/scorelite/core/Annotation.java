// file: src/main/java/io/scorelite/core/Annotation.java
package io.scorelite.core;

import java.util.Objects;

/**
 * A free-text note attached to a score (rehearsal mark, fingering hint ...).
 * Annotations live in the snapshot next to the pages, so they are versioned
 * with them and edited behind the same parent check.
 */
public record Annotation(String content) implements ScoreObject {

    public Annotation {
        Objects.requireNonNull(content, "content");
    }

    @Override
    public ObjectKind kind() { return ObjectKind.ANNOTATION; }
}
