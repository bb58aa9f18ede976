// file: src/main/java/io/scorelite/core/ScoreObject.java
package io.scorelite.core;

/**
 * Immutable object stored in the content object store.
 * <p>
 * Every implementation is a value: two instances with the same fields encode
 * to the same canonical bytes and therefore share a hash (see {@link ObjectCodec}).
 */
public sealed interface ScoreObject permits Page, Snapshot, Property, Annotation {

    ObjectKind kind();

    /** Content hash of this object, computed through the canonical codec. */
    default String hash() {
        return ContentHash.of(this);
    }
}
