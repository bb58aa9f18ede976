// file: src/main/java/io/scorelite/core/Property.java
package io.scorelite.core;

import java.util.Objects;

/**
 * Property record of a score (title, description), chained through its parent hash.
 * <p>
 * Both fields are optional. Two properties are "the same content" when
 * {@link #sameContent(Property)} holds, regardless of their parents.
 */
public record Property(String parent, String title, String description) implements ScoreObject {

    public static Property root(String title, String description) {
        return new Property(null, title, description);
    }

    @Override
    public ObjectKind kind() { return ObjectKind.PROPERTY; }

    /** Field-for-field comparison of title and description, ignoring the parent. */
    public boolean sameContent(Property other) {
        return Objects.equals(title, other.title) && Objects.equals(description, other.description);
    }

    /**
     * Merge a patch on top of this property: provided fields override, omitted
     * fields keep their current value. The result is chained to {@code parentHash}.
     */
    public Property merge(PropertyPatch patch, String parentHash) {
        return new Property(
                parentHash,
                patch.title() != null ? patch.title() : title,
                patch.description() != null ? patch.description() : description
        );
    }
}
