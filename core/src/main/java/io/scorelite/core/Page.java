// file: src/main/java/io/scorelite/core/Page.java
package io.scorelite.core;

import java.util.Objects;

/**
 * One page of a score.
 *
 * @param image     blob reference of the full-size image
 * @param thumbnail blob reference of the thumbnail
 * @param number    display label ("1", "iv", "12a" ...), not a position
 */
public record Page(String image, String thumbnail, String number) implements ScoreObject {

    public Page {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(thumbnail, "thumbnail");
        Objects.requireNonNull(number, "number");
    }

    @Override
    public ObjectKind kind() { return ObjectKind.PAGE; }
}
