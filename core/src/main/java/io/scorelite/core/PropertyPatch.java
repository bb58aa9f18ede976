package io.scorelite.core;

/**
 * Partial property update. A null field means "not provided": it keeps the prior value.
 */
public record PropertyPatch(String title, String description) {

    public static PropertyPatch empty() {
        return new PropertyPatch(null, null);
    }

    public boolean isEmpty() {
        return title == null && description == null;
    }

    /** Later patch wins field by field. */
    public PropertyPatch then(PropertyPatch later) {
        return new PropertyPatch(
                later.title != null ? later.title : title,
                later.description != null ? later.description : description
        );
    }
}
