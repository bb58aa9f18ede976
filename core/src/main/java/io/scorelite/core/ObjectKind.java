package io.scorelite.core;

/**
 * Kinds of content-addressed objects. The tag is the first byte of the
 * canonical encoding, so two objects of different kinds never share a hash
 * even if their fields happen to encode identically.
 */
public enum ObjectKind {
    PAGE((byte) 1),
    SNAPSHOT((byte) 2),
    PROPERTY((byte) 3),
    ANNOTATION((byte) 4);

    private final byte tag;

    ObjectKind(byte tag) {
        this.tag = tag;
    }

    public byte tag() { return tag; }

    public static ObjectKind fromTag(byte tag) {
        for (ObjectKind k : values()) {
            if (k.tag == tag) return k;
        }
        throw new IllegalArgumentException("unknown object tag: " + tag);
    }
}
