// file: src/main/java/io/scorelite/core/ContentHash.java
package io.scorelite.core;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * SHA-256 over canonical bytes, rendered as 64 lowercase hex characters.
 * <p>
 * The hex string is used as storage key and as the reference one object
 * holds to another (snapshot -> page, snapshot -> parent snapshot, ...).
 */
public final class ContentHash {
    public static final int HEX_LENGTH = 64;

    private static final Pattern HEX = Pattern.compile("[0-9a-f]{64}");
    private static final HexFormat FORMAT = HexFormat.of();

    private ContentHash() {
        // utility
    }

    /** Hash of an object's canonical encoding. */
    public static String of(ScoreObject obj) {
        return ofBytes(ObjectCodec.encode(obj));
    }

    /** Hash of arbitrary bytes (blob references use this too). */
    public static String ofBytes(byte[] bytes) {
        return FORMAT.formatHex(newDigest().digest(bytes));
    }

    public static boolean isValid(String hash) {
        return hash != null && HEX.matcher(hash).matches();
    }

    static MessageDigest newDigest() {
        try { return MessageDigest.getInstance("SHA-256"); }
        catch (NoSuchAlgorithmException e) { throw new IllegalStateException(e); }
    }
}
