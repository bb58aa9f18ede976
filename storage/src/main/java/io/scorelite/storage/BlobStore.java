package io.scorelite.storage;

import java.util.Optional;

/**
 * Binary content (page images, thumbnails) addressed by the SHA-256 hex of its bytes.
 * The versioning engine only stores and compares the returned references.
 */
public interface BlobStore {

    /** Store bytes if absent and return their stable reference. */
    String put(byte[] content);

    Optional<byte[]> get(String ref);
}
