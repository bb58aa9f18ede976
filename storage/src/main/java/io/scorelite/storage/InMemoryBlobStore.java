package io.scorelite.storage;

import io.scorelite.core.ContentHash;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Blob store for tests and memory-only servers. */
public final class InMemoryBlobStore implements BlobStore {
    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();

    @Override
    public String put(byte[] content) {
        Objects.requireNonNull(content, "content");
        String ref = ContentHash.ofBytes(content);
        blobs.putIfAbsent(ref, Arrays.copyOf(content, content.length));
        return ref;
    }

    @Override
    public Optional<byte[]> get(String ref) {
        byte[] b = ref == null ? null : blobs.get(ref);
        return b == null ? Optional.empty() : Optional.of(Arrays.copyOf(b, b.length));
    }
}
