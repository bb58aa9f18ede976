package io.scorelite.storage;

import io.scorelite.core.ContentHash;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileBlobStoreTest {

    @TempDir Path dir;

    @Test
    void reference_is_digest_of_content_and_survives_reopen() {
        byte[] png = "not-really-a-png".getBytes(StandardCharsets.UTF_8);
        var store = new FileBlobStore(dir);

        String ref = store.put(png);
        assertEquals(ContentHash.ofBytes(png), ref);
        assertEquals(ref, store.put(png.clone()), "same bytes, same reference");

        var reopened = new FileBlobStore(dir);
        assertArrayEquals(png, reopened.get(ref).orElseThrow());
    }

    @Test
    void unknown_or_malformed_reference_is_empty() {
        var store = new FileBlobStore(dir);
        assertTrue(store.get("0".repeat(64)).isEmpty());
        assertTrue(store.get("../../etc/passwd").isEmpty());
    }
}
