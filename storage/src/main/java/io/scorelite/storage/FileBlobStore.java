// file: src/main/java/io/scorelite/storage/FileBlobStore.java
package io.scorelite.storage;

import io.scorelite.core.ContentHash;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * One file per blob, named by the SHA-256 hex of its bytes and fanned out by
 * the first two hex characters ("ab/abcdef...").
 * <p>
 * Atomicity:
 *   - bytes go to "<ref>.tmp" first,
 *   - then move to "<ref>" using ATOMIC_MOVE.
 * A reader therefore sees either no file or the complete blob.
 */
public final class FileBlobStore implements BlobStore {
    private final Path dir;

    public FileBlobStore(Path dir) {
        this.dir = dir;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    @Override
    public String put(byte[] content) {
        String ref = ContentHash.ofBytes(content);
        Path dst = pathFor(ref);
        if (Files.exists(dst)) return ref;

        try {
            Files.createDirectories(dst.getParent());
            Path tmp = Files.createTempFile(dst.getParent(), ref, ".tmp");
            Files.write(tmp, content, StandardOpenOption.TRUNCATE_EXISTING);
            try {
                Files.move(tmp, dst, ATOMIC_MOVE);
            } catch (FileAlreadyExistsException raced) {
                // same content written by someone else first
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("blob write failed: " + ref, e);
        }
        return ref;
    }

    @Override
    public Optional<byte[]> get(String ref) {
        if (!ContentHash.isValid(ref)) return Optional.empty();
        Path p = pathFor(ref);
        if (!Files.exists(p)) return Optional.empty();
        try {
            return Optional.of(Files.readAllBytes(p));
        } catch (IOException e) {
            throw new UncheckedIOException("blob read failed: " + ref, e);
        }
    }

    private Path pathFor(String ref) {
        return dir.resolve(ref.substring(0, 2)).resolve(ref);
    }
}
