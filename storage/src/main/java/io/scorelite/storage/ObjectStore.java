// file: src/main/java/io/scorelite/storage/ObjectStore.java
package io.scorelite.storage;

import io.scorelite.core.Annotation;
import io.scorelite.core.Page;
import io.scorelite.core.Property;
import io.scorelite.core.ScoreHistoryException.ObjectNotFound;
import io.scorelite.core.ScoreObject;
import io.scorelite.core.Snapshot;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Content object store: hash -> immutable object.
 * <p>
 * Semantics:
 *  - put() computes the canonical hash and stores the object if absent. Storing
 *    the same content again is a no-op, so put() may be retried freely.
 *  - getBatch() is all-or-nothing: if any hash is absent it throws
 *    {@link ObjectNotFound} listing the missing subset.
 *  - Objects are never mutated or deleted once written.
 */
public interface ObjectStore {

    /** Store the object if absent and return its hash. */
    String put(ScoreObject object);

    /** Resolve every hash or fail with the missing subset. */
    Map<String, ScoreObject> getBatch(Set<String> hashes);

    boolean contains(String hash);

    default Snapshot getSnapshot(String hash) {
        return typed(hash, Snapshot.class);
    }

    default Property getProperty(String hash) {
        return typed(hash, Property.class);
    }

    /**
     * Resolve page hashes in one round, preserving order and duplicates.
     */
    default List<Page> getPages(List<String> hashes) {
        return typedList(hashes, Page.class);
    }

    /** Resolve annotation hashes in one round, preserving order and duplicates. */
    default List<Annotation> getAnnotations(List<String> hashes) {
        return typedList(hashes, Annotation.class);
    }

    private <T extends ScoreObject> List<T> typedList(List<String> hashes, Class<T> type) {
        if (hashes.isEmpty()) return List.of();
        Map<String, ScoreObject> found = getBatch(new LinkedHashSet<>(hashes));
        List<T> out = new ArrayList<>(hashes.size());
        for (String h : hashes) {
            ScoreObject obj = found.get(h);
            if (!type.isInstance(obj)) {
                throw new ObjectNotFound(Set.of(h));
            }
            out.add(type.cast(obj));
        }
        return out;
    }

    private <T extends ScoreObject> T typed(String hash, Class<T> type) {
        ScoreObject obj = getBatch(Set.of(hash)).get(hash);
        if (!type.isInstance(obj)) {
            // a hash naming an object of another kind is as good as missing
            throw new ObjectNotFound(Set.of(hash));
        }
        return type.cast(obj);
    }
}
