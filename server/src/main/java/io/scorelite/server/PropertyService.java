// file: server/src/main/java/io/scorelite/server/PropertyService.java
package io.scorelite.server;

import io.scorelite.core.Property;
import io.scorelite.core.PropertyPatch;
import io.scorelite.core.ScoreHead;
import io.scorelite.core.ScoreHistoryException.ConcurrencyConflict;
import io.scorelite.core.ScoreHistoryException.InvalidOperation;
import io.scorelite.core.ScoreHistoryException.NoChange;
import io.scorelite.core.ScoreHistoryException.ObjectNotFound;
import io.scorelite.core.ScoreHistoryException.ScoreNotFound;
import io.scorelite.core.ScoreId;
import io.scorelite.storage.HeadStore;
import io.scorelite.storage.ObjectStore;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Application service for the property chain of a score.
 * <p>
 * Same optimistic shape as page commits, over a simpler object:
 *  1) Load the head (under the per-score write lock).
 *  2) Reject a declared parent that is not the current property hash.
 *  3) Merge: provided fields override, omitted fields keep their value.
 *  4) Reject a merge that changes nothing.
 *  5) Store the new property (parent = old property hash) and CAS the head.
 */
public class PropertyService {
    private static final Logger log = Logger.getLogger(PropertyService.class.getName());

    private final ObjectStore objects;
    private final HeadStore heads;
    private final ScoreLocks locks;

    public PropertyService(ObjectStore objects, HeadStore heads, ScoreLocks locks) {
        this.objects = Objects.requireNonNull(objects, "objects");
        this.heads = Objects.requireNonNull(heads, "heads");
        this.locks = Objects.requireNonNull(locks, "locks");
    }

    /** Result of a property update: the new property hash and the merged property. */
    public record Update(String propertyHash, Property property) {}

    public Update updateProperty(ScoreId id, String parent, PropertyPatch patch) {
        Objects.requireNonNull(patch, "patch");
        return locks.withLock(id, () -> {
            ScoreHead head = heads.get(id).orElseThrow(() -> new ScoreNotFound(id));
            return publish(id, head, prepare(id, head, parent, patch));
        });
    }

    /** Current property of a score. Lock-free. */
    public Property getProperty(ScoreId id) {
        ScoreHead head = heads.get(id).orElseThrow(() -> new ScoreNotFound(id));
        return load(id, head.propertyHash());
    }

    /**
     * Validate and merge a patch against {@code head} without writing anything.
     * The caller must hold the write lock of {@code id}.
     *
     * @return the property to store, chained to the head property
     */
    Property prepare(ScoreId id, ScoreHead head, String parent, PropertyPatch patch) {
        if (parent == null) {
            throw new InvalidOperation("property parent is required to update the property");
        }
        if (!parent.equals(head.propertyHash())) {
            log.fine(() -> "stale property parent for " + id + ": " + parent + " != " + head.propertyHash());
            throw new ConcurrencyConflict("property parent " + parent + " is not the current property of " + id);
        }
        Property current = load(id, head.propertyHash());
        Property merged = current.merge(patch, head.propertyHash());
        if (merged.sameContent(current)) {
            throw new NoChange(id);
        }
        return merged;
    }

    /**
     * Store a prepared property and move the property head only.
     * The caller must hold the write lock of {@code id}.
     */
    Update publish(ScoreId id, ScoreHead head, Property next) {
        String hash = objects.put(next);
        if (!heads.compareAndSet(id, head, head.withProperty(hash))) {
            log.fine(() -> "property head of " + id + " moved under us");
            throw new ConcurrencyConflict("property of " + id + " changed concurrently");
        }
        log.info(() -> "property of " + id + " -> " + hash);
        return new Update(hash, next);
    }

    private Property load(ScoreId id, String hash) {
        try {
            return objects.getProperty(hash);
        } catch (ObjectNotFound missing) {
            log.log(Level.SEVERE, "property " + hash + " of " + id + " is missing from the object store", missing);
            throw new IllegalStateException("store corruption: property of " + id + " is missing", missing);
        }
    }
}
