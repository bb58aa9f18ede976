// file: server/src/main/java/io/scorelite/server/ScoreService.java
package io.scorelite.server;

import io.scorelite.core.Annotation;
import io.scorelite.core.AnnotationSequence;
import io.scorelite.core.CommitRequest;
import io.scorelite.core.Page;
import io.scorelite.core.PageSequence;
import io.scorelite.core.Property;
import io.scorelite.core.ScoreHead;
import io.scorelite.core.ScoreHistoryException.ConcurrencyConflict;
import io.scorelite.core.ScoreHistoryException.ObjectNotFound;
import io.scorelite.core.ScoreHistoryException.ScoreAlreadyExists;
import io.scorelite.core.ScoreHistoryException.ScoreNotFound;
import io.scorelite.core.ScoreId;
import io.scorelite.core.ScoreObject;
import io.scorelite.core.Snapshot;
import io.scorelite.core.VersionEntry;
import io.scorelite.storage.ObjectStore;
import io.scorelite.storage.RefStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Application service for score history: the versioning engine.
 * <p>
 * Responsibilities:
 *  - Hide storage details (object store, heads, version index) from the HTTP layer.
 *  - Resolve the latest or a named version into an ordered page list and annotation list.
 *  - Apply an ordered batch of operations against a declared parent and publish
 *    the result as a new snapshot and a new version.
 * <p>
 * Write path ({@link #commit}), under the per-score write lock:
 *  1) Load the head; unknown score fails.
 *  2) Declared parent must equal the head snapshot hash, checked before any write.
 *  3) Fold property operations and validate them against the property parent.
 *  4) Materialize the parent snapshot (cached per snapshot hash).
 *  5) Apply page and annotation operations in order; store only the objects
 *     created by this batch.
 *  6) Store the new snapshot (parent = old head).
 *  7) Advance the head and record the next version in one store write (the commit point).
 * <p>
 * Reads never lock: they read one head pointer and immutable objects.
 */
public class ScoreService {
    private static final Logger log = Logger.getLogger(ScoreService.class.getName());

    private final ObjectStore objects;
    private final RefStore refs;
    private final ScoreLocks locks;
    private final PropertyService properties;
    private final SnapshotCache cache;

    public ScoreService(ObjectStore objects,
                        RefStore refs,
                        ScoreLocks locks,
                        PropertyService properties,
                        int cacheSize) {
        this.objects = Objects.requireNonNull(objects, "objects");
        this.refs = Objects.requireNonNull(refs, "refs");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.cache = new SnapshotCache(cacheSize);
    }

    // ---------- view models ----------

    /**
     * Full view of one score.
     *
     * @param headHash         current snapshot hash (the value to send back as a commit parent)
     * @param pageHashes       page hashes of the head snapshot, in order
     * @param annotationHashes annotation hashes of the head snapshot, in order
     * @param versions         version labels, ascending
     */
    public record ScoreDetail(ScoreId id,
                              String headHash,
                              String propertyHash,
                              Property property,
                              List<String> pageHashes,
                              List<String> annotationHashes,
                              List<String> versions) {}

    /** One row of an owner's score listing. latestVersion is null before the first commit. */
    public record ScoreSummary(ScoreId id, String title, Integer latestVersion) {}

    /** A resolved page together with its hash. */
    public record StoredPage(String hash, Page page) {}

    /** A resolved annotation together with its hash. */
    public record StoredAnnotation(String hash, Annotation annotation) {}

    /**
     * Outcome of a commit. For a batch without page or annotation operations the
     * snapshot is unchanged and {@code version} is the latest existing version, or null.
     */
    public record CommitResult(String snapshotHash,
                               Integer version,
                               List<String> pages,
                               List<String> annotations,
                               String propertyHash) {}

    // ---------- writes ----------

    /**
     * Create a score with an empty root snapshot and a root property.
     * No version is recorded: version 1 is the first commit.
     */
    public ScoreDetail createScore(ScoreId id, String title, String description) {
        locks.withLock(id, () -> {
            if (refs.get(id).isPresent()) throw new ScoreAlreadyExists(id);
            String property = objects.put(Property.root(title, description));
            String snapshot = objects.put(Snapshot.root());
            if (!refs.createIfAbsent(id, new ScoreHead(snapshot, property))) {
                throw new ScoreAlreadyExists(id);
            }
            log.info(() -> "created score " + id);
            return null;
        });
        return getScore(id);
    }

    /**
     * Remove a score: its head and its version list. Stored objects stay, and a
     * score created again under the same name starts at version 1.
     */
    public void deleteScore(ScoreId id) {
        locks.withLock(id, () -> {
            ScoreHead head = refs.get(id).orElseThrow(() -> new ScoreNotFound(id));
            if (!refs.delete(id, head)) {
                log.fine(() -> "head of " + id + " moved under us");
                throw new ConcurrencyConflict("head of " + id + " changed concurrently");
            }
            log.info(() -> "deleted score " + id);
            return null;
        });
    }

    public CommitResult commit(ScoreId id, CommitRequest request) {
        Objects.requireNonNull(request, "request");
        return locks.withLock(id, () -> {
            ScoreHead head = refs.get(id).orElseThrow(() -> new ScoreNotFound(id));

            if (request.parent() != null && !request.parent().equals(head.snapshotHash())) {
                log.fine(() -> "stale parent for " + id + ": " + request.parent() + " != " + head.snapshotHash());
                throw new ConcurrencyConflict("parent " + request.parent() + " is not the head of " + id);
            }

            Property nextProperty = request.hasPropertyOperations()
                    ? properties.prepare(id, head, request.propertyParent(), request.propertyPatch())
                    : null;

            SnapshotCache.Materialized parent = materialize(id, head.snapshotHash());
            if (!request.hasSnapshotOperations()) {
                // property only: no snapshot, no version
                PropertyService.Update update = properties.publish(id, head, nextProperty);
                OptionalInt latest = refs.latestVersion(id);
                return new CommitResult(head.snapshotHash(), latest.isPresent() ? latest.getAsInt() : null,
                        parent.pageHashes(), parent.annotationHashes(), update.propertyHash());
            }

            PageSequence pages = PageSequence.of(parent.pageHashes(), parent.pages());
            pages.applyAll(request.pageOperations());
            AnnotationSequence annotations = AnnotationSequence.of(parent.annotationHashes(), parent.annotations());
            annotations.applyAll(request.annotationOperations());

            List<String> pageHashes = new ArrayList<>(pages.size());
            for (PageSequence.Entry e : pages.entries()) {
                pageHashes.add(e.persisted() ? e.hash() : objects.put(e.page()));
            }
            List<String> annotationHashes = new ArrayList<>(annotations.size());
            for (AnnotationSequence.Entry e : annotations.entries()) {
                annotationHashes.add(e.persisted() ? e.hash() : objects.put(e.annotation()));
            }
            Snapshot snapshot = new Snapshot(head.snapshotHash(), pageHashes, annotationHashes);
            String snapshotHash = objects.put(snapshot);
            cache.put(snapshotHash, new SnapshotCache.Materialized(snapshot, pages.pages(), annotations.annotations()));

            ScoreHead next = head.withSnapshot(snapshotHash);
            if (nextProperty != null) {
                next = next.withProperty(objects.put(nextProperty));
            }

            OptionalInt version = refs.advance(id, head, next);
            if (version.isEmpty()) {
                log.fine(() -> "head of " + id + " moved under us");
                throw new ConcurrencyConflict("head of " + id + " changed concurrently");
            }
            log.info(() -> "committed " + id + " v" + version.getAsInt() + " -> " + snapshotHash
                    + " (" + request.operations().size() + " ops)");
            return new CommitResult(snapshotHash, version.getAsInt(), List.copyOf(pageHashes),
                    List.copyOf(annotationHashes), next.propertyHash());
        });
    }

    // ---------- reads ----------

    public ScoreDetail getScore(ScoreId id) {
        ScoreHead head = refs.get(id).orElseThrow(() -> new ScoreNotFound(id));
        Property property = properties.getProperty(id);
        Snapshot snapshot = snapshot(id, head.snapshotHash());
        List<String> labels = new ArrayList<>();
        for (VersionEntry v : refs.listVersions(id)) labels.add(v.label());
        return new ScoreDetail(id, head.snapshotHash(), head.propertyHash(), property,
                snapshot.pages(), snapshot.annotations(), labels);
    }

    /** Scores of one owner, sorted by score name. */
    public List<ScoreSummary> listScores(String owner) {
        List<ScoreSummary> out = new ArrayList<>();
        for (ScoreId id : refs.list(owner)) {
            OptionalInt latest = refs.latestVersion(id);
            out.add(new ScoreSummary(id, properties.getProperty(id).title(),
                    latest.isPresent() ? latest.getAsInt() : null));
        }
        return out;
    }

    public List<VersionEntry> listVersions(ScoreId id) {
        requireScore(id);
        List<VersionEntry> out = new ArrayList<>();
        refs.listVersions(id).forEach(out::add);
        return out;
    }

    /** Pages of the snapshot that version {@code label} names. */
    public List<StoredPage> getPages(ScoreId id, String label) {
        requireScore(id);
        return pageView(materialize(id, refs.resolve(id, label)));
    }

    /** Pages of the current head, which is ahead of the last version only for a fresh score. */
    public List<StoredPage> getLatestPages(ScoreId id) {
        return pageView(materialize(id, headSnapshot(id)));
    }

    /** Annotations of the snapshot that version {@code label} names. */
    public List<StoredAnnotation> getAnnotations(ScoreId id, String label) {
        requireScore(id);
        return annotationView(materialize(id, refs.resolve(id, label)));
    }

    public List<StoredAnnotation> getLatestAnnotations(ScoreId id) {
        return annotationView(materialize(id, headSnapshot(id)));
    }

    /** Batch lookup for clients caching objects by hash; all-or-nothing. */
    public Map<String, ScoreObject> getObjects(Set<String> hashes) {
        return objects.getBatch(hashes);
    }

    // ---------- internals ----------

    private void requireScore(ScoreId id) {
        if (refs.get(id).isEmpty()) throw new ScoreNotFound(id);
    }

    private String headSnapshot(ScoreId id) {
        return refs.get(id).orElseThrow(() -> new ScoreNotFound(id)).snapshotHash();
    }

    private SnapshotCache.Materialized materialize(ScoreId id, String snapshotHash) {
        SnapshotCache.Materialized hit = cache.get(snapshotHash);
        if (hit != null) return hit;

        Snapshot snapshot = snapshot(id, snapshotHash);
        List<Page> pages;
        List<Annotation> annotations;
        try {
            pages = objects.getPages(snapshot.pages());
            annotations = objects.getAnnotations(snapshot.annotations());
        } catch (ObjectNotFound missing) {
            throw corruption(id, "content of snapshot " + snapshotHash, missing);
        }
        SnapshotCache.Materialized m = new SnapshotCache.Materialized(snapshot, pages, annotations);
        cache.put(snapshotHash, m);
        return m;
    }

    private Snapshot snapshot(ScoreId id, String hash) {
        try {
            return objects.getSnapshot(hash);
        } catch (ObjectNotFound missing) {
            throw corruption(id, "snapshot " + hash, missing);
        }
    }

    private static IllegalStateException corruption(ScoreId id, String what, ObjectNotFound missing) {
        log.log(Level.SEVERE, what + " of " + id + " missing from the object store: " + missing.missing(), missing);
        return new IllegalStateException("store corruption: " + what + " of " + id + " is missing", missing);
    }

    private static List<StoredPage> pageView(SnapshotCache.Materialized m) {
        List<StoredPage> out = new ArrayList<>(m.pages().size());
        for (int i = 0; i < m.pages().size(); i++) {
            out.add(new StoredPage(m.pageHashes().get(i), m.pages().get(i)));
        }
        return out;
    }

    private static List<StoredAnnotation> annotationView(SnapshotCache.Materialized m) {
        List<StoredAnnotation> out = new ArrayList<>(m.annotations().size());
        for (int i = 0; i < m.annotations().size(); i++) {
            out.add(new StoredAnnotation(m.annotationHashes().get(i), m.annotations().get(i)));
        }
        return out;
    }
}
