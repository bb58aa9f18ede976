package io.scorelite.server;

import io.scorelite.core.CommitOperation;
import io.scorelite.core.CommitRequest;
import io.scorelite.core.Page;
import io.scorelite.core.ScoreHead;
import io.scorelite.core.ScoreHistoryException.ConcurrencyConflict;
import io.scorelite.core.ScoreHistoryException.InvalidOperation;
import io.scorelite.core.ScoreHistoryException.ObjectNotFound;
import io.scorelite.core.ScoreHistoryException.ScoreAlreadyExists;
import io.scorelite.core.ScoreHistoryException.ScoreNotFound;
import io.scorelite.core.ScoreHistoryException.VersionNotFound;
import io.scorelite.core.ScoreId;
import io.scorelite.core.Snapshot;
import io.scorelite.core.VersionEntry;
import io.scorelite.storage.InMemoryObjectStore;
import io.scorelite.storage.InMemoryRefStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Engine-level specs for the commit path over in-memory stores.
 *
 * Focus:
 *  - Optimistic concurrency on the parent hash (stale parent never writes).
 *  - Operation order and index validation.
 *  - Version numbering, including under concurrent writers.
 *  - Corruption surfaces as an internal error, not a client error.
 */
class ScoreServiceTest {

    private static final ScoreId ID = ScoreId.of("u1", "s1");

    private InMemoryObjectStore objects;
    private InMemoryRefStore refs;
    private ScoreService scores;

    @BeforeEach
    void setUp() {
        objects = new InMemoryObjectStore();
        refs = new InMemoryRefStore();
        var locks = new ScoreLocks(2_000);
        var properties = new PropertyService(objects, refs, locks);
        scores = new ScoreService(objects, refs, locks, properties, 16);
    }

    private static CommitOperation add(String n) {
        return CommitOperation.addPage("img-" + n, "th-" + n, n);
    }

    private static CommitOperation insert(int index, String n) {
        return CommitOperation.insertPage(index, "img-" + n, "th-" + n, n);
    }

    private List<String> contents(List<ScoreService.StoredAnnotation> annotations) {
        return annotations.stream().map(a -> a.annotation().content()).toList();
    }

    private List<String> numbers(List<ScoreService.StoredPage> pages) {
        return pages.stream().map(p -> p.page().number()).toList();
    }

    @Test
    void end_to_end_create_commit_conflict_retry() {
        var created = scores.createScore(ID, "Sonata", null);
        assertEquals("Sonata", created.property().title());
        assertTrue(created.versions().isEmpty(), "creating a score records no version");
        String stale = created.headHash();

        scores.commit(ID, CommitRequest.of(stale, List.of(add("1"), add("2"))));
        var afterAdd = scores.getScore(ID);
        assertEquals(List.of("1"), afterAdd.versions());
        assertEquals(2, afterAdd.pageHashes().size());

        assertThrows(ConcurrencyConflict.class,
                () -> scores.commit(ID, CommitRequest.of(stale, List.of(insert(1, "x")))));

        String fresh = scores.getScore(ID).headHash();
        var result = scores.commit(ID, CommitRequest.of(fresh, List.of(insert(1, "x"))));
        assertEquals(2, result.version());

        var after = scores.getScore(ID);
        assertEquals(List.of("1", "2"), after.versions());
        assertEquals(3, after.pageHashes().size());
        assertEquals(List.of("1", "x", "2"), numbers(scores.getLatestPages(ID)));
        assertEquals(List.of("1", "2"), numbers(scores.getPages(ID, "1")), "old versions stay readable");
    }

    @Test
    void same_batch_twice_with_same_parent_second_conflicts() {
        String root = scores.createScore(ID, "t", null).headHash();
        var batch = CommitRequest.of(root, List.of(add("1")));

        scores.commit(ID, batch);
        assertThrows(ConcurrencyConflict.class, () -> scores.commit(ID, batch));
        assertEquals(1, scores.listVersions(ID).size());
    }

    @Test
    void stale_parent_leaves_every_store_untouched() {
        String root = scores.createScore(ID, "t", null).headHash();
        scores.commit(ID, CommitRequest.of(root, List.of(add("1"))));
        ScoreHead head = refs.get(ID).orElseThrow();
        int storedObjects = objects.size();

        assertThrows(ConcurrencyConflict.class,
                () -> scores.commit(ID, CommitRequest.of(root, List.of(add("2"), add("3")))));

        assertEquals(head, refs.get(ID).orElseThrow());
        assertEquals(storedObjects, objects.size());
        assertEquals(1, refs.latestVersion(ID).orElseThrow());
    }

    @Test
    void ops_apply_in_order_and_bad_index_rejects_whole_batch() {
        String root = scores.createScore(ID, "t", null).headHash();
        String h1 = scores.commit(ID, CommitRequest.of(root, List.of(add("A"), add("B"), add("C")))).snapshotHash();

        var r = scores.commit(ID, CommitRequest.of(h1, List.of(insert(1, "D"), CommitOperation.deletePage(0))));
        assertEquals(List.of("D", "B", "C"), numbers(scores.getLatestPages(ID)));

        int storedObjects = objects.size();
        assertThrows(InvalidOperation.class, () -> scores.commit(ID,
                CommitRequest.of(r.snapshotHash(), List.of(add("E"), CommitOperation.deletePage(4)))));
        assertThrows(InvalidOperation.class, () -> scores.commit(ID,
                CommitRequest.of(r.snapshotHash(), List.of(insert(4, "F")))));

        assertEquals(r.snapshotHash(), refs.get(ID).orElseThrow().snapshotHash());
        assertEquals(storedObjects, objects.size(), "a rejected batch stores nothing");
    }

    @Test
    void only_new_pages_are_stored_and_existing_hashes_are_reused() {
        String root = scores.createScore(ID, "t", null).headHash();
        var first = scores.commit(ID, CommitRequest.of(root, List.of(add("1"), add("2"))));
        int before = objects.size();

        var second = scores.commit(ID, CommitRequest.of(first.snapshotHash(), List.of(add("3"))));

        assertEquals(before + 2, objects.size(), "one new page plus one snapshot");
        assertEquals(first.pages(), second.pages().subList(0, 2));
        Snapshot snap = objects.getSnapshot(second.snapshotHash());
        assertEquals(first.snapshotHash(), snap.parent());
    }

    @Test
    void duplicate_pages_are_allowed_in_a_snapshot() {
        String root = scores.createScore(ID, "t", null).headHash();
        var r = scores.commit(ID, CommitRequest.of(root, List.of(add("1"), add("1"))));
        assertEquals(2, r.pages().size());
        assertEquals(r.pages().get(0), r.pages().get(1));
        assertEquals(List.of("1", "1"), numbers(scores.getLatestPages(ID)));
    }

    @Test
    void property_only_batch_moves_property_head_but_records_no_version() {
        var created = scores.createScore(ID, "Sonata", null);

        var r = scores.commit(ID, new CommitRequest(null, created.propertyHash(),
                List.of(CommitOperation.updateProperty(null, "draft"))));

        assertNull(r.version());
        assertEquals(created.headHash(), r.snapshotHash());
        var after = scores.getScore(ID);
        assertEquals("Sonata", after.property().title());
        assertEquals("draft", after.property().description());
        assertTrue(scores.listVersions(ID).isEmpty());
    }

    @Test
    void mixed_batch_with_stale_property_parent_changes_nothing() {
        var created = scores.createScore(ID, "Sonata", null);
        ScoreHead head = refs.get(ID).orElseThrow();

        assertThrows(ConcurrencyConflict.class, () -> scores.commit(ID, new CommitRequest(
                created.headHash(), created.headHash(),
                List.of(add("1"), CommitOperation.updateProperty("New", null)))));

        assertEquals(head, refs.get(ID).orElseThrow());
        assertTrue(scores.listVersions(ID).isEmpty());
    }

    @Test
    void mixed_batch_advances_both_heads_together() {
        var created = scores.createScore(ID, "Sonata", null);

        var r = scores.commit(ID, new CommitRequest(created.headHash(), created.propertyHash(),
                List.of(add("1"), CommitOperation.updateProperty("First", null),
                        CommitOperation.updateProperty("Second", "d"))));

        assertEquals(1, r.version());
        var after = scores.getScore(ID);
        assertEquals(r.propertyHash(), after.propertyHash());
        assertEquals("Second", after.property().title(), "later property ops win");
        assertEquals("d", after.property().description());
    }

    @Test
    void unknown_scores_versions_and_objects_are_not_found() {
        assertThrows(ScoreNotFound.class, () -> scores.getScore(ID));
        assertThrows(ScoreNotFound.class, () -> scores.commit(ID, CommitRequest.of("x", List.of(add("1")))));

        scores.createScore(ID, "t", null);
        assertThrows(ScoreAlreadyExists.class, () -> scores.createScore(ID, "t", null));
        assertThrows(VersionNotFound.class, () -> scores.getPages(ID, "1"));

        String missing = new Page("no", "no", "no").hash();
        ObjectNotFound nf = assertThrows(ObjectNotFound.class, () -> scores.getObjects(Set.of(missing)));
        assertEquals(Set.of(missing), nf.missing());
    }

    @Test
    void scores_are_listed_by_name_with_title_and_latest_version() {
        String b = scores.createScore(ScoreId.of("u1", "b"), "Beta", null).headHash();
        scores.createScore(ScoreId.of("u1", "a"), "Alpha", null);
        scores.createScore(ScoreId.of("u2", "c"), "Gamma", null);
        scores.commit(ScoreId.of("u1", "b"), CommitRequest.of(b, List.of(add("1"))));

        var list = scores.listScores("u1");
        assertEquals(2, list.size());
        assertEquals("Alpha", list.get(0).title());
        assertNull(list.get(0).latestVersion());
        assertEquals("Beta", list.get(1).title());
        assertEquals(1, list.get(1).latestVersion());
    }

    @Test
    void missing_page_object_is_store_corruption() {
        String root = scores.createScore(ID, "t", null).headHash();
        String ghost = new Page("gone", "gone", "1").hash();
        String broken = objects.put(new Snapshot(root, List.of(ghost)));
        ScoreHead head = refs.get(ID).orElseThrow();
        assertTrue(refs.compareAndSet(ID, head, head.withSnapshot(broken)));

        assertThrows(IllegalStateException.class, () -> scores.getLatestPages(ID));
        assertThrows(IllegalStateException.class,
                () -> scores.commit(ID, CommitRequest.of(broken, List.of(add("2")))));
    }

    @Test
    void annotations_are_versioned_with_the_pages() {
        String root = scores.createScore(ID, "t", null).headHash();
        var v1 = scores.commit(ID, CommitRequest.of(root, List.of(
                add("1"),
                CommitOperation.addAnnotation("breathe"),
                CommitOperation.addAnnotation("forte"),
                CommitOperation.addAnnotation("rit."))));
        assertEquals(1, v1.version(), "pages and annotations share one version");
        assertEquals(3, v1.annotations().size());

        var v2 = scores.commit(ID, CommitRequest.of(v1.snapshotHash(), List.of(
                CommitOperation.replaceAnnotation(1, "piano"),
                CommitOperation.removeAnnotation(0))));
        assertEquals(2, v2.version());
        assertEquals(v1.pages(), v2.pages(), "an annotation-only batch keeps the pages");

        assertEquals(List.of("piano", "rit."), contents(scores.getLatestAnnotations(ID)));
        assertEquals(List.of("breathe", "forte", "rit."), contents(scores.getAnnotations(ID, "1")));
        assertEquals(v1.annotations().get(2), v2.annotations().get(1), "untouched annotations keep their hash");
        assertEquals(v2.annotations(), scores.getScore(ID).annotationHashes());
    }

    @Test
    void bad_annotation_index_rejects_the_page_ops_of_the_same_batch() {
        String root = scores.createScore(ID, "t", null).headHash();
        int storedObjects = objects.size();

        assertThrows(InvalidOperation.class, () -> scores.commit(ID, CommitRequest.of(root, List.of(
                add("1"), CommitOperation.replaceAnnotation(0, "nothing to replace")))));
        assertThrows(InvalidOperation.class, () -> scores.commit(ID, CommitRequest.of(root, List.of(
                CommitOperation.addAnnotation("a"), CommitOperation.removeAnnotation(1)))));

        assertEquals(root, refs.get(ID).orElseThrow().snapshotHash());
        assertEquals(storedObjects, objects.size());
        assertTrue(scores.listVersions(ID).isEmpty());
    }

    @Test
    void deleted_score_is_gone_and_can_be_created_again() {
        String root = scores.createScore(ID, "Old", null).headHash();
        scores.commit(ID, CommitRequest.of(root, List.of(add("1"))));

        scores.deleteScore(ID);

        assertThrows(ScoreNotFound.class, () -> scores.getScore(ID));
        assertThrows(ScoreNotFound.class, () -> scores.listVersions(ID));
        assertThrows(ScoreNotFound.class, () -> scores.deleteScore(ID));
        assertTrue(scores.listScores("u1").isEmpty());

        var again = scores.createScore(ID, "New", null);
        assertEquals("New", again.property().title());
        assertTrue(again.versions().isEmpty());
        var r = scores.commit(ID, CommitRequest.of(again.headHash(), List.of(add("2"))));
        assertEquals(1, r.version(), "version numbering starts over");
    }

    @Test
    void concurrent_writers_get_distinct_consecutive_versions() throws Exception {
        scores.createScore(ID, "t", null);
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        try {
            for (int w = 0; w < writers; w++) {
                final String n = Integer.toString(w);
                futures.add(pool.submit(() -> {
                    start.await();
                    while (true) {
                        // read head, edit, submit; refresh and retry on conflict
                        String parent = scores.getScore(ID).headHash();
                        try {
                            return scores.commit(ID, CommitRequest.of(parent, List.of(add(n)))).version();
                        } catch (ConcurrencyConflict retry) {
                            Thread.onSpinWait();
                        }
                    }
                }));
            }
            start.countDown();

            Set<Integer> got = new HashSet<>();
            for (Future<Integer> f : futures) got.add(f.get(30, TimeUnit.SECONDS));

            Set<Integer> expected = new HashSet<>();
            for (int v = 1; v <= writers; v++) expected.add(v);
            assertEquals(expected, got);
            assertEquals(writers, scores.getLatestPages(ID).size(), "no commit was lost");

            List<VersionEntry> listed = scores.listVersions(ID);
            for (int i = 0; i < listed.size(); i++) assertEquals(i + 1, listed.get(i).version());
        } finally {
            pool.shutdownNow();
        }
    }
}
