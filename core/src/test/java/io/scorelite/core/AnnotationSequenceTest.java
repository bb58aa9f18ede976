package io.scorelite.core;

import io.scorelite.core.ScoreHistoryException.InvalidOperation;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnnotationSequenceTest {

    private static final Annotation X = new Annotation("breathe");
    private static final Annotation Y = new Annotation("forte");
    private static final Annotation Z = new Annotation("ritardando");

    private static AnnotationSequence xy() {
        return AnnotationSequence.of(List.of(X.hash(), Y.hash()), List.of(X, Y));
    }

    @Test
    void add_replace_remove_in_order() {
        AnnotationSequence seq = xy();
        seq.applyAll(List.of(
                new CommitOperation.AddAnnotation(Z),
                new CommitOperation.ReplaceAnnotation(0, Y),
                new CommitOperation.RemoveAnnotation(1)
        ));
        assertEquals(List.of(Y, Z), seq.annotations());
    }

    @Test
    void replaced_and_added_slots_are_not_persisted() {
        AnnotationSequence seq = xy();
        seq.apply(new CommitOperation.ReplaceAnnotation(1, Z));
        seq.apply(new CommitOperation.AddAnnotation(X));

        List<AnnotationSequence.Entry> entries = seq.entries();
        assertTrue(entries.get(0).persisted());
        assertFalse(entries.get(1).persisted());
        assertFalse(entries.get(2).persisted());
    }

    @Test
    void out_of_range_index_is_invalid() {
        AnnotationSequence seq = xy();
        var e = assertThrows(InvalidOperation.class, () -> seq.apply(new CommitOperation.RemoveAnnotation(2)));
        assertTrue(e.getMessage().contains("remove_annotation index 2"));
        assertThrows(InvalidOperation.class, () -> seq.apply(new CommitOperation.ReplaceAnnotation(-1, Z)));
        assertEquals(2, seq.size());
    }

    @Test
    void page_operations_are_refused() {
        assertThrows(IllegalArgumentException.class,
                () -> xy().apply(new CommitOperation.DeletePage(0)));
    }

    @Test
    void missing_fields_are_invalid() {
        assertThrows(InvalidOperation.class, () -> CommitOperation.addAnnotation(null));
        assertThrows(InvalidOperation.class, () -> CommitOperation.removeAnnotation(null));
        assertThrows(InvalidOperation.class, () -> CommitOperation.replaceAnnotation(0, null));
    }

    @Test
    void batch_rejects_null_elements_and_needs_a_parent_for_annotations() {
        var nullElement = assertThrows(InvalidOperation.class,
                () -> CommitRequest.of("p", Arrays.asList(new CommitOperation.AddAnnotation(X), null)));
        assertEquals("commit element must be an object", nullElement.getMessage());

        assertThrows(InvalidOperation.class,
                () -> CommitRequest.of(null, List.of(new CommitOperation.AddAnnotation(X))));

        CommitRequest mixed = CommitRequest.of("p", List.of(
                new CommitOperation.DeletePage(0), new CommitOperation.AddAnnotation(X)));
        assertTrue(mixed.hasSnapshotOperations());
        assertEquals(1, mixed.pageOperations().size());
        assertEquals(1, mixed.annotationOperations().size());
    }
}
