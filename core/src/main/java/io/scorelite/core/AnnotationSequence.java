// file: src/main/java/io/scorelite/core/AnnotationSequence.java
package io.scorelite.core;

import io.scorelite.core.ScoreHistoryException.InvalidOperation;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable annotation list used while applying one commit batch.
 * <p>
 * Same contract as {@link PageSequence}: slots loaded from a snapshot keep
 * their hash, slots written by add/replace do not and are the only ones the
 * engine stores. Not thread safe.
 */
public final class AnnotationSequence {

    /** An annotation plus its stored hash, or null hash when not persisted yet. */
    public record Entry(String hash, Annotation annotation) {
        public boolean persisted() { return hash != null; }
    }

    private final List<Entry> entries;

    private AnnotationSequence(List<Entry> entries) {
        this.entries = entries;
    }

    public static AnnotationSequence of(List<String> hashes, List<Annotation> annotations) {
        if (hashes.size() != annotations.size()) {
            throw new IllegalArgumentException("hashes and annotations differ in size");
        }
        List<Entry> list = new ArrayList<>(hashes.size() + 4);
        for (int i = 0; i < hashes.size(); i++) {
            list.add(new Entry(hashes.get(i), annotations.get(i)));
        }
        return new AnnotationSequence(list);
    }

    public int size() { return entries.size(); }

    public void apply(CommitOperation op) {
        if (op instanceof CommitOperation.AddAnnotation add) {
            entries.add(new Entry(null, add.annotation()));
        } else if (op instanceof CommitOperation.RemoveAnnotation rm) {
            checkIndex(op.type(), rm.index());
            entries.remove(rm.index());
        } else if (op instanceof CommitOperation.ReplaceAnnotation rep) {
            checkIndex(op.type(), rep.index());
            entries.set(rep.index(), new Entry(null, rep.annotation()));
        } else {
            throw new IllegalArgumentException(op.type() + " is not an annotation operation");
        }
    }

    public void applyAll(List<? extends CommitOperation> ops) {
        for (CommitOperation op : ops) apply(op);
    }

    public List<Entry> entries() {
        return List.copyOf(entries);
    }

    public List<Annotation> annotations() {
        return entries.stream().map(Entry::annotation).toList();
    }

    private void checkIndex(String type, int index) {
        if (index < 0 || index >= entries.size()) {
            throw new InvalidOperation(type + " index " + index
                    + " out of range for " + entries.size() + " annotations");
        }
    }
}
