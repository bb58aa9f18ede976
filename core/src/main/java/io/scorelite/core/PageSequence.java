// file: src/main/java/io/scorelite/core/PageSequence.java
package io.scorelite.core;

import io.scorelite.core.ScoreHistoryException.InvalidOperation;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable, in-memory page sequence used while applying one commit batch.
 * <p>
 * Each slot remembers the hash of its page when the page came from an existing
 * snapshot. Slots created by add/insert have no hash yet; only those are written
 * to the object store when the batch is persisted.
 * <p>
 * Not thread safe: one instance belongs to one write request.
 */
public final class PageSequence {

    /** A page plus its stored hash, or null hash when not persisted yet. */
    public record Entry(String hash, Page page) {
        public boolean persisted() { return hash != null; }
    }

    private final List<Entry> entries;

    private PageSequence(List<Entry> entries) {
        this.entries = entries;
    }

    /** Sequence materialized from stored pages, hashes in snapshot order. */
    public static PageSequence of(List<String> hashes, List<Page> pages) {
        if (hashes.size() != pages.size()) {
            throw new IllegalArgumentException("hashes and pages differ in size");
        }
        List<Entry> list = new ArrayList<>(hashes.size() + 8);
        for (int i = 0; i < hashes.size(); i++) {
            list.add(new Entry(hashes.get(i), pages.get(i)));
        }
        return new PageSequence(list);
    }

    public static PageSequence empty() {
        return new PageSequence(new ArrayList<>());
    }

    public int size() { return entries.size(); }

    /**
     * Apply one page operation against the current state.
     * Property operations are not page operations and are rejected here.
     */
    public void apply(CommitOperation op) {
        if (op instanceof CommitOperation.AddPage add) {
            entries.add(new Entry(null, add.page()));
        } else if (op instanceof CommitOperation.InsertPage ins) {
            if (ins.index() < 0 || ins.index() > entries.size()) {
                throw new InvalidOperation("insert_page index " + ins.index()
                        + " out of range for " + entries.size() + " pages");
            }
            entries.add(ins.index(), new Entry(null, ins.page()));
        } else if (op instanceof CommitOperation.DeletePage del) {
            if (del.index() < 0 || del.index() >= entries.size()) {
                throw new InvalidOperation("delete_page index " + del.index()
                        + " out of range for " + entries.size() + " pages");
            }
            entries.remove(del.index());
        } else {
            throw new IllegalArgumentException(op.type() + " is not a page operation");
        }
    }

    /** Apply operations strictly in list order. */
    public void applyAll(List<? extends CommitOperation> ops) {
        for (CommitOperation op : ops) apply(op);
    }

    /** Read-only view of the current slots. */
    public List<Entry> entries() {
        return List.copyOf(entries);
    }

    public List<Page> pages() {
        return entries.stream().map(Entry::page).toList();
    }
}
