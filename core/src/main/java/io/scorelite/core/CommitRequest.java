// file: src/main/java/io/scorelite/core/CommitRequest.java
package io.scorelite.core;

import io.scorelite.core.ScoreHistoryException.InvalidOperation;

import java.util.ArrayList;
import java.util.List;

/**
 * An ordered batch of operations plus the heads the caller believes are current.
 *
 * @param parent         snapshot hash the page and annotation operations were computed against
 * @param propertyParent property hash the property operations were computed against;
 *                       required only when the batch contains {@code update_property}
 * @param operations     applied strictly in list order
 */
public record CommitRequest(String parent, String propertyParent, List<CommitOperation> operations) {

    public CommitRequest {
        if (operations == null || operations.isEmpty()) {
            throw new InvalidOperation("commit has no operations");
        }
        for (CommitOperation op : operations) {
            if (op == null) throw new InvalidOperation("commit element must be an object");
        }
        operations = List.copyOf(operations);
        if (parent == null && operations.stream().anyMatch(CommitRequest::editsSnapshot)) {
            throw new InvalidOperation("parent is required for page and annotation operations");
        }
    }

    public static CommitRequest of(String parent, List<CommitOperation> operations) {
        return new CommitRequest(parent, null, operations);
    }

    /** Page operations, in request order. */
    public List<CommitOperation> pageOperations() {
        List<CommitOperation> out = new ArrayList<>(operations.size());
        for (CommitOperation op : operations) {
            if (op.isPageOperation()) out.add(op);
        }
        return out;
    }

    /** Annotation operations, in request order. */
    public List<CommitOperation> annotationOperations() {
        List<CommitOperation> out = new ArrayList<>();
        for (CommitOperation op : operations) {
            if (op.isAnnotationOperation()) out.add(op);
        }
        return out;
    }

    /** True when the batch produces a new snapshot (and therefore a new version). */
    public boolean hasSnapshotOperations() {
        return operations.stream().anyMatch(CommitRequest::editsSnapshot);
    }

    /** All property operations folded in order into a single patch. */
    public PropertyPatch propertyPatch() {
        PropertyPatch patch = PropertyPatch.empty();
        for (CommitOperation op : operations) {
            if (op instanceof CommitOperation.UpdateProperty up) patch = patch.then(up.patch());
        }
        return patch;
    }

    public boolean hasPropertyOperations() {
        return operations.stream().anyMatch(op -> op instanceof CommitOperation.UpdateProperty);
    }

    private static boolean editsSnapshot(CommitOperation op) {
        return op.isPageOperation() || op.isAnnotationOperation();
    }
}
