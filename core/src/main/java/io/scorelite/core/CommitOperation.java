// file: src/main/java/io/scorelite/core/CommitOperation.java
package io.scorelite.core;

import io.scorelite.core.ScoreHistoryException.InvalidOperation;
import io.scorelite.core.ScoreHistoryException.UnsupportedOperation;

/**
 * One operation of a commit request. Closed set: one case per wire type tag.
 * <p>
 * Page operations edit the page sequence and annotation operations the
 * annotation list of the snapshot; {@link UpdateProperty} is routed to the
 * property chain and never touches the snapshot.
 */
public sealed interface CommitOperation
        permits CommitOperation.AddPage, CommitOperation.InsertPage,
                CommitOperation.DeletePage, CommitOperation.UpdateProperty,
                CommitOperation.AddAnnotation, CommitOperation.RemoveAnnotation,
                CommitOperation.ReplaceAnnotation {

    String TYPE_ADD_PAGE = "add_page";
    String TYPE_INSERT_PAGE = "insert_page";
    String TYPE_DELETE_PAGE = "delete_page";
    String TYPE_UPDATE_PROPERTY = "update_property";
    String TYPE_ADD_ANNOTATION = "add_annotation";
    String TYPE_REMOVE_ANNOTATION = "remove_annotation";
    String TYPE_REPLACE_ANNOTATION = "replace_annotation";

    /** Wire type tag. */
    String type();

    /** Append a page. */
    record AddPage(Page page) implements CommitOperation {
        public AddPage {
            if (page == null) throw new InvalidOperation("add_page requires image, thumbnail and number");
        }

        @Override public String type() { return TYPE_ADD_PAGE; }
    }

    /** Insert a page at a 0-based index; index == length appends. */
    record InsertPage(int index, Page page) implements CommitOperation {
        public InsertPage {
            if (page == null) throw new InvalidOperation("insert_page requires image, thumbnail and number");
        }

        @Override public String type() { return TYPE_INSERT_PAGE; }
    }

    /** Remove the page at a 0-based index. */
    record DeletePage(int index) implements CommitOperation {
        @Override public String type() { return TYPE_DELETE_PAGE; }
    }

    /** Override the provided property fields. */
    record UpdateProperty(PropertyPatch patch) implements CommitOperation {
        public UpdateProperty {
            if (patch == null) throw new InvalidOperation("update_property requires a payload");
        }

        @Override public String type() { return TYPE_UPDATE_PROPERTY; }
    }

    /** Append an annotation. */
    record AddAnnotation(Annotation annotation) implements CommitOperation {
        public AddAnnotation {
            if (annotation == null) throw new InvalidOperation("add_annotation requires content");
        }

        @Override public String type() { return TYPE_ADD_ANNOTATION; }
    }

    /** Remove the annotation at a 0-based index. */
    record RemoveAnnotation(int index) implements CommitOperation {
        @Override public String type() { return TYPE_REMOVE_ANNOTATION; }
    }

    /** Replace the content of the annotation at a 0-based index, keeping its position. */
    record ReplaceAnnotation(int index, Annotation annotation) implements CommitOperation {
        public ReplaceAnnotation {
            if (annotation == null) throw new InvalidOperation("replace_annotation requires content");
        }

        @Override public String type() { return TYPE_REPLACE_ANNOTATION; }
    }

    /**
     * Build a page for an add/insert payload, rejecting missing fields as a
     * client error rather than a programming error.
     */
    static Page page(String type, String image, String thumbnail, String number) {
        if (image == null || thumbnail == null || number == null) {
            throw new InvalidOperation(type + " requires image, thumbnail and number");
        }
        return new Page(image, thumbnail, number);
    }

    static AddPage addPage(String image, String thumbnail, String number) {
        return new AddPage(page(TYPE_ADD_PAGE, image, thumbnail, number));
    }

    static InsertPage insertPage(Integer index, String image, String thumbnail, String number) {
        if (index == null) throw new InvalidOperation("insert_page requires an index");
        return new InsertPage(index, page(TYPE_INSERT_PAGE, image, thumbnail, number));
    }

    static DeletePage deletePage(Integer index) {
        if (index == null) throw new InvalidOperation("delete_page requires an index");
        return new DeletePage(index);
    }

    static UpdateProperty updateProperty(String title, String description) {
        return new UpdateProperty(new PropertyPatch(title, description));
    }

    static AddAnnotation addAnnotation(String content) {
        if (content == null) throw new InvalidOperation("add_annotation requires content");
        return new AddAnnotation(new Annotation(content));
    }

    static RemoveAnnotation removeAnnotation(Integer index) {
        if (index == null) throw new InvalidOperation("remove_annotation requires an index");
        return new RemoveAnnotation(index);
    }

    static ReplaceAnnotation replaceAnnotation(Integer index, String content) {
        if (index == null) throw new InvalidOperation("replace_annotation requires an index");
        if (content == null) throw new InvalidOperation("replace_annotation requires content");
        return new ReplaceAnnotation(index, new Annotation(content));
    }

    /** True for operations that edit the page sequence. */
    default boolean isPageOperation() {
        return this instanceof AddPage || this instanceof InsertPage || this instanceof DeletePage;
    }

    /** True for operations that edit the annotation list. */
    default boolean isAnnotationOperation() {
        return this instanceof AddAnnotation || this instanceof RemoveAnnotation || this instanceof ReplaceAnnotation;
    }

    /** Strict mode: unknown tags are rejected, never ignored. */
    static UnsupportedOperation unsupported(String type) {
        return new UnsupportedOperation(type);
    }
}
