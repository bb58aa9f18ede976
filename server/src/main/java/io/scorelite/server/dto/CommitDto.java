// file: src/main/java/io/scorelite/server/dto/CommitDto.java
package io.scorelite.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.scorelite.core.CommitOperation;
import io.scorelite.core.ScoreHistoryException.InvalidOperation;

/**
 * One element of "commits": a type tag plus the payload stored under the field
 * of the same name.
 * Example:
 *   { "type": "insert_page", "insert_page": { "index": 1, "image": "..", "thumbnail": "..", "number": "2" } }
 */
public class CommitDto {
    public String type;

    @JsonProperty("add_page")
    public PagePayload addPage;

    @JsonProperty("insert_page")
    public PagePayload insertPage;

    @JsonProperty("delete_page")
    public PagePayload deletePage;

    @JsonProperty("update_property")
    public PropertyDto updateProperty;

    @JsonProperty("add_annotation")
    public AnnotationPayload addAnnotation;

    @JsonProperty("remove_annotation")
    public AnnotationPayload removeAnnotation;

    @JsonProperty("replace_annotation")
    public AnnotationPayload replaceAnnotation;

    public CommitOperation toOperation() {
        if (type == null) throw new InvalidOperation("commit type is required");
        return switch (type) {
            case CommitOperation.TYPE_ADD_PAGE -> {
                PagePayload p = require(addPage);
                yield CommitOperation.addPage(p.image, p.thumbnail, p.number);
            }
            case CommitOperation.TYPE_INSERT_PAGE -> {
                PagePayload p = require(insertPage);
                yield CommitOperation.insertPage(p.index, p.image, p.thumbnail, p.number);
            }
            case CommitOperation.TYPE_DELETE_PAGE -> CommitOperation.deletePage(require(deletePage).index);
            case CommitOperation.TYPE_UPDATE_PROPERTY -> {
                PropertyDto p = require(updateProperty);
                yield CommitOperation.updateProperty(p.title, p.description);
            }
            case CommitOperation.TYPE_ADD_ANNOTATION -> CommitOperation.addAnnotation(require(addAnnotation).content);
            case CommitOperation.TYPE_REMOVE_ANNOTATION -> CommitOperation.removeAnnotation(require(removeAnnotation).index);
            case CommitOperation.TYPE_REPLACE_ANNOTATION -> {
                AnnotationPayload p = require(replaceAnnotation);
                yield CommitOperation.replaceAnnotation(p.index, p.content);
            }
            default -> throw CommitOperation.unsupported(type);
        };
    }

    private <T> T require(T payload) {
        if (payload == null) throw new InvalidOperation(type + " requires a '" + type + "' payload");
        return payload;
    }
}
