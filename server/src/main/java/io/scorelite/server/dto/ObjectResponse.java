// file: src/main/java/io/scorelite/server/dto/ObjectResponse.java
package io.scorelite.server.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.scorelite.core.Annotation;
import io.scorelite.core.Page;
import io.scorelite.core.Property;
import io.scorelite.core.ScoreObject;
import io.scorelite.core.Snapshot;

import java.util.List;
import java.util.Locale;

/**
 * One stored object keyed by its hash in the POST /objects response.
 * Only the fields of the object's kind are present.
 * Examples:
 *   { "kind": "page", "image": "..", "thumbnail": "..", "number": "1" }
 *   { "kind": "snapshot", "parent": "..", "pages": [".."], "annotations": [] }
 *   { "kind": "property", "parent": "..", "title": "Sonata" }
 *   { "kind": "annotation", "content": "breathe here" }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ObjectResponse {
    public String kind;
    public String parent;
    public List<String> pages;
    public List<String> annotations;
    public String image;
    public String thumbnail;
    public String number;
    public String title;
    public String description;
    public String content;

    public static ObjectResponse from(ScoreObject obj) {
        var dto = new ObjectResponse();
        dto.kind = obj.kind().name().toLowerCase(Locale.ROOT);
        if (obj instanceof Page p) {
            dto.image = p.image();
            dto.thumbnail = p.thumbnail();
            dto.number = p.number();
        } else if (obj instanceof Snapshot s) {
            dto.parent = s.parent();
            dto.pages = s.pages();
            dto.annotations = s.annotations();
        } else if (obj instanceof Property p) {
            dto.parent = p.parent();
            dto.title = p.title();
            dto.description = p.description();
        } else if (obj instanceof Annotation a) {
            dto.content = a.content();
        }
        return dto;
    }
}
