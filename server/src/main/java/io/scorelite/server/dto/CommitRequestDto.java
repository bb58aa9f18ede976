// file: src/main/java/io/scorelite/server/dto/CommitRequestDto.java
package io.scorelite.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.scorelite.core.CommitOperation;
import io.scorelite.core.CommitRequest;
import io.scorelite.core.ScoreHistoryException.InvalidOperation;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON body for POST /scores/{owner}/{name}/commits.
 * Example:
 *   {
 *     "parent": "5f1c...",
 *     "property_parent": "9ab0...",
 *     "commits": [
 *       { "type": "add_page", "add_page": { "image": "..", "thumbnail": "..", "number": "1" } },
 *       { "type": "add_annotation", "add_annotation": { "content": "breathe here" } },
 *       { "type": "update_property", "update_property": { "title": "Sonata No. 2" } }
 *     ]
 *   }
 * "property_parent" is only needed when the batch contains update_property.
 */
public class CommitRequestDto {
    public String parent;

    @JsonProperty("property_parent")
    public String propertyParent;

    public List<CommitDto> commits;

    public CommitRequest toCommitRequest() {
        List<CommitOperation> ops = new ArrayList<>();
        if (commits != null) {
            for (CommitDto c : commits) {
                if (c == null) throw new InvalidOperation("commit element must be an object");
                ops.add(c.toOperation());
            }
        }
        return new CommitRequest(parent, propertyParent, ops);
    }
}
