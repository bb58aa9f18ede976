// file: src/main/java/io/scorelite/server/dto/CommitResponse.java
package io.scorelite.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.scorelite.server.ScoreService;

import java.util.List;

/**
 * JSON response for a successful commit.
 * Example:
 *   { "head_hash": "..", "version": 2, "pages": ["..", ".."], "annotations": [], "property_hash": ".." }
 */
public class CommitResponse {
    @JsonProperty("head_hash")
    public String headHash;

    public Integer version; // null until the first page or annotation commit

    public List<String> pages;

    public List<String> annotations;

    @JsonProperty("property_hash")
    public String propertyHash;

    public static CommitResponse from(ScoreService.CommitResult r) {
        var dto = new CommitResponse();
        dto.headHash = r.snapshotHash();
        dto.version = r.version();
        dto.pages = r.pages();
        dto.annotations = r.annotations();
        dto.propertyHash = r.propertyHash();
        return dto;
    }
}
