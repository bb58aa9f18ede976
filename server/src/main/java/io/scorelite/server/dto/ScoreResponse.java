// file: src/main/java/io/scorelite/server/dto/ScoreResponse.java
package io.scorelite.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.scorelite.server.ScoreService;

import java.util.List;

/**
 * JSON response for GET /scores/{owner}/{name} (and score creation).
 * Example:
 *   {
 *     "owner": "u1",
 *     "score_name": "s1",
 *     "head_hash": "..",
 *     "property_hash": "..",
 *     "property": { "title": "Sonata", "description": null },
 *     "pages": ["..", ".."],
 *     "annotations": [".."],
 *     "versions": ["1", "2"]
 *   }
 */
public class ScoreResponse {
    public String owner;

    @JsonProperty("score_name")
    public String scoreName;

    @JsonProperty("head_hash")
    public String headHash;

    @JsonProperty("property_hash")
    public String propertyHash;

    public PropertyDto property;
    public List<String> pages;
    public List<String> annotations;
    public List<String> versions;

    public static ScoreResponse from(ScoreService.ScoreDetail d) {
        var dto = new ScoreResponse();
        dto.owner = d.id().owner();
        dto.scoreName = d.id().scoreName();
        dto.headHash = d.headHash();
        dto.propertyHash = d.propertyHash();
        dto.property = PropertyDto.from(d.property());
        dto.pages = d.pageHashes();
        dto.annotations = d.annotationHashes();
        dto.versions = d.versions();
        return dto;
    }
}
