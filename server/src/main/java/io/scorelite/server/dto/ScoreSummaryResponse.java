// file: src/main/java/io/scorelite/server/dto/ScoreSummaryResponse.java
package io.scorelite.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.scorelite.server.ScoreService;

/**
 * One element of GET /scores/{owner}.
 */
public class ScoreSummaryResponse {
    public String owner;

    @JsonProperty("score_name")
    public String scoreName;

    public String title;

    @JsonProperty("latest_version")
    public Integer latestVersion;

    public static ScoreSummaryResponse from(ScoreService.ScoreSummary s) {
        var dto = new ScoreSummaryResponse();
        dto.owner = s.id().owner();
        dto.scoreName = s.id().scoreName();
        dto.title = s.title();
        dto.latestVersion = s.latestVersion();
        return dto;
    }
}
