// file: client/src/main/java/io/scorelite/client/ScoreSummaryInfo.java
package io.scorelite.client;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of GET /scores/{owner}.
 */
public class ScoreSummaryInfo {
    public String owner;

    @JsonProperty("score_name")
    public String scoreName;

    public String title;

    @JsonProperty("latest_version")
    public Integer latestVersion;
}
