// file: client/src/main/java/io/scorelite/client/ScoreInfo.java
package io.scorelite.client;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Score detail as returned by GET /scores/{owner}/{name}.
 */
public class ScoreInfo {
    public String owner;

    @JsonProperty("score_name")
    public String scoreName;

    @JsonProperty("head_hash")
    public String headHash;

    @JsonProperty("property_hash")
    public String propertyHash;

    public Property property;
    public List<String> pages;
    public List<String> annotations;
    public List<String> versions;

    public static class Property {
        public String title;
        public String description;
    }
}
