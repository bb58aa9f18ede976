// file: client/src/main/java/io/scorelite/client/CommitInfo.java
package io.scorelite.client;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of a commit: the new head and the version it was recorded as.
 */
public class CommitInfo {
    @JsonProperty("head_hash")
    public String headHash;

    public Integer version;
    public List<String> pages;
    public List<String> annotations;

    @JsonProperty("property_hash")
    public String propertyHash;
}
