// file: src/main/java/io/scorelite/server/dto/VersionResponse.java
package io.scorelite.server.dto;

import io.scorelite.core.VersionEntry;

/**
 * One element of GET /scores/{owner}/{name}/versions.
 * Example:
 *   { "version": 1, "hash": "5f1c..." }
 */
public class VersionResponse {
    public int version;
    public String hash;

    public static VersionResponse from(VersionEntry e) {
        var dto = new VersionResponse();
        dto.version = e.version();
        dto.hash = e.snapshotHash();
        return dto;
    }
}
