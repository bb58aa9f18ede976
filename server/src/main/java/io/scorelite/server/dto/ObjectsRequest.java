// file: src/main/java/io/scorelite/server/dto/ObjectsRequest.java
package io.scorelite.server.dto;

import java.util.List;

/**
 * JSON body for POST /objects.
 * Example:
 *   { "hashes": ["5f1c...", "9ab0..."] }
 */
public class ObjectsRequest {
    public List<String> hashes;
}
