// file: src/main/java/io/scorelite/server/dto/UpdatePropertyRequest.java
package io.scorelite.server.dto;

/**
 * JSON body for PATCH /scores/{owner}/{name}/property.
 * Only the provided fields are changed.
 * Example:
 *   {
 *     "parent": "9ab0...",
 *     "property": { "description": "second draft" }
 *   }
 */
public class UpdatePropertyRequest {
    public String parent;        // property hash the caller last saw
    public PropertyDto property;
}
