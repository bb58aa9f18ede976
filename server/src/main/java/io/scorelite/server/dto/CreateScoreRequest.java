// file: src/main/java/io/scorelite/server/dto/CreateScoreRequest.java
package io.scorelite.server.dto;

/**
 * JSON body for POST /scores/{owner}/{name}.
 * Example:
 *   {
 *     "property": { "title": "Sonata", "description": "first draft" }
 *   }
 */
public class CreateScoreRequest {
    public PropertyDto property; // optional; absent means an empty property
}
