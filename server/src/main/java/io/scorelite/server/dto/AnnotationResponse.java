// file: src/main/java/io/scorelite/server/dto/AnnotationResponse.java
package io.scorelite.server.dto;

import io.scorelite.server.ScoreService;

/**
 * One annotation in GET .../annotations, in snapshot order.
 * Example:
 *   { "index": 0, "hash": "..", "content": "breathe here" }
 */
public class AnnotationResponse {
    public int index;
    public String hash;
    public String content;

    public static AnnotationResponse from(int index, ScoreService.StoredAnnotation a) {
        var dto = new AnnotationResponse();
        dto.index = index;
        dto.hash = a.hash();
        dto.content = a.annotation().content();
        return dto;
    }
}
