// file: src/main/java/io/scorelite/server/dto/PageResponse.java
package io.scorelite.server.dto;

import io.scorelite.server.ScoreService;

/**
 * One page in a page listing, in document order.
 */
public class PageResponse {
    public String hash;
    public String image;
    public String thumbnail;
    public String number;

    public static PageResponse from(ScoreService.StoredPage p) {
        var dto = new PageResponse();
        dto.hash = p.hash();
        dto.image = p.page().image();
        dto.thumbnail = p.page().thumbnail();
        dto.number = p.page().number();
        return dto;
    }
}
