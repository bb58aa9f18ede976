// file: src/main/java/io/scorelite/server/dto/PagePayload.java
package io.scorelite.server.dto;

/**
 * Payload of add_page, insert_page and delete_page. Which fields are required
 * depends on the operation type; missing ones are rejected when mapped.
 */
public class PagePayload {
    public Integer index;     // insert_page, delete_page
    public String image;      // blob reference
    public String thumbnail;  // blob reference
    public String number;     // display label
}
