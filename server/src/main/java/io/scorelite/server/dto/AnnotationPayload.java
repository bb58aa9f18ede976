// file: src/main/java/io/scorelite/server/dto/AnnotationPayload.java
package io.scorelite.server.dto;

/**
 * Payload of add_annotation, remove_annotation and replace_annotation.
 * "index" is required by remove/replace, "content" by add/replace.
 */
public class AnnotationPayload {
    public Integer index;
    public String content;
}
