package io.scorelite.client;

/**
 * One annotation of an annotation listing, in snapshot order.
 */
public class AnnotationInfo {
    public int index;
    public String hash;
    public String content;
}
