// file: client/src/main/java/io/scorelite/client/PageInfo.java
package io.scorelite.client;

/**
 * One page of a page listing.
 */
public class PageInfo {
    public String hash;
    public String image;
    public String thumbnail;
    public String number;
}
