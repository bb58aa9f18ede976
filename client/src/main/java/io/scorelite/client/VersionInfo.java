package io.scorelite.client;

/**
 * One recorded version: its number and the snapshot it points at.
 */
public class VersionInfo {
    public int version;
    public String hash;
}
