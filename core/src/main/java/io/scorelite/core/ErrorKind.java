package io.scorelite.core;

/**
 * Stable error codes. Each maps to a user-facing category so a client can tell
 * "refresh and retry" apart from "this request is malformed".
 */
public enum ErrorKind {
    SCORE_NOT_FOUND("not found"),
    VERSION_NOT_FOUND("not found"),
    OBJECT_NOT_FOUND("not found"),
    SCORE_ALREADY_EXISTS("already exists"),
    CONCURRENCY_CONFLICT("stale data, refresh and retry"),
    INVALID_OPERATION("malformed request"),
    NO_CHANGE("nothing to update"),
    UNSUPPORTED_OPERATION("malformed request");

    private final String category;

    ErrorKind(String category) {
        this.category = category;
    }

    public String category() { return category; }

    /** Only a conflict is worth retrying, and only after re-reading the head. */
    public boolean retryable() { return this == CONCURRENCY_CONFLICT; }
}
