// file: client/src/main/java/io/scorelite/client/ApiException.java
package io.scorelite.client;

/**
 * Non-2xx answer from the server, carrying the server's error code
 * (e.g. "CONCURRENCY_CONFLICT") when the body had one.
 */
public class ApiException extends RuntimeException {
    private final int status;
    private final String code;

    public ApiException(int status, String code, String message) {
        super(message + " (" + status + (code != null ? ", " + code : "") + ")");
        this.status = status;
        this.code = code;
    }

    public int status() { return status; }

    public String code() { return code; }

    /** Someone else changed the score first: re-read and retry. */
    public boolean isConflict() { return "CONCURRENCY_CONFLICT".equals(code); }
}
