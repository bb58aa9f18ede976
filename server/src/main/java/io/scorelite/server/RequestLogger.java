// file: server/src/main/java/io/scorelite/server/RequestLogger.java
package io.scorelite.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place for request-level logging.
 *
 * Responsibilities:
 *  - One line per HTTP request: method, path, status and latency.
 *  - Server errors are logged at WARNING with their cause; client errors and
 *    successes at INFO.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method       HTTP method (GET, POST, PATCH, ...)
     * @param path         request path
     * @param status       HTTP status code
     * @param totalMillis  wall-clock latency for the whole request
     * @param engineMillis latency of the engine call, or -1 if the request never reached it
     * @param error        exception behind an error status, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long engineMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                engineMillis >= 0 ? ", engine=" + engineMillis + "ms" : ""
        );

        if (error != null && status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 500) {
            log.log(Level.WARNING, msg);
        } else if (error != null) {
            log.log(Level.INFO, msg + ": " + error.getMessage());
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
