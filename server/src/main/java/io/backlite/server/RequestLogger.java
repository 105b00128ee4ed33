// file: server/src/main/java/io/backlite/server/RequestLogger.java
package io.backlite.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place for per-request logging: method, path, status and latency.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param actor       value of X-Actor, or the default actor
     * @param totalMillis wall-clock latency for the whole request
     * @param error       exception behind a 5xx response, null otherwise
     */
    public static void logRequest(String method, String path, String actor, int status,
                                  long totalMillis, Throwable error) {
        String msg = String.format("HTTP %s %s [%s] -> %d (total=%dms)", method, path, actor, status, totalMillis);
        if (status >= 500) {
            if (error != null) log.log(Level.WARNING, msg, error);
            else log.log(Level.WARNING, msg);
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
