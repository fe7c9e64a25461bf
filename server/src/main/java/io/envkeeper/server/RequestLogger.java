package io.envkeeper.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-request access log.
 * <p>
 * One line per request: method, path, status, total latency and the time spent
 * inside the supervisor operation. 5xx lines are WARNING with the error attached.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * @param opMillis time spent in the supervisor call, or -1 if none was made
     * @param error    failure behind a 4xx/5xx, or null
     */
    public static void logRequest(String method, String path, int status, long totalMillis, long opMillis, Throwable error) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                opMillis >= 0 ? ", op=" + opMillis + "ms" : ""
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (error != null) {
            log.log(Level.INFO, msg + ": " + error.getMessage());
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
