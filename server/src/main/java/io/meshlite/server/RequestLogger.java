package io.meshlite.server;

import io.meshlite.core.ContentHash;
import io.undertow.server.HttpServerExchange;

import java.net.InetSocketAddress;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging for the HTTP surface.
 *
 * One line per request: method, path, calling address, status, and, where the
 * handler measured them, latency and the peer or track the request was about.
 * Content hashes in paths are shortened so lines stay readable.
 * 5xx responses are logged at WARNING with their cause, everything else at INFO.
 */
final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private static final String CONTENT_PREFIX = "/content/";

    private RequestLogger() {
        // utility
    }

    /** Requests answered straight from memory: no timing, no subject. */
    static void logRequest(HttpServerExchange ex, int status) {
        logRequest(ex, status, -1, -1, null, null);
    }

    /**
     * @param totalMillis   wall-clock latency for the whole request, or -1 if not measured
     * @param storageMillis content store latency, or -1 if the request did not touch disk
     * @param subject       what the request concerned, e.g. "peer=..." or "track=...", or null
     * @param error         cause of a 5xx, or null
     */
    static void logRequest(HttpServerExchange ex, int status, long totalMillis, long storageMillis,
                           String subject, Throwable error) {
        String msg = format(ex.getRequestMethod().toString(), ex.getRequestPath(), remote(ex),
                status, totalMillis, storageMillis, subject);

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else {
            log.log(Level.INFO, msg);
        }
    }

    static String format(String method, String path, String remote, int status,
                         long totalMillis, long storageMillis, String subject) {
        StringBuilder sb = new StringBuilder()
                .append("HTTP ").append(method).append(' ').append(shortenPath(path))
                .append(" from ").append(remote == null ? "?" : remote)
                .append(" -> ").append(status);

        StringBuilder detail = new StringBuilder();
        if (subject != null) {
            detail.append(subject);
        }
        if (totalMillis >= 0) {
            appendField(detail, "total=" + totalMillis + "ms");
        }
        if (storageMillis >= 0) {
            appendField(detail, "storage=" + storageMillis + "ms");
        }
        if (detail.length() > 0) {
            sb.append(" (").append(detail).append(')');
        }
        return sb.toString();
    }

    private static void appendField(StringBuilder sb, String field) {
        if (sb.length() > 0) {
            sb.append(", ");
        }
        sb.append(field);
    }

    private static String shortenPath(String path) {
        if (path.startsWith(CONTENT_PREFIX)) {
            String hash = path.substring(CONTENT_PREFIX.length());
            if (ContentHash.isValid(hash)) {
                return CONTENT_PREFIX + ContentHash.shortForm(hash);
            }
        }
        return path;
    }

    private static String remote(HttpServerExchange ex) {
        InetSocketAddress source = ex.getSourceAddress();
        return source == null ? null : source.getHostString();
    }
}
