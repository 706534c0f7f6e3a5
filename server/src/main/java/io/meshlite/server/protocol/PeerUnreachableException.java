package io.meshlite.server.protocol;

/**
 * A peer could not be talked to: connection refused, timeout, or a non-success
 * HTTP status. The peer may still hold the content; it just did not answer.
 */
public class PeerUnreachableException extends RuntimeException {

    private final String target;

    public PeerUnreachableException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public PeerUnreachableException(String target, String message) {
        this(target, message, null);
    }

    /** host:port (or peer id) that failed. */
    public String target() {
        return target;
    }
}
