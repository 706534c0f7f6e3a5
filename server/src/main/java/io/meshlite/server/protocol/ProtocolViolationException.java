package io.meshlite.server.protocol;

/**
 * A peer answered, but not in the expected shape: malformed JSON, missing
 * fields, or bytes that do not hash to the address that was requested.
 */
public class ProtocolViolationException extends RuntimeException {

    private final String target;

    public ProtocolViolationException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public ProtocolViolationException(String target, String message) {
        this(target, message, null);
    }

    public String target() {
        return target;
    }
}
