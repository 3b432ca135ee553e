package com.bastion.security.token;

/**
 * Raised by {@link TokenCodec#decode(String)} for any value that is not a token this codec
 * produced. The message never contains the token itself.
 */
public class TokenDecodeException extends Exception {

    /** Why decoding failed. */
    public enum Reason {
        MALFORMED,
        INTEGRITY,
        UNSUPPORTED_VERSION
    }

    private final Reason reason;

    public TokenDecodeException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TokenDecodeException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
