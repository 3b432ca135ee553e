package com.bastion.security.authz;

/**
 * Thrown when a policy document cannot be read or contains an invalid rule.
 */
public class PolicyLoadException extends RuntimeException {

    public PolicyLoadException(String message) {
        super(message);
    }

    public PolicyLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
