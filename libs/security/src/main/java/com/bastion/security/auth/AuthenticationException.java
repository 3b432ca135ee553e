package com.bastion.security.auth;

/**
 * Base of the typed authentication failures. Each subtype corresponds to one
 * {@link AuthFailure}.
 */
public abstract class AuthenticationException extends RuntimeException {

    private final AuthFailure failure;

    protected AuthenticationException(AuthFailure failure) {
        super(failure.message());
        this.failure = failure;
    }

    public AuthFailure failure() {
        return failure;
    }
}
