package com.bastion.security.auth;

/**
 * Bad login or password, unknown user, or an attempt to assign the guest account.
 */
public class InvalidCredentialException extends AuthenticationException {

    public InvalidCredentialException() {
        super(AuthFailure.INVALID_CREDENTIALS);
    }
}
