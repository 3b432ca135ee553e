package com.bastion.security.auth;

/**
 * A password change supplied the password that is already set.
 */
public class PasswordReuseException extends AuthenticationException {

    public PasswordReuseException() {
        super(AuthFailure.PASSWORD_REUSE);
    }
}
