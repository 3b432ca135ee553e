package com.bastion.security.auth;

/**
 * The account exists but its status is not active.
 */
public class AccountDisabledException extends AuthenticationException {

    public AccountDisabledException() {
        super(AuthFailure.ACCOUNT_DISABLED);
    }
}
