package com.bastion.security.auth;

/**
 * Per-request authentication state.
 * <pre>
 * ANONYMOUS -> AUTHENTICATING -> AUTHENTICATED | REJECTED
 * AUTHENTICATED -> ANONYMOUS (logout)
 * </pre>
 */
public enum AuthenticationState {
    ANONYMOUS,
    AUTHENTICATING,
    AUTHENTICATED,
    REJECTED
}
