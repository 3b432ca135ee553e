package com.bastion.security.auth;

import com.bastion.security.identity.Identity;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of assigning an identity: either {@link Granted} or {@link Denied}.
 */
public sealed interface AuthResult permits AuthResult.Granted, AuthResult.Denied {

    boolean isGranted();

    /**
     * @return this result as {@link Granted}
     * @throws AuthenticationException the typed failure when denied
     */
    Granted orElseThrow();

    /**
     * @param identity the identity now bound to the request
     * @param token    freshly minted session token; null for system accounts and for checks that
     *                 do not mint
     */
    record Granted(Identity identity, String token) implements AuthResult {

        public Granted {
            Objects.requireNonNull(identity, "identity must not be null");
        }

        public Optional<String> sessionToken() {
            return Optional.ofNullable(token);
        }

        public Granted withToken(String newToken) {
            return new Granted(identity, newToken);
        }

        @Override
        public boolean isGranted() {
            return true;
        }

        @Override
        public Granted orElseThrow() {
            return this;
        }
    }

    /**
     * @param failure why assignment failed
     */
    record Denied(AuthFailure failure) implements AuthResult {

        public Denied {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public boolean isGranted() {
            return false;
        }

        @Override
        public Granted orElseThrow() {
            throw failure.toException();
        }
    }
}
