package com.bastion.security.token;

import java.util.Locale;
import java.util.Optional;

/**
 * Locates the session token of a request.
 * <p>
 * The literal {@value #BEARER_MARKER} is reserved: presented in place of a cookie it means the
 * caller authenticates with an Authorization header handled elsewhere, and it is never handed to
 * a {@link TokenCodec}.
 */
public final class TokenExtractor {

    /** Reserved value meaning "header-based bearer auth in use, no cookie". */
    public static final String BEARER_MARKER = "Bearer";

    private TokenExtractor() {
        // utility class
    }

    public static boolean isBearerMarker(String raw) {
        return BEARER_MARKER.equals(raw);
    }

    /**
     * Picks the value to authenticate with: the session cookie when present, otherwise
     * {@link #BEARER_MARKER} when the request carries a bearer Authorization header.
     *
     * @param cookieValue         session cookie value (may be null)
     * @param authorizationHeader full Authorization header value (may be null)
     * @return the raw token, the bearer marker, or empty if the request carries neither
     */
    public static Optional<String> sessionToken(String cookieValue, String authorizationHeader) {
        if (cookieValue != null && !cookieValue.isBlank()) {
            return Optional.of(cookieValue.strip());
        }
        if (bearerToken(authorizationHeader).isPresent()) {
            return Optional.of(BEARER_MARKER);
        }
        return Optional.empty();
    }

    /**
     * Extracts the token from a {@code "Bearer <token>"} Authorization header value.
     *
     * @param authorizationHeader the full header value (may be null)
     * @return the token string, or empty if the header is missing or malformed
     */
    public static Optional<String> bearerToken(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (!trimmed.toLowerCase(Locale.ROOT).startsWith("bearer ")) {
            return Optional.empty();
        }
        String token = trimmed.substring("bearer".length()).strip();
        if (token.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(token);
    }
}
