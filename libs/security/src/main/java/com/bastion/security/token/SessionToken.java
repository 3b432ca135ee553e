package com.bastion.security.token;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;

/**
 * Logical content of a session cookie.
 * <p>
 * The server keeps no per-token record: a token is live while its tenant matches the request,
 * both generation indices are current, it has not expired and (when {@code loginEventId != 0})
 * its login event is still registered.
 *
 * @param tenantId         tenant the token was minted for
 * @param userId           user the token authenticates
 * @param tenantGeneration tenant generation index at mint time
 * @param userGeneration   user generation index at mint time
 * @param expiresAt        expiry, millisecond precision; {@link #NEVER} for no expiry
 * @param loginEventId     login event id, 0 when the session is not tracked
 */
public record SessionToken(
        int tenantId,
        UUID userId,
        int tenantGeneration,
        int userGeneration,
        Instant expiresAt,
        int loginEventId
) {

    /** Expiry sentinel: encoded as {@code Long.MAX_VALUE} epoch millis. */
    public static final Instant NEVER = Instant.ofEpochMilli(Long.MAX_VALUE);

    public SessionToken {
        Objects.requireNonNull(userId, "userId must not be null");
        Objects.requireNonNull(expiresAt, "expiresAt must not be null");
        expiresAt = expiresAt.truncatedTo(ChronoUnit.MILLIS);
    }

    public boolean neverExpires() {
        return NEVER.equals(expiresAt);
    }

    /** True if the token has a finite expiry that lies before {@code now}. */
    public boolean isExpiredAt(Instant now) {
        return !neverExpires() && expiresAt.isBefore(now);
    }

    public boolean tracksLoginEvent() {
        return loginEventId != 0;
    }
}
