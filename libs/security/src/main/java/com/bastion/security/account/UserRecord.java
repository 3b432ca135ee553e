package com.bastion.security.account;

import java.util.Objects;
import java.util.UUID;

/**
 * Stored user as returned by an {@link com.bastion.security.store.IdentityRegistry}.
 *
 * @param id           user identifier
 * @param tenantId     owning tenant
 * @param login        login name (email or user name)
 * @param displayName  human-readable name
 * @param status       current status
 * @param directorySid directory security identifier for externally provisioned users, else null
 */
public record UserRecord(
        UUID id,
        int tenantId,
        String login,
        String displayName,
        UserStatus status,
        String directorySid
) {

    public UserRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    /** Creates an active, locally provisioned user. */
    public static UserRecord active(UUID id, int tenantId, String login, String displayName) {
        return new UserRecord(id, tenantId, login, displayName, UserStatus.ACTIVE, null);
    }

    /** True for the sentinel returned when a lookup finds nobody. */
    public boolean isLost() {
        return Accounts.LOST_USER_ID.equals(id);
    }

    /** True when the user is bound to an external directory. */
    public boolean isDirectoryBound() {
        return directorySid != null;
    }

    public UserRecord withStatus(UserStatus newStatus) {
        return new UserRecord(id, tenantId, login, displayName, newStatus, directorySid);
    }
}
