package com.bastion.security.account;

import java.util.Objects;
import java.util.UUID;

/**
 * A tenant-scoped person account.
 *
 * @param id          user identifier (unique within the tenant)
 * @param tenantId    owning tenant
 * @param displayName human-readable name
 */
public record UserAccount(UUID id, int tenantId, String displayName) implements Account {

    public UserAccount {
        Objects.requireNonNull(id, "id must not be null");
        displayName = displayName == null ? "" : displayName;
    }

    /** Builds the account view of a stored user record. */
    public static UserAccount of(UserRecord user) {
        return new UserAccount(user.id(), user.tenantId(), user.displayName());
    }

    @Override
    public boolean authenticated() {
        return true;
    }

    @Override
    public AccountKind kind() {
        return AccountKind.USER;
    }
}
