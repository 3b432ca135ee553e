package com.bastion.security.account;

import java.util.Objects;
import java.util.UUID;

/**
 * A platform service identity. System accounts are not bound to a tenant and never receive a
 * session token.
 *
 * @param id          globally unique identifier
 * @param displayName human-readable name
 */
public record SystemAccount(UUID id, String displayName) implements Account {

    public SystemAccount {
        Objects.requireNonNull(id, "id must not be null");
    }

    @Override
    public int tenantId() {
        return Accounts.NO_TENANT;
    }

    @Override
    public boolean authenticated() {
        return true;
    }

    @Override
    public AccountKind kind() {
        return AccountKind.SYSTEM;
    }
}
