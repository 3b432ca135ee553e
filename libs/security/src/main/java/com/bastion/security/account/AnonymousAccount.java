package com.bastion.security.account;

import java.util.Objects;
import java.util.UUID;

/**
 * The unauthenticated guest.
 *
 * @param id          identifier of the guest sentinel
 * @param displayName human-readable name
 */
public record AnonymousAccount(UUID id, String displayName) implements Account {

    public AnonymousAccount {
        Objects.requireNonNull(id, "id must not be null");
    }

    @Override
    public int tenantId() {
        return Accounts.NO_TENANT;
    }

    @Override
    public boolean authenticated() {
        return false;
    }

    @Override
    public AccountKind kind() {
        return AccountKind.ANONYMOUS;
    }
}
