package com.bastion.security.account;

import java.util.UUID;

/**
 * An identity that can act within the platform.
 *
 * <p>Closed over three variants: {@link UserAccount} (a person within one tenant),
 * {@link SystemAccount} (a platform-wide service identity) and {@link AnonymousAccount}
 * (the unauthenticated guest). Accounts are immutable values; a change of identity always
 * produces a new account.
 */
public sealed interface Account permits UserAccount, SystemAccount, AnonymousAccount {

    /** Opaque identifier, unique within a tenant for users and globally for system accounts. */
    UUID id();

    /** Owning tenant, or {@link Accounts#NO_TENANT} for accounts that are not tenant-scoped. */
    int tenantId();

    String displayName();

    boolean authenticated();

    AccountKind kind();
}
