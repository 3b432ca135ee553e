package com.bastion.security.identity;

import com.bastion.security.account.Account;
import com.bastion.security.account.Accounts;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * The "who" of a request: one account plus the roles derived for it at assignment time.
 * <p>
 * Lives for one request on one thread (see {@link IdentityHolder}); never persisted.
 *
 * @param account the acting account
 * @param roles   roles computed when the identity was assigned
 */
public record Identity(Account account, Set<Role> roles) {

    /** Identity of a request that has not authenticated. */
    public static final Identity ANONYMOUS = new Identity(Accounts.GUEST, Set.of(Role.EVERYONE));

    public Identity {
        Objects.requireNonNull(account, "account must not be null");
        roles = roles == null || roles.isEmpty()
                ? Set.of(Role.EVERYONE)
                : Set.copyOf(EnumSet.copyOf(roles));
    }

    public UUID accountId() {
        return account.id();
    }

    public int tenantId() {
        return account.tenantId();
    }

    public boolean isAuthenticated() {
        return account.authenticated();
    }

    public boolean hasRole(Role role) {
        return roles.contains(role);
    }
}
