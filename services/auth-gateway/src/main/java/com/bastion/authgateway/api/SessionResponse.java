package com.bastion.authgateway.api;

import com.bastion.security.auth.AuthenticationState;
import com.bastion.security.identity.Identity;
import com.bastion.security.identity.Role;
import java.util.List;

/**
 * The identity bound to the current request.
 *
 * @param accountId acting account id
 * @param tenantId tenant of the account; -1 for accounts that are not tenant-scoped
 * @param displayName account display name
 * @param authenticated false for the guest
 * @param roles role values, e.g. {@code "Users"}
 * @param state authentication state of the request
 */
public record SessionResponse(
        String accountId,
        int tenantId,
        String displayName,
        boolean authenticated,
        List<String> roles,
        AuthenticationState state) {

    public static SessionResponse of(Identity identity, AuthenticationState state) {
        return new SessionResponse(
                identity.accountId().toString(),
                identity.tenantId(),
                identity.account().displayName(),
                identity.isAuthenticated(),
                identity.roles().stream().sorted().map(Role::value).toList(),
                state);
    }
}
