package com.bastion.security.auth;

import com.bastion.security.account.Account;
import com.bastion.security.account.Accounts;
import com.bastion.security.account.UserAccount;
import com.bastion.security.account.UserRecord;
import com.bastion.security.account.UserStatus;
import com.bastion.security.identity.Identity;
import com.bastion.security.identity.Role;
import com.bastion.security.store.IdentityRegistry;
import com.bastion.security.store.TenantPlanProvider;

import java.util.EnumSet;
import java.util.Objects;

/**
 * Turns an account into an {@link Identity}, computing its roles and enforcing the account
 * rules shared by every way of authenticating.
 * <p>
 * Roles: always EVERYONE; SYSTEM for the core system account; USERS for every user account plus
 * ADMINISTRATORS for members of the admin group. A user account is re-read from the registry and
 * must be known, active and, if directory-bound, licensed for the tenant.
 */
public class IdentityAssigner {

    private final IdentityRegistry registry;
    private final TenantPlanProvider planProvider;

    public IdentityAssigner(IdentityRegistry registry, TenantPlanProvider planProvider) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.planProvider = Objects.requireNonNull(planProvider, "planProvider must not be null");
    }

    /**
     * @param account  account to assign (null is treated as the guest)
     * @param tenantId tenant of the current request
     * @return the granted identity (without token) or the failure
     */
    public AuthResult assign(Account account, int tenantId) {
        if (account == null) {
            return new AuthResult.Denied(AuthFailure.INVALID_CREDENTIALS);
        }
        return switch (account.kind()) {
            case ANONYMOUS -> new AuthResult.Denied(AuthFailure.INVALID_CREDENTIALS);
            case SYSTEM -> {
                EnumSet<Role> roles = EnumSet.of(Role.EVERYONE);
                if (Accounts.CORE_SYSTEM.id().equals(account.id())) {
                    roles.add(Role.SYSTEM);
                }
                yield new AuthResult.Granted(new Identity(account, roles), null);
            }
            case USER -> assignUser(account, tenantId);
        };
    }

    private AuthResult assignUser(Account account, int tenantId) {
        UserRecord user = registry.user(tenantId, account.id());
        if (user.isLost()) {
            return new AuthResult.Denied(AuthFailure.INVALID_CREDENTIALS);
        }
        if (user.status() != UserStatus.ACTIVE) {
            return new AuthResult.Denied(AuthFailure.ACCOUNT_DISABLED);
        }
        if (user.isDirectoryBound() && !planProvider.isDirectoryLoginLicensed(tenantId)) {
            return new AuthResult.Denied(AuthFailure.FEATURE_NOT_LICENSED);
        }
        EnumSet<Role> roles = EnumSet.of(Role.EVERYONE);
        if (registry.isInGroup(tenantId, user.id(), Accounts.ADMIN_GROUP_ID)) {
            roles.add(Role.ADMINISTRATORS);
        }
        roles.add(Role.USERS);
        return new AuthResult.Granted(new Identity(UserAccount.of(user), roles), null);
    }
}
