package com.bastion.security.authz;

import com.bastion.security.account.AccountKind;
import com.bastion.security.identity.Identity;

/**
 * Compares an identity's tenant with a resource's tenant. System accounts are not tenant-scoped
 * and pass for every tenant.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    public static boolean isSameTenant(Identity identity, int resourceTenantId) {
        return identity.account().kind() == AccountKind.SYSTEM || identity.tenantId() == resourceTenantId;
    }
}
