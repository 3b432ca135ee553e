package com.bastion.security.store;

import java.util.Set;

/**
 * Answers entitlement questions about a tenant's plan.
 */
@FunctionalInterface
public interface TenantPlanProvider {

    /**
     * @return true if users bound to an external directory may log in to this tenant
     */
    boolean isDirectoryLoginLicensed(int tenantId);

    /** Standalone installations are entitled to everything. */
    static TenantPlanProvider standalone() {
        return tenantId -> true;
    }

    /** Only the listed tenants are entitled to directory login. */
    static TenantPlanProvider directoryLoginFor(Set<Integer> tenantIds) {
        Set<Integer> licensed = Set.copyOf(tenantIds);
        return licensed::contains;
    }
}
