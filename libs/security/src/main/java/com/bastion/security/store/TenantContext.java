package com.bastion.security.store;

/**
 * Supplies the tenant the current request is addressed to.
 */
@FunctionalInterface
public interface TenantContext {

    /**
     * @return the current tenant id
     * @throws IllegalStateException if no tenant is bound to the current request
     */
    int currentTenantId();
}
