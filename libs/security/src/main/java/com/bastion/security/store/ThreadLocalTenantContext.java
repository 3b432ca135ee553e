package com.bastion.security.store;

import java.util.OptionalInt;

/**
 * {@link TenantContext} whose tenant is bound per thread by the request filter.
 * <p>
 * Falls back to a default tenant when one is configured; otherwise reading an unbound context
 * fails.
 */
public class ThreadLocalTenantContext implements TenantContext {

    private final ThreadLocal<Integer> current = new ThreadLocal<>();
    private final OptionalInt defaultTenant;

    public ThreadLocalTenantContext() {
        this.defaultTenant = OptionalInt.empty();
    }

    public ThreadLocalTenantContext(int defaultTenant) {
        this.defaultTenant = OptionalInt.of(defaultTenant);
    }

    public void set(int tenantId) {
        current.set(tenantId);
    }

    public void clear() {
        current.remove();
    }

    @Override
    public int currentTenantId() {
        Integer tenantId = current.get();
        if (tenantId != null) {
            return tenantId;
        }
        return defaultTenant.orElseThrow(
                () -> new IllegalStateException("No tenant bound to the current request"));
    }
}
