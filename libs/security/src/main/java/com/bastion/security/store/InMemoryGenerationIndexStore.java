package com.bastion.security.store;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory {@link GenerationIndexStore}. Counters start at zero.
 */
public class InMemoryGenerationIndexStore implements GenerationIndexStore {

    private final Map<Integer, Integer> tenants = new ConcurrentHashMap<>();
    private final Map<UserKey, Integer> users = new ConcurrentHashMap<>();

    @Override
    public int tenantGeneration(int tenantId) {
        return tenants.getOrDefault(tenantId, 0);
    }

    @Override
    public int userGeneration(int tenantId, UUID userId) {
        return users.getOrDefault(new UserKey(tenantId, userId), 0);
    }

    @Override
    public int bumpTenant(int tenantId) {
        return tenants.merge(tenantId, 1, Integer::sum);
    }

    @Override
    public int bumpUser(int tenantId, UUID userId) {
        return users.merge(new UserKey(tenantId, userId), 1, Integer::sum);
    }

    /** Sets a tenant counter explicitly, e.g. when seeding from persisted settings. */
    public void setTenantGeneration(int tenantId, int generation) {
        tenants.put(tenantId, generation);
    }

    /** Sets a user counter explicitly, e.g. when seeding from persisted settings. */
    public void setUserGeneration(int tenantId, UUID userId, int generation) {
        users.put(new UserKey(tenantId, userId), generation);
    }

    private record UserKey(int tenantId, UUID userId) {}
}
