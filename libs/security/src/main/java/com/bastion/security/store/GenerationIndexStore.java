package com.bastion.security.store;

import java.util.UUID;

/**
 * Per-tenant and per-user settings-generation counters. A token is only live while the
 * counters it was minted with are still current, so bumping a counter revokes every
 * outstanding token for that scope at once.
 * <p>
 * Reads must observe every completed bump, from any thread; callers do not cache the values.
 */
public interface GenerationIndexStore {

    int tenantGeneration(int tenantId);

    int userGeneration(int tenantId, UUID userId);

    /**
     * Increments the tenant counter (e.g. after cookie-secret rotation).
     *
     * @return the new value
     */
    int bumpTenant(int tenantId);

    /**
     * Increments the user counter (e.g. after a password change or forced logout).
     *
     * @return the new value
     */
    int bumpUser(int tenantId, UUID userId);
}
