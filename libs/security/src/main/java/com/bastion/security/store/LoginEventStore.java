package com.bastion.security.store;

import java.util.Set;
import java.util.UUID;

/**
 * Registry of currently valid login events per (tenant, user). A token minted with a non-zero
 * login event id is only live while that id is registered, which allows one session to be
 * revoked without touching the user's other sessions.
 */
public interface LoginEventStore {

    /**
     * @return an immutable snapshot of the valid event ids
     */
    Set<Integer> validEventIds(int tenantId, UUID userId);

    /**
     * Records a new login event.
     *
     * @return the new, non-zero event id
     */
    int register(int tenantId, UUID userId);

    /**
     * @return true if the event was registered and is now removed
     */
    boolean remove(int tenantId, UUID userId, int loginEventId);

    void removeAll(int tenantId, UUID userId);
}
