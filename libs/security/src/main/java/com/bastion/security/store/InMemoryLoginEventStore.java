package com.bastion.security.store;

import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe in-memory {@link LoginEventStore}. Event ids come from one process-wide sequence
 * starting at 1. Every write to a user's set runs inside the map's per-key compute, so a
 * registration never lands in a set that {@link #removeAll} has already dropped. Empty sets are
 * removed.
 */
public class InMemoryLoginEventStore implements LoginEventStore {

    private final Map<UserKey, Set<Integer>> events = new ConcurrentHashMap<>();
    private final AtomicInteger sequence = new AtomicInteger();

    @Override
    public Set<Integer> validEventIds(int tenantId, UUID userId) {
        Set<Integer> ids = events.get(new UserKey(tenantId, userId));
        return ids == null ? Set.of() : Set.copyOf(ids);
    }

    @Override
    public int register(int tenantId, UUID userId) {
        int id = sequence.incrementAndGet();
        events.compute(new UserKey(tenantId, userId), (key, ids) -> {
            Set<Integer> updated = ids != null ? ids : ConcurrentHashMap.newKeySet();
            updated.add(id);
            return updated;
        });
        return id;
    }

    @Override
    public boolean remove(int tenantId, UUID userId, int loginEventId) {
        AtomicBoolean removed = new AtomicBoolean();
        events.computeIfPresent(new UserKey(tenantId, userId), (key, ids) -> {
            removed.set(ids.remove(loginEventId));
            return ids.isEmpty() ? null : ids;
        });
        return removed.get();
    }

    @Override
    public void removeAll(int tenantId, UUID userId) {
        events.remove(new UserKey(tenantId, userId));
    }

    /** Number of users holding at least one valid event. */
    int trackedUsers() {
        return events.size();
    }

    private record UserKey(int tenantId, UUID userId) {}
}
