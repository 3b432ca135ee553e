package com.bastion.security.store;

import java.time.Duration;

/**
 * Lifetime of freshly minted session tokens per tenant. {@link Duration#ZERO} means the token
 * never expires on its own and is only revoked through the generation counters.
 */
@FunctionalInterface
public interface TokenLifetimePolicy {

    Duration lifetimeFor(int tenantId);

    static TokenLifetimePolicy fixed(Duration lifetime) {
        if (lifetime == null || lifetime.isNegative()) {
            throw new IllegalArgumentException("lifetime must be zero or positive");
        }
        return tenantId -> lifetime;
    }
}
