package com.bastion.security.identity;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Request-scoped slot for the current {@link Identity}, backed by a ThreadLocal with an SLF4J
 * MDC bridge ({@value #MDC_USER_ID}).
 * <p>
 * Whoever opens a request scope must {@link #clear()} it when the request ends; servlet
 * containers reuse threads.
 */
public final class IdentityHolder {

    /** MDC key for the acting account id. */
    public static final String MDC_USER_ID = "userId";

    private static final ThreadLocal<Identity> CURRENT = new ThreadLocal<>();

    private IdentityHolder() {
        // utility class
    }

    /**
     * Binds the identity to the current thread.
     *
     * @throws IllegalArgumentException if identity is null
     */
    public static void set(Identity identity) {
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        CURRENT.set(identity);
        MDC.put(MDC_USER_ID, identity.accountId().toString());
    }

    /** The bound identity, if any. */
    public static Optional<Identity> get() {
        return Optional.ofNullable(CURRENT.get());
    }

    /** The bound identity, or {@link Identity#ANONYMOUS} when nothing is bound. */
    public static Identity current() {
        Identity identity = CURRENT.get();
        return identity != null ? identity : Identity.ANONYMOUS;
    }

    public static void clear() {
        CURRENT.remove();
        MDC.remove(MDC_USER_ID);
    }

    /**
     * Runs work as the given identity and restores whatever was bound before, even on failure.
     */
    public static <T> T callAs(Identity identity, Supplier<T> work) {
        Identity previous = CURRENT.get();
        try {
            set(identity);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }
}
