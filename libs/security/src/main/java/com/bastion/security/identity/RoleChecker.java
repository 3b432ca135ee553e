package com.bastion.security.identity;

/**
 * Role checks over an {@link Identity}.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    public static boolean hasRole(Identity identity, Role required) {
        return identity.roles().contains(required);
    }
}
