package com.bastion.security.identity;

import java.util.Optional;

/**
 * Capability tags attached to an {@link Identity} when it is assigned.
 * <p>
 * Roles are flat: holding ADMINISTRATORS does not imply USERS. Every identity holds EVERYONE,
 * every user account additionally holds USERS.
 */
public enum Role {

    EVERYONE("Everyone"),
    SYSTEM("System"),
    ADMINISTRATORS("Administrators"),
    USERS("Users");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g., "Administrators"). */
    public String value() {
        return value;
    }

    /**
     * Looks up a Role by its canonical value or its constant name, ignoring case.
     *
     * @param value the string to match
     * @return the matching Role, or empty if not found
     */
    public static Optional<Role> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Role role : values()) {
            if (role.value.equalsIgnoreCase(value) || role.name().equalsIgnoreCase(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
