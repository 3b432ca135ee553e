package com.bastion.security.testing;

import com.bastion.security.account.Accounts;
import com.bastion.security.account.UserAccount;
import com.bastion.security.identity.Identity;
import com.bastion.security.identity.Role;

import java.util.EnumSet;
import java.util.UUID;

/**
 * Factory for {@link Identity} instances in tests.
 * <p>
 * Lives in src/main so other modules can use it from their test scope through a regular
 * dependency.
 */
public final class TestIdentityFactory {

    /** Tenant used when none is given. */
    public static final int DEFAULT_TENANT = 1;

    private TestIdentityFactory() {
        // utility class
    }

    /** A plain user (EVERYONE, USERS) in the default tenant. */
    public static Identity user() {
        return user(UUID.randomUUID(), DEFAULT_TENANT);
    }

    public static Identity user(UUID userId, int tenantId) {
        return new Identity(new UserAccount(userId, tenantId, "Test User"),
                EnumSet.of(Role.EVERYONE, Role.USERS));
    }

    /** A member of the admin group (EVERYONE, USERS, ADMINISTRATORS) in the default tenant. */
    public static Identity admin() {
        return new Identity(new UserAccount(UUID.randomUUID(), DEFAULT_TENANT, "Test Admin"),
                EnumSet.of(Role.EVERYONE, Role.USERS, Role.ADMINISTRATORS));
    }

    /** A user holding exactly the given roles. */
    public static Identity withRoles(Role... roles) {
        EnumSet<Role> set = EnumSet.of(Role.EVERYONE, roles);
        return new Identity(new UserAccount(UUID.randomUUID(), DEFAULT_TENANT, "Test User"), set);
    }

    /** The core system identity (EVERYONE, SYSTEM). */
    public static Identity system() {
        return new Identity(Accounts.CORE_SYSTEM, EnumSet.of(Role.EVERYONE, Role.SYSTEM));
    }

    public static Identity anonymous() {
        return Identity.ANONYMOUS;
    }
}
