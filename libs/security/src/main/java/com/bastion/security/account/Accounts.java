package com.bastion.security.account;

import java.util.UUID;

/**
 * Well-known identities shared by every tenant.
 */
public final class Accounts {

    /** Tenant id reported by accounts that are not tenant-scoped. */
    public static final int NO_TENANT = -1;

    /** The unauthenticated guest. */
    public static final AnonymousAccount GUEST =
            new AnonymousAccount(UUID.fromString("712d9ec3-5d2b-4b13-824f-71f00191dcca"), "Guest");

    /** The core system identity; the only system account granted the SYSTEM role. */
    public static final SystemAccount CORE_SYSTEM =
            new SystemAccount(UUID.fromString("a37ee56e-3302-4a7b-b67e-ddba8e64d2a9"), "System");

    /** Identifier of the "lost user" sentinel returned when a user lookup misses. */
    public static final UUID LOST_USER_ID = UUID.fromString("4a515a15-d4d6-4b8e-828e-e0586f18f3a3");

    /** Membership in this group grants the ADMINISTRATORS role. */
    public static final UUID ADMIN_GROUP_ID = UUID.fromString("cd84e66b-b803-40fc-99f9-b2969a54a1de");

    private Accounts() {
        // constants
    }

    /** The lost-user sentinel record for a tenant. */
    public static UserRecord lostUser(int tenantId) {
        return new UserRecord(LOST_USER_ID, tenantId, "", "Unknown user", UserStatus.TERMINATED, null);
    }

    /** Account view of the lost-user sentinel. */
    public static UserAccount lostUserAccount(int tenantId) {
        return UserAccount.of(lostUser(tenantId));
    }

    /** True if the account is the lost-user sentinel. */
    public static boolean isLost(Account account) {
        return account.kind() == AccountKind.USER && LOST_USER_ID.equals(account.id());
    }
}
