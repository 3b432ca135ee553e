package com.bastion.security.store;

import com.bastion.security.account.Account;
import com.bastion.security.account.UserRecord;
import com.bastion.security.account.UserStatus;

import java.util.UUID;

/**
 * Resolves identifiers and credentials into accounts. Implementations front the user store and
 * may block; callers must not hold locks across these calls.
 * <p>
 * A miss never raises: lookups return the lost-user sentinel
 * ({@link com.bastion.security.account.Accounts#lostUser(int)}) so that "no such user" and
 * "wrong password" follow the same path.
 */
public interface IdentityRegistry {

    /**
     * Resolves a user or system account id.
     *
     * @return the system account, the user account, or the lost-user account on a miss
     */
    Account resolveById(int tenantId, UUID accountId);

    /**
     * Resolves a login (or the user id in string form) plus password hash.
     *
     * @return the user account, or the lost-user account when the login is unknown or the hash
     *     does not match
     */
    Account resolveByCredential(int tenantId, String login, String passwordHash);

    /**
     * @return the stored user, or the lost-user sentinel on a miss
     */
    UserRecord user(int tenantId, UUID userId);

    boolean isInGroup(int tenantId, UUID userId, UUID groupId);

    default UserStatus userStatus(int tenantId, UUID userId) {
        return user(tenantId, userId).status();
    }

    /**
     * Stores a new password hash for an existing user.
     *
     * @throws IllegalArgumentException if the user does not exist
     */
    void setPasswordHash(int tenantId, UUID userId, String passwordHash);
}
