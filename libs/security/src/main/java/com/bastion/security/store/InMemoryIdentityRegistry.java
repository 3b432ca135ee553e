package com.bastion.security.store;

import com.bastion.security.account.Account;
import com.bastion.security.account.Accounts;
import com.bastion.security.account.SystemAccount;
import com.bastion.security.account.UserAccount;
import com.bastion.security.account.UserRecord;
import com.bastion.security.account.UserStatus;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory {@link IdentityRegistry} for tests and single-node setups.
 * <p>
 * Hash comparison is constant-time, and an unknown login is still compared against a
 * placeholder hash so that both failure paths do the same work.
 */
public class InMemoryIdentityRegistry implements IdentityRegistry {

    private static final String PLACEHOLDER_HASH = "0".repeat(64);

    private final Map<UserKey, StoredUser> users = new ConcurrentHashMap<>();
    private final Map<LoginKey, UUID> logins = new ConcurrentHashMap<>();
    private final Map<UUID, SystemAccount> systemAccounts = new ConcurrentHashMap<>();

    public InMemoryIdentityRegistry() {
        registerSystemAccount(Accounts.CORE_SYSTEM);
    }

    /**
     * Adds or replaces a user.
     */
    public void addUser(UserRecord user, String passwordHash) {
        Objects.requireNonNull(user, "user must not be null");
        Objects.requireNonNull(passwordHash, "passwordHash must not be null");
        UserKey key = new UserKey(user.tenantId(), user.id());
        StoredUser previous = users.put(key, new StoredUser(user, passwordHash, ConcurrentHashMap.newKeySet()));
        if (previous != null) {
            logins.remove(LoginKey.of(previous.record().tenantId(), previous.record().login()));
            users.get(key).groups().addAll(previous.groups());
        }
        if (user.login() != null && !user.login().isBlank()) {
            logins.put(LoginKey.of(user.tenantId(), user.login()), user.id());
        }
    }

    public void addToGroup(int tenantId, UUID userId, UUID groupId) {
        stored(tenantId, userId).groups().add(groupId);
    }

    public void updateStatus(int tenantId, UUID userId, UserStatus status) {
        users.computeIfPresent(new UserKey(tenantId, userId),
                (key, stored) -> new StoredUser(stored.record().withStatus(status), stored.passwordHash(), stored.groups()));
    }

    public void registerSystemAccount(SystemAccount account) {
        systemAccounts.put(account.id(), account);
    }

    @Override
    public Account resolveById(int tenantId, UUID accountId) {
        SystemAccount system = systemAccounts.get(accountId);
        if (system != null) {
            return system;
        }
        return UserAccount.of(user(tenantId, accountId));
    }

    @Override
    public Account resolveByCredential(int tenantId, String login, String passwordHash) {
        StoredUser candidate = findByLogin(tenantId, login);
        String expected = candidate != null ? candidate.passwordHash() : PLACEHOLDER_HASH;
        boolean matches = MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                String.valueOf(passwordHash).getBytes(StandardCharsets.UTF_8));
        if (candidate != null && matches) {
            return UserAccount.of(candidate.record());
        }
        return Accounts.lostUserAccount(tenantId);
    }

    @Override
    public UserRecord user(int tenantId, UUID userId) {
        StoredUser stored = users.get(new UserKey(tenantId, userId));
        return stored != null ? stored.record() : Accounts.lostUser(tenantId);
    }

    @Override
    public boolean isInGroup(int tenantId, UUID userId, UUID groupId) {
        StoredUser stored = users.get(new UserKey(tenantId, userId));
        return stored != null && stored.groups().contains(groupId);
    }

    @Override
    public void setPasswordHash(int tenantId, UUID userId, String passwordHash) {
        Objects.requireNonNull(passwordHash, "passwordHash must not be null");
        StoredUser updated = users.computeIfPresent(new UserKey(tenantId, userId),
                (key, stored) -> new StoredUser(stored.record(), passwordHash, stored.groups()));
        if (updated == null) {
            throw new IllegalArgumentException("Unknown user " + userId + " in tenant " + tenantId);
        }
    }

    private StoredUser findByLogin(int tenantId, String login) {
        if (login == null) {
            return null;
        }
        UUID byLogin = logins.get(LoginKey.of(tenantId, login));
        UUID byId = parseUuid(login);
        UUID userId = byLogin != null ? byLogin : byId;
        return userId != null ? users.get(new UserKey(tenantId, userId)) : null;
    }

    private StoredUser stored(int tenantId, UUID userId) {
        StoredUser stored = users.get(new UserKey(tenantId, userId));
        if (stored == null) {
            throw new IllegalArgumentException("Unknown user " + userId + " in tenant " + tenantId);
        }
        return stored;
    }

    /** Parses the canonical 8-4-4-4-12 hex form; anything else is null without an exception. */
    static UUID parseUuid(String value) {
        if (value.length() != 36) {
            return null;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            boolean dash = i == 8 || i == 13 || i == 18 || i == 23;
            if (dash ? c != '-' : Character.digit(c, 16) < 0) {
                return null;
            }
        }
        return UUID.fromString(value);
    }

    private record UserKey(int tenantId, UUID userId) {}

    private record LoginKey(int tenantId, String login) {
        static LoginKey of(int tenantId, String login) {
            return new LoginKey(tenantId, login.toLowerCase(Locale.ROOT));
        }
    }

    private record StoredUser(UserRecord record, String passwordHash, Set<UUID> groups) {}
}
