package com.bastion.security.auth;

import com.bastion.security.account.UserAccount;
import com.bastion.security.store.LoginEventStore;

/**
 * Creates the login event a freshly minted token is bound to.
 */
@FunctionalInterface
public interface LoginEventFactory {

    /**
     * @return the login event id, or 0 to leave the session untracked
     */
    int newLoginEvent(UserAccount account);

    /** Leaves sessions untracked. */
    static LoginEventFactory untracked() {
        return account -> 0;
    }

    /** Registers each session in the given store so it can be revoked on its own. */
    static LoginEventFactory tracking(LoginEventStore store) {
        return account -> store.register(account.tenantId(), account.id());
    }
}
