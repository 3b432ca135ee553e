package com.bastion.security.identity;

import com.bastion.security.testing.TestIdentityFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IdentityHolder")
class IdentityHolderTest {

    @AfterEach
    void tearDown() {
        IdentityHolder.clear();
    }

    @Test
    @DisplayName("is anonymous when nothing is bound")
    void anonymousByDefault() {
        assertThat(IdentityHolder.get()).isEmpty();
        assertThat(IdentityHolder.current()).isEqualTo(Identity.ANONYMOUS);
        assertThat(IdentityHolder.current().isAuthenticated()).isFalse();
    }

    @Test
    @DisplayName("set binds the identity and the MDC user id; clear removes both")
    void setAndClear() {
        Identity user = TestIdentityFactory.user();

        IdentityHolder.set(user);
        assertThat(IdentityHolder.current()).isEqualTo(user);
        assertThat(MDC.get(IdentityHolder.MDC_USER_ID)).isEqualTo(user.accountId().toString());

        IdentityHolder.clear();
        assertThat(IdentityHolder.get()).isEmpty();
        assertThat(MDC.get(IdentityHolder.MDC_USER_ID)).isNull();
    }

    @Test
    @DisplayName("rejects null")
    void rejectsNull() {
        assertThatThrownBy(() -> IdentityHolder.set(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("callAs restores the previous identity even when the work fails")
    void callAsRestores() {
        Identity user = TestIdentityFactory.user();
        IdentityHolder.set(user);

        assertThat(IdentityHolder.callAs(TestIdentityFactory.system(), () -> IdentityHolder.current().hasRole(Role.SYSTEM)))
                .isTrue();
        assertThat(IdentityHolder.current()).isEqualTo(user);

        assertThatThrownBy(() -> IdentityHolder.callAs(TestIdentityFactory.admin(), () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(IdentityHolder.current()).isEqualTo(user);
    }

    @Test
    @DisplayName("identities do not leak across threads")
    void threadIsolation() throws Exception {
        IdentityHolder.set(TestIdentityFactory.admin());
        AtomicReference<Identity> seen = new AtomicReference<>();

        Thread thread = new Thread(() -> seen.set(IdentityHolder.current()));
        thread.start();
        thread.join();

        assertThat(seen.get()).isEqualTo(Identity.ANONYMOUS);
    }
}
