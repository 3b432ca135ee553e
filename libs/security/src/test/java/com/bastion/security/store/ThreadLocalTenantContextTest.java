package com.bastion.security.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Tenant context and plan settings")
class ThreadLocalTenantContextTest {

    @Test
    @DisplayName("an unbound context without default fails")
    void unbound() {
        var context = new ThreadLocalTenantContext();

        assertThatThrownBy(context::currentTenantId).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("a bound tenant overrides the default until cleared")
    void boundOverridesDefault() {
        var context = new ThreadLocalTenantContext(1);
        context.set(7);

        assertThat(context.currentTenantId()).isEqualTo(7);
        context.clear();
        assertThat(context.currentTenantId()).isEqualTo(1);
    }

    @Test
    @DisplayName("the tenant is per thread")
    void perThread() throws Exception {
        var context = new ThreadLocalTenantContext(0);
        context.set(7);
        int[] seen = new int[1];

        Thread thread = new Thread(() -> seen[0] = context.currentTenantId());
        thread.start();
        thread.join();

        assertThat(seen[0]).isZero();
        context.clear();
    }

    @Test
    @DisplayName("directory login is licensed only for listed tenants")
    void plans() {
        TenantPlanProvider plan = TenantPlanProvider.directoryLoginFor(Set.of(7));

        assertThat(plan.isDirectoryLoginLicensed(7)).isTrue();
        assertThat(plan.isDirectoryLoginLicensed(8)).isFalse();
        assertThat(TenantPlanProvider.standalone().isDirectoryLoginLicensed(8)).isTrue();
    }

    @Test
    @DisplayName("token lifetime must not be negative")
    void lifetime() {
        assertThat(TokenLifetimePolicy.fixed(Duration.ofHours(1)).lifetimeFor(3)).isEqualTo(Duration.ofHours(1));
        assertThatThrownBy(() -> TokenLifetimePolicy.fixed(Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
