package com.bastion.authgateway.config;

import com.bastion.observability.MetricFactory;
import com.bastion.observability.SensitiveDataRedactor;
import com.bastion.security.account.Accounts;
import com.bastion.security.account.UserRecord;
import com.bastion.security.account.UserStatus;
import com.bastion.security.auth.AuthenticationMetrics;
import com.bastion.security.auth.AuthenticationSession;
import com.bastion.security.auth.LoginEventFactory;
import com.bastion.security.authz.JsonPolicyStore;
import com.bastion.security.authz.PermissionResolver;
import com.bastion.security.authz.PolicyStore;
import com.bastion.security.store.GenerationIndexStore;
import com.bastion.security.store.IdentityRegistry;
import com.bastion.security.store.InMemoryGenerationIndexStore;
import com.bastion.security.store.InMemoryIdentityRegistry;
import com.bastion.security.store.InMemoryLoginEventStore;
import com.bastion.security.store.LoginEventStore;
import com.bastion.security.store.TenantPlanProvider;
import com.bastion.security.store.ThreadLocalTenantContext;
import com.bastion.security.store.TokenLifetimePolicy;
import com.bastion.security.token.AesGcmTokenCodec;
import com.bastion.security.token.TokenCodec;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.HashSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Beans of the authentication core.
 *
 * <p>Stores are in-memory; a deployment backed by a user database replaces the {@link
 * IdentityRegistry}, {@link GenerationIndexStore} and {@link LoginEventStore} beans.
 */
@Configuration
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    @Bean
    public TokenCodec tokenCodec(BastionSecurityProperties properties) {
        return AesGcmTokenCodec.fromBase64Secret(properties.tokenSecret());
    }

    @Bean
    public ThreadLocalTenantContext tenantContext(BastionSecurityProperties properties) {
        return new ThreadLocalTenantContext(properties.defaultTenantId());
    }

    @Bean
    public GenerationIndexStore generationIndexStore() {
        return new InMemoryGenerationIndexStore();
    }

    @Bean
    public LoginEventStore loginEventStore() {
        return new InMemoryLoginEventStore();
    }

    @Bean
    public LoginEventFactory loginEventFactory(LoginEventStore loginEventStore) {
        return LoginEventFactory.tracking(loginEventStore);
    }

    @Bean
    public IdentityRegistry identityRegistry(BastionSecurityProperties properties) {
        var registry = new InMemoryIdentityRegistry();
        for (BastionSecurityProperties.SeedUser user : properties.users()) {
            String displayName = user.displayName() != null ? user.displayName() : user.login();
            registry.addUser(
                    new UserRecord(
                            user.id(),
                            user.tenantId(),
                            user.login(),
                            displayName,
                            UserStatus.ACTIVE,
                            user.directorySid()),
                    user.passwordHash());
            if (user.administrator()) {
                registry.addToGroup(user.tenantId(), user.id(), Accounts.ADMIN_GROUP_ID);
            }
        }
        log.info("Identity registry seeded with {} users", properties.users().size());
        return registry;
    }

    @Bean
    public PolicyStore policyStore(BastionSecurityProperties properties) {
        JsonPolicyStore store = JsonPolicyStore.fromClasspath(properties.policyLocation());
        log.info("Loaded {} policy rules from {}", store.rules().size(), properties.policyLocation());
        return store;
    }

    @Bean
    public PermissionResolver permissionResolver(PolicyStore policyStore) {
        return new PermissionResolver(policyStore);
    }

    @Bean
    public TenantPlanProvider tenantPlanProvider(BastionSecurityProperties properties) {
        if (properties.standalone()) {
            return TenantPlanProvider.standalone();
        }
        return TenantPlanProvider.directoryLoginFor(new HashSet<>(properties.directoryLoginTenants()));
    }

    @Bean
    public AuthenticationMetrics authenticationMetrics(
            MeterRegistry meterRegistry,
            @Value("${spring.application.name:auth-gateway}") String serviceName) {
        return new AuthenticationMetrics(new MetricFactory(meterRegistry, serviceName));
    }

    @Bean
    public AuthenticationSession authenticationSession(
            BastionSecurityProperties properties,
            ThreadLocalTenantContext tenantContext,
            TokenCodec tokenCodec,
            GenerationIndexStore generationIndexStore,
            LoginEventStore loginEventStore,
            IdentityRegistry identityRegistry,
            PermissionResolver permissionResolver,
            TenantPlanProvider tenantPlanProvider,
            AuthenticationMetrics authenticationMetrics) {
        return AuthenticationSession.builder()
                .tenantContext(tenantContext)
                .tokenCodec(tokenCodec)
                .generations(generationIndexStore)
                .loginEvents(loginEventStore)
                .registry(identityRegistry)
                .permissionResolver(permissionResolver)
                .planProvider(tenantPlanProvider)
                .lifetimePolicy(TokenLifetimePolicy.fixed(properties.tokenLifetime()))
                .metrics(authenticationMetrics)
                .redactor(new SensitiveDataRedactor())
                .clock(Clock.systemUTC())
                .build();
    }
}
