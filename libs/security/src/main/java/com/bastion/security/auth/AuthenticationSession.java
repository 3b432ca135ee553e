package com.bastion.security.auth;

import com.bastion.observability.MetricFactory;
import com.bastion.observability.SensitiveDataRedactor;
import com.bastion.security.account.Account;
import com.bastion.security.account.AccountKind;
import com.bastion.security.account.Accounts;
import com.bastion.security.account.UserAccount;
import com.bastion.security.authz.AccessDeniedException;
import com.bastion.security.authz.Action;
import com.bastion.security.authz.PermissionResolver;
import com.bastion.security.authz.SecuredObject;
import com.bastion.security.authz.SecurityObjectProvider;
import com.bastion.security.identity.Identity;
import com.bastion.security.identity.IdentityHolder;
import com.bastion.security.store.GenerationIndexStore;
import com.bastion.security.store.IdentityRegistry;
import com.bastion.security.store.LoginEventStore;
import com.bastion.security.store.TenantContext;
import com.bastion.security.store.TenantPlanProvider;
import com.bastion.security.store.TokenLifetimePolicy;
import com.bastion.security.token.SessionToken;
import com.bastion.security.token.TokenCodec;
import com.bastion.security.token.TokenDecodeException;
import com.bastion.security.token.TokenExtractor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point of the authentication core: establishes the identity of the current request and
 * gates privileged work behind permission checks.
 * <p>
 * The identity is held in {@link IdentityHolder} and the state in a thread-local slot, both
 * scoped to the request thread. Generation indices and login events are read from their stores
 * on every check and never cached, so a revocation is visible to the next request on any thread.
 * <p>
 * Token authentication fails closed: every failure, expected or not, leaves the request
 * anonymous and is reported as {@code false}.
 */
public class AuthenticationSession {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationSession.class);

    private static final ThreadLocal<AuthenticationState> STATE = new ThreadLocal<>();

    private final TenantContext tenantContext;
    private final TokenCodec tokenCodec;
    private final GenerationIndexStore generations;
    private final LoginEventStore loginEvents;
    private final IdentityRegistry registry;
    private final IdentityAssigner assigner;
    private final PermissionResolver permissionResolver;
    private final TokenLifetimePolicy lifetimePolicy;
    private final AuthenticationMetrics metrics;
    private final SensitiveDataRedactor redactor;
    private final Clock clock;

    private AuthenticationSession(Builder builder) {
        this.tenantContext = Objects.requireNonNull(builder.tenantContext, "tenantContext must not be null");
        this.tokenCodec = Objects.requireNonNull(builder.tokenCodec, "tokenCodec must not be null");
        this.generations = Objects.requireNonNull(builder.generations, "generations must not be null");
        this.loginEvents = Objects.requireNonNull(builder.loginEvents, "loginEvents must not be null");
        this.registry = Objects.requireNonNull(builder.registry, "registry must not be null");
        this.permissionResolver = Objects.requireNonNull(builder.permissionResolver, "permissionResolver must not be null");
        this.assigner = new IdentityAssigner(registry,
                builder.planProvider != null ? builder.planProvider : TenantPlanProvider.standalone());
        this.lifetimePolicy = builder.lifetimePolicy != null
                ? builder.lifetimePolicy : TokenLifetimePolicy.fixed(Duration.ZERO);
        this.metrics = builder.metrics != null
                ? builder.metrics
                : new AuthenticationMetrics(new MetricFactory(new SimpleMeterRegistry(), "bastion-security"));
        this.redactor = builder.redactor != null ? builder.redactor : new SensitiveDataRedactor();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ------------------------------------------------------------------
    // Authentication
    // ------------------------------------------------------------------

    /**
     * Authenticates the request with a session cookie value.
     *
     * @param raw cookie value; empty values and the bearer marker leave the request anonymous
     * @return true if the token is live and its user could be assigned
     */
    public boolean authenticateByToken(String raw) {
        return metrics.timer(AuthenticationMetrics.Method.TOKEN).record(() -> verifyToken(raw));
    }

    private boolean verifyToken(String raw) {
        if (raw == null || raw.isEmpty()) {
            return false;
        }
        if (TokenExtractor.isBearerMarker(raw)) {
            log.info("Bearer marker presented instead of a session cookie, deferring to header authentication");
            metrics.recordAttempt(AuthenticationMetrics.Method.TOKEN, AuthenticationMetrics.Outcome.BEARER_MARKER);
            return false;
        }

        STATE.set(AuthenticationState.AUTHENTICATING);
        SessionToken token;
        try {
            token = tokenCodec.decode(raw);
        } catch (TokenDecodeException e) {
            log.warn("Cannot decode session cookie ({}): {}", e.reason(), redactor.redact(context(raw, null)));
            return reject(AuthenticationMetrics.Method.TOKEN, AuthenticationMetrics.Outcome.INVALID_TOKEN);
        }

        try {
            AuthenticationMetrics.Outcome staleness = checkLiveness(token);
            if (staleness != null) {
                log.debug("Session cookie rejected ({}): {}", staleness, redactor.redact(context(raw, token)));
                return reject(AuthenticationMetrics.Method.TOKEN, staleness);
            }

            Account account = registry.resolveById(token.tenantId(), token.userId());
            AuthResult result = assigner.assign(account, token.tenantId());
            if (result instanceof AuthResult.Granted granted) {
                bind(granted.identity(), AuthenticationMetrics.Method.TOKEN);
                return true;
            }
            log.debug("{}: {}", ((AuthResult.Denied) result).failure().message(), redactor.redact(context(raw, token)));
        } catch (AuthenticationException | SecurityException e) {
            log.debug("{}: {}", e.getMessage(), redactor.redact(context(raw, token)));
        } catch (RuntimeException e) {
            log.error("Authenticate error: {}", redactor.redact(context(raw, token)), e);
            return reject(AuthenticationMetrics.Method.TOKEN, AuthenticationMetrics.Outcome.ERROR);
        }
        return reject(AuthenticationMetrics.Method.TOKEN, AuthenticationMetrics.Outcome.REJECTED);
    }

    /**
     * Authenticates with login and password hash and mints a session token.
     *
     * @return the new session token
     * @throws InvalidCredentialException  for an unknown login or a wrong password
     * @throws AccountDisabledException    if the user is not active
     * @throws FeatureNotLicensedException if the user is directory-bound and the plan lacks it
     */
    public String authenticateByCredential(String login, String passwordHash, LoginEventFactory loginEventFactory) {
        return attemptCredential(login, passwordHash, loginEventFactory).orElseThrow().token();
    }

    /**
     * Same as {@link #authenticateByCredential} but reports failures as a {@link AuthResult.Denied}
     * value.
     */
    public AuthResult attemptCredential(String login, String passwordHash, LoginEventFactory loginEventFactory) {
        Objects.requireNonNull(login, "login must not be null");
        Objects.requireNonNull(passwordHash, "passwordHash must not be null");
        return metrics.timer(AuthenticationMetrics.Method.CREDENTIAL).record(() -> {
            int tenantId = tenantContext.currentTenantId();
            Account account = registry.resolveByCredential(tenantId, login, passwordHash);
            return assignAndMint(account, tenantId, loginEventFactory, AuthenticationMetrics.Method.CREDENTIAL);
        });
    }

    /**
     * Switches the request to a known account id and mints a token if it is a user.
     *
     * @return the new session token, or null for system accounts
     * @throws AuthenticationException if the account cannot be assigned
     */
    public String authenticateByUserId(UUID userId, LoginEventFactory loginEventFactory) {
        Objects.requireNonNull(userId, "userId must not be null");
        int tenantId = tenantContext.currentTenantId();
        Account account = registry.resolveById(tenantId, userId);
        return assignAndMint(account, tenantId, loginEventFactory, AuthenticationMetrics.Method.USER_ID)
                .orElseThrow()
                .token();
    }

    /**
     * Binds an account to the request without minting a token. User accounts are re-read in the
     * tenant of the request, so a user of another tenant is refused as an invalid credential.
     *
     * @return the assigned identity
     * @throws AuthenticationException if the account cannot be assigned
     */
    public Identity setCurrentAccount(Account account) {
        STATE.set(AuthenticationState.AUTHENTICATING);
        AuthResult result = assigner.assign(account, tenantIdFor(account));
        if (result instanceof AuthResult.Granted granted) {
            bind(granted.identity(), AuthenticationMetrics.Method.ACCOUNT);
            return granted.identity();
        }
        reject(AuthenticationMetrics.Method.ACCOUNT, AuthenticationMetrics.Outcome.REJECTED);
        return result.orElseThrow().identity();
    }

    /**
     * Runs work as the given account, then restores the previous identity and state.
     *
     * @throws AuthenticationException if the account cannot be assigned; the work is not run
     */
    public <T> T runAs(Account account, Supplier<T> work) {
        AuthResult result = assigner.assign(account, tenantIdFor(account));
        metrics.recordAttempt(AuthenticationMetrics.Method.ACCOUNT, result.isGranted()
                ? AuthenticationMetrics.Outcome.SUCCESS : AuthenticationMetrics.Outcome.REJECTED);
        Identity identity = result.orElseThrow().identity();

        AuthenticationState previousState = STATE.get();
        try {
            return IdentityHolder.callAs(identity, () -> {
                STATE.set(AuthenticationState.AUTHENTICATED);
                return work.get();
            });
        } finally {
            if (previousState != null) {
                STATE.set(previousState);
            } else {
                STATE.remove();
            }
        }
    }

    /** Returns the request to the anonymous state. */
    public void logout() {
        IdentityHolder.clear();
        STATE.remove();
    }

    /**
     * Logs out and, when the presented token tracks a login event, revokes that event so the
     * token cannot be replayed.
     */
    public void signOut(String raw) {
        try {
            if (raw != null && !raw.isEmpty() && !TokenExtractor.isBearerMarker(raw)) {
                SessionToken token = tokenCodec.decode(raw);
                if (token.tracksLoginEvent()) {
                    loginEvents.remove(token.tenantId(), token.userId(), token.loginEventId());
                }
            }
        } catch (TokenDecodeException e) {
            log.debug("Sign-out with undecodable cookie ({})", e.reason());
        } finally {
            logout();
        }
    }

    // ------------------------------------------------------------------
    // Revocation
    // ------------------------------------------------------------------

    /**
     * Revokes every outstanding token of a user in the current tenant.
     */
    public void logoutEverywhere(UUID userId) {
        int tenantId = tenantContext.currentTenantId();
        int generation = generations.bumpUser(tenantId, userId);
        loginEvents.removeAll(tenantId, userId);
        log.info("All sessions of user {} revoked, user generation now {}", userId, generation);
    }

    /**
     * Revokes one session of a user in the current tenant.
     *
     * @return true if the login event was registered
     */
    public boolean revokeLoginEvent(UUID userId, int loginEventId) {
        int tenantId = tenantContext.currentTenantId();
        boolean removed = loginEvents.remove(tenantId, userId, loginEventId);
        log.info("Login event {} of user {} revoked: {}", loginEventId, userId, removed);
        return removed;
    }

    /**
     * Stores a new password hash and revokes every outstanding token of the user.
     *
     * @throws PasswordReuseException if the hash equals the current one
     * @throws IllegalArgumentException if the user does not exist
     */
    public void changePasswordHash(UUID userId, String newPasswordHash) {
        Objects.requireNonNull(userId, "userId must not be null");
        Objects.requireNonNull(newPasswordHash, "newPasswordHash must not be null");
        int tenantId = tenantContext.currentTenantId();
        Account existing = registry.resolveByCredential(tenantId, userId.toString(), newPasswordHash);
        if (!Accounts.isLost(existing)) {
            throw new PasswordReuseException();
        }
        registry.setPasswordHash(tenantId, userId, newPasswordHash);
        generations.bumpUser(tenantId, userId);
        log.info("Password of user {} changed, outstanding sessions revoked", userId);
    }

    // ------------------------------------------------------------------
    // Current identity and permissions
    // ------------------------------------------------------------------

    /** The identity of the current request; anonymous when nothing is bound. */
    public Identity currentIdentity() {
        return IdentityHolder.current();
    }

    public boolean isAuthenticated() {
        return currentIdentity().isAuthenticated();
    }

    public AuthenticationState state() {
        AuthenticationState state = STATE.get();
        return state != null ? state : AuthenticationState.ANONYMOUS;
    }

    public boolean checkPermissions(Action... actions) {
        return permissionResolver.check(currentIdentity(), actions);
    }

    public boolean checkPermissions(SecuredObject object, SecurityObjectProvider provider, Action... actions) {
        return permissionResolver.check(currentIdentity(), object, provider, actions);
    }

    /**
     * @throws AccessDeniedException if the current identity lacks any of the actions
     */
    public void demandPermissions(Action... actions) {
        Identity identity = currentIdentity();
        try {
            permissionResolver.demand(identity, actions);
        } catch (AccessDeniedException e) {
            auditDenial(e);
            throw e;
        }
    }

    /**
     * @throws AccessDeniedException if the current identity lacks any of the actions on the object
     */
    public void demandPermissions(SecuredObject object, SecurityObjectProvider provider, Action... actions) {
        Identity identity = currentIdentity();
        try {
            permissionResolver.demand(identity, object, provider, actions);
        } catch (AccessDeniedException e) {
            auditDenial(e);
            throw e;
        }
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    /**
     * @return null if the token is live, otherwise the reason it is not
     */
    private AuthenticationMetrics.Outcome checkLiveness(SessionToken token) {
        if (token.tenantId() != tenantContext.currentTenantId()) {
            return AuthenticationMetrics.Outcome.TENANT_MISMATCH;
        }
        if (token.tenantGeneration() != generations.tenantGeneration(token.tenantId())) {
            return AuthenticationMetrics.Outcome.STALE_TENANT;
        }
        if (token.isExpiredAt(clock.instant())) {
            return AuthenticationMetrics.Outcome.EXPIRED;
        }
        if (token.userGeneration() != generations.userGeneration(token.tenantId(), token.userId())) {
            return AuthenticationMetrics.Outcome.STALE_USER;
        }
        if (token.tracksLoginEvent()
                && !loginEvents.validEventIds(token.tenantId(), token.userId()).contains(token.loginEventId())) {
            return AuthenticationMetrics.Outcome.REVOKED;
        }
        return null;
    }

    private AuthResult assignAndMint(Account account, int tenantId, LoginEventFactory loginEventFactory,
                                     AuthenticationMetrics.Method method) {
        STATE.set(AuthenticationState.AUTHENTICATING);
        AuthResult result = assigner.assign(account, tenantId);
        if (!(result instanceof AuthResult.Granted granted)) {
            log.info("Authentication rejected: {}", ((AuthResult.Denied) result).failure());
            reject(method, AuthenticationMetrics.Outcome.REJECTED);
            return result;
        }
        bind(granted.identity(), method);
        if (granted.identity().account() instanceof UserAccount user) {
            int loginEventId = loginEventFactory != null ? loginEventFactory.newLoginEvent(user) : 0;
            return granted.withToken(mint(tenantId, user.id(), loginEventId));
        }
        return granted;
    }

    private String mint(int tenantId, UUID userId, int loginEventId) {
        Duration lifetime = lifetimePolicy.lifetimeFor(tenantId);
        Instant expiresAt = lifetime.isZero() ? SessionToken.NEVER : clock.instant().plus(lifetime);
        SessionToken token = new SessionToken(
                tenantId,
                userId,
                generations.tenantGeneration(tenantId),
                generations.userGeneration(tenantId, userId),
                expiresAt,
                loginEventId);
        return tokenCodec.encode(token);
    }

    private int tenantIdFor(Account account) {
        if (account != null && account.kind() == AccountKind.USER) {
            return tenantContext.currentTenantId();
        }
        return Accounts.NO_TENANT;
    }

    private void bind(Identity identity, AuthenticationMetrics.Method method) {
        IdentityHolder.set(identity);
        STATE.set(AuthenticationState.AUTHENTICATED);
        metrics.recordAttempt(method, AuthenticationMetrics.Outcome.SUCCESS);
    }

    private boolean reject(AuthenticationMetrics.Method method, AuthenticationMetrics.Outcome outcome) {
        IdentityHolder.clear();
        STATE.set(AuthenticationState.REJECTED);
        metrics.recordAttempt(method, outcome);
        return false;
    }

    private void auditDenial(AccessDeniedException e) {
        metrics.recordDenial();
        log.warn("Permission denied: actor={} actions={} object={}", e.actorId(), e.actions(), e.object());
    }

    private static Map<String, Object> context(String raw, SessionToken token) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("cookie", raw);
        if (token != null) {
            context.put("tenant", token.tenantId());
            context.put("userId", token.userId());
        }
        return context;
    }

    /**
     * Collects the collaborators of an {@link AuthenticationSession}. Plan provider, lifetime
     * policy, metrics, redactor and clock are optional.
     */
    public static final class Builder {

        private TenantContext tenantContext;
        private TokenCodec tokenCodec;
        private GenerationIndexStore generations;
        private LoginEventStore loginEvents;
        private IdentityRegistry registry;
        private PermissionResolver permissionResolver;
        private TenantPlanProvider planProvider;
        private TokenLifetimePolicy lifetimePolicy;
        private AuthenticationMetrics metrics;
        private SensitiveDataRedactor redactor;
        private Clock clock;

        private Builder() {
        }

        public Builder tenantContext(TenantContext tenantContext) {
            this.tenantContext = tenantContext;
            return this;
        }

        public Builder tokenCodec(TokenCodec tokenCodec) {
            this.tokenCodec = tokenCodec;
            return this;
        }

        public Builder generations(GenerationIndexStore generations) {
            this.generations = generations;
            return this;
        }

        public Builder loginEvents(LoginEventStore loginEvents) {
            this.loginEvents = loginEvents;
            return this;
        }

        public Builder registry(IdentityRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder permissionResolver(PermissionResolver permissionResolver) {
            this.permissionResolver = permissionResolver;
            return this;
        }

        public Builder planProvider(TenantPlanProvider planProvider) {
            this.planProvider = planProvider;
            return this;
        }

        public Builder lifetimePolicy(TokenLifetimePolicy lifetimePolicy) {
            this.lifetimePolicy = lifetimePolicy;
            return this;
        }

        public Builder metrics(AuthenticationMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder redactor(SensitiveDataRedactor redactor) {
            this.redactor = redactor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public AuthenticationSession build() {
            return new AuthenticationSession(this);
        }
    }
}
