package com.bastion.security.authz;

import com.bastion.security.identity.Identity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether an identity may perform a set of actions, optionally on a resource.
 * <p>
 * Granted when ANY rule of the {@link PolicyStore} grants ALL requested actions. A resource that
 * belongs to another tenant is denied before any rule is consulted. The decision depends only on
 * the identity, the resource descriptor and the rules.
 */
public class PermissionResolver {

    private static final Logger log = LoggerFactory.getLogger(PermissionResolver.class);

    private final PolicyStore policyStore;

    public PermissionResolver(PolicyStore policyStore) {
        this.policyStore = Objects.requireNonNull(policyStore, "policyStore must not be null");
    }

    public boolean check(Identity identity, Action... actions) {
        return decide(identity, names(actions), null);
    }

    /**
     * Checks the actions against a resource. With no provider, or when the provider does not know
     * the resource, only resource-independent rules can grant.
     */
    public boolean check(Identity identity, SecuredObject object, SecurityObjectProvider provider, Action... actions) {
        Set<String> names = names(actions);
        ResourceDescriptor descriptor = describe(object, provider).orElse(null);
        if (descriptor != null && !TenantIsolationEnforcer.isSameTenant(identity, descriptor.tenantId())) {
            log.debug("Cross-tenant access to {} by {} refused", object, identity.accountId());
            return false;
        }
        return decide(identity, names, descriptor);
    }

    /**
     * @throws AccessDeniedException if {@link #check(Identity, Action...)} would return false
     */
    public void demand(Identity identity, Action... actions) {
        if (!check(identity, actions)) {
            throw new AccessDeniedException(identity.accountId(), List.copyOf(names(actions)), null);
        }
    }

    /**
     * @throws AccessDeniedException if the resource check would return false
     */
    public void demand(Identity identity, SecuredObject object, SecurityObjectProvider provider, Action... actions) {
        if (!check(identity, object, provider, actions)) {
            throw new AccessDeniedException(identity.accountId(), List.copyOf(names(actions)), object);
        }
    }

    private boolean decide(Identity identity, Set<String> names, ResourceDescriptor descriptor) {
        Objects.requireNonNull(identity, "identity must not be null");
        for (PolicyRule rule : policyStore.rules()) {
            if (rule.grants(identity, names, descriptor)) {
                return true;
            }
        }
        return false;
    }

    private static Optional<ResourceDescriptor> describe(SecuredObject object, SecurityObjectProvider provider) {
        if (object == null || provider == null) {
            return Optional.empty();
        }
        return provider.describe(object);
    }

    private static Set<String> names(Action... actions) {
        if (actions == null || actions.length == 0) {
            throw new IllegalArgumentException("at least one action is required");
        }
        Set<String> names = new LinkedHashSet<>();
        Arrays.stream(actions).map(Action::name).forEach(names::add);
        return names;
    }
}
