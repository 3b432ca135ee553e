package com.bastion.security.authz;

import com.bastion.security.identity.Identity;

import java.util.Set;

/**
 * Grants a fixed set of actions to the authenticated owner of a resource.
 *
 * @param actions granted action names
 */
public record OwnerPolicyRule(Set<String> actions) implements PolicyRule {

    public OwnerPolicyRule {
        actions = Set.copyOf(actions);
    }

    @Override
    public boolean grants(Identity identity, Set<String> actionNames, ResourceDescriptor resource) {
        return resource != null
                && resource.ownerId() != null
                && identity.isAuthenticated()
                && resource.ownerId().equals(identity.accountId())
                && actions.containsAll(actionNames);
    }
}
