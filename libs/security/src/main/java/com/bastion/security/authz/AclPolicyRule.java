package com.bastion.security.authz;

import com.bastion.security.identity.Identity;
import com.bastion.security.identity.Role;

import java.util.HashSet;
import java.util.Set;

/**
 * Grants whatever the resource ACL lists for the actor's user id or any of its roles.
 */
public final class AclPolicyRule implements PolicyRule {

    @Override
    public boolean grants(Identity identity, Set<String> actionNames, ResourceDescriptor resource) {
        if (resource == null || resource.acl().isEmpty()) {
            return false;
        }
        Set<String> granted = new HashSet<>();
        if (identity.isAuthenticated()) {
            granted.addAll(resource.actionsFor(ResourceDescriptor.userPrincipal(identity.accountId())));
        }
        for (Role role : identity.roles()) {
            granted.addAll(resource.actionsFor(ResourceDescriptor.rolePrincipal(role)));
        }
        return granted.containsAll(actionNames);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof AclPolicyRule;
    }

    @Override
    public int hashCode() {
        return AclPolicyRule.class.hashCode();
    }

    @Override
    public String toString() {
        return "AclPolicyRule";
    }
}
