package com.bastion.security.authz;

import com.bastion.security.identity.Identity;
import com.bastion.security.identity.Role;
import com.bastion.security.identity.RoleChecker;

import java.util.Objects;
import java.util.Set;

/**
 * Grants a fixed set of actions to every holder of a role.
 *
 * @param role    required role
 * @param actions granted action names
 */
public record RolePolicyRule(Role role, Set<String> actions) implements PolicyRule {

    public RolePolicyRule {
        Objects.requireNonNull(role, "role must not be null");
        actions = Set.copyOf(actions);
    }

    @Override
    public boolean grants(Identity identity, Set<String> actionNames, ResourceDescriptor resource) {
        return RoleChecker.hasRole(identity, role) && actions.containsAll(actionNames);
    }
}
