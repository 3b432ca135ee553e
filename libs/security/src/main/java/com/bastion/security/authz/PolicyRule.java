package com.bastion.security.authz;

import com.bastion.security.identity.Identity;

import java.util.Set;

/**
 * One allow rule. Rules never deny; a request is allowed when at least one rule grants every
 * requested action. Implementations must be pure functions of their arguments.
 */
public interface PolicyRule {

    /**
     * @param identity    the acting identity
     * @param actionNames requested action names (never empty)
     * @param resource    security facts of the target resource, or null for resource-less checks
     * @return true if this rule grants all of {@code actionNames}
     */
    boolean grants(Identity identity, Set<String> actionNames, ResourceDescriptor resource);
}
