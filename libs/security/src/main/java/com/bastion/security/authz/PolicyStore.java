package com.bastion.security.authz;

import java.util.List;

/**
 * Source of the allow rules consulted by {@link PermissionResolver}.
 */
@FunctionalInterface
public interface PolicyStore {

    /**
     * @return the current rules in evaluation order; never null
     */
    List<PolicyRule> rules();
}
