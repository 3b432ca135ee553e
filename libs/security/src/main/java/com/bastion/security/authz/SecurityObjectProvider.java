package com.bastion.security.authz;

import java.util.Optional;

/**
 * Looks up the security facts of a resource. Supplied by the module that owns the resource type.
 */
@FunctionalInterface
public interface SecurityObjectProvider {

    Optional<ResourceDescriptor> describe(SecuredObject object);
}
