package com.bastion.security.authz;

import com.bastion.security.identity.Role;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Security facts about one resource: owning tenant, owner and access-control list.
 * <p>
 * ACL keys are principals: a user id in string form ({@link #userPrincipal(UUID)}) or
 * {@code "role:<ROLE>"} ({@link #rolePrincipal(Role)}). Values are action names.
 *
 * @param object   the described resource
 * @param tenantId tenant the resource belongs to
 * @param ownerId  owning user, or null if the resource has no owner
 * @param acl      principal to granted action names
 */
public record ResourceDescriptor(
        SecuredObject object,
        int tenantId,
        UUID ownerId,
        Map<String, Set<String>> acl
) {

    public ResourceDescriptor {
        Objects.requireNonNull(object, "object must not be null");
        acl = acl == null ? Map.of() : Map.copyOf(acl);
    }

    public static String userPrincipal(UUID userId) {
        return userId.toString();
    }

    public static String rolePrincipal(Role role) {
        return "role:" + role.name();
    }

    /** Action names the ACL grants to the principal; empty if none. */
    public Set<String> actionsFor(String principal) {
        Set<String> actions = acl.get(principal);
        return actions == null ? Set.of() : actions;
    }
}
