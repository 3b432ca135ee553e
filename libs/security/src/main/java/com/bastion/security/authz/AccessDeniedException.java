package com.bastion.security.authz;

import java.util.List;
import java.util.UUID;

/**
 * Thrown by a demand when the acting identity is not granted every requested action.
 * Carries the actor and the denied actions for audit logging.
 */
public class AccessDeniedException extends RuntimeException {

    private final UUID actorId;
    private final List<String> actions;
    private final SecuredObject object;

    public AccessDeniedException(UUID actorId, List<String> actions, SecuredObject object) {
        super("Access denied: account '%s' may not perform %s%s"
                .formatted(actorId, actions, object != null ? " on " + object : ""));
        this.actorId = actorId;
        this.actions = List.copyOf(actions);
        this.object = object;
    }

    public UUID actorId() {
        return actorId;
    }

    public List<String> actions() {
        return actions;
    }

    /** The target resource, or null for resource-less demands. */
    public SecuredObject object() {
        return object;
    }
}
