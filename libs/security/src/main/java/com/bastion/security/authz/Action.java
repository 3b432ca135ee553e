package com.bastion.security.authz;

/**
 * An operation that can be authorized, identified by name (e.g. {@code "project.edit"}).
 *
 * @param name action identifier
 */
public record Action(String name) {

    public Action {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("action name must not be null or blank");
        }
    }

    public static Action of(String name) {
        return new Action(name);
    }
}
