package com.bastion.security.authz;

/**
 * Reference to a protected resource.
 *
 * @param type resource type (e.g. {@code "project"})
 * @param id   resource id within its type
 */
public record SecuredObject(String type, String id) {

    public SecuredObject {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be null or blank");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
    }

    @Override
    public String toString() {
        return type + ":" + id;
    }
}
