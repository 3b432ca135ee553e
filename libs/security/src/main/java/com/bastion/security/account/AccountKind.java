package com.bastion.security.account;

/**
 * Capability tag of an {@link Account}. Role computation switches over this enum, so adding a
 * constant forces every switch to handle it.
 */
public enum AccountKind {
    USER,
    SYSTEM,
    ANONYMOUS
}
