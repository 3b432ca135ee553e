package com.bastion.security.account;

/**
 * Employment status of a user. Only {@link #ACTIVE} users may authenticate.
 */
public enum UserStatus {
    ACTIVE,
    TERMINATED,
    LEAVE_OF_ABSENCE
}
