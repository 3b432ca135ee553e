package com.bastion.security.auth;

/**
 * The account needs an entitlement the tenant's plan lacks.
 */
public class FeatureNotLicensedException extends AuthenticationException {

    /** Feature name for directory-bound logins. */
    public static final String DIRECTORY_LOGIN = "DirectoryLogin";

    private final String feature;

    public FeatureNotLicensedException(String feature) {
        super(AuthFailure.FEATURE_NOT_LICENSED);
        this.feature = feature;
    }

    public String feature() {
        return feature;
    }
}
