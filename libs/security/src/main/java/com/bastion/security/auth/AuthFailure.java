package com.bastion.security.auth;

/**
 * Why an identity could not be assigned. Unknown logins and wrong passwords both map to
 * {@link #INVALID_CREDENTIALS} and share one message.
 */
public enum AuthFailure {

    INVALID_CREDENTIALS("Invalid username or password."),
    ACCOUNT_DISABLED("Account disabled."),
    FEATURE_NOT_LICENSED("Your tariff plan does not support this option."),
    PASSWORD_REUSE("A new password must be used");

    private final String message;

    AuthFailure(String message) {
        this.message = message;
    }

    /** User-facing message. */
    public String message() {
        return message;
    }

    /** The typed exception for this failure. */
    public AuthenticationException toException() {
        return switch (this) {
            case INVALID_CREDENTIALS -> new InvalidCredentialException();
            case ACCOUNT_DISABLED -> new AccountDisabledException();
            case FEATURE_NOT_LICENSED -> new FeatureNotLicensedException(FeatureNotLicensedException.DIRECTORY_LOGIN);
            case PASSWORD_REUSE -> new PasswordReuseException();
        };
    }
}
