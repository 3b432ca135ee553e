package com.bastion.authgateway.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.bastion.observability.CorrelationContext;
import com.bastion.observability.CorrelationContextHolder;
import com.bastion.security.auth.AccountDisabledException;
import com.bastion.security.auth.FeatureNotLicensedException;
import com.bastion.security.auth.InvalidCredentialException;
import com.bastion.security.auth.PasswordReuseException;
import com.bastion.security.authz.AccessDeniedException;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("maps invalid credentials to 401 with the uniform message")
    void invalidCredentials() {
        ProblemDetail result = handler.handleAuthentication(new InvalidCredentialException());

        assertThat(result.getStatus()).isEqualTo(401);
        assertThat(result.getDetail()).isEqualTo("Invalid username or password.");
        assertThat(result.getType().toString()).endsWith("/invalid-credentials");
    }

    @Test
    @DisplayName("maps the other authentication failures")
    void otherFailures() {
        assertThat(handler.handleAuthentication(new AccountDisabledException()).getStatus()).isEqualTo(403);
        assertThat(
                        handler.handleAuthentication(
                                        new FeatureNotLicensedException(FeatureNotLicensedException.DIRECTORY_LOGIN))
                                .getStatus())
                .isEqualTo(402);
        assertThat(handler.handleAuthentication(new PasswordReuseException()).getStatus()).isEqualTo(400);
    }

    @Test
    @DisplayName("maps access denial to 403 without leaking the actions")
    void accessDenied() {
        ProblemDetail result =
                handler.handleAccessDenied(
                        new AccessDeniedException(UUID.randomUUID(), List.of("project.delete"), null));

        assertThat(result.getStatus()).isEqualTo(403);
        assertThat(result.getDetail()).isEqualTo("Access denied");
    }

    @Test
    @DisplayName("maps IllegalArgumentException to 400 without echoing its message")
    void illegalArgumentHidesMessage() {
        ProblemDetail result = handler.handleIllegalArgument(
                new IllegalArgumentException("Unknown user 11111111-2222-4333-8444-555555555555 in tenant 7"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("Invalid request");
    }

    @Test
    @DisplayName("maps anything else to 500")
    void genericMappings() {
        ProblemDetail internal = handler.handleGeneric(new RuntimeException("secret detail"));
        assertThat(internal.getStatus()).isEqualTo(500);
        assertThat(internal.getDetail()).doesNotContain("secret detail");
    }

    @Test
    @DisplayName("adds timestamp and correlation id")
    void enrichment() {
        CorrelationContextHolder.set(new CorrelationContext("corr-1", null, null));

        ProblemDetail result = handler.handleGeneric(new RuntimeException("oops"));

        assertThat(result.getProperties()).containsKey("timestamp").containsEntry("correlationId", "corr-1");
    }
}
