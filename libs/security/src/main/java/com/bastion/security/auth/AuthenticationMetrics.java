package com.bastion.security.auth;

import com.bastion.observability.MetricFactory;
import io.micrometer.core.instrument.Timer;

import java.util.Locale;
import java.util.Objects;

/**
 * Counters for authentication attempts and authorization denials, and attempt timers.
 */
public class AuthenticationMetrics {

    static final String ATTEMPTS = "bastion.auth.attempts";
    static final String DENIALS = "bastion.authz.denials";
    static final String DURATION = "bastion.auth.duration";

    /** How the caller tried to authenticate. */
    public enum Method {
        TOKEN,
        CREDENTIAL,
        USER_ID,
        ACCOUNT;

        String tag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /** Result of one attempt. */
    public enum Outcome {
        SUCCESS,
        BEARER_MARKER,
        INVALID_TOKEN,
        TENANT_MISMATCH,
        STALE_TENANT,
        EXPIRED,
        STALE_USER,
        REVOKED,
        REJECTED,
        ERROR;

        String tag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final MetricFactory metricFactory;

    public AuthenticationMetrics(MetricFactory metricFactory) {
        this.metricFactory = Objects.requireNonNull(metricFactory, "metricFactory must not be null");
    }

    public void recordAttempt(Method method, Outcome outcome) {
        metricFactory.counter(ATTEMPTS, "Authentication attempts by method and outcome",
                "method", method.tag(), "outcome", outcome.tag()).increment();
    }

    /** Timer around one authentication attempt, tagged with the method. */
    public Timer timer(Method method) {
        return metricFactory.timer(DURATION, "Authentication duration by method", "method", method.tag());
    }

    public void recordDenial() {
        metricFactory.counter(DENIALS, "Permission demands that were denied").increment();
    }
}
