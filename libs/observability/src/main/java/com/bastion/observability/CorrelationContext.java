package com.bastion.observability;

/**
 * Immutable correlation context that flows with a single request.
 *
 * <p>Every inbound request establishes a {@code CorrelationContext}; its values are copied into
 * SLF4J MDC by {@link CorrelationContextHolder} so that every log line written while the request is
 * handled carries them.
 *
 * @param correlationId unique ID for the business flow (propagated from the caller when present)
 * @param tenantId      tenant the request is addressed to (nullable until resolved)
 * @param requestId     unique ID for this specific request (nullable)
 */
public record CorrelationContext(String correlationId, String tenantId, String requestId) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Returns a copy of this context bound to the given tenant. */
    public CorrelationContext withTenant(String tenant) {
        return new CorrelationContext(correlationId, tenant, requestId);
    }
}
