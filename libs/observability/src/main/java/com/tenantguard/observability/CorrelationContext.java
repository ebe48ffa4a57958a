package com.tenantguard.observability;

/**
 * Immutable per-request correlation data.
 * <p>
 * A context is opened at the edge of the service (HTTP filter) with only the correlation and
 * request identifiers. Once the caller has been resolved, the operation guard replaces it with
 * {@link #withPrincipal(String, String)} so every log line written afterwards carries the tenant
 * and user it was written for.
 *
 * @param correlationId id of the business flow, propagated from the caller when present
 * @param requestId     id of this single request
 * @param networkOrigin caller network origin (client IP), nullable
 * @param tenantId      resolved tenant, nullable until the caller is resolved
 * @param userId        resolved user, nullable until the caller is resolved
 */
public record CorrelationContext(
        String correlationId,
        String requestId,
        String networkOrigin,
        String tenantId,
        String userId
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_NETWORK_ORIGIN = "origin";
    public static final String MDC_TENANT_ID = "tenantId";
    public static final String MDC_USER_ID = "userId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates an edge context that has no principal yet.
     */
    public static CorrelationContext forRequest(String correlationId, String requestId, String networkOrigin) {
        return new CorrelationContext(correlationId, requestId, networkOrigin, null, null);
    }

    /**
     * Returns a copy bound to the given tenant and user.
     */
    public CorrelationContext withPrincipal(String tenantId, String userId) {
        return new CorrelationContext(correlationId, requestId, networkOrigin, tenantId, userId);
    }

    /**
     * Whether a tenant has been attached to this context.
     */
    public boolean hasPrincipal() {
        return tenantId != null;
    }
}
