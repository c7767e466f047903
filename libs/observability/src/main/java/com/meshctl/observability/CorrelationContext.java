package com.meshctl.observability;

/**
 * Immutable correlation context that flows with a single inbound API request.
 * <p>
 * Every request handled by the controller establishes a {@code CorrelationContext} carrying the
 * identifiers needed to tie log lines and error responses back to one call. The values are pushed
 * into the SLF4J MDC by {@link CorrelationContextHolder} so that every log statement on the request
 * thread includes them. The correlation ID never reaches the configuration store.
 *
 * @param correlationId request correlation ID (propagated from {@code X-Request-ID} or generated)
 * @param tenantId      verified tenant identifier, or null before identity has been resolved
 * @param httpMethod    HTTP method of the inbound request (nullable)
 * @param httpPath      request URI path (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String httpMethod,
        String httpPath
) {

    /**
     * MDC key for correlation ID.
     */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /**
     * MDC key for tenant ID.
     */
    public static final String MDC_TENANT_ID = "tenantId";

    /**
     * MDC key for the HTTP method.
     */
    public static final String MDC_HTTP_METHOD = "httpMethod";

    /**
     * MDC key for the HTTP path.
     */
    public static final String MDC_HTTP_PATH = "httpPath";

    /**
     * Compact constructor: ensures correlationId is never null.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context that only carries a correlation ID.
     */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null);
    }

    /**
     * Returns a copy of this context bound to the given tenant.
     */
    public CorrelationContext withTenant(String tenantId) {
        return new CorrelationContext(correlationId, tenantId, httpMethod, httpPath);
    }
}
