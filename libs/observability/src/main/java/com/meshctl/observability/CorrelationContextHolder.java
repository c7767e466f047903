package com.meshctl.observability;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * When a correlation context is set, the MDC keys (correlationId, tenantId, httpMethod,
 * httpPath) are populated so that every log statement on this thread automatically includes
 * them. When cleared, all MDC keys are removed.
 * <p>
 * Servlet containers reuse request threads, so whoever calls {@link #set(CorrelationContext)}
 * must also call {@link #clear()} once the request is done.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // Utility class: no instantiation
    }

    /**
     * Sets the correlation context for the current thread and populates SLF4J MDC.
     *
     * @param context the correlation context to set (must not be null)
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /**
     * Returns the current thread's correlation context, if set.
     */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Returns the current correlation ID, or null when no context is set.
     */
    public static String currentCorrelationId() {
        CorrelationContext context = CONTEXT.get();
        return context != null ? context.correlationId() : null;
    }

    /**
     * Binds the current context to a tenant. No-op when no context is set.
     *
     * @param tenantId the verified tenant identifier
     */
    public static void bindTenant(String tenantId) {
        CorrelationContext context = CONTEXT.get();
        if (context != null) {
            set(context.withTenant(tenantId));
        }
    }

    /**
     * Clears the correlation context and removes all MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_TENANT_ID, ctx.tenantId());
        setMdc(CorrelationContext.MDC_HTTP_METHOD, ctx.httpMethod());
        setMdc(CorrelationContext.MDC_HTTP_PATH, ctx.httpPath());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_ID);
        MDC.remove(CorrelationContext.MDC_HTTP_METHOD);
        MDC.remove(CorrelationContext.MDC_HTTP_PATH);
    }
}
