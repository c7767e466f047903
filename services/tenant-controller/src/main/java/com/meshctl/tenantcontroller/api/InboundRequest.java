package com.meshctl.tenantcontroller.api;

import com.meshctl.security.TenantIdentity;
import com.meshctl.tenantcontroller.domain.error.ControllerException;

/**
 * Request-scoped inputs every handler receives besides its payload.
 *
 * @param identity verified tenant identity, or null when the request carries none
 * @param correlationId request correlation ID for logs and error bodies (nullable)
 */
public record InboundRequest(TenantIdentity identity, String correlationId) {

    /**
     * Returns the verified identity.
     *
     * @throws ControllerException with kind {@code INVALID_INPUT} when the request has none
     */
    public TenantIdentity requireIdentity() {
        if (identity == null) {
            throw ControllerException.invalidInput("tenant identity is required");
        }
        return identity;
    }

    /** Tenant ID for logging, or null. */
    public String tenantId() {
        return identity != null ? identity.tenantId() : null;
    }
}
