package com.meshctl.tenantcontroller.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Stored routing configuration of a tenant, as consumed by the proxy data plane.
 *
 * @param credentials opaque credentials (nullable)
 * @param loadBalance load-balancing strategy token
 * @param port listening port
 * @param reqTrackingHeader request-tracking header name
 * @param filters ordered, opaque filter specifications
 */
public record ProxyConfig(
        JsonNode credentials,
        String loadBalance,
        int port,
        String reqTrackingHeader,
        List<JsonNode> filters) {

    public ProxyConfig {
        filters = filters == null ? List.of() : List.copyOf(filters);
    }
}
