package com.meshctl.tenantcontroller.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * A tenant's complete routing configuration as exchanged over the wire.
 *
 * <p>{@code credentials} and the entries of {@code filters} are opaque to the controller: they
 * are stored and returned as-is. Filter order is significant downstream and is preserved.
 *
 * @param id tenant identifier; required on create, otherwise replaced by the request identity
 * @param credentials opaque credentials used by the proxy (nullable)
 * @param loadBalance load-balancing strategy token, e.g. {@code round_robin}
 * @param port listening port assigned to the tenant
 * @param reqTrackingHeader name of the request-tracking header
 * @param filters ordered, opaque traffic filter specifications
 */
public record TenantInfo(
        @JsonProperty("id") String id,
        @JsonProperty("credentials") JsonNode credentials,
        @JsonProperty("load_balance") String loadBalance,
        @JsonProperty("port") int port,
        @JsonProperty("req_tracking_header") String reqTrackingHeader,
        @JsonProperty("filters") List<JsonNode> filters) {

    public TenantInfo {
        filters = filters == null ? List.of() : List.copyOf(filters);
    }

    /** Returns a copy addressed to the given tenant. */
    public TenantInfo withId(String tenantId) {
        return new TenantInfo(tenantId, credentials, loadBalance, port, reqTrackingHeader, filters);
    }

    /** Returns the stored form of this configuration. */
    public ProxyConfig toProxyConfig() {
        return new ProxyConfig(credentials, loadBalance, port, reqTrackingHeader, filters);
    }

    /** Rebuilds the wire form from a stored entry, re-attaching the tenant ID. */
    public static TenantInfo fromEntry(TenantEntry entry) {
        ProxyConfig config = entry.proxyConfig();
        return new TenantInfo(
                entry.tenantId(),
                config.credentials(),
                config.loadBalance(),
                config.port(),
                config.reqTrackingHeader(),
                config.filters());
    }
}
