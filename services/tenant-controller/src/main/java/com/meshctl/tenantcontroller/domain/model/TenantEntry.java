package com.meshctl.tenantcontroller.domain.model;

/**
 * What the configuration store returns for a tenant: its ID and stored proxy configuration.
 *
 * @param tenantId tenant identifier
 * @param proxyConfig stored routing configuration
 */
public record TenantEntry(String tenantId, ProxyConfig proxyConfig) {

    public TenantEntry {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (proxyConfig == null) {
            throw new IllegalArgumentException("proxyConfig must not be null");
        }
    }
}
