package com.meshctl.tenantcontroller.config;

import com.meshctl.security.TenantIdentityResolver;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * How the verified tenant identity is read from inbound requests ({@code meshctl.identity.*}).
 *
 * @param header name of the header injected by the authenticating gateway
 * @param bearerFallback accept a bearer token as the tenant ID when the header is absent
 */
@ConfigurationProperties(prefix = "meshctl.identity")
public record IdentityProperties(String header, boolean bearerFallback) {

    public IdentityProperties {
        if (header == null || header.isBlank()) {
            header = TenantIdentityResolver.DEFAULT_TENANT_HEADER;
        }
    }
}
