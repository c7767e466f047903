package com.meshctl.security;

/**
 * Verified identity of the tenant issuing a request.
 * <p>
 * Produced only by {@link TenantIdentityResolver} from request metadata that the upstream
 * authentication layer vouches for. Holding a {@code TenantIdentity} means the tenant ID is
 * present and non-blank, so downstream code never has to re-check it.
 *
 * @param tenantId unique tenant identifier, never blank
 * @param source   where the identity was read from
 */
public record TenantIdentity(String tenantId, IdentitySource source) {

    public TenantIdentity {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        tenantId = tenantId.strip();
    }

    /** Identity carried by the verified tenant header. */
    public static TenantIdentity fromHeader(String tenantId) {
        return new TenantIdentity(tenantId, IdentitySource.VERIFIED_HEADER);
    }
}
