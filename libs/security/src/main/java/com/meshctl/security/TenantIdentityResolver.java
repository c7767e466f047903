package com.meshctl.security;

import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves the {@link TenantIdentity} of an inbound request from its headers.
 * <p>
 * The authenticating gateway in front of the controller strips any client-supplied copy of the
 * tenant header and injects the verified one, so this resolver only checks presence. When
 * {@code bearerFallback} is enabled and the tenant header is absent, the bearer token in
 * {@code Authorization} is taken as the tenant ID.
 * <p>
 * The resolver works on a header lookup function so it stays independent of the servlet API.
 */
public final class TenantIdentityResolver {

    /** Default header carrying the verified tenant ID. */
    public static final String DEFAULT_TENANT_HEADER = "X-Tenant-ID";

    /** Standard authorization header. */
    public static final String AUTHORIZATION_HEADER = "Authorization";

    private final String tenantHeader;
    private final boolean bearerFallback;

    /**
     * @param tenantHeader   name of the verified tenant header
     * @param bearerFallback whether to accept a bearer token when the header is absent
     */
    public TenantIdentityResolver(String tenantHeader, boolean bearerFallback) {
        if (tenantHeader == null || tenantHeader.isBlank()) {
            throw new IllegalArgumentException("tenantHeader must not be null or blank");
        }
        this.tenantHeader = tenantHeader;
        this.bearerFallback = bearerFallback;
    }

    /**
     * Resolves the identity of a request.
     *
     * @param headers header lookup returning the header value or null
     * @return the identity, or empty when the request carries none
     */
    public Optional<TenantIdentity> resolve(Function<String, String> headers) {
        String headerValue = headers.apply(tenantHeader);
        if (headerValue != null && !headerValue.isBlank()) {
            return Optional.of(TenantIdentity.fromHeader(headerValue));
        }
        if (!bearerFallback) {
            return Optional.empty();
        }
        return BearerTokenExtractor.extract(headers.apply(AUTHORIZATION_HEADER))
                .map(token -> new TenantIdentity(token, IdentitySource.BEARER_TOKEN));
    }
}
