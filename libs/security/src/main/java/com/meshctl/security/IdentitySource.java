package com.meshctl.security;

/**
 * Origin of a resolved {@link TenantIdentity}.
 */
public enum IdentitySource {
    /** Header injected by the authenticating gateway. */
    VERIFIED_HEADER,
    /** Bearer token used directly as the tenant ID (local auth mode). */
    BEARER_TOKEN
}
