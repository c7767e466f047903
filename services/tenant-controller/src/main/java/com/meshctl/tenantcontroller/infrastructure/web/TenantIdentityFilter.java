package com.meshctl.tenantcontroller.infrastructure.web;

import com.meshctl.observability.CorrelationContextHolder;
import com.meshctl.security.TenantIdentity;
import com.meshctl.security.TenantIdentityResolver;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the verified {@link TenantIdentity} of a request before any handler runs.
 *
 * <p>The identity is published as the {@value #IDENTITY_ATTRIBUTE} request attribute and bound
 * to the correlation context, so log lines of the request carry the tenant ID. A request without
 * identity passes through untouched: rejecting it is the handler's job, which keeps the
 * rejection inside the instrumented and error-mapped path.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class TenantIdentityFilter extends OncePerRequestFilter {

    /** Request attribute holding the resolved identity. Must stay a compile-time constant. */
    public static final String IDENTITY_ATTRIBUTE = "com.meshctl.security.TenantIdentity";

    private final TenantIdentityResolver resolver;

    public TenantIdentityFilter(TenantIdentityResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        Optional<TenantIdentity> identity = resolver.resolve(request::getHeader);
        identity.ifPresent(
                resolved -> {
                    request.setAttribute(IDENTITY_ATTRIBUTE, resolved);
                    CorrelationContextHolder.bindTenant(resolved.tenantId());
                });

        filterChain.doFilter(request, response);
    }
}
