package com.meshctl.tenantcontroller.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.meshctl.observability.CorrelationContext;
import com.meshctl.observability.CorrelationContextHolder;
import com.meshctl.security.IdentitySource;
import com.meshctl.security.TenantIdentity;
import com.meshctl.security.TenantIdentityResolver;
import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

/** Unit tests for {@link TenantIdentityFilter}. */
@DisplayName("TenantIdentityFilter")
class TenantIdentityFilterTest {

    private final TenantIdentityFilter filter =
            new TenantIdentityFilter(
                    new TenantIdentityResolver(TenantIdentityResolver.DEFAULT_TENANT_HEADER, true));

    @BeforeEach
    void openContext() {
        CorrelationContextHolder.set(CorrelationContext.of("req-1"));
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("publishes the header identity and binds it to the context")
    void publishesHeaderIdentity() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-Tenant-ID", "t1");
        var boundTenant = new AtomicReference<String>();
        FilterChain chain =
                (req, resp) ->
                        boundTenant.set(
                                CorrelationContextHolder.get()
                                        .map(CorrelationContext::tenantId)
                                        .orElse(null));

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        TenantIdentity identity =
                (TenantIdentity) request.getAttribute(TenantIdentityFilter.IDENTITY_ATTRIBUTE);
        assertThat(identity.tenantId()).isEqualTo("t1");
        assertThat(identity.source()).isEqualTo(IdentitySource.VERIFIED_HEADER);
        assertThat(boundTenant.get()).isEqualTo("t1");
    }

    @Test
    @DisplayName("falls back to the bearer token when enabled")
    void bearerFallback() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("Authorization", "Bearer t2");

        filter.doFilter(request, new MockHttpServletResponse(), (req, resp) -> {});

        TenantIdentity identity =
                (TenantIdentity) request.getAttribute(TenantIdentityFilter.IDENTITY_ATTRIBUTE);
        assertThat(identity.tenantId()).isEqualTo("t2");
        assertThat(identity.source()).isEqualTo(IdentitySource.BEARER_TOKEN);
    }

    @Test
    @DisplayName("identity attribute is named after the identity type")
    void identityAttributeName() {
        assertThat(TenantIdentityFilter.IDENTITY_ATTRIBUTE)
                .isEqualTo(TenantIdentity.class.getName());
    }

    @Test
    @DisplayName("anonymous requests pass through without an identity")
    void anonymousPassesThrough() throws Exception {
        var request = new MockHttpServletRequest();
        var chainRan = new AtomicReference<Boolean>(false);

        filter.doFilter(
                request, new MockHttpServletResponse(), (req, resp) -> chainRan.set(true));

        assertThat(chainRan.get()).isTrue();
        assertThat(request.getAttribute(TenantIdentityFilter.IDENTITY_ATTRIBUTE)).isNull();
    }
}
