package com.meshctl.tenantcontroller.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.meshctl.observability.CorrelationContext;
import com.meshctl.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

/**
 * Unit tests for {@link CorrelationIdFilter}.
 *
 * <p>WHY: every log line and error body of a request carries its request ID. These tests pin the
 * filter's contract with plain servlet mocks, no Spring context.
 */
@DisplayName("CorrelationIdFilter")
class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("generates a request ID when none is provided")
    void generatesRequestId() throws Exception {
        var response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest(), response, (req, resp) -> {});

        assertThat(response.getHeader(CorrelationIdFilter.REQUEST_ID_HEADER)).isNotBlank();
    }

    @Test
    @DisplayName("echoes an inbound request ID")
    void propagatesRequestId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-Request-ID", "req-abc-123");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader("X-Request-ID")).isEqualTo("req-abc-123");
    }

    @Test
    @DisplayName("replaces a blank request ID")
    void replacesBlankRequestId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-Request-ID", "  ");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader("X-Request-ID")).isNotBlank().isNotEqualTo("  ");
    }

    @Test
    @DisplayName("context holds the request ID, method and path while the chain runs")
    void populatesContextDuringChain() throws Exception {
        var captured = new AtomicReference<CorrelationContext>();
        FilterChain capturingChain =
                (req, resp) -> captured.set(CorrelationContextHolder.get().orElse(null));

        var request = new MockHttpServletRequest("PUT", "/v1/tenants");
        request.addHeader("X-Request-ID", "during-chain-123");

        filter.doFilter(request, new MockHttpServletResponse(), capturingChain);

        assertThat(captured.get()).isNotNull();
        assertThat(captured.get().correlationId()).isEqualTo("during-chain-123");
        assertThat(captured.get().httpMethod()).isEqualTo("PUT");
        assertThat(captured.get().httpPath()).isEqualTo("/v1/tenants");
    }

    @Test
    @DisplayName("clears the context after the request")
    void clearsContextAfterRequest() throws Exception {
        filter.doFilter(
                new MockHttpServletRequest(), new MockHttpServletResponse(), (req, resp) -> {});

        assertThat(CorrelationContextHolder.get()).isEmpty();
    }
}
