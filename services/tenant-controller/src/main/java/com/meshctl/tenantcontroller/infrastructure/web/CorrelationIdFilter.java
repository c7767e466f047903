package com.meshctl.tenantcontroller.infrastructure.web;

import com.meshctl.observability.CorrelationContext;
import com.meshctl.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that propagates or generates a request ID for every HTTP request.
 *
 * <p>The ID flows through:
 *
 * <ol>
 *   <li>{@code X-Request-ID} request header → this filter → {@link CorrelationContextHolder}
 *   <li>CorrelationContextHolder → SLF4J MDC → every log line of the request
 *   <li>CorrelationContextHolder → {@code correlationId} of error responses
 *   <li>This filter → {@code X-Request-ID} response header
 * </ol>
 *
 * <p>It is never forwarded to the configuration store. Runs at {@link
 * Ordered#HIGHEST_PRECEDENCE} so the context exists before identity resolution.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }

        CorrelationContextHolder.set(
                new CorrelationContext(
                        requestId, null, request.getMethod(), request.getRequestURI()));

        response.setHeader(REQUEST_ID_HEADER, requestId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // WHY: Tomcat reuses threads; a leftover context would tag the next request.
            CorrelationContextHolder.clear();
        }
    }
}
