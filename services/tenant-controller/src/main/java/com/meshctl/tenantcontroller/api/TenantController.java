package com.meshctl.tenantcontroller.api;

import com.meshctl.observability.CorrelationContextHolder;
import com.meshctl.security.TenantIdentity;
import com.meshctl.tenantcontroller.infrastructure.web.TenantIdentityFilter;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Routes of the tenant configuration API.
 *
 * <p>Bodies are taken as raw strings so that decoding, and its failure, happens inside the
 * instrumented handler rather than in Spring's message conversion. The identity resolved by
 * {@link TenantIdentityFilter} arrives as a request attribute and is absent for anonymous
 * requests.
 */
@RestController
@RequestMapping("/v1")
public class TenantController {

    private final TenantRequestHandler handler;
    private final OperationInstrumentation instrumentation;

    public TenantController(
            TenantRequestHandler handler, OperationInstrumentation instrumentation) {
        this.handler = handler;
        this.instrumentation = instrumentation;
    }

    @PostMapping("/tenants")
    public ResponseEntity<?> createTenant(
            @RequestAttribute(name = TenantIdentityFilter.IDENTITY_ATTRIBUTE, required = false)
                    TenantIdentity identity,
            @RequestBody(required = false) String body) {
        InboundRequest request = inbound(identity);
        return instrumentation
                .instrument(Operations.TENANTS_CREATE, () -> handler.createTenant(request, body))
                .response();
    }

    @PutMapping("/tenants")
    public ResponseEntity<?> updateTenant(
            @RequestAttribute(name = TenantIdentityFilter.IDENTITY_ATTRIBUTE, required = false)
                    TenantIdentity identity,
            @RequestBody(required = false) String body) {
        InboundRequest request = inbound(identity);
        return instrumentation
                .instrument(Operations.TENANTS_UPDATE, () -> handler.updateTenant(request, body))
                .response();
    }

    @GetMapping("/tenants")
    public ResponseEntity<?> readTenant(
            @RequestAttribute(name = TenantIdentityFilter.IDENTITY_ATTRIBUTE, required = false)
                    TenantIdentity identity) {
        InboundRequest request = inbound(identity);
        return instrumentation
                .instrument(Operations.TENANTS_READ, () -> handler.readTenant(request))
                .response();
    }

    @DeleteMapping("/tenants")
    public ResponseEntity<?> deleteTenant(
            @RequestAttribute(name = TenantIdentityFilter.IDENTITY_ATTRIBUTE, required = false)
                    TenantIdentity identity) {
        InboundRequest request = inbound(identity);
        return instrumentation
                .instrument(Operations.TENANTS_DELETE, () -> handler.deleteTenant(request))
                .response();
    }

    @PutMapping("/versions/{service}")
    public ResponseEntity<?> setServiceVersion(
            @RequestAttribute(name = TenantIdentityFilter.IDENTITY_ATTRIBUTE, required = false)
                    TenantIdentity identity,
            @PathVariable("service") String service,
            @RequestBody(required = false) String body) {
        InboundRequest request = inbound(identity);
        return instrumentation
                .instrument(
                        Operations.VERSIONS_UPDATE,
                        () -> handler.setServiceVersion(request, service, body))
                .response();
    }

    @GetMapping("/versions/{service}")
    public ResponseEntity<?> getServiceVersion(
            @RequestAttribute(name = TenantIdentityFilter.IDENTITY_ATTRIBUTE, required = false)
                    TenantIdentity identity,
            @PathVariable("service") String service) {
        InboundRequest request = inbound(identity);
        return instrumentation
                .instrument(
                        Operations.VERSIONS_READ,
                        () -> handler.getServiceVersion(request, service))
                .response();
    }

    @DeleteMapping("/versions/{service}")
    public ResponseEntity<?> deleteServiceVersion(
            @RequestAttribute(name = TenantIdentityFilter.IDENTITY_ATTRIBUTE, required = false)
                    TenantIdentity identity,
            @PathVariable("service") String service) {
        InboundRequest request = inbound(identity);
        return instrumentation
                .instrument(
                        Operations.VERSIONS_UPDATE,
                        () -> handler.deleteServiceVersion(request, service))
                .response();
    }

    private static InboundRequest inbound(TenantIdentity identity) {
        return new InboundRequest(identity, CorrelationContextHolder.currentCorrelationId());
    }
}
