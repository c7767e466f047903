package com.meshctl.tenantcontroller;

import com.meshctl.tenantcontroller.config.IdentityProperties;
import com.meshctl.tenantcontroller.config.StoreProperties;
import com.meshctl.tenantcontroller.config.TenantControllerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * meshctl tenant controller: configuration API of the service-mesh controller.
 *
 * <p>Exposes the tenant routing configuration ({@code /v1/tenants}) and per-service version
 * metadata ({@code /v1/versions/{service}}) of each tenant, delegating all state to the
 * configured {@link com.meshctl.tenantcontroller.domain.ports.ConfigurationStore}.
 *
 * <p>Key features configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, info and Prometheus endpoints
 *   <li>Request ID propagation and tenant identity resolution (servlet filters)
 *   <li>Structured error responses (RFC 7807 ProblemDetail)
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties({
    TenantControllerProperties.class,
    IdentityProperties.class,
    StoreProperties.class
})
public class TenantControllerApplication {

    private static final Logger log = LoggerFactory.getLogger(TenantControllerApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(TenantControllerApplication.class, args);
        log.info("meshctl tenant controller started");
    }
}
