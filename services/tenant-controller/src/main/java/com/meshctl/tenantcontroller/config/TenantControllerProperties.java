package com.meshctl.tenantcontroller.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe service properties for the tenant controller.
 *
 * <p>Spring Boot binds the {@code meshctl.service.*} prefix to this record at startup and
 * validates it via Bean Validation, so a missing name fails fast instead of producing unlabeled
 * metrics.
 *
 * <pre>
 * meshctl:
 *   service:
 *     name: tenant-controller
 *     environment: production
 *     description: Tenant and service-version configuration API
 * </pre>
 *
 * @param name Service name used for logging and as the metrics {@code service} tag. Required.
 * @param environment Deployment environment (development, staging, production).
 * @param description Human-readable service description for /actuator/info.
 */
@ConfigurationProperties(prefix = "meshctl.service")
@Validated
public record TenantControllerProperties(
        @NotBlank String name, String environment, String description) {

    /** Applies defaults for optional fields. Runs BEFORE Bean Validation. */
    public TenantControllerProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
