package com.meshctl.tenantcontroller.domain.ports;

import com.meshctl.tenantcontroller.domain.error.ControllerException;
import com.meshctl.tenantcontroller.domain.model.TenantEntry;
import com.meshctl.tenantcontroller.domain.model.TenantInfo;
import com.meshctl.tenantcontroller.domain.model.Version;

/**
 * Persistence and consistency port for tenant and service-version configuration.
 *
 * <p>Every call is scoped by tenant ID. Implementations own all shared mutable state, must make
 * a successful {@code create}/{@code set} visible to a later {@code get} for the same key, and
 * cascade {@link #delete(String)} to the tenant's versions.
 *
 * <p>Failures are reported as {@link ControllerException} with one of the store kinds
 * ({@code INVALID_RULE}, {@code BACKING_STORE_FAILURE}, {@code SERVICE_UNAVAILABLE},
 * {@code NOT_FOUND}); any other runtime exception is treated as unclassified.
 */
public interface ConfigurationStore {

    /** Registers a new tenant. Fails if the tenant already exists. */
    void create(String tenantId, TenantInfo tenantInfo);

    /** Replaces the full configuration of an existing tenant. */
    void set(String tenantId, TenantInfo tenantInfo);

    /** Returns the stored configuration of a tenant. */
    TenantEntry get(String tenantId);

    /** Removes a tenant and all of its versions. */
    void delete(String tenantId);

    /** Creates or replaces the version record of {@code version.service()}. */
    void setVersion(String tenantId, Version version);

    /** Returns the version record of a service. */
    Version getVersion(String tenantId, String service);

    /** Removes the version record of a service. */
    void deleteVersion(String tenantId, String service);
}
