/**
 * Domain layer: tenant configuration model, the configuration store port, and the error
 * taxonomy shared by every layer.
 *
 * <ul>
 *   <li>{@code model/}: wire and stored representations of tenant and version configuration
 *   <li>{@code ports/}: the {@link com.meshctl.tenantcontroller.domain.ports.ConfigurationStore}
 *       contract implemented by infrastructure adapters
 *   <li>{@code error/}: the closed set of failure kinds and the exception that carries them
 * </ul>
 *
 * <p>Domain MUST NOT depend on the api or infrastructure packages.
 */
package com.meshctl.tenantcontroller.domain;
