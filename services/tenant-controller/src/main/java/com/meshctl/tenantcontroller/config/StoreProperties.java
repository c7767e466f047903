package com.meshctl.tenantcontroller.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the bundled in-memory configuration store ({@code meshctl.store.*}).
 *
 * @param loadBalanceModes load-balancing tokens the store accepts
 */
@ConfigurationProperties(prefix = "meshctl.store")
public record StoreProperties(List<String> loadBalanceModes) {

    public static final List<String> DEFAULT_LOAD_BALANCE_MODES = List.of("round_robin", "random");

    public StoreProperties {
        loadBalanceModes =
                loadBalanceModes == null || loadBalanceModes.isEmpty()
                        ? DEFAULT_LOAD_BALANCE_MODES
                        : List.copyOf(loadBalanceModes);
    }
}
