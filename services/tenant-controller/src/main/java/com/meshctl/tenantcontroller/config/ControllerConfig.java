package com.meshctl.tenantcontroller.config;

import com.meshctl.observability.MetricFactory;
import com.meshctl.observability.MetricsReporter;
import com.meshctl.observability.MicrometerMetricsReporter;
import com.meshctl.security.TenantIdentityResolver;
import com.meshctl.tenantcontroller.api.ApiErrorMapper;
import com.meshctl.tenantcontroller.api.DatabaseErrorClassifier;
import com.meshctl.tenantcontroller.api.ErrorResponder;
import com.meshctl.tenantcontroller.api.OperationInstrumentation;
import com.meshctl.tenantcontroller.domain.ports.ConfigurationStore;
import com.meshctl.tenantcontroller.infrastructure.store.InMemoryConfigurationStore;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the controller's collaborators.
 *
 * <p>The store, metrics reporter and error logger are plain objects built here rather than
 * component-scanned, so tests and alternative deployments can construct them directly.
 */
@Configuration
public class ControllerConfig {

    @Bean
    public TenantIdentityResolver tenantIdentityResolver(IdentityProperties properties) {
        return new TenantIdentityResolver(properties.header(), properties.bearerFallback());
    }

    @Bean
    public MetricFactory metricFactory(
            MeterRegistry meterRegistry, TenantControllerProperties properties) {
        return new MetricFactory(meterRegistry, properties.name());
    }

    @Bean
    public MetricsReporter metricsReporter(MetricFactory metricFactory) {
        return new MicrometerMetricsReporter(metricFactory);
    }

    @Bean
    public OperationInstrumentation operationInstrumentation(MetricsReporter metricsReporter) {
        return new OperationInstrumentation(metricsReporter, Clock.SYSTEM);
    }

    @Bean
    public ConfigurationStore configurationStore(StoreProperties properties) {
        return new InMemoryConfigurationStore(properties.loadBalanceModes());
    }

    @Bean
    public ApiErrorMapper apiErrorMapper() {
        return new ApiErrorMapper(new DatabaseErrorClassifier());
    }

    @Bean
    public ErrorResponder errorResponder(ApiErrorMapper apiErrorMapper) {
        return new ErrorResponder(apiErrorMapper, LoggerFactory.getLogger(ErrorResponder.class));
    }
}
