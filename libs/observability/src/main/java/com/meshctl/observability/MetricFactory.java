package com.meshctl.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Factory for creating Micrometer metrics with an automatic {@code service} tag.
 * <p>
 * Wraps {@link MeterRegistry} so that every meter registered by a meshctl service carries the
 * same service tag and follows the same naming. Registering the same name and tags twice
 * returns the existing meter.
 */
public final class MetricFactory {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * Creates a MetricFactory bound to the given registry and service name.
     *
     * @param registry    the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     * @param serviceName logical service name included as a default tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Creates a counter with the service tag.
     *
     * @param name        metric name (e.g., "meshctl.api.failures")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     * @return the counter
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Creates a timer (histogram of durations) with the service tag.
     *
     * @param name        metric name (e.g., "meshctl.api.requests")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     * @return the timer
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
