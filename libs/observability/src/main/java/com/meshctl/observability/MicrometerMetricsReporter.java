package com.meshctl.observability;

import java.time.Duration;

/**
 * {@link MetricsReporter} backed by Micrometer meters created through {@link MetricFactory}.
 * <p>
 * Each record updates the {@value #REQUESTS_METRIC} timer tagged with the operation and outcome.
 * Failures additionally increment {@value #FAILURES_METRIC}, which keeps error-rate alerts cheap
 * to express in Prometheus.
 */
public final class MicrometerMetricsReporter implements MetricsReporter {

    /** Timer recording handler latency per operation and outcome. */
    public static final String REQUESTS_METRIC = "meshctl.api.requests";

    /** Counter of failed operations. */
    public static final String FAILURES_METRIC = "meshctl.api.failures";

    /** Tag key for the operation name. */
    public static final String TAG_OPERATION = "operation";

    /** Tag key for the outcome. */
    public static final String TAG_OUTCOME = "outcome";

    private final MetricFactory metricFactory;

    public MicrometerMetricsReporter(MetricFactory metricFactory) {
        if (metricFactory == null) {
            throw new IllegalArgumentException("metricFactory must not be null");
        }
        this.metricFactory = metricFactory;
    }

    @Override
    public void record(String operation, Outcome outcome, Duration elapsed) {
        metricFactory.timer(REQUESTS_METRIC, "API operation latency",
                        TAG_OPERATION, operation,
                        TAG_OUTCOME, outcome.tagValue())
                .record(elapsed);
        if (outcome == Outcome.FAILURE) {
            metricFactory.counter(FAILURES_METRIC, "Failed API operations",
                            TAG_OPERATION, operation)
                    .increment();
        }
    }
}
