package com.meshctl.tenantcontroller.api;

import com.meshctl.observability.MetricsReporter;
import com.meshctl.observability.Outcome;
import io.micrometer.core.instrument.Clock;
import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records one metrics entry per handler invocation.
 *
 * <p>The wrapper is purely observational: the handler's result or exception is passed through
 * unchanged, and the record is written exactly once, after the handler returns or throws. A
 * reporter failure is logged and never reaches the client.
 */
public class OperationInstrumentation {

    private static final Logger log = LoggerFactory.getLogger(OperationInstrumentation.class);

    private final MetricsReporter reporter;
    private final Clock clock;

    public OperationInstrumentation(MetricsReporter reporter, Clock clock) {
        this.reporter = reporter;
        this.clock = clock;
    }

    /**
     * Runs {@code handler} and reports its outcome under {@code operation}.
     *
     * @param operation operation name (see {@link Operations})
     * @param handler the handler invocation
     * @return the handler's result, unchanged
     */
    public HandlerResult instrument(String operation, Supplier<HandlerResult> handler) {
        long start = clock.monotonicTime();
        Outcome outcome = Outcome.FAILURE;
        try {
            HandlerResult result = handler.get();
            outcome = result.outcome();
            return result;
        } finally {
            report(operation, outcome, Duration.ofNanos(clock.monotonicTime() - start));
        }
    }

    private void report(String operation, Outcome outcome, Duration elapsed) {
        try {
            reporter.record(operation, outcome, elapsed);
        } catch (RuntimeException e) {
            log.warn("Could not record metrics for operation {}", operation, e);
        }
    }
}
