package com.meshctl.observability;

import java.time.Duration;

/**
 * Sink for per-operation API metrics.
 * <p>
 * Fire-and-forget: callers never inspect a result, and an implementation must not rely on being
 * called from any particular thread. Exactly one record is expected per handled request.
 */
public interface MetricsReporter {

    /**
     * Records the completion of one operation.
     *
     * @param operation operation name (e.g., "tenants_create")
     * @param outcome   whether the operation succeeded
     * @param elapsed   wall-clock time spent in the handler
     */
    void record(String operation, Outcome outcome, Duration elapsed);
}
