package com.meshctl.observability;

/**
 * Result of a single instrumented API operation, as seen by the metrics sink.
 */
public enum Outcome {
    SUCCESS,
    FAILURE;

    /** Lower-case tag value used on meters. */
    public String tagValue() {
        return name().toLowerCase();
    }
}
