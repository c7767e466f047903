package com.meshctl.tenantcontroller.domain.error;

/**
 * Closed set of failure kinds an API operation can end in.
 *
 * <p>The first two are raised by the request handlers before any store call; the rest are
 * reported by the configuration store. Each kind carries the token used when no more specific
 * one is available.
 */
public enum ErrorKind {
    INVALID_INPUT("error_invalid_input"),
    MALFORMED_PAYLOAD("json_error"),
    INVALID_RULE("error_invalid_rule"),
    BACKING_STORE_FAILURE("error_db_unavailable"),
    SERVICE_UNAVAILABLE("error_service_unavailable"),
    NOT_FOUND("error_not_found"),
    UNKNOWN("unknown_availability_error");

    private final String defaultToken;

    ErrorKind(String defaultToken) {
        this.defaultToken = defaultToken;
    }

    public String defaultToken() {
        return defaultToken;
    }
}
