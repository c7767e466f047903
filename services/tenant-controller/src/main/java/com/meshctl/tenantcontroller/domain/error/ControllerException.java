package com.meshctl.tenantcontroller.domain.error;

/**
 * Failure of a tenant or version operation, classified by {@link ErrorKind}.
 *
 * <p>WHY a RuntimeException: store adapters and handlers raise it wherever the failure is
 * detected, and the request handler boundary is the single place it is caught and mapped to a
 * response.
 *
 * <p>For store-reported kinds the message doubles as the client-facing error token, so adapters
 * should use stable snake_case tokens such as {@code error_tenant_not_found}.
 */
public class ControllerException extends RuntimeException {

    private final ErrorKind kind;

    public ControllerException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public ControllerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static ControllerException invalidInput(String message) {
        return new ControllerException(ErrorKind.INVALID_INPUT, message);
    }

    public static ControllerException malformedPayload(String message, Throwable cause) {
        return new ControllerException(ErrorKind.MALFORMED_PAYLOAD, message, cause);
    }

    public static ControllerException invalidRule(String message) {
        return new ControllerException(ErrorKind.INVALID_RULE, message);
    }

    public static ControllerException notFound(String message) {
        return new ControllerException(ErrorKind.NOT_FOUND, message);
    }

    public static ControllerException serviceUnavailable(String message) {
        return new ControllerException(ErrorKind.SERVICE_UNAVAILABLE, message);
    }

    public static ControllerException backingStoreFailure(String message, Throwable cause) {
        return new ControllerException(ErrorKind.BACKING_STORE_FAILURE, message, cause);
    }
}
