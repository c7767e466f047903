package com.meshctl.tenantcontroller.api;

import com.meshctl.tenantcontroller.domain.error.ControllerException;
import com.meshctl.tenantcontroller.domain.error.ErrorKind;
import org.springframework.http.HttpStatus;

/**
 * Maps any failure to the status and token the client sees.
 *
 * <p>Total: every {@link ErrorKind} has an arm, and anything that is not a {@link
 * ControllerException} (including null) is reported as an unknown availability error. Only the
 * kind drives the decision; message text is used as the token for store-reported kinds and
 * never inspected.
 *
 * <table>
 *   <caption>Mapping</caption>
 *   <tr><th>Kind</th><th>Status</th><th>Token</th></tr>
 *   <tr><td>INVALID_INPUT</td><td>400</td><td>error_invalid_input</td></tr>
 *   <tr><td>MALFORMED_PAYLOAD</td><td>400</td><td>json_error</td></tr>
 *   <tr><td>INVALID_RULE</td><td>400</td><td>store message</td></tr>
 *   <tr><td>BACKING_STORE_FAILURE</td><td colspan="2">{@link DatabaseErrorClassifier}</td></tr>
 *   <tr><td>SERVICE_UNAVAILABLE</td><td>503</td><td>store message</td></tr>
 *   <tr><td>NOT_FOUND</td><td>404</td><td>store message</td></tr>
 *   <tr><td>UNKNOWN / other</td><td>503</td><td>unknown_availability_error</td></tr>
 * </table>
 */
public class ApiErrorMapper {

    private final DatabaseErrorClassifier databaseErrorClassifier;

    public ApiErrorMapper(DatabaseErrorClassifier databaseErrorClassifier) {
        this.databaseErrorClassifier = databaseErrorClassifier;
    }

    public ApiError map(Throwable failure) {
        if (!(failure instanceof ControllerException controllerFailure)) {
            return unknown();
        }
        ErrorKind kind = controllerFailure.kind();
        return switch (kind) {
            case INVALID_INPUT, MALFORMED_PAYLOAD ->
                    new ApiError(HttpStatus.BAD_REQUEST, kind.defaultToken(), kind, detailOf(controllerFailure));
            case INVALID_RULE -> storeError(HttpStatus.BAD_REQUEST, controllerFailure);
            case BACKING_STORE_FAILURE -> databaseErrorClassifier.classify(controllerFailure.getCause());
            case SERVICE_UNAVAILABLE -> storeError(HttpStatus.SERVICE_UNAVAILABLE, controllerFailure);
            case NOT_FOUND -> storeError(HttpStatus.NOT_FOUND, controllerFailure);
            case UNKNOWN -> unknown();
        };
    }

    private static ApiError storeError(HttpStatus status, ControllerException failure) {
        String token = hasText(failure.getMessage()) ? failure.getMessage() : failure.kind().defaultToken();
        return new ApiError(status, token, failure.kind(), detailOf(failure));
    }

    private static ApiError unknown() {
        return new ApiError(
                HttpStatus.SERVICE_UNAVAILABLE,
                ErrorKind.UNKNOWN.defaultToken(),
                ErrorKind.UNKNOWN,
                "unknown availability error");
    }

    private static String detailOf(ControllerException failure) {
        return hasText(failure.getMessage())
                ? failure.getMessage()
                : failure.kind().name().toLowerCase().replace('_', ' ');
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
