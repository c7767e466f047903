package com.meshctl.tenantcontroller.infrastructure.web;

import com.meshctl.observability.CorrelationContext;
import com.meshctl.observability.CorrelationContextHolder;
import com.meshctl.tenantcontroller.api.ApiError;
import com.meshctl.tenantcontroller.api.ErrorResponder;
import com.meshctl.tenantcontroller.domain.error.ErrorKind;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Shapes failures that never reach a request handler.
 *
 * <p>The handlers map their own failures; this advice covers what Spring MVC rejects before
 * dispatch or while writing the response (unknown route, unsupported method, unsupported or
 * unacceptable media type) and anything that escapes unexpectedly, so every error the API
 * returns has the same RFC 7807 body with an {@code error} token and the correlation ID.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private final ErrorResponder errorResponder;

    public GlobalExceptionHandler(ErrorResponder errorResponder) {
        this.errorResponder = errorResponder;
    }

    @ExceptionHandler({
        NoResourceFoundException.class,
        HttpRequestMethodNotSupportedException.class,
        HttpMediaTypeNotSupportedException.class,
        HttpMediaTypeNotAcceptableException.class
    })
    public ResponseEntity<ProblemDetail> handleRouting(Exception ex) {
        HttpStatus status = HttpStatus.resolve(((ErrorResponse) ex).getStatusCode().value());
        if (status == null) {
            status = HttpStatus.BAD_REQUEST;
        }
        ErrorKind kind =
                status == HttpStatus.NOT_FOUND ? ErrorKind.NOT_FOUND : ErrorKind.INVALID_INPUT;
        ApiError error =
                new ApiError(status, "error_" + status.name().toLowerCase(), kind, ex.getMessage());
        return errorResponder.respond(error, ex, currentTenantId(), currentCorrelationId());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGeneric(Exception ex) {
        return errorResponder.respond(ex, currentTenantId(), currentCorrelationId());
    }

    private static String currentTenantId() {
        return CorrelationContextHolder.get().map(CorrelationContext::tenantId).orElse(null);
    }

    private static String currentCorrelationId() {
        return CorrelationContextHolder.currentCorrelationId();
    }
}
