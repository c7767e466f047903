package com.meshctl.tenantcontroller.api;

import com.meshctl.tenantcontroller.domain.error.ErrorKind;
import java.net.URI;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;

/**
 * Turns a failure into an RFC 7807 response and logs it.
 *
 * <p>Error bodies look like:
 *
 * <pre>
 * {
 *   "type": "https://meshctl.io/errors/not-found",
 *   "title": "Not Found",
 *   "status": 404,
 *   "detail": "error_tenant_not_found",
 *   "error": "error_tenant_not_found",
 *   "timestamp": "2026-03-02T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>{@code error} is the stable token clients switch on. The log line carries the tenant ID and
 * correlation ID. Logging is best effort: a logger that throws is counted and otherwise ignored,
 * so the client still gets its response.
 */
public class ErrorResponder {

    static final String ERROR_TYPE_BASE = "https://meshctl.io/errors/";

    private final ApiErrorMapper mapper;
    private final Logger log;
    private final AtomicLong suppressedLogFailures = new AtomicLong();

    /**
     * @param mapper failure classifier
     * @param log logger that receives one line per failure
     */
    public ErrorResponder(ApiErrorMapper mapper, Logger log) {
        this.mapper = mapper;
        this.log = log;
    }

    /** Maps, logs and shapes a failure raised while handling {@code request}. */
    public HandlerResult respond(InboundRequest request, Throwable failure) {
        ApiError error = mapper.map(failure);
        logFailure(error, failure, request.tenantId(), request.correlationId());
        return HandlerResult.failure(toResponse(error, request.correlationId()));
    }

    /** Shapes an already classified error, logging it against the given request. */
    public ResponseEntity<ProblemDetail> respond(
            ApiError error, Throwable failure, String tenantId, String correlationId) {
        logFailure(error, failure, tenantId, correlationId);
        return toResponse(error, correlationId);
    }

    /** Classifies a failure that escaped the handlers and shapes it. */
    public ResponseEntity<ProblemDetail> respond(
            Throwable failure, String tenantId, String correlationId) {
        return respond(mapper.map(failure), failure, tenantId, correlationId);
    }

    /** Number of failure log lines that could not be written. */
    public long suppressedLogFailures() {
        return suppressedLogFailures.get();
    }

    private ResponseEntity<ProblemDetail> toResponse(ApiError error, String correlationId) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(error.status(), error.detail());
        problem.setTitle(error.status().getReasonPhrase());
        problem.setType(URI.create(ERROR_TYPE_BASE + typeSlug(error.kind())));
        problem.setProperty("error", error.token());
        problem.setProperty("timestamp", Instant.now().toString());
        if (correlationId != null) {
            problem.setProperty("correlationId", correlationId);
        }
        return ResponseEntity.status(error.status())
                .contentType(MediaType.APPLICATION_PROBLEM_JSON)
                .body(problem);
    }

    private void logFailure(ApiError error, Throwable failure, String tenantId, String correlationId) {
        try {
            String summary = summary(error.kind());
            if (error.status().is5xxServerError()) {
                log.error(
                        "{}: error={} tenant_id={} request_id={}",
                        summary,
                        error.token(),
                        tenantId,
                        correlationId,
                        failure);
            } else {
                log.warn(
                        "{}: error={} tenant_id={} request_id={} cause={}",
                        summary,
                        error.token(),
                        tenantId,
                        correlationId,
                        failure != null ? failure.getMessage() : null);
            }
        } catch (RuntimeException loggingFailure) {
            suppressedLogFailures.incrementAndGet();
        }
    }

    private static String typeSlug(ErrorKind kind) {
        return kind.name().toLowerCase().replace('_', '-');
    }

    private static String summary(ErrorKind kind) {
        return switch (kind) {
            case INVALID_INPUT -> "Invalid input";
            case MALFORMED_PAYLOAD -> "Could not parse JSON";
            case INVALID_RULE -> "Bad request";
            case BACKING_STORE_FAILURE -> "Database error occurred";
            case SERVICE_UNAVAILABLE -> "Service unavailable";
            case NOT_FOUND -> "Record not found";
            case UNKNOWN -> "Unknown availability error occurred";
        };
    }
}
