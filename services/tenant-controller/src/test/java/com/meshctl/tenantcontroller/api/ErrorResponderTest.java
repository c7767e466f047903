package com.meshctl.tenantcontroller.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.meshctl.observability.Outcome;
import com.meshctl.security.TenantIdentity;
import com.meshctl.tenantcontroller.domain.error.ControllerException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;

/** Unit tests for {@link ErrorResponder}. */
@DisplayName("ErrorResponder")
class ErrorResponderTest {

    private final ApiErrorMapper mapper = new ApiErrorMapper(new DatabaseErrorClassifier());
    private final Logger log = mock(Logger.class);
    private final ErrorResponder responder = new ErrorResponder(mapper, log);

    private final InboundRequest request =
            new InboundRequest(TenantIdentity.fromHeader("t1"), "req-42");

    @Test
    @DisplayName("shapes a ProblemDetail carrying the token and correlation ID")
    void shapesProblemDetail() {
        HandlerResult result =
                responder.respond(request, ControllerException.notFound("error_tenant_not_found"));

        assertThat(result.outcome()).isEqualTo(Outcome.FAILURE);
        ResponseEntity<?> response = result.response();
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getHeaders().getContentType())
                .isEqualTo(MediaType.APPLICATION_PROBLEM_JSON);

        ProblemDetail problem = (ProblemDetail) response.getBody();
        assertThat(problem).isNotNull();
        assertThat(problem.getType().toString())
                .isEqualTo(ErrorResponder.ERROR_TYPE_BASE + "not-found");
        assertThat(problem.getProperties())
                .containsEntry("error", "error_tenant_not_found")
                .containsEntry("correlationId", "req-42")
                .containsKey("timestamp");
    }

    @Test
    @DisplayName("logs client errors at warn with tenant and request ID")
    void logsClientErrorsAtWarn() {
        responder.respond(request, ControllerException.invalidRule("error_invalid_port"));

        verify(log)
                .warn(
                        anyString(),
                        eq("Bad request"),
                        eq("error_invalid_port"),
                        eq("t1"),
                        eq("req-42"),
                        any());
    }

    @Test
    @DisplayName("logs server-side errors at error")
    void logsServerErrorsAtError() {
        responder.respond(request, new IllegalStateException("store unreachable"));

        verify(log)
                .error(
                        anyString(),
                        eq("Unknown availability error occurred"),
                        eq("unknown_availability_error"),
                        eq("t1"),
                        eq("req-42"),
                        any());
    }

    @Test
    @DisplayName("omits correlationId when the request has none")
    void omitsMissingCorrelationId() {
        ResponseEntity<ProblemDetail> response =
                responder.respond(new IllegalStateException("x"), null, null);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().getProperties()).doesNotContainKey("correlationId");
        assertThat(response.getBody().getProperties())
                .containsEntry("error", "unknown_availability_error");
    }

    @Test
    @DisplayName("still responds when the logger throws")
    void respondsWhenLoggerThrows() {
        doThrow(new IllegalStateException("appender broken"))
                .when(log)
                .error(anyString(), any(), any(), any(), any(), any());

        HandlerResult result = responder.respond(request, new IllegalStateException("boom"));

        assertThat(result.response().getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(responder.suppressedLogFailures()).isEqualTo(1);
    }
}
