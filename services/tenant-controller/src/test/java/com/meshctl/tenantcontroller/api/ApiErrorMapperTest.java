package com.meshctl.tenantcontroller.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.meshctl.tenantcontroller.domain.error.ControllerException;
import com.meshctl.tenantcontroller.domain.error.ErrorKind;
import java.io.IOException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;

/**
 * Unit tests for {@link ApiErrorMapper}.
 *
 * <p>WHY: the mapper decides what clients see for every failure. It must be total and driven by
 * the kind alone.
 */
@DisplayName("ApiErrorMapper")
class ApiErrorMapperTest {

    private final ApiErrorMapper mapper = new ApiErrorMapper(new DatabaseErrorClassifier());

    @Nested
    @DisplayName("handler-raised kinds")
    class HandlerKinds {

        @Test
        @DisplayName("INVALID_INPUT maps to 400 error_invalid_input")
        void invalidInput() {
            ApiError error =
                    mapper.map(ControllerException.invalidInput("tenant identity is required"));

            assertThat(error.status()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(error.token()).isEqualTo("error_invalid_input");
            assertThat(error.detail()).isEqualTo("tenant identity is required");
        }

        @Test
        @DisplayName("MALFORMED_PAYLOAD maps to 400 json_error")
        void malformedPayload() {
            ApiError error =
                    mapper.map(ControllerException.malformedPayload("bad json", new IOException()));

            assertThat(error.status()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(error.token()).isEqualTo("json_error");
        }
    }

    @Nested
    @DisplayName("store-reported kinds")
    class StoreKinds {

        @Test
        @DisplayName("INVALID_RULE maps to 400 with the store message")
        void invalidRule() {
            ApiError error = mapper.map(ControllerException.invalidRule("error_invalid_port"));

            assertThat(error.status()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(error.token()).isEqualTo("error_invalid_port");
            assertThat(error.kind()).isEqualTo(ErrorKind.INVALID_RULE);
        }

        @Test
        @DisplayName("SERVICE_UNAVAILABLE maps to 503 with the store message")
        void serviceUnavailable() {
            ApiError error =
                    mapper.map(ControllerException.serviceUnavailable("error_store_draining"));

            assertThat(error.status()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
            assertThat(error.token()).isEqualTo("error_store_draining");
        }

        @Test
        @DisplayName("NOT_FOUND maps to 404 with the store message")
        void notFound() {
            ApiError error = mapper.map(ControllerException.notFound("error_tenant_not_found"));

            assertThat(error.status()).isEqualTo(HttpStatus.NOT_FOUND);
            assertThat(error.token()).isEqualTo("error_tenant_not_found");
        }

        @Test
        @DisplayName("BACKING_STORE_FAILURE is delegated to the database classifier")
        void backingStoreFailure() {
            ApiError error =
                    mapper.map(
                            ControllerException.backingStoreFailure(
                                    "db down", new QueryTimeoutException("timeout")));

            assertThat(error.status()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
            assertThat(error.token()).isEqualTo("error_db_unavailable");
            assertThat(error.kind()).isEqualTo(ErrorKind.BACKING_STORE_FAILURE);
        }

        @Test
        @DisplayName("blank store message falls back to the kind's default token")
        void blankMessageFallsBack() {
            ApiError error = mapper.map(ControllerException.notFound("  "));

            assertThat(error.token()).isEqualTo("error_not_found");
        }
    }

    @Nested
    @DisplayName("unknown failures")
    class UnknownFailures {

        @Test
        @DisplayName("UNKNOWN kind maps to 503 unknown_availability_error")
        void unknownKind() {
            ApiError error = mapper.map(new ControllerException(ErrorKind.UNKNOWN, "whatever"));

            assertThat(error.status()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
            assertThat(error.token()).isEqualTo("unknown_availability_error");
        }

        @Test
        @DisplayName("foreign exception maps to 503 unknown_availability_error")
        void foreignException() {
            ApiError error = mapper.map(new IllegalStateException("connection reset"));

            assertThat(error.status()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
            assertThat(error.token()).isEqualTo("unknown_availability_error");
            assertThat(error.kind()).isEqualTo(ErrorKind.UNKNOWN);
        }

        @Test
        @DisplayName("null maps to 503 unknown_availability_error")
        void nullFailure() {
            assertThat(mapper.map(null).token()).isEqualTo("unknown_availability_error");
        }
    }

    @ParameterizedTest(name = "{0} yields a response")
    @EnumSource(ErrorKind.class)
    @DisplayName("every kind produces a status and a token")
    void everyKindIsMapped(ErrorKind kind) {
        ApiError error = mapper.map(new ControllerException(kind, null));

        assertThat(error.status()).isNotNull();
        assertThat(error.token()).isNotBlank();
        assertThat(error.detail()).isNotBlank();
    }
}
