package com.meshctl.tenantcontroller.api;

import com.meshctl.observability.Outcome;
import org.springframework.http.ResponseEntity;

/**
 * What a request handler produced: the HTTP response and the outcome to report.
 *
 * <p>The outcome is usually implied by the status, but a handler may answer 200 and still
 * report a failure (see the version read path when encoding the stored payload fails).
 *
 * @param response response to send to the client
 * @param outcome outcome reported to the metrics sink
 */
public record HandlerResult(ResponseEntity<?> response, Outcome outcome) {

    public static HandlerResult success(ResponseEntity<?> response) {
        return new HandlerResult(response, Outcome.SUCCESS);
    }

    public static HandlerResult failure(ResponseEntity<?> response) {
        return new HandlerResult(response, Outcome.FAILURE);
    }
}
