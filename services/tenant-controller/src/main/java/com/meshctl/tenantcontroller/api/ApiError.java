package com.meshctl.tenantcontroller.api;

import com.meshctl.tenantcontroller.domain.error.ErrorKind;
import org.springframework.http.HttpStatus;

/**
 * Client-observable form of a failure.
 *
 * @param status HTTP status of the response
 * @param token stable, machine-readable error token
 * @param kind failure kind the error was classified as
 * @param detail human-readable explanation
 */
public record ApiError(HttpStatus status, String token, ErrorKind kind, String detail) {}
