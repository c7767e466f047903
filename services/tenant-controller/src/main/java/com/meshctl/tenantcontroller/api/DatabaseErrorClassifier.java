package com.meshctl.tenantcontroller.api;

import com.meshctl.tenantcontroller.domain.error.ErrorKind;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.dao.NonTransientDataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;

/**
 * Classifies the cause of a backing-store failure.
 *
 * <p>Store adapters built on Spring data access translate driver errors into the {@code
 * DataAccessException} hierarchy, which already separates transient from permanent failures.
 * Anything this classifier does not recognise, including a missing cause, is reported as an
 * unavailable database.
 */
public class DatabaseErrorClassifier {

    static final String NOT_FOUND = "error_not_found";
    static final String CONFLICT = "error_db_conflict";
    static final String UNAVAILABLE = "error_db_unavailable";
    static final String FAILURE = "error_db_failure";

    public ApiError classify(Throwable cause) {
        // Most specific first: EmptyResult and DuplicateKey are themselves non-transient.
        if (cause instanceof EmptyResultDataAccessException) {
            return error(HttpStatus.NOT_FOUND, NOT_FOUND, "record not found in database");
        }
        if (cause instanceof DuplicateKeyException) {
            return error(HttpStatus.CONFLICT, CONFLICT, "conflicting record in database");
        }
        if (cause instanceof TransientDataAccessException
                || cause instanceof RecoverableDataAccessException) {
            return error(HttpStatus.SERVICE_UNAVAILABLE, UNAVAILABLE, "database temporarily unavailable");
        }
        if (cause instanceof NonTransientDataAccessException) {
            return error(HttpStatus.INTERNAL_SERVER_ERROR, FAILURE, "database operation failed");
        }
        return error(HttpStatus.SERVICE_UNAVAILABLE, UNAVAILABLE, "database unavailable");
    }

    private static ApiError error(HttpStatus status, String token, String detail) {
        return new ApiError(status, token, ErrorKind.BACKING_STORE_FAILURE, detail);
    }
}
