package com.todolist.api.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base class for expected, caller-recoverable API outcomes.
 *
 * Subclasses fix the HTTP status; the message becomes the "detail" field of
 * the error body rendered by {@link ApiExceptionHandler}.
 */
@Getter
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;

    protected ApiException(HttpStatus status, String detail) {
        super(detail);
        this.status = status;
    }
}
