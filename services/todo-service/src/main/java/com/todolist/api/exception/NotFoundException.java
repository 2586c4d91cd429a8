package com.todolist.api.exception;

import org.springframework.http.HttpStatus;

/**
 * Resource absent, or present but owned by someone else. The two cases are
 * reported identically.
 */
public class NotFoundException extends ApiException {

    public NotFoundException(String detail) {
        super(HttpStatus.NOT_FOUND, detail);
    }
}
