package com.todolist.api.exception;

import org.springframework.http.HttpStatus;

/**
 * Username or email already taken at registration.
 */
public class ConflictException extends ApiException {

    public ConflictException(String detail) {
        super(HttpStatus.BAD_REQUEST, detail);
    }
}
