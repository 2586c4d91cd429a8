package com.todolist.api.exception;

import org.springframework.http.HttpStatus;

/**
 * Bad credentials at login, or a missing/invalid/expired bearer token.
 * The message never says which of those happened.
 */
public class UnauthorizedException extends ApiException {

    public UnauthorizedException(String detail) {
        super(HttpStatus.UNAUTHORIZED, detail);
    }
}
