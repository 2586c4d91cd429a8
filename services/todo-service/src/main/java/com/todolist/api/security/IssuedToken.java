package com.todolist.api.security;

import lombok.Value;

import java.time.Instant;

/**
 * A freshly signed token together with its absolute expiry.
 */
@Value
public class IssuedToken {

    String token;

    Instant expiresAt;
}
