package com.todolist.api.security;

import lombok.Value;

import java.time.Instant;

/**
 * Claims of a bearer token that passed signature and expiry checks.
 */
@Value
public class TokenClaims {

    /** The username the token was issued to. */
    String subject;

    Instant issuedAt;

    Instant expiresAt;
}
