package com.todolist.api.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.io.Encoders;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Optional;

/**
 * JwtUtil - Issues and validates the API's bearer tokens.
 *
 * JWT Structure (RFC 7519):
 * - Header: Algorithm (HS256) and token type (JWT)
 * - Payload: Subject (username), issued at, expiration
 * - Signature: HMAC-SHA256 using the shared secret
 *
 * Configuration (from application.yml):
 * - jwt.secret: HMAC signing key, at least 256 bits (32 bytes) for HS256
 * - jwt.expiration: Token lifetime in milliseconds (default: 24 hours)
 *
 * Tokens are stateless. Nothing is stored server-side, so a token stays
 * usable until it expires; there is no revocation.
 *
 * Token Lifecycle:
 * 1. User logs in with username and password
 * 2. issue() creates a signed JWT with the username as subject
 * 3. Client sends it as "Authorization: Bearer &lt;token&gt;"
 * 4. validate() verifies signature and expiry on each request
 * 5. After the TTL the client must log in again
 *
 * @see IdentityResolver for how validated claims become a user
 */
@Component
@Slf4j
public class JwtUtil {

    private final Key signingKey;

    private final Duration expiration;

    private final Clock clock;

    /**
     * @param secret Shared HMAC secret (jwt.secret)
     * @param expirationMillis Token lifetime in milliseconds (jwt.expiration)
     * @param clock Time source for issuing and validating
     * @throws io.jsonwebtoken.security.WeakKeyException if the secret is shorter than 256 bits
     */
    public JwtUtil(@Value("${jwt.secret}") String secret,
                   @Value("${jwt.expiration:86400000}") long expirationMillis,
                   Clock clock) {
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expiration = Duration.ofMillis(expirationMillis);
        this.clock = clock;
    }

    public IssuedToken issue(String subject) {
        return issue(subject, clock.instant());
    }

    /**
     * Generate a signed token for an authenticated user.
     *
     * Creates a JWT with:
     * - Subject (sub): the username
     * - Issued At (iat): now
     * - Expiration (exp): now + configured lifetime
     *
     * JWT dates have second precision, so the expiry is truncated to seconds.
     *
     * @param subject Username of the authenticated user
     * @param now Issue time
     * @return Compact token (header.payload.signature) and its expiry
     */
    public IssuedToken issue(String subject, Instant now) {
        Instant expiresAt = now.plus(expiration).truncatedTo(ChronoUnit.SECONDS);
        String token = Jwts.builder()
                .setSubject(subject)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(expiresAt))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
        return new IssuedToken(token, expiresAt);
    }

    public Optional<TokenClaims> validate(String token) {
        return validate(token, clock.instant());
    }

    /**
     * Verify a token's signature and expiry.
     *
     * Malformed, mis-signed, unsigned and expired tokens all come back as
     * empty. The reason is only logged, at debug level.
     *
     * @param token Compact JWT (without the "Bearer " prefix), may be null
     * @param now Validation time; the token is valid only while now &lt; exp
     * @return The token's claims, or empty if the token is not acceptable
     */
    public Optional<TokenClaims> validate(String token, Instant now) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        Claims claims;
        try {
            if (!hasCanonicalSignature(token)) {
                log.debug("Rejected bearer token with non-canonical signature encoding");
                return Optional.empty();
            }
            claims = Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .setClock(() -> Date.from(now))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            return Optional.empty();
        }

        String subject = claims.getSubject();
        Date expiresAt = claims.getExpiration();
        if (subject == null || subject.isBlank() || expiresAt == null) {
            log.debug("Rejected bearer token without subject or expiry");
            return Optional.empty();
        }
        if (!now.isBefore(expiresAt.toInstant())) {
            log.debug("Rejected bearer token expired at {}", expiresAt.toInstant());
            return Optional.empty();
        }
        Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null;
        return Optional.of(new TokenClaims(subject, issuedAt, expiresAt.toInstant()));
    }

    /**
     * The decoder ignores the unused low bits of the last base64url character,
     * so several encodings map to the same signature bytes. Only the one the
     * encoder produces is accepted.
     */
    static boolean hasCanonicalSignature(String token) {
        int lastDot = token.lastIndexOf('.');
        if (lastDot < 0 || lastDot == token.length() - 1) {
            return false;
        }
        String signature = token.substring(lastDot + 1);
        return Encoders.BASE64URL.encode(Decoders.BASE64URL.decode(signature)).equals(signature);
    }
}
