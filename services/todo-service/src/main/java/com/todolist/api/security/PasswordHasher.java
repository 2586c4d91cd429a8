package com.todolist.api.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * PasswordHasher - One-way salted hashing of user passwords.
 *
 * Backed by bcrypt: every call to {@link #hash(String)} draws a fresh salt,
 * so equal passwords produce different hashes, and the configurable work
 * factor keeps brute force expensive.
 *
 * Configuration (from application.yml):
 * - security.bcrypt.strength: log2 of the bcrypt rounds (default 10)
 */
@Component
@Slf4j
public class PasswordHasher {

    private final BCryptPasswordEncoder encoder;

    public PasswordHasher(@Value("${security.bcrypt.strength:10}") int strength) {
        this.encoder = new BCryptPasswordEncoder(strength);
    }

    /**
     * Hash a plaintext password for storage.
     *
     * @param plaintext The raw password
     * @return bcrypt hash including algorithm version, cost and salt
     */
    public String hash(String plaintext) {
        return encoder.encode(plaintext);
    }

    /**
     * Check a plaintext password against a stored hash.
     *
     * A missing or malformed stored hash is a mismatch, not an error.
     *
     * @param plaintext The raw password presented by the client
     * @param storedHash The hash read from the credential store
     * @return true only if the password matches
     */
    public boolean verify(String plaintext, String storedHash) {
        if (plaintext == null || storedHash == null || storedHash.isEmpty()) {
            return false;
        }
        try {
            return encoder.matches(plaintext, storedHash);
        } catch (IllegalArgumentException e) {
            log.warn("Stored password hash could not be parsed: {}", e.getMessage());
            return false;
        }
    }
}
