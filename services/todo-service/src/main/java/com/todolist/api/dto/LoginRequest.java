package com.todolist.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * LoginRequest - Payload of POST /auth/login.
 *
 * <pre>
 * POST /auth/login
 * Content-Type: application/json
 *
 * {
 *   "username": "alice",
 *   "password": "secret1"
 * }
 * </pre>
 *
 * Security Note:
 * Password should be transmitted over HTTPS only.
 * Never log or persist the password field.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotBlank
    private String username;

    @NotNull
    @Size(min = 6, max = 128)
    private String password;
}
