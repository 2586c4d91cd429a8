package com.todolist.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * RegisterRequest - Payload of POST /auth/register.
 *
 * Validation:
 * - username: 3-32 characters
 * - email: valid email syntax, at most 255 characters
 * - password: 6-128 characters
 *
 * <pre>
 * {
 *   "username": "alice",
 *   "email": "a@x.com",
 *   "password": "secret1"
 * }
 * </pre>
 *
 * Never log or persist the password field.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisterRequest {

    @NotBlank
    @Size(min = 3, max = 32)
    private String username;

    @NotBlank
    @Email
    @Size(max = 255)
    private String email;

    @NotNull
    @Size(min = 6, max = 128)
    private String password;
}
