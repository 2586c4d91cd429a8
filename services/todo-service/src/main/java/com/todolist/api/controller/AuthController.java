package com.todolist.api.controller;

import com.todolist.api.dto.LoginRequest;
import com.todolist.api.dto.RegisterRequest;
import com.todolist.api.dto.TokenResponse;
import com.todolist.api.dto.UserResponse;
import com.todolist.api.service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * AuthController - REST API endpoints for registration and login.
 *
 * Endpoints:
 * - POST /auth/register - Create an account
 * - POST /auth/login    - Exchange username and password for a bearer token
 *
 * Both endpoints are public.
 *
 * Error Handling:
 * - 400 Bad Request: Invalid input, or username/email already in use
 * - 401 Unauthorized: Wrong username or password (not distinguished)
 *
 * @see AuthService for business logic
 */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    /**
     * Register a new user.
     *
     * @param request Username (3-32 chars), email and password (6-128 chars)
     * @return The created user without any password material
     */
    @PostMapping("/register")
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.ok(authService.register(request));
    }

    /**
     * Authenticate and obtain an access token.
     *
     * Flow:
     * 1. Client posts username and password
     * 2. Backend verifies the bcrypt hash and signs a JWT (subject = username)
     * 3. Client stores the token and sends it as a Bearer header afterwards
     *
     * @param request Username and password
     * @return {access_token, token_type: "bearer"}
     */
    @PostMapping("/login")
    public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }
}
