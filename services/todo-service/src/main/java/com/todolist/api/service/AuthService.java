package com.todolist.api.service;

import com.todolist.api.dto.LoginRequest;
import com.todolist.api.dto.RegisterRequest;
import com.todolist.api.dto.TokenResponse;
import com.todolist.api.dto.UserResponse;
import com.todolist.api.entity.User;
import com.todolist.api.exception.ConflictException;
import com.todolist.api.exception.UnauthorizedException;
import com.todolist.api.repository.UserRepository;
import com.todolist.api.security.IssuedToken;
import com.todolist.api.security.JwtUtil;
import com.todolist.api.security.PasswordHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

/**
 * AuthService - Registration and password login.
 *
 * Key Responsibilities:
 * - Creating users with unique username and email and a bcrypt password hash
 * - Verifying credentials and issuing JWT bearer tokens
 *
 * Transaction Management:
 * - register: no surrounding transaction. The existence check and the insert
 *   each run in their own repository transaction, so a unique-constraint
 *   violation from a concurrent registration surfaces here as a
 *   DataIntegrityViolationException and is reported as a conflict
 * - login: read-only
 *
 * Security Considerations:
 * - Unknown username and wrong password produce the same 401
 * - Passwords and tokens are never logged
 *
 * @see JwtUtil for token generation
 * @see PasswordHasher for password hashing
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    static final String DUPLICATE_USER = "Username or email already in use.";

    static final String BAD_CREDENTIALS = "Incorrect username or password.";

    private final UserRepository userRepository;

    private final PasswordHasher passwordHasher;

    private final JwtUtil jwtUtil;

    private final Clock clock;

    /**
     * Register a new user.
     *
     * @param request Validated registration payload
     * @return Public projection of the created user
     * @throws ConflictException if the username or email is already taken
     */
    public UserResponse register(RegisterRequest request) {
        log.info("Registration attempt for username: {}", request.getUsername());

        if (userRepository.existsByUsernameOrEmail(request.getUsername(), request.getEmail())) {
            log.info("Registration rejected, username or email taken: {}", request.getUsername());
            throw new ConflictException(DUPLICATE_USER);
        }

        User user = User.builder()
                .username(request.getUsername())
                .email(request.getEmail())
                .hashedPassword(passwordHasher.hash(request.getPassword()))
                .createdAt(clock.instant())
                .build();

        User saved;
        try {
            saved = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            // Lost the race against a concurrent registration
            log.info("Registration rejected by unique constraint: {}", request.getUsername());
            throw new ConflictException(DUPLICATE_USER);
        }

        log.info("Created user {} with id {}", saved.getUsername(), saved.getId());
        return UserResponse.from(saved);
    }

    /**
     * Authenticate with username and password.
     *
     * @param request Login payload
     * @return Bearer token whose subject is the username
     * @throws UnauthorizedException if the user is unknown or the password is wrong
     */
    @Transactional(readOnly = true)
    public TokenResponse login(LoginRequest request) {
        Optional<User> user = userRepository.findByUsername(request.getUsername());
        if (user.isEmpty() || !passwordHasher.verify(request.getPassword(), user.get().getHashedPassword())) {
            log.info("Login failed for username: {}", request.getUsername());
            throw new UnauthorizedException(BAD_CREDENTIALS);
        }

        IssuedToken token = jwtUtil.issue(user.get().getUsername());
        log.info("User authenticated successfully: {}", user.get().getUsername());
        return TokenResponse.bearer(token.getToken());
    }
}
