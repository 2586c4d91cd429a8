package com.todolist.api.security;

import com.todolist.api.entity.User;
import com.todolist.api.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * IdentityResolver - Turns a bearer token into the user it was issued to.
 *
 * Steps:
 * 1. Validate the token (signature and expiry) with {@link JwtUtil}
 * 2. Look the subject up as a username in the credential store
 *
 * A valid token whose user no longer exists does not authenticate.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IdentityResolver {

    private final JwtUtil jwtUtil;

    private final UserRepository userRepository;

    /**
     * @param token Compact JWT without the "Bearer " prefix
     * @return The token's user, or empty when the request is unauthenticated
     */
    public Optional<User> resolve(String token) {
        return jwtUtil.validate(token).flatMap(claims -> {
            Optional<User> user = userRepository.findByUsername(claims.getSubject());
            if (user.isEmpty()) {
                log.debug("Token subject no longer exists: {}", claims.getSubject());
            }
            return user;
        });
    }
}
