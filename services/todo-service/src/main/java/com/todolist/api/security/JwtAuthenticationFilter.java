package com.todolist.api.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.todolist.api.dto.ErrorDetail;
import com.todolist.api.entity.User;
import com.todolist.api.exception.ApiExceptionHandler;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;
import java.util.Optional;

/**
 * Reads "Authorization: Bearer &lt;token&gt;" and, when the token resolves to a
 * user, authenticates the request with that user as principal.
 *
 * Requests without a usable token pass through unauthenticated; the
 * security chain then answers protected paths with 401.
 *
 * The user lookup runs before Spring MVC, out of reach of
 * {@link ApiExceptionHandler}, so a store outage is answered here with the
 * same 503 body the handler writes.
 *
 * Built by {@link com.todolist.api.config.SecurityConfig}, not a bean, so the
 * servlet container does not register it a second time.
 */
@RequiredArgsConstructor
@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final IdentityResolver identityResolver;

    private final ObjectMapper objectMapper;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String token = extractBearerToken(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token != null) {
            Optional<User> user;
            try {
                user = identityResolver.resolve(token);
            } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
                log.error("Database unavailable while resolving bearer token", e);
                response.setStatus(HttpStatus.SERVICE_UNAVAILABLE.value());
                response.setContentType(MediaType.APPLICATION_JSON_VALUE);
                objectMapper.writeValue(response.getOutputStream(),
                        new ErrorDetail(ApiExceptionHandler.STORE_UNAVAILABLE));
                return;
            }
            user.ifPresent(u -> authenticate(request, u));
        }
        filterChain.doFilter(request, response);
    }

    private void authenticate(HttpServletRequest request, User user) {
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(user, null, Collections.emptyList());
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(authentication);
        SecurityContextHolder.setContext(context);
    }

    static String extractBearerToken(String header) {
        if (header == null || header.length() <= BEARER_PREFIX.length()) {
            return null;
        }
        if (!header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
