package com.todolist.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * TokenResponse - Body of a successful login.
 *
 * Example Response:
 * <pre>
 * {
 *   "access_token": "eyJhbGciOiJIUzI1NiJ9...",
 *   "token_type": "bearer"
 * }
 * </pre>
 *
 * The client sends the token back as "Authorization: Bearer &lt;access_token&gt;"
 * until it expires (24 hours by default); there is no refresh.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenResponse {

    public static final String BEARER = "bearer";

    private String accessToken;

    private String tokenType;

    public static TokenResponse bearer(String accessToken) {
        return new TokenResponse(accessToken, BEARER);
    }
}
