package com.todolist.api.dto;

import com.todolist.api.entity.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * UserResponse - Public projection of a user.
 *
 * Returned by registration and GET /users/me. The password hash has no
 * field here and therefore can never be serialized.
 *
 * Example Response:
 * <pre>
 * {
 *   "id": 1,
 *   "username": "alice",
 *   "email": "a@x.com",
 *   "created_at": "2024-01-15T10:30:00Z"
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {

    private Long id;

    private String username;

    private String email;

    private Instant createdAt;

    public static UserResponse from(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .username(user.getUsername())
                .email(user.getEmail())
                .createdAt(user.getCreatedAt())
                .build();
    }
}
