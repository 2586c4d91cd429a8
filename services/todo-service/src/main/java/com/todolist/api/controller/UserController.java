package com.todolist.api.controller;

import com.todolist.api.dto.UserResponse;
import com.todolist.api.entity.User;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Profile of the authenticated user.
 */
@RestController
@RequestMapping("/users")
public class UserController {

    /**
     * The principal is the user the bearer token resolved to.
     */
    @GetMapping("/me")
    public ResponseEntity<UserResponse> me(@AuthenticationPrincipal User currentUser) {
        return ResponseEntity.ok(UserResponse.from(currentUser));
    }
}
