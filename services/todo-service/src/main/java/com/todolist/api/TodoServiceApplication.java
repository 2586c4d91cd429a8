package com.todolist.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

/**
 * TodoServiceApplication - Main entry point for the To-Do List API.
 *
 * This service is responsible for:
 * - User registration with bcrypt-hashed passwords
 * - Username/password login issuing 24-hour JWT bearer tokens
 * - Per-request identity resolution from the Authorization header
 * - Create/read/update/delete of tasks, strictly scoped to their owner
 *
 * Architecture Context:
 * - Runs on port 8080 by default (PORT environment variable)
 * - Connects to PostgreSQL for users and tasks; schema owned by Flyway
 * - Stateless design: no server-side sessions, identity travels in the JWT
 *
 * @see com.todolist.api.controller.AuthController for authentication endpoints
 * @see com.todolist.api.controller.TaskController for task endpoints
 * @see com.todolist.api.security.JwtUtil for JWT token operations
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class TodoServiceApplication {

    /**
     * Application entry point.
     *
     * @param args Command-line arguments (supports standard Spring Boot args)
     */
    public static void main(String[] args) {
        SpringApplication.run(TodoServiceApplication.class, args);
    }
}
