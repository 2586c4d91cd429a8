package com.todolist.api.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * User - JPA Entity representing an account of the To-Do List API.
 *
 * This entity maps to the 'users' table and is the identity record every
 * task points at through tasks.owner_id.
 *
 * Table Schema (from V1__initial_schema.sql):
 * - id: BIGINT identity primary key
 * - username: Unique login name (3-32 chars), also the JWT subject
 * - email: Unique email address
 * - hashed_password: bcrypt hash, never leaves the service
 * - created_at: Account creation timestamp (immutable)
 *
 * Lifecycle:
 * - Created only via registration (AuthService.register)
 * - Never updated or deleted through the API
 * - Deleting a row removes the owner's tasks through the
 *   fk_tasks_owner ON DELETE CASCADE foreign key
 *
 * @see com.todolist.api.repository.UserRepository for database operations
 * @see com.todolist.api.service.AuthService for user creation logic
 */
@Entity
@Table(name = "users")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "hashedPassword")
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    /**
     * Login name and JWT subject claim.
     * UNIQUE at the database level; the constraint is what closes the
     * check-then-insert race during concurrent registrations.
     */
    @Column(name = "username", unique = true, nullable = false, length = 32)
    private String username;

    @Column(name = "email", unique = true, nullable = false)
    private String email;

    /**
     * bcrypt hash of the password. Never serialized; responses go through
     * UserResponse, which has no such field.
     */
    @Column(name = "hashed_password", nullable = false)
    private String hashedPassword;

    /**
     * Set by AuthService from the service clock before INSERT.
     */
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
