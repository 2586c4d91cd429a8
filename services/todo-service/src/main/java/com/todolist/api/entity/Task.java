package com.todolist.api.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Task - JPA Entity for a unit of work owned by exactly one user.
 *
 * The owner is kept as a plain foreign key column rather than a mapped
 * association: ownership checks only ever compare ids, and the
 * User-to-Task cascade lives in the schema (ON DELETE CASCADE), not in
 * the object graph.
 *
 * Invariants:
 * - ownerId is set at creation and never changes (updatable = false)
 * - createdAt is immutable, updatedAt is refreshed on every mutation
 *
 * @see com.todolist.api.repository.TaskRepository
 * @see com.todolist.api.service.TaskService
 */
@Entity
@Table(name = "tasks")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
public class Task {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "description", length = 1000)
    private String description;

    @Builder.Default
    @Column(name = "completed", nullable = false)
    private boolean completed = false;

    @Column(name = "due_date")
    private Instant dueDate;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private Long ownerId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
