package com.todolist.api.dto;

import com.todolist.api.entity.Task;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * TaskResponse - Full projection of a task.
 *
 * Example Response:
 * <pre>
 * {
 *   "id": 7,
 *   "title": "buy milk",
 *   "description": null,
 *   "completed": false,
 *   "due_date": null,
 *   "owner_id": 1,
 *   "created_at": "2024-01-15T10:30:00Z",
 *   "updated_at": "2024-01-15T10:30:00Z"
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResponse {

    private Long id;

    private String title;

    private String description;

    private boolean completed;

    private Instant dueDate;

    private Long ownerId;

    private Instant createdAt;

    private Instant updatedAt;

    public static TaskResponse from(Task task) {
        return TaskResponse.builder()
                .id(task.getId())
                .title(task.getTitle())
                .description(task.getDescription())
                .completed(task.isCompleted())
                .dueDate(task.getDueDate())
                .ownerId(task.getOwnerId())
                .createdAt(task.getCreatedAt())
                .updatedAt(task.getUpdatedAt())
                .build();
    }
}
