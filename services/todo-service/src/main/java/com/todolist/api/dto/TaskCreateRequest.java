package com.todolist.api.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * TaskCreateRequest - Payload of POST /tasks/.
 *
 * <pre>
 * {
 *   "title": "buy milk",
 *   "description": "2 litres",
 *   "due_date": "2024-06-01T18:00:00Z"
 * }
 * </pre>
 *
 * due_date may omit the offset, in which case it is read as UTC.
 * Only the title is required. New tasks always start not completed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskCreateRequest {

    @NotNull
    @Size(min = 1, max = 200)
    private String title;

    @Size(max = 1000)
    private String description;

    @JsonDeserialize(using = UtcInstantDeserializer.class)
    private Instant dueDate;
}
