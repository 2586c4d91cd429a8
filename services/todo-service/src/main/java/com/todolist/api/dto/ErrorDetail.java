package com.todolist.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ErrorDetail - Body of every non-2xx response.
 *
 * Example:
 * <pre>
 * { "detail": "Task not found." }
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorDetail {

    private String detail;
}
