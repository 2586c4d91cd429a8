package com.todolist.api.controller;

import com.todolist.api.dto.TaskCreateRequest;
import com.todolist.api.dto.TaskResponse;
import com.todolist.api.dto.TaskUpdateRequest;
import com.todolist.api.entity.User;
import com.todolist.api.service.TaskService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * TaskController - CRUD endpoints for the caller's own tasks.
 *
 * Endpoints (all require a bearer token):
 * - POST   /tasks/      - Create a task
 * - GET    /tasks/      - List my tasks
 * - GET    /tasks/{id}  - Get one of my tasks
 * - PUT    /tasks/{id}  - Partially update one of my tasks
 * - DELETE /tasks/{id}  - Delete one of my tasks
 *
 * A task that belongs to another user answers 404 exactly like a missing one.
 *
 * @see TaskService for the ownership rules
 */
@RestController
@RequestMapping("/tasks")
@RequiredArgsConstructor
public class TaskController {

    private final TaskService taskService;

    @PostMapping({"", "/"})
    public ResponseEntity<TaskResponse> create(@AuthenticationPrincipal User currentUser,
                                               @Valid @RequestBody TaskCreateRequest request) {
        return ResponseEntity.ok(taskService.create(currentUser, request));
    }

    @GetMapping({"", "/"})
    public ResponseEntity<List<TaskResponse>> list(@AuthenticationPrincipal User currentUser) {
        return ResponseEntity.ok(taskService.list(currentUser));
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<TaskResponse> get(@AuthenticationPrincipal User currentUser,
                                            @PathVariable("taskId") Long taskId) {
        return ResponseEntity.ok(taskService.get(currentUser, taskId));
    }

    /**
     * Only the properties present in the body change; see {@link TaskUpdateRequest}.
     */
    @PutMapping("/{taskId}")
    public ResponseEntity<TaskResponse> update(@AuthenticationPrincipal User currentUser,
                                               @PathVariable("taskId") Long taskId,
                                               @Valid @RequestBody TaskUpdateRequest request) {
        return ResponseEntity.ok(taskService.update(currentUser, taskId, request));
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<Void> delete(@AuthenticationPrincipal User currentUser,
                                       @PathVariable("taskId") Long taskId) {
        taskService.delete(currentUser, taskId);
        return ResponseEntity.noContent().build();
    }
}
