package com.todolist.api.service;

import com.todolist.api.dto.TaskCreateRequest;
import com.todolist.api.dto.TaskResponse;
import com.todolist.api.dto.TaskUpdateRequest;
import com.todolist.api.entity.Task;
import com.todolist.api.entity.User;
import com.todolist.api.exception.NotFoundException;
import com.todolist.api.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static com.todolist.api.dto.TaskUpdateRequest.Field.COMPLETED;
import static com.todolist.api.dto.TaskUpdateRequest.Field.DESCRIPTION;
import static com.todolist.api.dto.TaskUpdateRequest.Field.DUE_DATE;
import static com.todolist.api.dto.TaskUpdateRequest.Field.TITLE;

/**
 * TaskService - Task CRUD scoped to the authenticated owner.
 *
 * Every read and write goes through the owner id of the resolved user. A
 * task owned by someone else is looked up with the same query as a missing
 * one and produces the same NotFoundException, so callers cannot discover
 * other users' task ids.
 *
 * Each public method is one transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskService {

    static final String TASK_NOT_FOUND = "Task not found.";

    private final TaskRepository taskRepository;

    private final Clock clock;

    @Transactional
    public TaskResponse create(User owner, TaskCreateRequest request) {
        Instant now = clock.instant();
        Task task = Task.builder()
                .title(request.getTitle())
                .description(request.getDescription())
                .dueDate(request.getDueDate())
                .completed(false)
                .ownerId(owner.getId())
                .createdAt(now)
                .updatedAt(now)
                .build();
        Task saved = taskRepository.save(task);
        log.info("User {} created task {}", owner.getId(), saved.getId());
        return TaskResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public List<TaskResponse> list(User owner) {
        return taskRepository.findAllByOwnerIdOrderByIdAsc(owner.getId()).stream()
                .map(TaskResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public TaskResponse get(User owner, Long taskId) {
        return TaskResponse.from(findOwned(owner, taskId));
    }

    /**
     * Apply the fields present in the request and bump updated_at.
     *
     * @throws NotFoundException if the task does not exist or is not the owner's
     */
    @Transactional
    public TaskResponse update(User owner, Long taskId, TaskUpdateRequest request) {
        Task task = findOwned(owner, taskId);

        if (request.has(TITLE)) {
            task.setTitle(request.getTitle());
        }
        if (request.has(DESCRIPTION)) {
            task.setDescription(request.getDescription());
        }
        if (request.has(COMPLETED)) {
            task.setCompleted(request.getCompleted());
        }
        if (request.has(DUE_DATE)) {
            task.setDueDate(request.getDueDate());
        }
        task.setUpdatedAt(clock.instant());

        Task saved = taskRepository.save(task);
        log.info("User {} updated task {}", owner.getId(), taskId);
        return TaskResponse.from(saved);
    }

    @Transactional
    public void delete(User owner, Long taskId) {
        Task task = findOwned(owner, taskId);
        taskRepository.delete(task);
        log.info("User {} deleted task {}", owner.getId(), taskId);
    }

    private Task findOwned(User owner, Long taskId) {
        return taskRepository.findByIdAndOwnerId(taskId, owner.getId())
                .orElseThrow(() -> new NotFoundException(TASK_NOT_FOUND));
    }
}
