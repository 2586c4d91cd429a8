package com.todolist.api.repository;

import com.todolist.api.entity.Task;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * TaskRepository - Data Access Layer for Task entities.
 *
 * Every lookup used by the API is scoped by owner id: a task belonging to
 * somebody else is simply not found.
 */
@Repository
public interface TaskRepository extends JpaRepository<Task, Long> {

    List<Task> findAllByOwnerIdOrderByIdAsc(Long ownerId);

    /**
     * Query: SELECT * FROM tasks WHERE id = :id AND owner_id = :ownerId
     */
    Optional<Task> findByIdAndOwnerId(Long id, Long ownerId);
}
