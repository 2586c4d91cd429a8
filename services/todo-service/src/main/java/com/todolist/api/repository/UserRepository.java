package com.todolist.api.repository;

import com.todolist.api.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * UserRepository - Data Access Layer for User entities (the credential store).
 *
 * Spring Data JPA generates the implementation from the method names:
 * - findByUsername -> SELECT * FROM users WHERE username = ?
 * - existsByUsernameOrEmail -> SELECT COUNT(*) > 0 FROM users WHERE username = ? OR email = ?
 *
 * Comparisons follow the database collation (case-sensitive on PostgreSQL's default).
 *
 * @see User for entity definition
 * @see com.todolist.api.service.AuthService for business logic using this repository
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /**
     * Find a user by login name. Used by login and by identity resolution
     * of the JWT subject claim.
     *
     * @param username The username to search for
     * @return Optional containing the User if found, empty Optional if not
     */
    Optional<User> findByUsername(String username);

    /**
     * Check whether either the username or the email is already taken.
     * Registration fails with a conflict when this returns true.
     *
     * @param username The requested username
     * @param email The requested email
     * @return true if some user has this username or this email
     */
    boolean existsByUsernameOrEmail(String username, String email);
}
