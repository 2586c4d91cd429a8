package com.todolist.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Size;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * TaskUpdateRequest - Partial update payload of PUT /tasks/{id}.
 *
 * Only the properties present in the JSON body are applied. Jackson calls a
 * setter only for properties it finds, so each setter records the field as
 * present; an explicit null is "present with value null", which differs from
 * leaving the property out.
 *
 * <pre>
 * { "completed": true }                    -> only completed changes
 * { "description": null, "due_date": null } -> both are cleared
 * </pre>
 *
 * title and completed cannot be cleared.
 */
@Getter
@ToString
public class TaskUpdateRequest {

    public enum Field { TITLE, DESCRIPTION, COMPLETED, DUE_DATE }

    @Size(min = 1, max = 200)
    private String title;

    @Size(max = 1000)
    private String description;

    private Boolean completed;

    @JsonDeserialize(using = UtcInstantDeserializer.class)
    private Instant dueDate;

    @Getter(AccessLevel.NONE)
    private final Set<Field> present = EnumSet.noneOf(Field.class);

    public void setTitle(String title) {
        this.title = title;
        present.add(Field.TITLE);
    }

    public void setDescription(String description) {
        this.description = description;
        present.add(Field.DESCRIPTION);
    }

    public void setCompleted(Boolean completed) {
        this.completed = completed;
        present.add(Field.COMPLETED);
    }

    public void setDueDate(Instant dueDate) {
        this.dueDate = dueDate;
        present.add(Field.DUE_DATE);
    }

    public boolean has(Field field) {
        return present.contains(field);
    }

    @JsonIgnore
    @AssertTrue(message = "title must not be null")
    public boolean isTitleNotNull() {
        return !has(Field.TITLE) || title != null;
    }

    @JsonIgnore
    @AssertTrue(message = "completed must not be null")
    public boolean isCompletedNotNull() {
        return !has(Field.COMPLETED) || completed != null;
    }
}
