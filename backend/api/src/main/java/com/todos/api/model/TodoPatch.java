package com.todos.api.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of a to-do item. A {@code null} field means "leave unchanged".
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TodoPatch {
    private String task;
    private Boolean completed;

    public boolean isEmpty() {
        return task == null && completed == null;
    }
}
