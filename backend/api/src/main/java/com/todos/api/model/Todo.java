package com.todos.api.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single to-do item as exposed over HTTP. The store's internal {@code _id}
 * is carried here as its hex string form.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({ "id", "task", "completed" })
public class Todo {
    private String id;
    private String task;
    private boolean completed;
}
