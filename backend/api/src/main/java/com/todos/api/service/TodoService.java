package com.todos.api.service;

import com.todos.api.config.TodoConfiguration;
import com.todos.api.model.Todo;
import com.todos.api.model.TodoOutcome;
import com.todos.api.store.TodoStore;
import com.todos.api.validation.TodoRequestValidator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class TodoService {

    static final String UNCHANGED_OR_MISSING_MESSAGE = "To-do item not found or no changes made";

    private final TodoStore todoStore;
    private final TodoRequestValidator validator;
    private final TodoConfiguration todoConfiguration;

    public TodoOutcome<Todo> create(Object body) {
        TodoOutcome<Todo> outcome = validator.validateCreate(body).flatMap(todoStore::insert);
        if (outcome.isSuccess()) {
            log.info("Created to-do {}", outcome.getValue().getId());
        }
        return outcome;
    }

    public TodoOutcome<List<Todo>> list() {
        return todoStore.findAll();
    }

    public TodoOutcome<Todo> get(String todoId) {
        log.debug("Fetching to-do {}", todoId);
        return validator.validateId(todoId).flatMap(todoStore::findById);
    }

    public TodoOutcome<String> update(String todoId, Object body) {
        TodoOutcome<Void> outcome = validator.validateUpdate(body)
                .flatMap(patch -> validator.validateId(todoId)
                        .flatMap(id -> todoStore.update(id, patch)));

        switch (outcome.getKind()) {
            case SUCCESS:
                log.info("Updated to-do {}", todoId);
                return TodoOutcome.success("To-do item updated successfully");
            case NOT_FOUND:
            case NO_CHANGE:
                return unchangedOrMissing(outcome);
            default:
                return outcome.map(v -> null);
        }
    }

    public TodoOutcome<String> delete(String todoId) {
        TodoOutcome<Void> outcome = validator.validateId(todoId).flatMap(todoStore::delete);
        if (outcome.isSuccess()) {
            log.info("Deleted to-do {}", todoId);
        }
        return outcome.map(v -> "To-do item deleted successfully");
    }

    // The store tells "no match" and "nothing modified" apart; by default both
    // are reported as the same 404.
    private TodoOutcome<String> unchangedOrMissing(TodoOutcome<Void> outcome) {
        if (todoConfiguration.getUpdate().isReportUnchangedAsNotFound()) {
            return TodoOutcome.notFound(UNCHANGED_OR_MISSING_MESSAGE);
        }
        return outcome.map(v -> null);
    }
}
