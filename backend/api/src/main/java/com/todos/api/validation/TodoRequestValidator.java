package com.todos.api.validation;

import com.todos.api.model.TodoOutcome;
import com.todos.api.model.TodoPatch;
import java.util.Map;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Component;

/**
 * Checks raw JSON request bodies and path identifiers before anything reaches
 * the store. Failures come back as {@link TodoOutcome.Kind#VALIDATION_FAILED}.
 */
@Component
public class TodoRequestValidator {

    static final String TASK = "task";
    static final String COMPLETED = "completed";

    /**
     * @param body the parsed JSON request body; anything other than an object counts as absent
     */
    public TodoOutcome<String> validateCreate(Object body) {
        if (!(body instanceof Map<?, ?> fields) || fields.get(TASK) == null) {
            return TodoOutcome.validationFailed("Missing \"task\" field");
        }
        return validateTask(fields.get(TASK));
    }

    public TodoOutcome<TodoPatch> validateUpdate(Object requestBody) {
        if (!(requestBody instanceof Map<?, ?> body) || body.isEmpty()) {
            return TodoOutcome.validationFailed("No data provided for update");
        }
        if (!body.containsKey(TASK) && !body.containsKey(COMPLETED)) {
            return TodoOutcome.validationFailed("No valid fields to update");
        }

        TodoPatch patch = new TodoPatch();
        if (body.containsKey(TASK)) {
            TodoOutcome<String> task = validateTask(body.get(TASK));
            if (!task.isSuccess()) {
                return task.map(t -> null);
            }
            patch.setTask(task.getValue());
        }
        if (body.containsKey(COMPLETED)) {
            if (!(body.get(COMPLETED) instanceof Boolean completed)) {
                return TodoOutcome.validationFailed("\"completed\" must be a boolean");
            }
            patch.setCompleted(completed);
        }
        return TodoOutcome.success(patch);
    }

    /**
     * Parses a path identifier. Only 24-digit hex ObjectIds are accepted.
     */
    public TodoOutcome<ObjectId> validateId(String todoId) {
        if (todoId == null || !ObjectId.isValid(todoId)) {
            return TodoOutcome.validationFailed("Invalid to-do id: " + todoId);
        }
        return TodoOutcome.success(new ObjectId(todoId));
    }

    private TodoOutcome<String> validateTask(Object task) {
        if (!(task instanceof String text) || text.isBlank()) {
            return TodoOutcome.validationFailed("\"task\" must be a non-empty string");
        }
        return TodoOutcome.success(text);
    }
}
