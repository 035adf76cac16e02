package com.todos.api.store;

import com.todos.api.model.Todo;
import com.todos.api.model.TodoOutcome;
import com.todos.api.model.TodoPatch;
import java.util.List;
import org.bson.types.ObjectId;

/**
 * Single-document operations on the todo collection. Implementations report
 * driver failures as {@link TodoOutcome.Kind#STORE_UNAVAILABLE} instead of throwing.
 */
public interface TodoStore {

    /**
     * Inserts a new, not yet completed item.
     */
    TodoOutcome<Todo> insert(String task);

    /**
     * Every item in the store's natural order.
     */
    TodoOutcome<List<Todo>> findAll();

    TodoOutcome<Todo> findById(ObjectId id);

    /**
     * Applies only the non-null fields of the patch. Reports
     * {@link TodoOutcome.Kind#NOT_FOUND} when nothing matched and
     * {@link TodoOutcome.Kind#NO_CHANGE} when the item already held those values.
     *
     * @throws IllegalArgumentException if the patch sets no field
     */
    TodoOutcome<Void> update(ObjectId id, TodoPatch patch);

    TodoOutcome<Void> delete(ObjectId id);
}
