package com.todos.api.store;

import static com.mongodb.client.model.Filters.eq;

import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import com.todos.api.model.Todo;
import com.todos.api.model.TodoOutcome;
import com.todos.api.model.TodoPatch;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.types.ObjectId;

/**
 * {@link TodoStore} over a raw MongoDB collection. Documents hold only
 * {@code _id}, {@code task} and {@code completed}.
 */
@RequiredArgsConstructor
@Slf4j
public class MongoTodoStore implements TodoStore {

    static final String ID = "_id";
    static final String TASK = "task";
    static final String COMPLETED = "completed";

    static final String NOT_FOUND_MESSAGE = "To-do item not found";

    private final MongoCollection<Document> collection;

    @Override
    public TodoOutcome<Todo> insert(String task) {
        Document doc = new Document(ID, new ObjectId())
                .append(TASK, task)
                .append(COMPLETED, false);
        try {
            collection.insertOne(doc);
        } catch (MongoException e) {
            return failure("insert", e);
        }
        ObjectId id = doc.getObjectId(ID);
        log.info("Inserted into {} with _id={}", collectionName(), id);
        return TodoOutcome.success(new Todo(id.toHexString(), task, false));
    }

    @Override
    public TodoOutcome<List<Todo>> findAll() {
        List<Document> docs;
        try {
            docs = collection.find().into(new ArrayList<>());
        } catch (MongoException e) {
            return failure("find", e);
        }
        log.debug("Fetched {} documents from {}", docs.size(), collectionName());
        return TodoOutcome.success(
                docs.stream().map(MongoTodoStore::toTodo).collect(Collectors.toList())
        );
    }

    @Override
    public TodoOutcome<Todo> findById(ObjectId id) {
        Document doc;
        try {
            doc = collection.find(eq(ID, id)).first();
        } catch (MongoException e) {
            return failure("find", e);
        }
        if (doc == null) {
            return TodoOutcome.notFound(NOT_FOUND_MESSAGE);
        }
        return TodoOutcome.success(toTodo(doc));
    }

    @Override
    public TodoOutcome<Void> update(ObjectId id, TodoPatch patch) {
        if (patch.isEmpty()) {
            throw new IllegalArgumentException("Patch must set at least one field");
        }
        Document fields = new Document();
        if (patch.getTask() != null) fields.append(TASK, patch.getTask());
        if (patch.getCompleted() != null) fields.append(COMPLETED, patch.getCompleted());

        UpdateResult result;
        try {
            result = collection.updateOne(eq(ID, id), new Document("$set", fields));
        } catch (MongoException e) {
            return failure("update", e);
        }
        log.info("Updated {} documents in {} (matched {})",
                result.getModifiedCount(), collectionName(), result.getMatchedCount());

        if (result.getMatchedCount() == 0) {
            return TodoOutcome.notFound(NOT_FOUND_MESSAGE);
        }
        if (result.getModifiedCount() == 0) {
            return TodoOutcome.noChange("No changes made");
        }
        return TodoOutcome.success(null);
    }

    @Override
    public TodoOutcome<Void> delete(ObjectId id) {
        DeleteResult result;
        try {
            result = collection.deleteOne(eq(ID, id));
        } catch (MongoException e) {
            return failure("delete", e);
        }
        log.info("Deleted {} documents from {}", result.getDeletedCount(), collectionName());
        if (result.getDeletedCount() == 0) {
            return TodoOutcome.notFound(NOT_FOUND_MESSAGE);
        }
        return TodoOutcome.success(null);
    }

    private <T> TodoOutcome<T> failure(String operation, MongoException e) {
        log.error("MongoDB {} on {} failed: {}", operation, collectionName(), e.getMessage(), e);
        return TodoOutcome.storeUnavailable(
                e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }

    private String collectionName() {
        return collection.getNamespace().getCollectionName();
    }

    static Todo toTodo(Document doc) {
        Object id = doc.get(ID);
        Object task = doc.get(TASK);
        return new Todo(
                id instanceof ObjectId objectId ? objectId.toHexString() : String.valueOf(id),
                task == null ? null : task.toString(),
                Boolean.TRUE.equals(doc.get(COMPLETED))
        );
    }
}
