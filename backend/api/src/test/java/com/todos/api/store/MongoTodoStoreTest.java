package com.todos.api.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mongodb.MongoNamespace;
import com.mongodb.MongoSocketReadException;
import com.mongodb.ServerAddress;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.InsertOneResult;
import com.mongodb.client.result.UpdateResult;
import com.todos.api.model.Todo;
import com.todos.api.model.TodoOutcome;
import com.todos.api.model.TodoPatch;
import java.util.List;
import org.bson.BsonObjectId;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MongoTodoStoreTest {

    @Mock
    private MongoCollection<Document> collection;

    @Mock
    private FindIterable<Document> findIterable;

    private MongoTodoStore store;

    @BeforeEach
    void setUp() {
        lenient().when(collection.getNamespace()).thenReturn(new MongoNamespace("todo_db", "todos"));
        store = new MongoTodoStore(collection);
    }

    @Test
    void insertStoresTaskWithCompletedFalse() {
        when(collection.insertOne(any(Document.class)))
                .thenReturn(InsertOneResult.acknowledged(new BsonObjectId(new ObjectId())));

        TodoOutcome<Todo> outcome = store.insert("buy milk");

        ArgumentCaptor<Document> inserted = ArgumentCaptor.forClass(Document.class);
        verify(collection).insertOne(inserted.capture());
        Document doc = inserted.getValue();
        assertThat(doc.keySet()).containsExactlyInAnyOrder("_id", "task", "completed");
        assertThat(doc.getBoolean("completed")).isFalse();

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getValue().getId()).isEqualTo(doc.getObjectId("_id").toHexString());
        assertThat(outcome.getValue().getTask()).isEqualTo("buy milk");
        assertThat(outcome.getValue().isCompleted()).isFalse();
    }

    @Test
    void driverFailureBecomesStoreUnavailable() {
        when(collection.insertOne(any(Document.class)))
                .thenThrow(new MongoSocketReadException("connection reset", new ServerAddress()));

        TodoOutcome<Todo> outcome = store.insert("buy milk");

        assertThat(outcome.getKind()).isEqualTo(TodoOutcome.Kind.STORE_UNAVAILABLE);
        assertThat(outcome.getMessage()).isEqualTo("connection reset");
    }

    @Test
    void findAllRemapsInternalIdentifier() {
        ObjectId first = new ObjectId();
        ObjectId second = new ObjectId();
        List<Document> docs = List.of(
                new Document("_id", first).append("task", "a").append("completed", true),
                new Document("_id", second).append("task", "b"));
        when(collection.find()).thenReturn(findIterable);
        when(findIterable.into(anyList())).thenAnswer(invocation -> {
            List<Document> target = invocation.getArgument(0);
            target.addAll(docs);
            return target;
        });

        TodoOutcome<List<Todo>> outcome = store.findAll();

        assertThat(outcome.getValue()).containsExactly(
                new Todo(first.toHexString(), "a", true),
                new Todo(second.toHexString(), "b", false));
    }

    @Test
    void findByIdReportsMissingDocument() {
        when(collection.find(any(Bson.class))).thenReturn(findIterable);
        when(findIterable.first()).thenReturn(null);

        TodoOutcome<Todo> outcome = store.findById(new ObjectId());

        assertThat(outcome.getKind()).isEqualTo(TodoOutcome.Kind.NOT_FOUND);
        assertThat(outcome.getMessage()).isEqualTo("To-do item not found");
    }

    @Test
    void findByIdReturnsMatchingDocument() {
        ObjectId id = new ObjectId();
        when(collection.find(any(Bson.class))).thenReturn(findIterable);
        when(findIterable.first()).thenReturn(new Document("_id", id).append("task", "x").append("completed", false));

        TodoOutcome<Todo> outcome = store.findById(id);

        assertThat(outcome.getValue()).isEqualTo(new Todo(id.toHexString(), "x", false));
    }

    @Test
    void updateSetsOnlySuppliedFields() {
        when(collection.updateOne(any(Bson.class), any(Bson.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        TodoOutcome<Void> outcome = store.update(new ObjectId(), new TodoPatch(null, true));

        ArgumentCaptor<Bson> update = ArgumentCaptor.forClass(Bson.class);
        verify(collection).updateOne(any(Bson.class), update.capture());
        assertThat(update.getValue()).isEqualTo(new Document("$set", new Document("completed", true)));
        assertThat(outcome.isSuccess()).isTrue();
    }

    @Test
    void updateDistinguishesMissingFromUnchanged() {
        when(collection.updateOne(any(Bson.class), any(Bson.class)))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null))
                .thenReturn(UpdateResult.acknowledged(1, 0L, null));

        assertThat(store.update(new ObjectId(), new TodoPatch("t", null)).getKind())
                .isEqualTo(TodoOutcome.Kind.NOT_FOUND);
        assertThat(store.update(new ObjectId(), new TodoPatch("t", null)).getKind())
                .isEqualTo(TodoOutcome.Kind.NO_CHANGE);
    }

    @Test
    void emptyPatchNeverReachesTheDriver() {
        assertThatThrownBy(() -> store.update(new ObjectId(), new TodoPatch()))
                .isInstanceOf(IllegalArgumentException.class);

        verify(collection, never()).updateOne(any(Bson.class), any(Bson.class));
    }

    @Test
    void deleteReportsWhetherADocumentWasRemoved() {
        ObjectId id = new ObjectId();
        when(collection.deleteOne(any(Bson.class)))
                .thenReturn(DeleteResult.acknowledged(1))
                .thenReturn(DeleteResult.acknowledged(0));

        assertThat(store.delete(id).isSuccess()).isTrue();
        assertThat(store.delete(id).getKind()).isEqualTo(TodoOutcome.Kind.NOT_FOUND);
        verify(collection, times(2)).deleteOne(any(Bson.class));
    }
}
