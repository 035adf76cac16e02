package com.todos.api.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.todos.api.exception.DatabaseUnavailableException;
import com.todos.api.startup.MongoConnectionInitializer;
import com.todos.api.store.MongoTodoStore;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MongoConfigTest {

    @Mock
    private MongoConnectionInitializer connectionInitializer;

    @Mock
    private MongoDatabase database;

    @Mock
    private MongoCollection<Document> collection;

    private final MongoConfig mongoConfig = new MongoConfig();

    @Test
    void failedHandshakeLeavesNoStore() {
        DatabaseUnavailableException failure =
                new DatabaseUnavailableException("Could not connect to database after 10 attempts");
        when(connectionInitializer.awaitConnection()).thenThrow(failure);

        assertThatThrownBy(() -> mongoConfig.todoStore(connectionInitializer, new TodoConfiguration()))
                .isSameAs(failure);
        verify(database, never()).getCollection(anyString());
    }

    @Test
    void storeIsBoundToConfiguredCollection() {
        when(connectionInitializer.awaitConnection()).thenReturn(database);
        when(database.getName()).thenReturn("todo_db");
        when(database.getCollection("todos")).thenReturn(collection);

        assertThat(mongoConfig.todoStore(connectionInitializer, new TodoConfiguration()))
                .isInstanceOf(MongoTodoStore.class);
        verify(database).getCollection("todos");
    }

    @Test
    void collectionNameComesFromConfiguration() {
        TodoConfiguration configuration = new TodoConfiguration();
        configuration.setCollection("chores");
        when(connectionInitializer.awaitConnection()).thenReturn(database);
        when(database.getName()).thenReturn("todo_db");
        when(database.getCollection("chores")).thenReturn(collection);

        mongoConfig.todoStore(connectionInitializer, configuration);

        verify(database).getCollection("chores");
    }
}
