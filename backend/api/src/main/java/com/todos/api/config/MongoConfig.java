package com.todos.api.config;

import com.mongodb.client.MongoDatabase;
import com.todos.api.startup.MongoConnectionInitializer;
import com.todos.api.store.MongoTodoStore;
import com.todos.api.store.TodoStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * MongoDB configuration. The client and {@code MongoTemplate} come from Spring Boot
 * auto-configuration, driven by application.properties:
 * - spring.data.mongodb.uri
 * - spring.data.mongodb.database
 *
 * The todo store is only created once the startup ping has succeeded.
 */
@Configuration
@Slf4j
public class MongoConfig {

    @Bean
    public TodoStore todoStore(
        MongoConnectionInitializer connectionInitializer,
        TodoConfiguration todoConfiguration
    ) {
        MongoDatabase database = connectionInitializer.awaitConnection();
        log.info(
            "Using collection '{}' in database '{}'",
            todoConfiguration.getCollection(),
            database.getName()
        );
        return new MongoTodoStore(
            database.getCollection(todoConfiguration.getCollection())
        );
    }
}
