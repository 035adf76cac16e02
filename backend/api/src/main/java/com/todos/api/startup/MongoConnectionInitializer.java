package com.todos.api.startup;

import com.mongodb.client.MongoDatabase;
import com.todos.api.config.TodoConfiguration;
import com.todos.api.exception.DatabaseUnavailableException;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

/**
 * Verifies that MongoDB answers a {@code ping} before the service accepts traffic.
 * Retries a fixed number of times with a fixed pause, then gives up for good.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MongoConnectionInitializer {

    private static final Document PING = new Document("ping", 1);

    private final MongoTemplate mongoTemplate;
    private final TodoConfiguration todoConfiguration;

    /**
     * Blocks until the database answers a ping.
     *
     * @return the database handle that answered
     * @throws DatabaseUnavailableException when every attempt failed or the wait was interrupted
     */
    public MongoDatabase awaitConnection() {
        int maxAttempts = todoConfiguration.getStartup().getMaxAttempts();
        Duration retryInterval = todoConfiguration.getStartup().getRetryInterval();
        RuntimeException lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                MongoDatabase database = mongoTemplate.getDb();
                database.runCommand(PING);
                log.info("✅ Connected to MongoDB database '{}' (attempt {}/{})",
                        database.getName(), attempt, maxAttempts);
                return database;
            } catch (RuntimeException e) {
                lastFailure = e;
                log.warn("⚠️ DB not ready yet (attempt {}/{}): {}", attempt, maxAttempts, e.getMessage());
            }

            if (attempt < maxAttempts) {
                pause(retryInterval);
            }
        }

        log.error("❌ Could not connect to database after {} attempts", maxAttempts);
        throw new DatabaseUnavailableException(
                "Could not connect to database after " + maxAttempts + " attempts",
                lastFailure
        );
    }

    private void pause(Duration retryInterval) {
        if (retryInterval.isZero() || retryInterval.isNegative()) {
            return;
        }
        try {
            Thread.sleep(retryInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DatabaseUnavailableException("Interrupted while waiting for the database", e);
        }
    }
}
