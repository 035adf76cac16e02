package com.todos.api.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration class for the todo API settings
 */
@Configuration
@ConfigurationProperties(prefix = "todo")
@Validated
@Data
public class TodoConfiguration {

    /**
     * Name of the MongoDB collection holding the todo documents
     */
    @NotBlank
    private String collection = "todos";

    @Valid
    private StartupConfig startup = new StartupConfig();

    @Valid
    private UpdateConfig update = new UpdateConfig();

    @Valid
    private CorsConfig cors = new CorsConfig();

    @Data
    public static class StartupConfig {
        /**
         * Total number of ping attempts before startup is aborted
         */
        @Min(1)
        private int maxAttempts = 10;

        /**
         * Fixed wait between two failed ping attempts
         */
        @NotNull
        private Duration retryInterval = Duration.ofSeconds(5);
    }

    @Data
    public static class UpdateConfig {
        /**
         * When true, an update that matched a document but changed nothing
         * is answered with 404, the same as a missing document.
         */
        private boolean reportUnchangedAsNotFound = true;
    }

    @Data
    public static class CorsConfig {
        @NotEmpty
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}
