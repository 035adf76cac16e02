package com.todos.api.model;

import java.util.function.Function;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Result of a todo operation: either a value or a classified failure with a
 * message suitable for the client.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class TodoOutcome<T> {

    public enum Kind {
        SUCCESS,
        VALIDATION_FAILED,
        NOT_FOUND,
        NO_CHANGE,
        STORE_UNAVAILABLE
    }

    private final Kind kind;
    private final T value;
    private final String message;

    public static <T> TodoOutcome<T> success(T value) {
        return new TodoOutcome<>(Kind.SUCCESS, value, null);
    }

    public static <T> TodoOutcome<T> validationFailed(String message) {
        return new TodoOutcome<>(Kind.VALIDATION_FAILED, null, message);
    }

    public static <T> TodoOutcome<T> notFound(String message) {
        return new TodoOutcome<>(Kind.NOT_FOUND, null, message);
    }

    public static <T> TodoOutcome<T> noChange(String message) {
        return new TodoOutcome<>(Kind.NO_CHANGE, null, message);
    }

    public static <T> TodoOutcome<T> storeUnavailable(String message) {
        return new TodoOutcome<>(Kind.STORE_UNAVAILABLE, null, message);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    /**
     * Chains another operation on success; failures pass through unchanged.
     */
    public <U> TodoOutcome<U> flatMap(Function<? super T, TodoOutcome<U>> next) {
        if (isSuccess()) {
            return next.apply(value);
        }
        return new TodoOutcome<>(kind, null, message);
    }

    public <U> TodoOutcome<U> map(Function<? super T, ? extends U> mapper) {
        return flatMap(v -> success(mapper.apply(v)));
    }

    @Override
    public String toString() {
        return isSuccess()
            ? "TodoOutcome[SUCCESS, " + value + "]"
            : "TodoOutcome[" + kind + ", " + message + "]";
    }
}
