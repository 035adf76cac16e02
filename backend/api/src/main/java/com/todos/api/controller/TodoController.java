package com.todos.api.controller;

import com.todos.api.model.Todo;
import com.todos.api.model.TodoOutcome;
import com.todos.api.service.TodoService;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/todos")
@RequiredArgsConstructor
@Slf4j
public class TodoController {

    private final TodoService todoService;

    @PostMapping
    public ResponseEntity<?> createTodo(@RequestBody(required = false) Object body) {
        TodoOutcome<Todo> outcome = todoService.create(body);
        return toResponse(outcome, HttpStatus.CREATED, outcome.getValue());
    }

    @GetMapping
    public ResponseEntity<?> getAllTodos() {
        TodoOutcome<List<Todo>> outcome = todoService.list();
        return toResponse(outcome, HttpStatus.OK, outcome.getValue());
    }

    @GetMapping("/{todoId}")
    public ResponseEntity<?> getTodo(@PathVariable String todoId) {
        TodoOutcome<Todo> outcome = todoService.get(todoId);
        return toResponse(outcome, HttpStatus.OK, outcome.getValue());
    }

    @PutMapping("/{todoId}")
    public ResponseEntity<?> updateTodo(
            @PathVariable String todoId,
            @RequestBody(required = false) Object body
    ) {
        TodoOutcome<String> outcome = todoService.update(todoId, body);
        return toResponse(outcome, HttpStatus.OK, Map.of("message", String.valueOf(outcome.getValue())));
    }

    @DeleteMapping("/{todoId}")
    public ResponseEntity<?> deleteTodo(@PathVariable String todoId) {
        TodoOutcome<String> outcome = todoService.delete(todoId);
        return toResponse(outcome, HttpStatus.OK, Map.of("message", String.valueOf(outcome.getValue())));
    }

    private ResponseEntity<?> toResponse(TodoOutcome<?> outcome, HttpStatus successStatus, Object successBody) {
        switch (outcome.getKind()) {
            case SUCCESS:
                return ResponseEntity.status(successStatus).body(successBody);
            case NO_CHANGE:
                return ResponseEntity.ok(Map.of("message", outcome.getMessage()));
            default:
                HttpStatus status = mapKindToHttpStatus(outcome.getKind());
                if (status.is5xxServerError()) {
                    log.error("Store failure answered with {}: {}", status.value(), outcome.getMessage());
                } else {
                    log.debug("Request answered with {}: {}", status.value(), outcome.getMessage());
                }
                return ResponseEntity.status(status).body(Map.of("error", outcome.getMessage()));
        }
    }

    // SUCCESS and NO_CHANGE are answered by toResponse directly
    static HttpStatus mapKindToHttpStatus(TodoOutcome.Kind kind) {
        switch (kind) {
            case VALIDATION_FAILED:
                return HttpStatus.BAD_REQUEST;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case STORE_UNAVAILABLE:
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
