package com.todolist.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
public class TodoController {
    private static final Logger logger = LoggerFactory.getLogger(TodoController.class);

    static final String INIT_FAILED = "Database initialization failed";
    static final String CONNECTION_FAILED = "Database connection failed";
    static final String TITLE_REQUIRED = "Title is required";

    private final ReadinessGuard readinessGuard;
    private final ConnectionProvider connectionProvider;
    private final TodoRepository todoRepository;
    private final TodoMetrics metrics;
    private final ObjectMapper objectMapper;

    public TodoController(
        ReadinessGuard readinessGuard,
        ConnectionProvider connectionProvider,
        TodoRepository todoRepository,
        TodoMetrics metrics,
        ObjectMapper objectMapper
    ) {
        this.readinessGuard = readinessGuard;
        this.connectionProvider = connectionProvider;
        this.todoRepository = todoRepository;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    @GetMapping(value = "/todos", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Object> listTodos() {
        if (!readinessGuard.ensureReady()) {
            return error(HttpStatus.INTERNAL_SERVER_ERROR, INIT_FAILED);
        }

        Optional<Connection> maybeConnection = connectionProvider.connect(true);
        if (maybeConnection.isEmpty()) {
            return error(HttpStatus.INTERNAL_SERVER_ERROR, CONNECTION_FAILED);
        }

        try (Connection connection = maybeConnection.get()) {
            DbResult<List<TodoItem>> todos = todoRepository.findAll(connection);
            if (todos instanceof DbResult.Failure<List<TodoItem>> failure) {
                return error(HttpStatus.INTERNAL_SERVER_ERROR, failure.message());
            }
            refreshItemCount(connection);
            return ResponseEntity.ok(((DbResult.Ok<List<TodoItem>>) todos).value());
        } catch (SQLException e) {
            return closeFailed(e);
        }
    }

    @PostMapping(value = "/todos", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Object> addTodo(@RequestBody(required = false) String body) {
        if (!readinessGuard.ensureReady()) {
            return error(HttpStatus.INTERNAL_SERVER_ERROR, INIT_FAILED);
        }

        Optional<String> title = parseTitle(body);
        if (title.isEmpty()) {
            return error(HttpStatus.BAD_REQUEST, TITLE_REQUIRED);
        }

        Optional<Connection> maybeConnection = connectionProvider.connect(true);
        if (maybeConnection.isEmpty()) {
            return error(HttpStatus.INTERNAL_SERVER_ERROR, CONNECTION_FAILED);
        }

        try (Connection connection = maybeConnection.get()) {
            DbResult<TodoItem> created = todoRepository.insert(connection, title.get());
            if (created instanceof DbResult.Failure<TodoItem> failure) {
                return error(HttpStatus.INTERNAL_SERVER_ERROR, failure.message());
            }
            refreshItemCount(connection);
            return ResponseEntity.status(HttpStatus.CREATED).body(((DbResult.Ok<TodoItem>) created).value());
        } catch (SQLException e) {
            return closeFailed(e);
        }
    }

    // Body must be a JSON object with a non-empty string title.
    private Optional<String> parseTitle(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            logger.debug("[DEBUG] Rejecting unparseable todo body: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (json == null || !json.isObject()) {
            return Optional.empty();
        }
        JsonNode title = json.get("title");
        if (title == null || !title.isTextual() || title.asText().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(title.asText());
    }

    // The gauge is always re-derived from the table, never from the rows just handled.
    private void refreshItemCount(Connection connection) {
        DbResult<Long> count = todoRepository.count(connection);
        if (count instanceof DbResult.Ok<Long> ok) {
            metrics.updateItemCount(ok.value());
        }
    }

    private static ResponseEntity<Object> closeFailed(SQLException e) {
        logger.error("[ERROR] Failed to release connection: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private static ResponseEntity<Object> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message == null ? status.getReasonPhrase() : message));
    }
}
