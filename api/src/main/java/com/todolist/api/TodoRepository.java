package com.todolist.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * SQL for the todo handlers. Every method runs against a connection owned by the caller and never closes it.
 */
@Repository
public class TodoRepository {
    private static final Logger logger = LoggerFactory.getLogger(TodoRepository.class);

    // Read as LocalDateTime so the column value is not shifted through the JVM default time zone.
    private static final RowMapper<TodoItem> TODO_ROW_MAPPER = (rs, rowNum) -> new TodoItem(
        rs.getLong("id"),
        rs.getString("title"),
        rs.getObject("created_at", LocalDateTime.class)
    );

    public DbResult<List<TodoItem>> findAll(Connection connection) {
        try {
            return DbResult.ok(jdbc(connection).query("SELECT id, title, created_at FROM todos", TODO_ROW_MAPPER));
        } catch (DataAccessException e) {
            return failure("list todos", e);
        }
    }

    /**
     * Inserts a row and reads it back so {@code created_at} is the value assigned by the database clock.
     */
    public DbResult<TodoItem> insert(Connection connection, String title) {
        try {
            JdbcTemplate jdbc = jdbc(connection);
            KeyHolder keyHolder = new GeneratedKeyHolder();
            jdbc.update(con -> {
                PreparedStatement ps = con.prepareStatement("INSERT INTO todos (title) VALUES (?)", Statement.RETURN_GENERATED_KEYS);
                ps.setString(1, title);
                return ps;
            }, keyHolder);
            if (!connection.getAutoCommit()) {
                connection.commit();
            }

            long id = generatedId(keyHolder);
            TodoItem created = jdbc.queryForObject(
                "SELECT id, title, created_at FROM todos WHERE id = ?",
                TODO_ROW_MAPPER,
                id
            );
            logger.info("[INFO] Created todo id={}", id);
            return DbResult.ok(created);
        } catch (DataAccessException e) {
            return failure("insert todo", e);
        } catch (SQLException | IllegalStateException e) {
            logger.error("[ERROR] insert todo failed: {}", e.getMessage(), e);
            return DbResult.failure(e.getMessage());
        }
    }

    public DbResult<Long> count(Connection connection) {
        try {
            Long count = jdbc(connection).queryForObject("SELECT COUNT(*) FROM todos", Long.class);
            return DbResult.ok(count == null ? 0L : count);
        } catch (DataAccessException e) {
            return failure("count todos", e);
        }
    }

    private static JdbcTemplate jdbc(Connection connection) {
        // suppressClose: the handler owns the connection and closes it itself.
        return new JdbcTemplate(new SingleConnectionDataSource(connection, true));
    }

    // MariaDB reports the key as insert_id, other drivers use the column name.
    private static long generatedId(KeyHolder keyHolder) {
        Map<String, Object> keys = keyHolder.getKeys();
        if (keys == null || keys.isEmpty()) {
            throw new IllegalStateException("INSERT INTO todos returned no generated key");
        }
        for (Map.Entry<String, Object> entry : keys.entrySet()) {
            if ("id".equalsIgnoreCase(entry.getKey()) && entry.getValue() instanceof Number number) {
                return number.longValue();
            }
        }
        return keys.values().stream()
            .filter(Number.class::isInstance)
            .map(Number.class::cast)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("INSERT INTO todos returned no numeric key"))
            .longValue();
    }

    private static <T> DbResult<T> failure(String operation, DataAccessException e) {
        Throwable cause = e.getMostSpecificCause();
        String message = cause.getMessage() != null ? cause.getMessage() : e.getMessage();
        logger.error("[ERROR] {} failed: {}", operation, message, e);
        return DbResult.failure(message);
    }
}
