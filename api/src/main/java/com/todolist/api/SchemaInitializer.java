package com.todolist.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

/**
 * Creates the todo database and its table when they are missing.
 *
 * Both statements use {@code IF NOT EXISTS}, so concurrent or repeated calls converge on the same schema
 * without any in-process locking.
 */
@Component
public class SchemaInitializer {
    private static final Logger logger = LoggerFactory.getLogger(SchemaInitializer.class);

    static final String CREATE_TABLE_SQL = """
        CREATE TABLE IF NOT EXISTS todos (
            id INT AUTO_INCREMENT PRIMARY KEY,
            title VARCHAR(255) NOT NULL,
            created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
        )
        """;

    private final ConnectionProvider connectionProvider;
    private final DatabaseProperties properties;

    public SchemaInitializer(ConnectionProvider connectionProvider, DatabaseProperties properties) {
        this.connectionProvider = connectionProvider;
        this.properties = properties;
    }

    /**
     * @return true when the database and table are known to exist after this call
     */
    public boolean initializeSchema() {
        Optional<Connection> maybeConnection = connectionProvider.connect(false);
        if (maybeConnection.isEmpty()) {
            logger.error("[ERROR] Failed to connect to MariaDB server, schema not initialized");
            return false;
        }

        String database = properties.database();
        Connection connection = maybeConnection.get();
        boolean initialized = false;
        try (Statement statement = connection.createStatement()) {
            statement.execute("CREATE DATABASE IF NOT EXISTS `" + database + "`");
            commit(connection);

            statement.execute("USE `" + database + "`");
            statement.execute(CREATE_TABLE_SQL);
            commit(connection);

            initialized = true;
            logger.info("[INFO] Database {} and table todos initialized", database);
        } catch (SQLException e) {
            if (initialized) {
                logger.warn("[WARN] Schema for {} created but statement release failed: {}", database, e.getMessage());
            } else {
                logger.error("[ERROR] Error initializing database {}: {}", database, e.getMessage(), e);
            }
        } finally {
            release(connection);
        }
        return initialized;
    }

    private static void release(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            logger.warn("[WARN] Failed to close schema connection: {}", e.getMessage());
        }
    }

    private static void commit(Connection connection) throws SQLException {
        if (!connection.getAutoCommit()) {
            connection.commit();
        }
    }
}
