package com.todolist.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Pre-handler check that the todo table exists, repairing the schema when it does not.
 *
 * Known inconsistency kept on purpose: when the connection itself fails, the repair is attempted but its
 * outcome is ignored and the call reports not-ready; when the table is missing, the repair outcome is
 * returned as this call's result.
 */
@Component
public class ReadinessGuard {
    private static final Logger logger = LoggerFactory.getLogger(ReadinessGuard.class);

    static final String TABLE_NAME = "todos";

    private final ConnectionProvider connectionProvider;
    private final SchemaInitializer schemaInitializer;

    public ReadinessGuard(ConnectionProvider connectionProvider, SchemaInitializer schemaInitializer) {
        this.connectionProvider = connectionProvider;
        this.schemaInitializer = schemaInitializer;
    }

    public boolean ensureReady() {
        Optional<Connection> maybeConnection = connectionProvider.connect(true);
        if (maybeConnection.isEmpty()) {
            logger.warn("[WARN] Attempting to initialize database due to connection failure");
            schemaInitializer.initializeSchema();
            return false;
        }

        boolean tablePresent;
        try (Connection connection = maybeConnection.get()) {
            tablePresent = tableExists(connection);
        } catch (SQLException e) {
            logger.error("[ERROR] Error checking existence of table {}: {}", TABLE_NAME, e.getMessage());
            return false;
        }

        if (!tablePresent) {
            logger.info("[INFO] Table {} not found, initializing database", TABLE_NAME);
            return schemaInitializer.initializeSchema();
        }
        return true;
    }

    private static boolean tableExists(Connection connection) throws SQLException {
        DatabaseMetaData metaData = connection.getMetaData();
        try (ResultSet tables = metaData.getTables(connection.getCatalog(), null, TABLE_NAME, null)) {
            return tables.next();
        }
    }
}
