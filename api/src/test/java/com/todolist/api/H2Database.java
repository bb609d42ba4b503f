package com.todolist.api;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * In-memory H2 database in MySQL mode standing in for MariaDB in tests.
 */
final class H2Database {
    private final String url;

    private H2Database(String url) {
        this.url = url;
    }

    static H2Database create() {
        String name = "todos_" + UUID.randomUUID().toString().replace("-", "");
        return new H2Database("jdbc:h2:mem:" + name + ";MODE=MySQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
    }

    Connection open() throws SQLException {
        return DriverManager.getConnection(url);
    }

    ConnectionOpener opener() {
        return (ignoredUrl, user, password) -> open();
    }

    void createTable() throws SQLException {
        execute(SchemaInitializer.CREATE_TABLE_SQL);
    }

    void dropTable() throws SQLException {
        execute("DROP TABLE IF EXISTS todos");
    }

    long count() throws SQLException {
        try (Connection connection = open();
             Statement statement = connection.createStatement();
             var rs = statement.executeQuery("SELECT COUNT(*) FROM todos")) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private void execute(String sql) throws SQLException {
        try (Connection connection = open(); Statement statement = connection.createStatement()) {
            statement.execute(sql);
        }
    }
}
