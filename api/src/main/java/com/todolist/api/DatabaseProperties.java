package com.todolist.api;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Connection settings for the MariaDB server holding the todo table.
 *
 * The database name is interpolated into DDL, so it is restricted to a plain identifier.
 */
@ConfigurationProperties(prefix = "todo.db")
public record DatabaseProperties(
    @DefaultValue("localhost") String host,
    @DefaultValue("3306") int port,
    @DefaultValue("todo_user") String user,
    @DefaultValue("your_secure_password") String password,
    @DefaultValue("todo_db") String database,
    @DefaultValue("5") int connectAttempts,
    @DefaultValue("2s") Duration connectDelay,
    @DefaultValue("true") boolean initializeOnStartup
) {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_$]+");

    public DatabaseProperties {
        if (database == null || !IDENTIFIER.matcher(database).matches()) {
            throw new IllegalArgumentException("todo.db.database must be a plain identifier, got: " + database);
        }
        if (connectAttempts < 1) {
            throw new IllegalArgumentException("todo.db.connect-attempts must be >= 1");
        }
        if (connectDelay == null || connectDelay.isNegative()) {
            throw new IllegalArgumentException("todo.db.connect-delay must not be negative");
        }
    }

    public String jdbcUrl(boolean includeDatabaseSelector) {
        String base = "jdbc:mariadb://" + host + ":" + port + "/";
        return includeDatabaseSelector ? base + database : base;
    }
}
