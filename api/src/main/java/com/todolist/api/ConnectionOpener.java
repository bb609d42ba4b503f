package com.todolist.api;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens a raw JDBC connection. Production code uses {@link java.sql.DriverManager#getConnection(String, String, String)}.
 */
@FunctionalInterface
public interface ConnectionOpener {
    Connection open(String url, String user, String password) throws SQLException;
}
