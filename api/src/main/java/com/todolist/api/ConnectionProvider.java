package com.todolist.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;

/**
 * Opens short-lived connections to the todo database, retrying with a fixed delay.
 *
 * Connections are never pooled: every caller owns the returned connection and must close it.
 */
@Component
public class ConnectionProvider {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionProvider.class);

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration delay) throws InterruptedException;
    }

    private final DatabaseProperties properties;
    private final ConnectionOpener opener;
    private final Sleeper sleeper;

    @Autowired
    public ConnectionProvider(DatabaseProperties properties, ConnectionOpener opener) {
        this(properties, opener, delay -> Thread.sleep(delay.toMillis()));
    }

    ConnectionProvider(DatabaseProperties properties, ConnectionOpener opener, Sleeper sleeper) {
        this.properties = properties;
        this.opener = opener;
        this.sleeper = sleeper;
    }

    public Optional<Connection> connect(boolean includeDatabaseSelector) {
        return connect(includeDatabaseSelector, properties.connectAttempts(), properties.connectDelay());
    }

    /**
     * Attempts to open a connection up to {@code maxAttempts} times.
     *
     * @param includeDatabaseSelector when false the URL targets the server only, which is required
     *                                before the database has been created
     * @param maxAttempts             total attempts including the first, must be >= 1
     * @param delayBetweenAttempts    pause after each failed attempt except the last
     * @return the open connection, or empty once every attempt has failed
     */
    public Optional<Connection> connect(boolean includeDatabaseSelector, int maxAttempts, Duration delayBetweenAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (delayBetweenAttempts.isNegative()) {
            throw new IllegalArgumentException("delayBetweenAttempts must not be negative");
        }

        String url = properties.jdbcUrl(includeDatabaseSelector);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return Optional.of(opener.open(url, properties.user(), properties.password()));
            } catch (SQLException e) {
                logger.warn("[WARN] Connection attempt {} failed: {}", attempt, e.getMessage());
                if (attempt < maxAttempts && !pause(delayBetweenAttempts)) {
                    logger.error("[ERROR] Interrupted while waiting to reconnect to {}", url);
                    return Optional.empty();
                }
            }
        }
        logger.error("[ERROR] Failed to connect to MariaDB at {} after {} attempts", url, maxAttempts);
        return Optional.empty();
    }

    private boolean pause(Duration delay) {
        if (delay.isZero()) return true;
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
