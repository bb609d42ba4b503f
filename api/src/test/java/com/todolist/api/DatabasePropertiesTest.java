package com.todolist.api;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatabasePropertiesTest {

    private static DatabaseProperties withDatabase(String database) {
        return new DatabaseProperties("db", 3306, "todo_user", "pw", database, 5, Duration.ofSeconds(2), true);
    }

    @Test
    void buildsUrlsWithAndWithoutDatabaseSelector() {
        DatabaseProperties properties = withDatabase("todo_db");

        assertThat(properties.jdbcUrl(true)).isEqualTo("jdbc:mariadb://db:3306/todo_db");
        assertThat(properties.jdbcUrl(false)).isEqualTo("jdbc:mariadb://db:3306/");
    }

    @ParameterizedTest
    @ValueSource(strings = {"todo_db; DROP DATABASE x", "todo-db", "`todo`", ""})
    void rejectsDatabaseNamesThatAreNotPlainIdentifiers(String name) {
        assertThatThrownBy(() -> withDatabase(name)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsInvalidRetrySettings() {
        assertThatThrownBy(() -> new DatabaseProperties("db", 3306, "u", "p", "todo_db", 0, Duration.ZERO, true))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DatabaseProperties("db", 3306, "u", "p", "todo_db", 1, Duration.ofSeconds(-1), true))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
