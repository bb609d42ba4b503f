package com.todolist.api;

/**
 * Outcome of a single database operation. Handlers branch on the variant instead of catching exceptions.
 */
public sealed interface DbResult<T> {

    record Ok<T>(T value) implements DbResult<T> {}

    record Failure<T>(String message) implements DbResult<T> {}

    static <T> DbResult<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> DbResult<T> failure(String message) {
        return new Failure<>(message);
    }
}
