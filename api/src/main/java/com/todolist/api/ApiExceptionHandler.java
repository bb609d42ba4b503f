package com.todolist.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Last line of defence: anything a handler did not turn into a response becomes a JSON 500.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(RuntimeException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(RuntimeException e) {
        logger.error("[ERROR] Unhandled exception: {}", e.getMessage(), e);
        return Map.of("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }
}
