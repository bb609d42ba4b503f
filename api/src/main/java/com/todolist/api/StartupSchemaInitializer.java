package com.todolist.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Creates the schema once at startup. A failure is not fatal: the readiness guard repairs it on the first request.
 */
@Component
@ConditionalOnProperty(prefix = "todo.db", name = "initialize-on-startup", havingValue = "true", matchIfMissing = true)
public class StartupSchemaInitializer {
    private static final Logger logger = LoggerFactory.getLogger(StartupSchemaInitializer.class);

    private final SchemaInitializer schemaInitializer;

    public StartupSchemaInitializer(SchemaInitializer schemaInitializer) {
        this.schemaInitializer = schemaInitializer;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void initializeOnStartup() {
        if (!schemaInitializer.initializeSchema()) {
            logger.warn("[WARN] Initial database setup failed, will retry on first request");
        }
    }
}
