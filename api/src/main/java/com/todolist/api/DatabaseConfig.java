package com.todolist.api;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.sql.DriverManager;

@Configuration
public class DatabaseConfig {

    @Bean
    public ConnectionOpener connectionOpener() {
        return DriverManager::getConnection;
    }
}
