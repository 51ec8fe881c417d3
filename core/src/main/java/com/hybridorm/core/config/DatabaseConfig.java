package com.hybridorm.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * @param driver   embedded SQL driver name, only {@code sqlite} is supported
 * @param database database file, or {@code :memory:}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DatabaseConfig(String driver, String database) {
    public static final String DEFAULT_DRIVER = "sqlite";
    public static final String DEFAULT_DATABASE = "hybridorm.db";
    public static final String IN_MEMORY = ":memory:";

    public DatabaseConfig {
        driver = driver == null || driver.isBlank() ? DEFAULT_DRIVER : driver;
        database = database == null || database.isBlank() ? DEFAULT_DATABASE : database;
    }

    public static DatabaseConfig defaults() {
        return new DatabaseConfig(null, null);
    }

    public static DatabaseConfig inMemory() {
        return new DatabaseConfig(DEFAULT_DRIVER, IN_MEMORY);
    }

    public boolean isInMemory() {
        return IN_MEMORY.equals(database);
    }
}
