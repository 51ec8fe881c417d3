package com.hybridorm.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.hybridorm.core.Json;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Root configuration, read from JSON such as:
 * <pre>{@code
 * {
 *   "database": {"driver": "sqlite", "database": "app.db"},
 *   "network":  {"baseUrl": "https://api.example.com", "timeoutMs": 5000}
 * }
 * }</pre>
 * Missing sections fall back to their defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PersistenceConfig(DatabaseConfig database, NetworkConfig network) {
    public PersistenceConfig {
        database = database != null ? database : DatabaseConfig.defaults();
        network = network != null ? network : NetworkConfig.disabled();
    }

    public static PersistenceConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return Json.MAPPER.readValue(in, PersistenceConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read configuration from " + path, e);
        }
    }

    public static PersistenceConfig fromResource(String name) {
        InputStream in = PersistenceConfig.class.getClassLoader().getResourceAsStream(name);
        if (in == null) {
            throw new IllegalArgumentException("No configuration resource named " + name);
        }
        try (in) {
            return Json.MAPPER.readValue(in, PersistenceConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read configuration resource " + name, e);
        }
    }
}
