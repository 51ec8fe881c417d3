package com.hybridorm.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class PersistenceConfigTest {

    @Test
    void fromResourceShouldReadEverySection() {
        PersistenceConfig config = PersistenceConfig.fromResource("persistence.json");

        assertEquals("sqlite", config.database().driver());
        assertEquals("app.db", config.database().database());
        assertFalse(config.database().isInMemory());

        NetworkConfig network = config.network();
        assertTrue(network.enabled());
        assertEquals("https://api.example.com/v1", network.baseUrl());
        assertEquals(5000, network.timeoutMs());
        assertEquals("Bearer token", network.headers().get("Authorization"));
        assertEquals("application/vnd.api+json", network.headers().get("Accept"));
        assertEquals("application/json", network.headers().get("Content-Type"));
    }

    @Test
    void missingSectionsShouldFallBackToDefaults(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("config.json");
        Files.writeString(file, "{\"database\": {\"database\": \":memory:\"}}");

        PersistenceConfig config = PersistenceConfig.load(file);

        assertEquals(DatabaseConfig.DEFAULT_DRIVER, config.database().driver());
        assertTrue(config.database().isInMemory());
        assertFalse(config.network().enabled());
        assertEquals(NetworkConfig.DEFAULT_TIMEOUT_MS, config.network().timeoutMs());
    }

    @Test
    void nullSectionsShouldBeDefaulted() {
        PersistenceConfig config = new PersistenceConfig(null, null);

        assertEquals(DatabaseConfig.defaults(), config.database());
        assertEquals("hybridorm.db", config.database().database());
        assertFalse(config.network().enabled());
    }

    @Test
    void blankBaseUrlShouldDisableNetwork() {
        assertFalse(new NetworkConfig("  ", 0, null).enabled());
        assertTrue(NetworkConfig.of("http://localhost:8080").enabled());
    }

    @Test
    void loadShouldWrapUnreadableFiles(@TempDir Path dir) {
        assertThrows(UncheckedIOException.class, () -> PersistenceConfig.load(dir.resolve("missing.json")));
    }

    @Test
    void loadShouldWrapMalformedJson(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{\"database\": ");

        assertThrows(UncheckedIOException.class, () -> PersistenceConfig.load(file));
    }

    @Test
    void fromResourceShouldRejectUnknownNames() {
        assertThrows(IllegalArgumentException.class, () -> PersistenceConfig.fromResource("nope.json"));
    }
}
