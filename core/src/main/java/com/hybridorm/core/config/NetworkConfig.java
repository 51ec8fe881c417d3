package com.hybridorm.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param baseUrl   root URL of the REST API; blank means no remote store
 * @param timeoutMs connect and request timeout
 * @param headers   headers sent with every request, merged under per-call headers
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NetworkConfig(String baseUrl, Integer timeoutMs, Map<String, String> headers) {
    public static final int DEFAULT_TIMEOUT_MS = 10_000;

    public NetworkConfig {
        timeoutMs = timeoutMs == null || timeoutMs <= 0 ? DEFAULT_TIMEOUT_MS : timeoutMs;
        Map<String, String> merged = new LinkedHashMap<>();
        merged.put("Accept", "application/json");
        merged.put("Content-Type", "application/json");
        if (headers != null) {
            merged.putAll(headers);
        }
        headers = Map.copyOf(merged);
    }

    public static NetworkConfig of(String baseUrl) {
        return new NetworkConfig(baseUrl, null, null);
    }

    public static NetworkConfig disabled() {
        return new NetworkConfig(null, null, null);
    }

    public boolean enabled() {
        return baseUrl != null && !baseUrl.isBlank();
    }
}
