package com.hybridorm.remote.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.hybridorm.core.Json;
import com.hybridorm.core.RemoteResource;
import com.hybridorm.core.RemoteResponse;
import com.hybridorm.core.RemoteUnavailableException;
import com.hybridorm.core.config.NetworkConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link RemoteResource} over JSON/HTTP using the conventional resource routes:
 * <pre>
 * index   GET    {base}/{resource}
 * show    GET    {base}/{resource}/{id}
 * store   POST   {base}/{resource}
 * update  PUT    {base}/{resource}/{id}
 * destroy DELETE {base}/{resource}/{id}
 * </pre>
 * Every status code comes back as a {@link RemoteResponse}; only transport failures and
 * unreadable success bodies raise {@link RemoteUnavailableException}.
 */
public class HttpRemoteResource implements RemoteResource {
    private static final Logger logger = LoggerFactory.getLogger(HttpRemoteResource.class);

    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration timeout;
    private final Map<String, String> defaultHeaders;

    public HttpRemoteResource(NetworkConfig config) {
        this(config, HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.timeoutMs()))
                .build());
    }

    public HttpRemoteResource(NetworkConfig config, HttpClient httpClient) {
        if (!config.enabled()) {
            throw new IllegalArgumentException("Network config has no base URL");
        }
        this.httpClient = httpClient;
        this.baseUrl = config.baseUrl().endsWith("/")
                ? config.baseUrl().substring(0, config.baseUrl().length() - 1)
                : config.baseUrl();
        this.timeout = Duration.ofMillis(config.timeoutMs());
        this.defaultHeaders = config.headers();
    }

    @Override
    public RemoteResponse index(String resource, Map<String, ?> filters, Map<String, String> headers) {
        return send("GET", uri(resource, null, filters), null, headers);
    }

    @Override
    public RemoteResponse show(String resource, String id, Map<String, String> headers) {
        return send("GET", uri(resource, id, Map.of()), null, headers);
    }

    @Override
    public RemoteResponse store(String resource, Map<String, Object> data, Map<String, String> headers) {
        return send("POST", uri(resource, null, Map.of()), data, headers);
    }

    @Override
    public RemoteResponse update(String resource, String id, Map<String, Object> data, Map<String, String> headers) {
        return send("PUT", uri(resource, id, Map.of()), data, headers);
    }

    @Override
    public RemoteResponse destroy(String resource, String id, Map<String, String> headers) {
        return send("DELETE", uri(resource, id, Map.of()), null, headers);
    }

    private RemoteResponse send(String method, URI uri, Map<String, Object> body, Map<String, String> headers) {
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(Json.encode(body));
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .method(method, publisher);

        Map<String, String> merged = new LinkedHashMap<>(defaultHeaders);
        merged.putAll(headers);
        merged.forEach(builder::header);

        logger.debug("{} {}", method, uri);
        try {
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            return toRemoteResponse(method, uri, response);
        } catch (IOException e) {
            logger.error("{} {} failed: {}", method, uri, e.getMessage());
            throw new RemoteUnavailableException(method + " " + uri + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteUnavailableException("Interrupted during " + method + " " + uri, e);
        }
    }

    private RemoteResponse toRemoteResponse(String method, URI uri, HttpResponse<String> response) {
        int status = response.statusCode();
        Map<String, String> headers = response.headers().map().entrySet().stream()
                .filter(e -> !e.getValue().isEmpty())
                .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().get(0), (a, b) -> a, LinkedHashMap::new));
        String text = response.body();
        if (text == null || text.isBlank()) {
            return new RemoteResponse(status, null, headers, null);
        }
        try {
            return new RemoteResponse(status, Json.decode(text), headers, null);
        } catch (JsonProcessingException e) {
            if (status >= 200 && status < 300) {
                logger.error("{} {} returned an unreadable body", method, uri, e);
                throw new RemoteUnavailableException(method + " " + uri + " returned an unreadable body", e);
            }
            return new RemoteResponse(status, null, headers, text);
        }
    }

    private URI uri(String resource, String id, Map<String, ?> query) {
        StringBuilder url = new StringBuilder(baseUrl).append('/').append(resource);
        if (id != null) {
            url.append('/').append(encode(id));
        }
        if (!query.isEmpty()) {
            url.append('?').append(query.entrySet().stream()
                    .map(e -> encode(e.getKey()) + "=" + encode(String.valueOf(e.getValue())))
                    .collect(Collectors.joining("&")));
        }
        return URI.create(url.toString());
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
