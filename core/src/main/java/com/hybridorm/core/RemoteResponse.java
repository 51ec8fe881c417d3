package com.hybridorm.core;

import java.util.*;

/**
 * The outcome of one remote resource call.
 *
 * @param statusCode HTTP-style status, success is 2xx
 * @param data       decoded body: a map, a list, a scalar or {@code null}
 * @param headers    response headers
 * @param message    transport level message, if any
 */
public record RemoteResponse(
        int statusCode,
        Object data,
        Map<String, String> headers,
        String message
) {
    public RemoteResponse {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    public RemoteResponse(int statusCode, Object data) {
        this(statusCode, data, Map.of(), null);
    }

    public boolean successful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean failed() {
        return statusCode >= 400;
    }

    public boolean clientError() {
        return statusCode >= 400 && statusCode < 500;
    }

    public boolean serverError() {
        return statusCode >= 500;
    }

    public boolean unauthorized() {
        return statusCode == 401;
    }

    public boolean forbidden() {
        return statusCode == 403;
    }

    public boolean notFound() {
        return statusCode == 404;
    }

    public boolean isValidationError() {
        return statusCode == 422;
    }

    /**
     * Value under {@code key} when the body is a map.
     */
    public Object get(String key) {
        return data instanceof Map ? ((Map<?, ?>) data).get(key) : null;
    }

    /**
     * Entity map with any {@code data} envelope removed.
     */
    public Optional<Map<String, Object>> entityData() {
        return Optional.ofNullable(Envelope.entity(data));
    }

    /**
     * Entity maps with any {@code data} envelope removed.
     */
    public List<Map<String, Object>> collectionData() {
        return Envelope.collection(data);
    }

    /**
     * Validation messages keyed by field, read from an {@code errors} object.
     */
    public Map<String, List<String>> errors() {
        Object errors = get("errors");
        if (!(errors instanceof Map)) {
            return Map.of();
        }
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) errors).entrySet()) {
            if (entry.getValue() instanceof List) {
                List<String> messages = new ArrayList<>();
                for (Object item : (List<?>) entry.getValue()) {
                    messages.add(String.valueOf(item));
                }
                result.put(String.valueOf(entry.getKey()), messages);
            }
        }
        return result;
    }

    public String firstError() {
        for (List<String> messages : errors().values()) {
            if (!messages.isEmpty()) {
                return messages.get(0);
            }
        }
        return errorMessage();
    }

    public String errorMessage() {
        Object bodyMessage = get("message");
        if (bodyMessage instanceof String) {
            return (String) bodyMessage;
        }
        return message;
    }
}
