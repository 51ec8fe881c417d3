package com.hybridorm.core;

import java.util.Map;

/**
 * A REST resource reached by name through the five conventional verbs.
 * <p>
 * Non-2xx answers are returned as unsuccessful {@link RemoteResponse}s. Transport
 * failures raise {@link RemoteUnavailableException}.
 */
public interface RemoteResource {
    RemoteResponse index(String resource, Map<String, ?> filters, Map<String, String> headers);

    RemoteResponse show(String resource, String id, Map<String, String> headers);

    RemoteResponse store(String resource, Map<String, Object> data, Map<String, String> headers);

    RemoteResponse update(String resource, String id, Map<String, Object> data, Map<String, String> headers);

    RemoteResponse destroy(String resource, String id, Map<String, String> headers);

    default RemoteResponse index(String resource) {
        return index(resource, Map.of(), Map.of());
    }

    default RemoteResponse show(String resource, String id) {
        return show(resource, id, Map.of());
    }

    default RemoteResponse store(String resource, Map<String, Object> data) {
        return store(resource, data, Map.of());
    }

    default RemoteResponse update(String resource, String id, Map<String, Object> data) {
        return update(resource, id, data, Map.of());
    }

    default RemoteResponse destroy(String resource, String id) {
        return destroy(resource, id, Map.of());
    }
}
