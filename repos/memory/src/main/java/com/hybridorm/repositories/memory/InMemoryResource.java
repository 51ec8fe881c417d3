package com.hybridorm.repositories.memory;

import com.hybridorm.core.Envelope;
import com.hybridorm.core.RemoteResource;
import com.hybridorm.core.RemoteResponse;
import com.hybridorm.core.RemoteUnavailableException;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A {@link RemoteResource} that keeps every resource in memory and answers the way a
 * conventional JSON REST API would. Ids are assigned sequentially per resource unless the
 * stored payload carries one.
 * <p>
 * Useful as an offline backend and as a test double: {@link #setAvailable(boolean)}
 * simulates a network outage.
 */
public class InMemoryResource implements RemoteResource {
    private static final String ID = "id";

    private final Map<String, Map<String, Map<String, Object>>> db = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();
    private final boolean wrapped;
    private volatile boolean available = true;

    public InMemoryResource() {
        this(false);
    }

    /**
     * @param wrapped when true, bodies are wrapped in a {@code data} envelope
     */
    public InMemoryResource(boolean wrapped) {
        this.wrapped = wrapped;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    /**
     * Number of entities currently held for {@code resource}.
     */
    public int size(String resource) {
        return table(resource).size();
    }

    @Override
    public RemoteResponse index(String resource, Map<String, ?> filters, Map<String, String> headers) {
        checkAvailable(resource);
        Map<String, Map<String, Object>> table = table(resource);
        List<Map<String, Object>> matches = new ArrayList<>();
        synchronized (table) {
            for (Map<String, Object> entity : table.values()) {
                if (matches(entity, filters)) {
                    matches.add(new LinkedHashMap<>(entity));
                }
            }
        }
        return new RemoteResponse(200, body(matches));
    }

    @Override
    public RemoteResponse show(String resource, String id, Map<String, String> headers) {
        checkAvailable(resource);
        Map<String, Object> entity = table(resource).get(id);
        if (entity == null) {
            return notFound(resource, id);
        }
        return new RemoteResponse(200, body(new LinkedHashMap<>(entity)));
    }

    @Override
    public RemoteResponse store(String resource, Map<String, Object> data, Map<String, String> headers) {
        checkAvailable(resource);
        Map<String, Object> entity = new LinkedHashMap<>(data);
        Object id = entity.get(ID);
        if (id == null) {
            id = sequences.computeIfAbsent(resource, k -> new AtomicLong()).incrementAndGet();
            entity.put(ID, id);
        }
        table(resource).put(String.valueOf(id), entity);
        return new RemoteResponse(201, body(new LinkedHashMap<>(entity)));
    }

    @Override
    public RemoteResponse update(String resource, String id, Map<String, Object> data, Map<String, String> headers) {
        checkAvailable(resource);
        Map<String, Object> existing = table(resource).get(id);
        if (existing == null) {
            return notFound(resource, id);
        }
        Map<String, Object> updated = new LinkedHashMap<>(existing);
        updated.putAll(data);
        updated.put(ID, existing.get(ID));
        table(resource).put(id, updated);
        return new RemoteResponse(200, body(new LinkedHashMap<>(updated)));
    }

    @Override
    public RemoteResponse destroy(String resource, String id, Map<String, String> headers) {
        checkAvailable(resource);
        if (table(resource).remove(id) == null) {
            return notFound(resource, id);
        }
        return new RemoteResponse(204, null);
    }

    private Map<String, Map<String, Object>> table(String resource) {
        return db.computeIfAbsent(resource, k -> Collections.synchronizedMap(new LinkedHashMap<>()));
    }

    private Object body(Object payload) {
        return wrapped ? Map.of(Envelope.DATA_KEY, payload) : payload;
    }

    private void checkAvailable(String resource) {
        if (!available) {
            throw new RemoteUnavailableException("Resource " + resource + " is unreachable");
        }
    }

    private static boolean matches(Map<String, Object> entity, Map<String, ?> filters) {
        for (Map.Entry<String, ?> filter : filters.entrySet()) {
            if (!Objects.equals(String.valueOf(entity.get(filter.getKey())), String.valueOf(filter.getValue()))) {
                return false;
            }
        }
        return true;
    }

    private static RemoteResponse notFound(String resource, String id) {
        return new RemoteResponse(404, Map.of("message", "No " + resource + " with id " + id));
    }
}
