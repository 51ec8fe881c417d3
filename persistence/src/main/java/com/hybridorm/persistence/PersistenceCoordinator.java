package com.hybridorm.persistence;

import com.hybridorm.core.*;
import com.hybridorm.repositories.rdbms.QueryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Supplier;

/**
 * Reads and writes entities against a local SQL store and a remote REST resource.
 * <p>
 * Each entity's {@link EntityDefinition} decides which stores take part. Reads try the
 * local store first and fall back to the remote one, copying remote results into the
 * local store on the way. Writes go to the remote store, then the local one, and succeed
 * when either store accepts them. A store failure is logged and treated as that store
 * declining the operation; nothing thrown by a store leaves this class.
 * <p>
 * A store passed as {@code null} is treated as disabled. No locking is done: concurrent
 * saves of the same entity instance may overwrite each other.
 */
public class PersistenceCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(PersistenceCoordinator.class);

    private final LocalStore local;
    private final RemoteResource remote;
    private final EventSink events;

    public PersistenceCoordinator(LocalStore local, RemoteResource remote) {
        this(local, remote, EventSink.NONE);
    }

    public PersistenceCoordinator(LocalStore local, RemoteResource remote, EventSink events) {
        this.local = local;
        this.remote = remote;
        this.events = events != null ? events : EventSink.NONE;
    }

    /**
     * The local store, for callers that need {@link LocalStore#transaction} around several
     * operations; {@code null} when none is configured.
     */
    public LocalStore localStore() {
        return local;
    }

    // Reads

    /**
     * @return the entity with primary key {@code id}, or {@code null} when neither store has it
     */
    public <T extends Entity> T find(Supplier<T> factory, Object id) {
        EntityDefinition definition = factory.get().definition();

        if (localEnabled(definition)) {
            StoreResult<Map<String, Object>> row = StoreResult.attempt(() ->
                    new QueryBuilder(local, definition.table()).where(definition.primaryKey(), id).first());
            if (row.isPresent()) {
                return Hydration.hydrate(factory, row.value().get());
            }
            row.error().ifPresent(e -> logger.warn("Local find of {} {} failed: {}", definition.table(), id, e.getMessage()));
        }

        if (remoteEnabled(definition)) {
            StoreResult<RemoteResponse> response = StoreResult.attempt(() ->
                    remote.show(definition.resource(), String.valueOf(id)));
            Optional<Map<String, Object>> data = entityData(response, "show", definition.resource());
            if (data.isPresent()) {
                T entity = Hydration.hydrate(factory, data.get());
                if (localEnabled(definition)) {
                    syncToLocal(entity);
                }
                return entity;
            }
        }

        return null;
    }

    /**
     * Every entity from the first store that answers. Results are never merged.
     */
    public <T extends Entity> List<T> all(Supplier<T> factory) {
        EntityDefinition definition = factory.get().definition();

        if (localEnabled(definition)) {
            StoreResult<List<Map<String, Object>>> rows = StoreResult.attempt(() ->
                    new QueryBuilder(local, definition.table()).get());
            if (rows.isSuccess()) {
                return Hydration.hydrateAll(factory, rows.value().orElse(List.of()));
            }
            rows.error().ifPresent(e -> logger.warn("Local listing of {} failed: {}", definition.table(), e.getMessage()));
        }

        if (remoteEnabled(definition)) {
            StoreResult<RemoteResponse> response = StoreResult.attempt(() -> remote.index(definition.resource()));
            if (accepted(response, "index", definition.resource())) {
                List<T> entities = Hydration.hydrateAll(factory, response.value().get().collectionData());
                if (localEnabled(definition)) {
                    entities.forEach(this::syncToLocal);
                }
                return entities;
            }
        }

        return new ArrayList<>();
    }

    /**
     * A fresh query builder on the entity's local table.
     *
     * @throws IllegalStateException when no local store is configured
     */
    public QueryBuilder query(Supplier<? extends Entity> factory) {
        if (local == null) {
            throw new IllegalStateException("No local store configured");
        }
        return new QueryBuilder(local, factory.get().definition().table());
    }

    /**
     * Runs {@code query} and hydrates the rows. Store failures propagate, as they do from
     * the builder itself.
     */
    public <T extends Entity> List<T> get(Supplier<T> factory, QueryBuilder query) {
        return Hydration.hydrateAll(factory, query.get());
    }

    // Writes

    /**
     * Creates or updates {@code entity} depending on {@link Entity#exists()}.
     *
     * @return true when at least one store accepted the write
     */
    public boolean save(Entity entity) {
        EntityDefinition definition = entity.definition();
        boolean creating = !entity.exists();

        fire(LifecycleEvent.SAVING, entity);
        fire(creating ? LifecycleEvent.CREATING : LifecycleEvent.UPDATING, entity);
        if (entity instanceof Timestamped) {
            ((Timestamped) entity).updateTimestamps();
        }

        Map<String, Object> data = entity.toPersistableMap();
        boolean remoteSaved = remoteEnabled(definition) && saveRemote(entity, definition, data, creating);
        boolean localSaved = localEnabled(definition) && saveLocal(entity, definition, data, creating);

        if (!remoteSaved && !localSaved) {
            logger.debug("Save of {} was not accepted by any store", definition.table());
            return false;
        }

        entity.setExists(true);
        entity.setRecentlyCreated(creating);
        entity.syncOriginal();
        fire(creating ? LifecycleEvent.CREATED : LifecycleEvent.UPDATED, entity);
        fire(LifecycleEvent.SAVED, entity);
        return true;
    }

    /**
     * @return true when at least one store removed the entity; false for an entity that does not exist
     */
    public boolean delete(Entity entity) {
        if (!entity.exists()) {
            return false;
        }
        EntityDefinition definition = entity.definition();
        Object id = entity.getId();

        boolean remoteDeleted = false;
        if (remoteEnabled(definition)) {
            StoreResult<RemoteResponse> response = StoreResult.attempt(() ->
                    remote.destroy(definition.resource(), String.valueOf(id)));
            remoteDeleted = accepted(response, "destroy", definition.resource());
        }

        boolean localDeleted = false;
        if (localEnabled(definition)) {
            StoreResult<Integer> deleted = StoreResult.attempt(() ->
                    new QueryBuilder(local, definition.table()).where(definition.primaryKey(), id).delete());
            deleted.error().ifPresent(e -> logger.warn("Local delete of {} {} failed: {}", definition.table(), id, e.getMessage()));
            localDeleted = deleted.isSuccess();
        }

        if (!remoteDeleted && !localDeleted) {
            return false;
        }
        entity.setExists(false);
        fire(LifecycleEvent.DELETED, entity);
        return true;
    }

    /**
     * Reloads {@code entity}'s attributes from the local store, else the remote one.
     *
     * @return false when the entity has no identity or neither store returned it
     */
    public boolean refresh(Entity entity) {
        Object id = entity.getId();
        if (!entity.exists() || id == null) {
            return false;
        }
        EntityDefinition definition = entity.definition();

        if (localEnabled(definition)) {
            StoreResult<Map<String, Object>> row = StoreResult.attempt(() ->
                    new QueryBuilder(local, definition.table()).where(definition.primaryKey(), id).first());
            if (row.isPresent()) {
                entity.setRawAttributes(row.value().get(), true);
                return true;
            }
            row.error().ifPresent(e -> logger.warn("Local refresh of {} {} failed: {}", definition.table(), id, e.getMessage()));
        }

        if (remoteEnabled(definition)) {
            StoreResult<RemoteResponse> response = StoreResult.attempt(() ->
                    remote.show(definition.resource(), String.valueOf(id)));
            Optional<Map<String, Object>> data = entityData(response, "show", definition.resource());
            if (data.isPresent()) {
                entity.setRawAttributes(data.get(), true);
                return true;
            }
        }

        return false;
    }

    /**
     * Binds {@code entity} to this coordinator.
     */
    public <T extends Entity> Persistable<T> bind(T entity) {
        return new Persistable<>(entity, this);
    }

    // Store steps

    private boolean saveRemote(Entity entity, EntityDefinition definition, Map<String, Object> data, boolean creating) {
        String resource = definition.resource();
        StoreResult<RemoteResponse> response = StoreResult.attempt(() -> creating
                ? remote.store(resource, data)
                : remote.update(resource, String.valueOf(entity.getId()), data));
        if (!accepted(response, creating ? "store" : "update", resource)) {
            return false;
        }
        if (creating) {
            response.value().get().entityData()
                    .map(created -> created.get(definition.primaryKey()))
                    .ifPresent(id -> {
                        entity.setAttribute(definition.primaryKey(), id);
                        data.put(definition.primaryKey(), id);
                    });
        }
        return true;
    }

    private boolean saveLocal(Entity entity, EntityDefinition definition, Map<String, Object> data, boolean creating) {
        StoreResult<Object> result = StoreResult.attempt(() -> {
            Map<String, Object> row = onlyColumns(definition.table(), data);
            QueryBuilder query = new QueryBuilder(local, definition.table());
            if (creating) {
                long id = query.insert(row);
                if (entity.getId() == null) {
                    entity.setAttribute(definition.primaryKey(), id);
                }
                return id;
            }
            return query.where(definition.primaryKey(), entity.getId()).update(row);
        });
        result.error().ifPresent(e -> logger.warn("Local {} of {} failed: {}",
                creating ? "insert" : "update", definition.table(), e.getMessage()));
        return result.isSuccess();
    }

    /**
     * Copies a remotely loaded entity into the local table, inserting or updating by
     * primary key. Failures are logged and otherwise ignored.
     */
    private void syncToLocal(Entity entity) {
        EntityDefinition definition = entity.definition();
        Object id = entity.getId();
        StoreResult<Object> result = StoreResult.attempt(() -> {
            Map<String, Object> row = onlyColumns(definition.table(), entity.toPersistableMap());
            boolean present = id != null && new QueryBuilder(local, definition.table())
                    .where(definition.primaryKey(), id)
                    .exists();
            if (present) {
                return new QueryBuilder(local, definition.table()).where(definition.primaryKey(), id).update(row);
            }
            return new QueryBuilder(local, definition.table()).insert(row);
        });
        if (result.isSuccess()) {
            logger.debug("Synced {} {} to local store", definition.table(), id);
        } else {
            result.error().ifPresent(e -> logger.warn("Sync of {} {} to local store failed: {}", definition.table(), id, e.getMessage()));
        }
    }

    /**
     * Keeps only the keys that are columns of {@code table}.
     *
     * @throws StoreException when the table has no columns, i.e. does not exist
     */
    private Map<String, Object> onlyColumns(String table, Map<String, Object> data) {
        Set<String> columns = new HashSet<>(local.getColumns(table));
        if (columns.isEmpty()) {
            throw new StoreException("No local table named " + table);
        }
        Map<String, Object> row = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (columns.contains(entry.getKey())) {
                row.put(entry.getKey(), entry.getValue());
            } else {
                logger.debug("Dropping {}.{}: no such column", table, entry.getKey());
            }
        }
        return row;
    }

    private boolean accepted(StoreResult<RemoteResponse> response, String verb, String resource) {
        if (response.isFailure()) {
            response.error().ifPresent(e -> logger.warn("Remote {} on {} failed: {}", verb, resource, e.getMessage()));
            return false;
        }
        RemoteResponse answer = response.value().orElse(null);
        if (answer == null) {
            logger.warn("Remote {} on {} returned no response", verb, resource);
            return false;
        }
        if (answer.notFound()) {
            logger.debug("Remote {} on {} answered 404", verb, resource);
            return false;
        }
        if (!answer.successful()) {
            logger.warn("Remote {} on {} answered {}: {}", verb, resource, answer.statusCode(), answer.firstError());
            return false;
        }
        return true;
    }

    private Optional<Map<String, Object>> entityData(StoreResult<RemoteResponse> response, String verb, String resource) {
        if (!accepted(response, verb, resource)) {
            return Optional.empty();
        }
        return response.value().get().entityData();
    }

    private boolean localEnabled(EntityDefinition definition) {
        if (definition.useLocal() && local == null) {
            logger.debug("{} uses a local store but none is configured", definition.table());
        }
        return definition.useLocal() && local != null;
    }

    private boolean remoteEnabled(EntityDefinition definition) {
        if (definition.useRemote() && remote == null) {
            logger.debug("{} uses a remote store but none is configured", definition.resource());
        }
        return definition.useRemote() && remote != null;
    }

    private void fire(LifecycleEvent type, Entity entity) {
        events.fire(new EntityEvent(type, entity));
    }
}
