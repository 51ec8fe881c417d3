package com.hybridorm.persistence;

import com.hybridorm.core.Entity;

/**
 * One entity bound to the coordinator that stores it.
 *
 * <pre>{@code
 * Persistable<User> user = coordinator.bind(new User());
 * user.entity().fill(Map.of("name", "Ada"));
 * user.save();
 * }</pre>
 */
public final class Persistable<T extends Entity> {
    private final T entity;
    private final PersistenceCoordinator coordinator;

    Persistable(T entity, PersistenceCoordinator coordinator) {
        this.entity = entity;
        this.coordinator = coordinator;
    }

    public T entity() {
        return entity;
    }

    public boolean save() {
        return coordinator.save(entity);
    }

    public boolean delete() {
        return coordinator.delete(entity);
    }

    public boolean refresh() {
        return coordinator.refresh(entity);
    }
}
