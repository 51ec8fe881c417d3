package com.hybridorm.persistence;

import com.hybridorm.core.Entity;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Runs coordinator operations on an executor. Operations on the same entity instance are
 * not serialized; callers that issue overlapping saves must order them themselves.
 */
public class AsyncPersistence {
    private final PersistenceCoordinator coordinator;
    private final Executor executor;

    public AsyncPersistence(PersistenceCoordinator coordinator, Executor executor) {
        this.coordinator = coordinator;
        this.executor = executor;
    }

    public <T extends Entity> CompletableFuture<T> find(Supplier<T> factory, Object id) {
        return CompletableFuture.supplyAsync(() -> coordinator.find(factory, id), executor);
    }

    public <T extends Entity> CompletableFuture<List<T>> all(Supplier<T> factory) {
        return CompletableFuture.supplyAsync(() -> coordinator.all(factory), executor);
    }

    public CompletableFuture<Boolean> save(Entity entity) {
        return CompletableFuture.supplyAsync(() -> coordinator.save(entity), executor);
    }

    public CompletableFuture<Boolean> delete(Entity entity) {
        return CompletableFuture.supplyAsync(() -> coordinator.delete(entity), executor);
    }

    public CompletableFuture<Boolean> refresh(Entity entity) {
        return CompletableFuture.supplyAsync(() -> coordinator.refresh(entity), executor);
    }
}
