package com.hybridorm.persistence;

import com.hybridorm.core.Entity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Builds existing entities from stored rows.
 */
public final class Hydration {
    private Hydration() {
    }

    /**
     * A new entity holding {@code data} as its synced attributes, marked as existing.
     */
    public static <T extends Entity> T hydrate(Supplier<T> factory, Map<String, ?> data) {
        T entity = factory.get();
        entity.setRawAttributes(data, true);
        entity.setExists(true);
        return entity;
    }

    public static <T extends Entity> List<T> hydrateAll(Supplier<T> factory, List<? extends Map<String, ?>> rows) {
        List<T> entities = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            entities.add(hydrate(factory, row));
        }
        return entities;
    }
}
