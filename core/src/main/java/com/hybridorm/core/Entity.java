package com.hybridorm.core;

import java.util.*;
import java.util.function.Supplier;

/**
 * Base class for persisted domain objects.
 * <p>
 * An entity owns a raw attribute map and a snapshot of that map taken at the last sync
 * point. Casting happens on the way in ({@link #setAttribute}) and on the way out
 * ({@link #getAttribute}); dirty tracking compares the raw map against the snapshot.
 * Persistence itself lives outside the entity, in a coordinator that reads the
 * {@link #definition()}.
 *
 * <pre>{@code
 * public class User extends Entity implements Timestamped {
 *     static final EntityDefinition DEFINITION = EntityDefinition.builder("users")
 *             .fillable("name", "email")
 *             .cast("born_at", CastKind.DATETIME)
 *             .build();
 *
 *     public EntityDefinition definition() { return DEFINITION; }
 * }
 * }</pre>
 */
public abstract class Entity {
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private final Map<String, Object> original = new LinkedHashMap<>();

    private final Set<String> runtimeHidden = new LinkedHashSet<>();
    private final Set<String> runtimeVisible = new LinkedHashSet<>();
    private final Set<String> runtimeAppends = new LinkedHashSet<>();

    private boolean exists = false;
    private boolean recentlyCreated = false;

    public abstract EntityDefinition definition();

    // Attribute access

    /**
     * Returns the stored value decoded through the attribute's cast.
     *
     * @throws DecodeException when a json-cast attribute holds malformed JSON
     */
    public Object getAttribute(String key) {
        Object value = attributes.get(key);
        if (value == null) {
            return null;
        }
        return Casts.read(key, value, definition().castFor(key));
    }

    public void setAttribute(String key, Object value) {
        attributes.put(key, Casts.write(value, definition().castFor(key)));
    }

    public <T> T get(String key, Class<T> type) {
        return get(key, type, null);
    }

    public <T> T get(String key, Class<T> type, T defaultValue) {
        Object value = getAttribute(key);
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        return defaultValue;
    }

    public void set(String key, Object value) {
        setAttribute(key, value);
    }

    public boolean has(String key) {
        return attributes.get(key) != null;
    }

    public Object getId() {
        return getAttribute(definition().primaryKey());
    }

    public void setId(Object id) {
        setAttribute(definition().primaryKey(), id);
    }

    /**
     * A copy of the raw attribute map, without casts applied.
     */
    public Map<String, Object> attributes() {
        return new LinkedHashMap<>(attributes);
    }

    public Object getOriginal(String key) {
        return original.get(key);
    }

    // Mass assignment

    /**
     * Sets each attribute that passes the fillable guard and silently skips the rest.
     */
    public Entity fill(Map<String, ?> values) {
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            if (isFillable(entry.getKey())) {
                setAttribute(entry.getKey(), entry.getValue());
            }
        }
        return this;
    }

    public boolean isFillable(String key) {
        EntityDefinition definition = definition();
        if (!definition.fillable().isEmpty()) {
            return definition.fillable().contains(key);
        }
        if (definition.guarded().contains(EntityDefinition.GUARD_ALL)) {
            return false;
        }
        return !definition.guarded().contains(key);
    }

    // Relations

    /**
     * Materializes the map stored under {@code key} into a child entity using the registered
     * factory. The result replaces the raw map, so later calls return the same instance.
     *
     * @return the child, or {@code null} when the value is absent or no factory is registered
     */
    public <T extends Entity> T getRelation(String key, Class<T> type) {
        Object data = attributes.get(key);
        if (data == null) {
            return null;
        }
        if (type.isInstance(data)) {
            return type.cast(data);
        }
        if (!(data instanceof Map)) {
            return null;
        }
        Optional<Supplier<? extends Entity>> factory = definition().relationFor(key);
        if (factory.isEmpty()) {
            return null;
        }
        T model = materialize(factory.get(), (Map<?, ?>) data, type);
        if (model != null) {
            attributes.put(key, model);
        }
        return model;
    }

    /**
     * List form of {@link #getRelation}. Elements that are not maps are dropped.
     *
     * @return the children, or an empty list when the value is absent or no factory is registered
     */
    public <T extends Entity> List<T> getRelations(String key, Class<T> type) {
        Object data = attributes.get(key);
        if (!(data instanceof List)) {
            return new ArrayList<>();
        }
        List<?> items = (List<?>) data;
        if (!items.isEmpty() && items.stream().allMatch(type::isInstance)) {
            List<T> cached = new ArrayList<>();
            for (Object item : items) {
                cached.add(type.cast(item));
            }
            return cached;
        }
        Optional<Supplier<? extends Entity>> factory = definition().relationFor(key);
        if (factory.isEmpty()) {
            return new ArrayList<>();
        }
        List<T> models = new ArrayList<>();
        for (Object item : items) {
            if (item instanceof Map) {
                T model = materialize(factory.get(), (Map<?, ?>) item, type);
                if (model != null) {
                    models.add(model);
                }
            }
        }
        attributes.put(key, new ArrayList<>(models));
        return models;
    }

    private static <T extends Entity> T materialize(Supplier<? extends Entity> factory, Map<?, ?> data, Class<T> type) {
        Entity model = factory.get();
        if (!type.isInstance(model)) {
            return null;
        }
        model.setRawAttributes(stringKeys(data), true);
        model.setExists(true);
        return type.cast(model);
    }

    private static Map<String, Object> stringKeys(Map<?, ?> data) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : data.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return copy;
    }

    // Serialization

    public Entity makeHidden(String... keys) {
        runtimeHidden.addAll(Arrays.asList(keys));
        return this;
    }

    public Entity makeVisible(String... keys) {
        runtimeVisible.addAll(Arrays.asList(keys));
        return this;
    }

    public Entity append(String... keys) {
        runtimeAppends.addAll(Arrays.asList(keys));
        return this;
    }

    /**
     * Serializes the entity for presentation, honouring hidden, visible and appended keys.
     * Nested entities are serialized recursively and temporal values are formatted with
     * {@link Moment#CANONICAL_PATTERN}.
     */
    public Map<String, Object> toMap() {
        EntityDefinition definition = definition();

        Set<String> shown = new LinkedHashSet<>(definition.visible());
        shown.addAll(runtimeVisible);

        Set<String> hidden = new LinkedHashSet<>(definition.hidden());
        hidden.addAll(runtimeHidden);
        hidden.removeAll(shown);

        Map<String, Object> result = new LinkedHashMap<>();
        for (String key : attributes.keySet()) {
            if (!definition.visible().isEmpty() && !shown.contains(key)) {
                continue;
            }
            if (hidden.contains(key)) {
                continue;
            }
            result.put(key, serialize(getAttribute(key), false));
        }

        Set<String> appended = new LinkedHashSet<>(definition.appends());
        appended.addAll(runtimeAppends);
        for (String key : appended) {
            if (!result.containsKey(key) && !hidden.contains(key)) {
                result.put(key, serialize(getAttribute(key), false));
            }
        }
        return result;
    }

    /**
     * Serializes every attribute for the backing stores: same value conversion as
     * {@link #toMap()} but without visibility filtering or appended keys.
     */
    public Map<String, Object> toPersistableMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        for (String key : attributes.keySet()) {
            result.put(key, serialize(getAttribute(key), true));
        }
        return result;
    }

    private static Object serialize(Object value, boolean persistable) {
        if (value instanceof Entity) {
            Entity entity = (Entity) value;
            return persistable ? entity.toPersistableMap() : entity.toMap();
        }
        if (value instanceof Moment) {
            return ((Moment) value).format();
        }
        if (value instanceof List) {
            List<?> items = (List<?>) value;
            if (items.stream().noneMatch(Entity.class::isInstance)) {
                return value;
            }
            List<Object> serialized = new ArrayList<>();
            for (Object item : items) {
                serialized.add(serialize(item, persistable));
            }
            return serialized;
        }
        return value;
    }

    public String toJson() {
        return Json.encode(toMap());
    }

    // Dirty tracking

    /**
     * True when any attribute differs from the last synced snapshot.
     */
    public boolean isDirty() {
        for (String key : attributes.keySet()) {
            if (isDirty(key)) {
                return true;
            }
        }
        return false;
    }

    public boolean isDirty(String key) {
        return !Objects.equals(attributes.get(key), original.get(key));
    }

    public Map<String, Object> getDirty() {
        Map<String, Object> dirty = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : attributes.entrySet()) {
            if (isDirty(entry.getKey())) {
                dirty.put(entry.getKey(), entry.getValue());
            }
        }
        return dirty;
    }

    public void syncOriginal() {
        original.clear();
        original.putAll(attributes);
    }

    /**
     * Replaces the attribute map without casting or guarding. Used when hydrating from a store.
     */
    public void setRawAttributes(Map<String, ?> values, boolean sync) {
        attributes.clear();
        attributes.putAll(values);
        if (sync) {
            syncOriginal();
        }
    }

    // Persistence state

    public boolean exists() {
        return exists;
    }

    public void setExists(boolean exists) {
        this.exists = exists;
    }

    public boolean wasRecentlyCreated() {
        return recentlyCreated;
    }

    public void setRecentlyCreated(boolean recentlyCreated) {
        this.recentlyCreated = recentlyCreated;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + toJson() + ")";
    }
}
