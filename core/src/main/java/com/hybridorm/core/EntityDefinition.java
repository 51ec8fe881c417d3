package com.hybridorm.core;

import java.util.*;
import java.util.function.Supplier;

/**
 * Per-type persistence configuration for an {@link Entity}.
 * <p>
 * Instances are immutable and intended to be held in a {@code static final} field of the
 * entity class, so every instance of a type shares one definition.
 *
 * @param table      local table name
 * @param resource   remote resource name
 * @param primaryKey primary key attribute, {@code id} unless overridden
 * @param fillable   mass-assignment allowlist; wins over {@code guarded} when non-empty
 * @param guarded    mass-assignment denylist, {@code *} guards everything
 * @param casts      attribute name to cast kind
 * @param relations  attribute name to child entity factory
 * @param hidden     attributes dropped from {@link Entity#toMap()}
 * @param visible    when non-empty, the only attributes {@link Entity#toMap()} emits
 * @param appends    computed attributes added to {@link Entity#toMap()}
 * @param useLocal   persist to the local store
 * @param useRemote  persist to the remote resource
 */
public record EntityDefinition(
        String table,
        String resource,
        String primaryKey,
        List<String> fillable,
        List<String> guarded,
        Map<String, CastKind> casts,
        Map<String, Supplier<? extends Entity>> relations,
        Set<String> hidden,
        Set<String> visible,
        Set<String> appends,
        boolean useLocal,
        boolean useRemote
) {
    public static final String GUARD_ALL = "*";

    public EntityDefinition {
        Objects.requireNonNull(primaryKey, "primaryKey");
        fillable = List.copyOf(fillable);
        guarded = List.copyOf(guarded);
        casts = Collections.unmodifiableMap(new LinkedHashMap<>(casts));
        relations = Collections.unmodifiableMap(new LinkedHashMap<>(relations));
        hidden = Collections.unmodifiableSet(new LinkedHashSet<>(hidden));
        visible = Collections.unmodifiableSet(new LinkedHashSet<>(visible));
        appends = Collections.unmodifiableSet(new LinkedHashSet<>(appends));
    }

    public CastKind castFor(String key) {
        return casts.getOrDefault(key, CastKind.NONE);
    }

    public Optional<Supplier<? extends Entity>> relationFor(String key) {
        return Optional.ofNullable(relations.get(key));
    }

    /**
     * @param table used as both the table and the resource name unless {@link Builder#resource(String)} is set
     */
    public static Builder builder(String table) {
        return new Builder(table);
    }

    public static class Builder {
        private final String table;
        private String resource;
        private String primaryKey = "id";
        private final List<String> fillable = new ArrayList<>();
        private final List<String> guarded = new ArrayList<>(List.of(GUARD_ALL));
        private boolean guardedDeclared = false;
        private final Map<String, CastKind> casts = new LinkedHashMap<>();
        private final Map<String, Supplier<? extends Entity>> relations = new LinkedHashMap<>();
        private final Set<String> hidden = new LinkedHashSet<>();
        private final Set<String> visible = new LinkedHashSet<>();
        private final Set<String> appends = new LinkedHashSet<>();
        private boolean useLocal = true;
        private boolean useRemote = true;

        private Builder(String table) {
            this.table = table;
        }

        public Builder resource(String resource) {
            this.resource = resource;
            return this;
        }

        public Builder primaryKey(String primaryKey) {
            this.primaryKey = primaryKey;
            return this;
        }

        public Builder fillable(String... keys) {
            fillable.addAll(Arrays.asList(keys));
            return this;
        }

        /**
         * Replaces the default {@code *} guard. Calling with no arguments leaves every key fillable.
         */
        public Builder guarded(String... keys) {
            if (!guardedDeclared) {
                guarded.clear();
                guardedDeclared = true;
            }
            guarded.addAll(Arrays.asList(keys));
            return this;
        }

        public Builder cast(String key, CastKind kind) {
            casts.put(key, kind);
            return this;
        }

        public Builder cast(String key, String kind) {
            return cast(key, CastKind.fromName(kind));
        }

        public Builder relation(String key, Supplier<? extends Entity> factory) {
            relations.put(key, factory);
            return this;
        }

        public Builder hidden(String... keys) {
            hidden.addAll(Arrays.asList(keys));
            return this;
        }

        public Builder visible(String... keys) {
            visible.addAll(Arrays.asList(keys));
            return this;
        }

        public Builder appends(String... keys) {
            appends.addAll(Arrays.asList(keys));
            return this;
        }

        public Builder useLocal(boolean useLocal) {
            this.useLocal = useLocal;
            return this;
        }

        public Builder useRemote(boolean useRemote) {
            this.useRemote = useRemote;
            return this;
        }

        public EntityDefinition build() {
            return new EntityDefinition(
                    table,
                    resource != null ? resource : table,
                    primaryKey,
                    fillable,
                    guarded,
                    casts,
                    relations,
                    hidden,
                    visible,
                    appends,
                    useLocal,
                    useRemote);
        }
    }
}
