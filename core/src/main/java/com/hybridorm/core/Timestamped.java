package com.hybridorm.core;

/**
 * Opt-in capability for entities that maintain {@code created_at} / {@code updated_at} columns.
 * <p>
 * Implemented by an {@link Entity} subclass; the abstract methods are satisfied by
 * {@code Entity} itself. The persistence coordinator calls {@link #updateTimestamps()}
 * before every save.
 */
public interface Timestamped {

    boolean exists();

    boolean isDirty(String key);

    Object getAttribute(String key);

    void setAttribute(String key, Object value);

    default boolean timestamps() {
        return true;
    }

    default String createdAtColumn() {
        return "created_at";
    }

    default String updatedAtColumn() {
        return "updated_at";
    }

    default Moment freshTimestamp() {
        return Moment.now();
    }

    default Moment createdAt() {
        return asMoment(getAttribute(createdAtColumn()));
    }

    default Moment updatedAt() {
        return asMoment(getAttribute(updatedAtColumn()));
    }

    /**
     * Stamps {@link #updatedAtColumn()} on every call, and {@link #createdAtColumn()} only for
     * entities that do not exist yet and whose creation time was not set by hand.
     */
    default void updateTimestamps() {
        if (!timestamps()) {
            return;
        }
        Moment time = freshTimestamp();
        setAttribute(updatedAtColumn(), time);
        if (!exists() && !isDirty(createdAtColumn())) {
            setAttribute(createdAtColumn(), time);
        }
    }

    default void touch() {
        if (timestamps()) {
            setAttribute(updatedAtColumn(), freshTimestamp());
        }
    }

    private static Moment asMoment(Object value) {
        if (value instanceof String || Moment.isTemporal(value)) {
            return Moment.from(value);
        }
        return null;
    }
}
