package com.hybridorm.core;

/**
 * Receives lifecycle signals from the persistence coordinator. Implementations must not
 * throw; the coordinator does not wait on or react to listeners.
 */
@FunctionalInterface
public interface EventSink {
    EventSink NONE = event -> { };

    void fire(EntityEvent event);
}
