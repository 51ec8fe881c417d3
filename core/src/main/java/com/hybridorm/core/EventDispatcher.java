package com.hybridorm.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * An {@link EventSink} that fans each event out to the listeners registered for its type.
 * A listener that throws is logged and skipped.
 */
public class EventDispatcher implements EventSink {
    private static final Logger logger = LoggerFactory.getLogger(EventDispatcher.class);

    private final Map<LifecycleEvent, List<Consumer<EntityEvent>>> listeners = new EnumMap<>(LifecycleEvent.class);

    public synchronized EventDispatcher listen(LifecycleEvent type, Consumer<EntityEvent> listener) {
        listeners.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>()).add(listener);
        return this;
    }

    public synchronized void clear() {
        listeners.clear();
    }

    @Override
    public void fire(EntityEvent event) {
        List<Consumer<EntityEvent>> registered;
        synchronized (this) {
            registered = listeners.get(event.type());
        }
        if (registered == null) {
            return;
        }
        for (Consumer<EntityEvent> listener : registered) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                logger.error("Listener for {} on {} failed", event.type(), event.entity().getClass().getSimpleName(), e);
            }
        }
    }
}
