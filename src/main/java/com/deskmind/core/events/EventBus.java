package com.deskmind.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans task progress events out to in-process listeners, such as the CLI's verbose output.
 * <p>
 * Delivery is synchronous on the publishing thread, which may be a tool worker. A
 * listener that throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Consumer<DeskmindEvent>> listeners = new CopyOnWriteArrayList<>();

    public void publish(DeskmindEvent event) {
        log.debug("Event {} for task {} (subtask {})", event.eventType(), event.taskId(), event.subtaskIndex());
        for (Consumer<DeskmindEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {} for task {}: {}", event.eventType(), event.taskId(), e.getMessage(), e);
            }
        }
    }

    /** Registers {@code listener} for every event until the returned subscription is closed. */
    public Subscription subscribe(Consumer<DeskmindEvent> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /** Registration handle; closing it twice is harmless. */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {

        Subscription NONE = () -> { };

        @Override
        void close();
    }
}
