package com.flowcode.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-memory pub/sub for task events. Every listener carries a filter over
 * {@link FlowcodeEvent}; a task subscription is the filter
 * {@code event.belongsTo(taskId)}.
 * <p>
 * Listeners are called on the publishing thread in registration order. A listener
 * that throws is logged and skipped, the others still receive the event.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private record Listener(Predicate<FlowcodeEvent> filter, Consumer<FlowcodeEvent> consumer) {
    }

    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    public void publish(FlowcodeEvent event) {
        int delivered = 0;
        for (Listener listener : listeners) {
            if (listener.filter().test(event)) {
                deliverSafely(listener.consumer(), event);
                delivered++;
            }
        }
        log.debug("Published {} for task {} to {} listener(s)", event.eventType(), event.taskId(), delivered);
    }

    /**
     * Events of one task. Events published without a task id never match.
     */
    public Subscription subscribe(String taskId, Consumer<FlowcodeEvent> consumer) {
        Objects.requireNonNull(taskId, "taskId");
        return subscribe(event -> event.belongsTo(taskId), consumer);
    }

    /**
     * Every event, whatever task it belongs to.
     */
    public Subscription subscribeAll(Consumer<FlowcodeEvent> consumer) {
        return subscribe(event -> true, consumer);
    }

    public Subscription subscribe(Predicate<FlowcodeEvent> filter, Consumer<FlowcodeEvent> consumer) {
        var listener = new Listener(filter, consumer);
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    int listenerCount() {
        return listeners.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<FlowcodeEvent> consumer, FlowcodeEvent event) {
        try {
            consumer.accept(event);
        } catch (Exception e) {
            log.warn("Listener failed on {} for task {}: {}", event.eventType(), event.taskId(), e.getMessage(), e);
        }
    }
}
