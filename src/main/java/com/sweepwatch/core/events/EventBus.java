package com.sweepwatch.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus carrying {@link StreamEvent}s from the sweep core to the stream layer.
 * <p>
 * Supports per-type subscriptions and global subscriptions that receive every event.
 * Delivery happens on the publishing thread, so subscribers must not block.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<StreamEventType, CopyOnWriteArrayList<Consumer<StreamEvent>>> typeSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<StreamEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (type-specific first, then global).
     *
     * @param event the event to publish
     */
    public void publish(StreamEvent event) {
        if (event.type() != StreamEventType.SWEEP_DATA) {
            log.debug("Publishing event: {}", event.type().wireName());
        }

        List<Consumer<StreamEvent>> typeSubs = typeSubscribers.get(event.type());
        if (typeSubs != null) {
            for (Consumer<StreamEvent> subscriber : typeSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<StreamEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of one type.
     *
     * @param type     the event type of interest
     * @param consumer callback invoked for each matching event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(StreamEventType type, Consumer<StreamEvent> consumer) {
        typeSubscribers.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to {}", type.wireName());
        return () -> {
            CopyOnWriteArrayList<Consumer<StreamEvent>> subs = typeSubscribers.get(type);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to every event regardless of type.
     *
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<StreamEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<StreamEvent> subscriber, StreamEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.type().wireName(), e.getMessage(), e);
        }
    }
}
