package com.sweepwatch.dispatch.api;

import com.sweepwatch.core.events.StreamEvent;
import com.sweepwatch.core.events.StreamEventType;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One live stream connection: what it wants, its bounded outbound queue, and delivery bookkeeping.
 * At most one worker drains the queue at a time, which keeps per-subscriber order.
 */
public final class StreamSubscription {

    private final String connectionId;
    private final Set<StreamEventType> subscribedTypes;
    private final SubscriptionFilter filter;
    private final EventSink sink;
    private final Instant createdAt;

    final BlockingQueue<StreamEvent> queue;
    final AtomicBoolean draining = new AtomicBoolean();
    final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicLong dropped = new AtomicLong();

    private volatile Instant lastSentAt;
    volatile Instant lastSweepDataAt;

    StreamSubscription(String connectionId, Set<StreamEventType> subscribedTypes, SubscriptionFilter filter,
                       EventSink sink, int capacity, Instant createdAt) {
        this.connectionId = connectionId;
        this.subscribedTypes = subscribedTypes == null ? Set.of() : Set.copyOf(subscribedTypes);
        this.filter = filter == null ? SubscriptionFilter.none() : filter;
        this.sink = sink;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.createdAt = createdAt;
        this.lastSentAt = createdAt;
    }

    /**
     * Whether this subscriber should receive the event. Control events always pass; an empty type
     * set means every type.
     */
    public boolean wants(StreamEvent event) {
        if (event.type().isControl()) {
            return true;
        }
        if (!subscribedTypes.isEmpty() && !subscribedTypes.contains(event.type())) {
            return false;
        }
        return filter.matches(event);
    }

    void markSent(Instant at) {
        lastSentAt = at;
    }

    long recordDrop() {
        return dropped.incrementAndGet();
    }

    EventSink sink() {
        return sink;
    }

    public String connectionId() { return connectionId; }
    public Set<StreamEventType> subscribedTypes() { return subscribedTypes; }
    public SubscriptionFilter filter() { return filter; }
    public Instant createdAt() { return createdAt; }
    public Instant lastSentAt() { return lastSentAt; }
    public long droppedCount() { return dropped.get(); }
    public int queuedCount() { return queue.size(); }
    public boolean isClosed() { return closed.get(); }
}
