package com.sweepwatch.dispatch.api;

import com.sweepwatch.core.events.EventBus;
import com.sweepwatch.core.events.StreamEvent;
import com.sweepwatch.core.events.StreamEventType;
import com.sweepwatch.core.logging.MdcContext;
import com.sweepwatch.core.metrics.SweepMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans {@link StreamEvent}s out to every live stream subscription.
 * <p>
 * Each subscription has a bounded FIFO queue drained by at most one delivery worker at a time,
 * so one subscriber's events are never reordered and a slow subscriber never blocks the others.
 * When a queue is full the event is dropped for that subscriber and counted.
 * <p>
 * A heartbeat carrying server uptime and the connection id goes to every subscriber at a fixed
 * interval. Subscriptions with no successful send for {@code heartbeat x missed} are evicted, as
 * are subscriptions whose sink fails.
 */
@Service
public class StreamHub {

    private static final Logger log = LoggerFactory.getLogger(StreamHub.class);

    private final StreamProperties properties;
    private final SweepMetrics metrics;
    private final Clock clock;
    private final Instant startedAt;
    private final ExecutorService deliveryExecutor;

    private final ConcurrentHashMap<String, StreamSubscription> subscriptions = new ConcurrentHashMap<>();
    private final AtomicLong connectionCounter = new AtomicLong();
    private final AtomicInteger workerCounter = new AtomicInteger();

    /** Scheduler for heartbeats and stale-subscriber eviction. */
    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "stream-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public StreamHub(EventBus eventBus, StreamProperties properties, SweepMetrics metrics) {
        this(eventBus, properties, metrics, Clock.systemUTC());
    }

    StreamHub(EventBus eventBus, StreamProperties properties, SweepMetrics metrics, Clock clock) {
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.deliveryExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "stream-delivery-" + workerCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        eventBus.subscribeAll(this::publish);
        metrics.registerSubscriberGauge(this, StreamHub::subscriberCount);
    }

    @PostConstruct
    void startHeartbeat() {
        long interval = properties.getHeartbeatIntervalMs();
        heartbeatScheduler.scheduleAtFixedRate(this::heartbeatAndEvict, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Stream heartbeat started (interval={}ms, evict after {}ms)", interval, properties.getEvictAfterMs());
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        for (StreamSubscription subscription : List.copyOf(subscriptions.values())) {
            remove(subscription, "shutdown");
        }
        deliveryExecutor.shutdownNow();
        log.info("Stream hub stopped");
    }

    /**
     * Creates an SSE emitter subscribed to the given event types.
     *
     * @param types   event types wanted, empty for all
     * @param filter  sweep data filters
     * @param initial events delivered right after {@code connected}, such as a status snapshot
     */
    public SseEmitter createEmitter(Set<StreamEventType> types, SubscriptionFilter filter, List<StreamEvent> initial) {
        SseEmitter emitter = new SseEmitter(properties.getEmitterTimeoutMs());
        String connectionId = nextConnectionId();
        StreamSubscription subscription = subscribe(connectionId, types, filter, new SseEventSink(emitter), initial);

        emitter.onCompletion(() -> remove(subscription, "completed"));
        emitter.onTimeout(() -> remove(subscription, "timeout"));
        emitter.onError(ex -> {
            log.debug("SSE emitter error for {}: {}", connectionId, ex.getMessage());
            remove(subscription, "error");
        });
        return emitter;
    }

    /**
     * Registers a subscriber. The first event it receives is {@code connected}, followed by
     * {@code initial}.
     */
    public StreamSubscription subscribe(String connectionId, Set<StreamEventType> types, SubscriptionFilter filter,
                                        EventSink sink, List<StreamEvent> initial) {
        StreamSubscription subscription = new StreamSubscription(connectionId, types, filter, sink,
                properties.getQueueCapacity(), clock.instant());
        subscriptions.put(connectionId, subscription);
        MdcContext.setConnection(connectionId);
        log.info("Stream subscriber connected: {} (types={}, total={})", connectionId,
                types == null || types.isEmpty() ? "all" : types, subscriptions.size());
        MdcContext.clear();

        enqueue(subscription, new StreamEvent.Connected(connectionId, clock.instant()));
        for (StreamEvent event : initial) {
            enqueue(subscription, event);
        }
        return subscription;
    }

    /**
     * Offers the event to every subscription that wants it.
     */
    public void publish(StreamEvent event) {
        boolean sweepData = event.type() == StreamEventType.SWEEP_DATA;
        long minGap = properties.getSweepDataMinIntervalMs();
        Instant now = sweepData && minGap > 0 ? clock.instant() : null;

        for (StreamSubscription subscription : subscriptions.values()) {
            if (!subscription.wants(event)) {
                continue;
            }
            if (now != null) {
                Instant last = subscription.lastSweepDataAt;
                if (last != null && Duration.between(last, now).toMillis() < minGap) {
                    continue;
                }
                subscription.lastSweepDataAt = now;
            }
            enqueue(subscription, event);
        }
    }

    /**
     * Delivers an event to one subscriber, bypassing its filters.
     *
     * @return false if no such subscriber exists
     */
    public boolean sendTo(String connectionId, StreamEvent event) {
        StreamSubscription subscription = subscriptions.get(connectionId);
        if (subscription == null) {
            return false;
        }
        enqueue(subscription, event);
        return true;
    }

    public void unsubscribe(String connectionId) {
        StreamSubscription subscription = subscriptions.get(connectionId);
        if (subscription != null) {
            remove(subscription, "unsubscribed");
        }
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    public List<StreamSubscription> subscriptions() {
        return List.copyOf(subscriptions.values());
    }

    public long uptimeMs() {
        return Duration.between(startedAt, clock.instant()).toMillis();
    }

    /**
     * Sends a heartbeat to every subscriber.
     */
    public void sendHeartbeats() {
        long uptime = uptimeMs();
        Instant now = clock.instant();
        for (StreamSubscription subscription : subscriptions.values()) {
            enqueue(subscription, new StreamEvent.Heartbeat(uptime, subscription.connectionId(), now));
        }
    }

    /**
     * Evicts subscriptions whose last successful send is older than the eviction timeout.
     *
     * @return number evicted
     */
    public int evictStale() {
        Instant now = clock.instant();
        long limit = properties.getEvictAfterMs();
        List<StreamSubscription> stale = new ArrayList<>();
        for (StreamSubscription subscription : subscriptions.values()) {
            if (Duration.between(subscription.lastSentAt(), now).toMillis() > limit) {
                stale.add(subscription);
            }
        }
        for (StreamSubscription subscription : stale) {
            log.info("Evicting stale subscriber {} (last send {})", subscription.connectionId(),
                    subscription.lastSentAt());
            remove(subscription, "stale");
        }
        return stale.size();
    }

    private void heartbeatAndEvict() {
        try {
            evictStale();
            sendHeartbeats();
        } catch (Exception e) {
            log.error("Heartbeat cycle failed: {}", e.getMessage(), e);
        }
    }

    private String nextConnectionId() {
        return "sse-" + clock.millis() + "-" + connectionCounter.incrementAndGet();
    }

    private void enqueue(StreamSubscription subscription, StreamEvent event) {
        if (subscription.isClosed()) {
            return;
        }
        if (!subscription.queue.offer(event)) {
            long dropped = subscription.recordDrop();
            metrics.recordDroppedEvent(event.type().wireName());
            if (dropped == 1 || dropped % 100 == 0) {
                log.warn("Subscriber {} queue full; dropped {} event(s) so far", subscription.connectionId(), dropped);
            }
            return;
        }
        if (subscription.draining.compareAndSet(false, true)) {
            deliveryExecutor.execute(() -> drain(subscription));
        }
    }

    private void drain(StreamSubscription subscription) {
        while (true) {
            StreamEvent event;
            while ((event = subscription.queue.poll()) != null) {
                if (subscription.isClosed()) {
                    return;
                }
                try {
                    subscription.sink().send(event);
                    subscription.markSent(clock.instant());
                } catch (IOException | IllegalStateException e) {
                    log.debug("Send to {} failed: {}", subscription.connectionId(), e.getMessage());
                    remove(subscription, "send_failed");
                    return;
                } catch (RuntimeException e) {
                    log.warn("Sink for {} threw: {}", subscription.connectionId(), e.getMessage(), e);
                    remove(subscription, "send_failed");
                    return;
                }
            }
            subscription.draining.set(false);
            if (subscription.queue.isEmpty() || !subscription.draining.compareAndSet(false, true)) {
                return;
            }
        }
    }

    private void remove(StreamSubscription subscription, String reason) {
        if (!subscription.closed.compareAndSet(false, true)) {
            return;
        }
        subscriptions.remove(subscription.connectionId(), subscription);
        subscription.queue.clear();
        try {
            subscription.sink().complete();
        } catch (Exception e) {
            log.debug("Completing sink for {} failed: {}", subscription.connectionId(), e.getMessage());
        }
        if (!"completed".equals(reason) && !"unsubscribed".equals(reason)) {
            metrics.recordEviction(reason);
        }
        log.info("Stream subscriber {} removed ({}, {} remaining)", subscription.connectionId(), reason,
                subscriptions.size());
    }
}
