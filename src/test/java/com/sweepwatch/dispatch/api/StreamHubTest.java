package com.sweepwatch.dispatch.api;

import com.sweepwatch.core.events.EventBus;
import com.sweepwatch.core.events.StreamEvent;
import com.sweepwatch.core.events.StreamEventType;
import com.sweepwatch.core.metrics.SweepMetrics;
import com.sweepwatch.core.model.SignalStrength;
import com.sweepwatch.core.model.SpectrumSample;
import com.sweepwatch.core.model.SweepPhase;
import com.sweepwatch.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link StreamHub}.
 */
class StreamHubTest {

    private MutableClock clock;
    private EventBus eventBus;
    private StreamProperties properties;
    private SimpleMeterRegistry registry;
    private StreamHub hub;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        eventBus = new EventBus();
        properties = new StreamProperties();
        properties.setHeartbeatIntervalMs(1000);
        properties.setEvictAfterMissedHeartbeats(4);
        properties.setSweepDataMinIntervalMs(0);
        registry = new SimpleMeterRegistry();
        hub = newHub();
    }

    @AfterEach
    void tearDown() {
        hub.stopHeartbeat();
    }

    private StreamHub newHub() {
        return new StreamHub(eventBus, properties, new SweepMetrics(registry), clock);
    }

    private static void await(BooleanSupplier condition, String what) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting for " + what);
            }
            Thread.sleep(5);
        }
    }

    private StreamEvent status(String message) {
        return new StreamEvent.Status(SweepPhase.RUNNING, null, message, clock.instant());
    }

    private StreamEvent sweepData(double peakDb, String source) {
        var sample = new SpectrumSample("2026-01-01", "00:00:00", 433_000_000L, 434_000_000L, 500_000, 10,
                List.of(peakDb), 0, 433.25, peakDb, 433.92, SignalStrength.fromPower(peakDb), clock.instant());
        return new StreamEvent.SweepData(sample, source, clock.instant());
    }

    private static List<String> messages(RecordingSink sink) {
        return sink.events.stream()
                .filter(e -> e instanceof StreamEvent.Status)
                .map(e -> ((StreamEvent.Status) e).message())
                .toList();
    }

    /** Records every event; optionally blocks on the first send until released. */
    static class RecordingSink implements EventSink {

        final List<StreamEvent> events = new CopyOnWriteArrayList<>();
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release;
        volatile boolean completed;
        volatile boolean failing;

        RecordingSink() {
            this(false);
        }

        RecordingSink(boolean blocking) {
            this.release = new CountDownLatch(blocking ? 1 : 0);
        }

        @Override
        public void send(StreamEvent event) throws IOException {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (failing) {
                throw new IOException("Broken pipe");
            }
            events.add(event);
        }

        @Override
        public void complete() {
            completed = true;
        }
    }

    @Nested
    @DisplayName("subscribe")
    class SubscribeTests {

        @Test
        @DisplayName("connected comes first, then the initial snapshot")
        void connectedFirst() throws Exception {
            var sink = new RecordingSink();

            hub.subscribe("c1", Set.of(), SubscriptionFilter.none(), sink, List.of(status("Current sweep state: IDLE")));

            await(() -> sink.events.size() == 2, "two events");
            var connected = assertInstanceOf(StreamEvent.Connected.class, sink.events.get(0));
            assertEquals("c1", connected.connectionId());
            assertEquals(List.of("Current sweep state: IDLE"), messages(sink));
            assertEquals(1, hub.subscriberCount());
        }

        @Test
        @DisplayName("unsubscribe completes the sink and removes the subscriber")
        void unsubscribe() {
            var sink = new RecordingSink();
            hub.subscribe("c1", Set.of(), SubscriptionFilter.none(), sink, List.of());

            hub.unsubscribe("c1");

            assertTrue(sink.completed);
            assertEquals(0, hub.subscriberCount());
            assertNull(registry.find("sweepwatch.stream.evictions").counter());
        }
    }

    @Nested
    @DisplayName("delivery")
    class DeliveryTests {

        @Test
        @DisplayName("each subscriber sees events in publish order")
        void preservesOrder() throws Exception {
            var sink = new RecordingSink();
            hub.subscribe("c1", Set.of(), SubscriptionFilter.none(), sink, List.of());

            for (int i = 0; i < 100; i++) {
                eventBus.publish(status("event-" + i));
            }

            await(() -> sink.events.size() == 101, "all events");
            List<String> received = messages(sink);
            for (int i = 0; i < 100; i++) {
                assertEquals("event-" + i, received.get(i));
            }
        }

        @Test
        @DisplayName("full queue drops events for the slow subscriber only")
        void dropsWhenFull() throws Exception {
            properties.setQueueCapacity(4);
            var slow = new RecordingSink(true);
            var fast = new RecordingSink();
            hub.subscribe("slow", Set.of(), SubscriptionFilter.none(), slow, List.of());
            hub.subscribe("fast", Set.of(), SubscriptionFilter.none(), fast, List.of());
            assertTrue(slow.entered.await(2, TimeUnit.SECONDS));

            for (int i = 0; i < 10; i++) {
                hub.publish(status("event-" + i));
            }

            await(() -> fast.events.size() == 11, "fast subscriber catches up");
            StreamSubscription slowSubscription = hub.subscriptions().stream()
                    .filter(s -> s.connectionId().equals("slow")).findFirst().orElseThrow();
            assertEquals(6, slowSubscription.droppedCount());
            assertEquals(6.0, registry.find("sweepwatch.stream.dropped_events")
                    .tag("type", "status").counter().count());

            slow.release.countDown();
            await(() -> slow.events.size() == 5, "slow subscriber drains");
            assertEquals(List.of("event-0", "event-1", "event-2", "event-3"), messages(slow));
        }

        @Test
        @DisplayName("a failing sink is removed and counted as an eviction")
        void failingSinkRemoved() throws Exception {
            var sink = new RecordingSink();
            sink.failing = true;

            hub.subscribe("c1", Set.of(), SubscriptionFilter.none(), sink, List.of());

            await(() -> hub.subscriberCount() == 0, "removal");
            assertTrue(sink.completed);
            assertEquals(1.0, registry.find("sweepwatch.stream.evictions")
                    .tag("reason", "send_failed").counter().count());
        }

        @Test
        @DisplayName("sendTo reaches one subscriber regardless of its filters")
        void sendTo() throws Exception {
            var sink = new RecordingSink();
            hub.subscribe("c1", Set.of(StreamEventType.STATUS), SubscriptionFilter.none(), sink, List.of());

            assertTrue(hub.sendTo("c1", sweepData(-40, "hackrf")));
            assertFalse(hub.sendTo("nobody", status("x")));

            await(() -> sink.events.size() == 2, "direct event");
            assertEquals(StreamEventType.SWEEP_DATA, sink.events.get(1).type());
        }

        @Test
        @DisplayName("sweep data is throttled per subscriber")
        void throttlesSweepData() throws Exception {
            properties.setSweepDataMinIntervalMs(50);
            var sink = new RecordingSink();
            hub.subscribe("c1", Set.of(), SubscriptionFilter.none(), sink, List.of());

            hub.publish(sweepData(-40, "hackrf"));
            hub.publish(sweepData(-41, "hackrf"));
            clock.advance(Duration.ofMillis(60));
            hub.publish(sweepData(-42, "hackrf"));

            await(() -> sink.events.size() == 3, "two sweep data events");
            Thread.sleep(50);
            assertEquals(3, sink.events.size());
        }
    }

    @Nested
    @DisplayName("filters")
    class FilterTests {

        @Test
        @DisplayName("type filter passes control events through")
        void typeFilter() throws Exception {
            var sink = new RecordingSink();
            hub.subscribe("c1", Set.of(StreamEventType.STATUS), SubscriptionFilter.none(), sink, List.of());

            hub.publish(sweepData(-40, "hackrf"));
            hub.publish(status("running"));
            hub.publish(new StreamEvent.ServerReset("reset", clock.instant()));

            await(() -> sink.events.size() == 3, "connected, status, reset");
            assertTrue(sink.events.stream().noneMatch(e -> e.type() == StreamEventType.SWEEP_DATA));
        }

        @Test
        @DisplayName("minimum signal and device type filters apply to sweep data")
        void signalAndSourceFilters() throws Exception {
            var sink = new RecordingSink();
            hub.subscribe("c1", Set.of(), new SubscriptionFilter(-60.0, Set.of("hackrf")), sink, List.of());

            hub.publish(sweepData(-80, "hackrf"));
            hub.publish(sweepData(-40, "rtlsdr"));
            hub.publish(sweepData(-40, "hackrf"));

            await(() -> sink.events.size() == 2, "one sweep data event");
            Thread.sleep(50);
            var data = assertInstanceOf(StreamEvent.SweepData.class, sink.events.get(1));
            assertEquals(-40.0, data.peakPowerDb());
            assertEquals(2, sink.events.size());
        }
    }

    @Nested
    @DisplayName("heartbeat and eviction")
    class HeartbeatTests {

        @Test
        @DisplayName("heartbeat carries uptime and the subscriber's own connection id")
        void heartbeat() throws Exception {
            var a = new RecordingSink();
            var b = new RecordingSink();
            hub.subscribe("a", Set.of(StreamEventType.STATUS), SubscriptionFilter.none(), a, List.of());
            hub.subscribe("b", Set.of(), SubscriptionFilter.none(), b, List.of());
            clock.advance(Duration.ofSeconds(15));

            hub.sendHeartbeats();

            await(() -> a.events.size() == 2 && b.events.size() == 2, "heartbeats");
            var heartbeat = assertInstanceOf(StreamEvent.Heartbeat.class, a.events.get(1));
            assertEquals("a", heartbeat.connectionId());
            assertEquals(15000, heartbeat.uptimeMs());
            assertEquals("b", ((StreamEvent.Heartbeat) b.events.get(1)).connectionId());
        }

        @Test
        @DisplayName("subscriber with no successful send is evicted after missed heartbeats")
        void evictsStale() throws Exception {
            var stuck = new RecordingSink(true);
            var healthy = new RecordingSink();
            hub.subscribe("stuck", Set.of(), SubscriptionFilter.none(), stuck, List.of());
            hub.subscribe("healthy", Set.of(), SubscriptionFilter.none(), healthy, List.of());
            await(() -> healthy.events.size() == 1, "healthy connected");

            clock.advance(Duration.ofSeconds(3));
            Instant heartbeatAt = clock.instant();
            hub.sendHeartbeats();
            StreamSubscription healthySubscription = hub.subscriptions().stream()
                    .filter(s -> s.connectionId().equals("healthy")).findFirst().orElseThrow();
            await(() -> heartbeatAt.equals(healthySubscription.lastSentAt()), "healthy heartbeat sent");
            clock.advance(Duration.ofSeconds(2));

            assertEquals(1, hub.evictStale());

            assertTrue(stuck.completed);
            assertEquals(List.of("healthy"), hub.subscriptions().stream().map(StreamSubscription::connectionId).toList());
            assertEquals(1.0, registry.find("sweepwatch.stream.evictions").tag("reason", "stale").counter().count());
            stuck.release.countDown();
        }

        @Test
        @DisplayName("subscriber gauge tracks live subscriptions")
        void gauge() {
            hub.subscribe("c1", Set.of(), SubscriptionFilter.none(), new RecordingSink(), List.of());
            hub.subscribe("c2", Set.of(), SubscriptionFilter.none(), new RecordingSink(), List.of());

            assertEquals(2.0, registry.find("sweepwatch.stream.subscribers").gauge().value());
        }
    }
}
