package com.sweepwatch.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.ToDoubleFunction;

/**
 * Centralised Micrometer metrics for sweep supervision and streaming.
 */
@Service
public class SweepMetrics {

    private final MeterRegistry registry;

    public SweepMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSpawn(boolean success) {
        Counter.builder("sweepwatch.process.spawns")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    /**
     * Time from spawn until the sweep settled into RUNNING.
     */
    public void recordSettleDuration(long ms) {
        Timer.builder("sweepwatch.sweep.settle.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordFrequencySwitch() {
        Counter.builder("sweepwatch.sweep.frequency_switches")
                .register(registry)
                .increment();
    }

    public void recordRecovery(String strategy) {
        Counter.builder("sweepwatch.recovery.attempts")
                .tag("strategy", strategy)
                .register(registry)
                .increment();
    }

    public void recordEscalation(String kind) {
        Counter.builder("sweepwatch.recovery.escalations")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordBlacklist() {
        Counter.builder("sweepwatch.recovery.blacklisted_frequencies")
                .description("Frequencies removed from the cycle after repeated startup failures")
                .register(registry)
                .increment();
    }

    public void recordEmergencyStop(int remainingProcesses) {
        Counter.builder("sweepwatch.sweep.emergency_stops")
                .register(registry)
                .increment();
        DistributionSummary.builder("sweepwatch.sweep.emergency_stop.remaining")
                .description("Sweep processes still alive after an emergency stop")
                .register(registry)
                .record(remainingProcesses);
    }

    /**
     * Records a reconciliation that changed believed state.
     *
     * @param source "manual" or "self-check"
     */
    public void recordStateSync(String source, int changes) {
        Counter.builder("sweepwatch.sweep.state_syncs")
                .tag("source", source)
                .register(registry)
                .increment();
        DistributionSummary.builder("sweepwatch.sweep.state_sync.changes")
                .tag("source", source)
                .register(registry)
                .record(changes);
    }

    public void recordSamples(int count) {
        Counter.builder("sweepwatch.stream.samples")
                .register(registry)
                .increment(count);
    }

    public void recordDroppedEvent(String eventType) {
        Counter.builder("sweepwatch.stream.dropped_events")
                .description("Events dropped because a subscriber queue was full")
                .tag("type", eventType)
                .register(registry)
                .increment();
    }

    public void recordEviction(String reason) {
        Counter.builder("sweepwatch.stream.evictions")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public <T> void registerSubscriberGauge(T source, ToDoubleFunction<T> count) {
        Gauge.builder("sweepwatch.stream.subscribers", source, count)
                .description("Active stream subscriptions")
                .register(registry);
    }
}
