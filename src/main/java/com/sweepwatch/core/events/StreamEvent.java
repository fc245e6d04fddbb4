package com.sweepwatch.core.events;

import com.sweepwatch.core.model.FrequencySpec;
import com.sweepwatch.core.model.SpectrumSample;
import com.sweepwatch.core.model.SweepConfig;
import com.sweepwatch.core.model.SweepPhase;
import com.sweepwatch.core.model.SweepState;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed telemetry and control events pushed to dashboard subscribers.
 * <p>
 * Each event knows its wire tag and renders a JSON-friendly payload; the
 * {@code timestamp} field is always included.
 */
public sealed interface StreamEvent {

    StreamEventType type();

    Instant timestamp();

    Map<String, Object> body();

    default Map<String, Object> payload() {
        Map<String, Object> data = new LinkedHashMap<>(body());
        data.put("timestamp", timestamp().toEpochMilli());
        return data;
    }

    record Connected(String connectionId, Instant timestamp) implements StreamEvent {
        public StreamEventType type() { return StreamEventType.CONNECTED; }

        public Map<String, Object> body() {
            return Map.of("connectionId", connectionId, "message", "Connected to sweep data stream");
        }
    }

    /**
     * A parsed spectrum block. {@code source} identifies the device family that produced it.
     */
    record SweepData(SpectrumSample sample, String source, Instant timestamp) implements StreamEvent {
        public StreamEventType type() { return StreamEventType.SWEEP_DATA; }

        public double peakPowerDb() {
            return sample.peakPowerDb();
        }

        public Map<String, Object> body() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("frequency", sample.peakFrequencyMhz());
            data.put("power", sample.peakPowerDb());
            data.put("powerLevels", sample.powerDb());
            data.put("startFreq", sample.lowHz());
            data.put("endFreq", sample.highHz());
            data.put("binSize", sample.binWidthHz());
            data.put("centerFrequency", sample.centerMhz());
            data.put("signalStrength", sample.signalStrength().label());
            data.put("source", source);
            return data;
        }
    }

    record Status(SweepPhase phase, Double progress, String message, Instant timestamp) implements StreamEvent {
        public StreamEventType type() { return StreamEventType.STATUS; }

        public Map<String, Object> body() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("phase", phase.name());
            data.put("running", phase.expectsProcess());
            if (progress != null) {
                data.put("progress", progress);
            }
            data.put("message", message);
            return data;
        }
    }

    record CycleConfig(SweepConfig config, int currentIndex, Instant timestamp) implements StreamEvent {
        public StreamEventType type() { return StreamEventType.CYCLE_CONFIG; }

        public Map<String, Object> body() {
            List<Map<String, Object>> freqs = config.frequencies().stream()
                    .map(StreamEvent::frequencyMap)
                    .toList();
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("frequencies", freqs);
            data.put("currentIndex", currentIndex);
            data.put("cycleTimeMs", config.cycleTimeMs());
            data.put("isCycling", config.isMultiFrequency());
            return data;
        }
    }

    record Heartbeat(long uptimeMs, String connectionId, Instant timestamp) implements StreamEvent {
        public StreamEventType type() { return StreamEventType.HEARTBEAT; }

        public Map<String, Object> body() {
            return Map.of("uptime", uptimeMs, "connectionId", connectionId);
        }
    }

    record RecoveryStart(String reason, int attempt, int maxAttempts, String strategy, long delayMs,
                         Instant timestamp) implements StreamEvent {
        public StreamEventType type() { return StreamEventType.RECOVERY_START; }

        public Map<String, Object> body() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("reason", reason);
            data.put("attempt", attempt);
            data.put("maxAttempts", maxAttempts);
            data.put("strategy", strategy);
            data.put("delayMs", delayMs);
            return data;
        }
    }

    record RecoveryComplete(int attempts, Instant timestamp) implements StreamEvent {
        public StreamEventType type() { return StreamEventType.RECOVERY_COMPLETE; }

        public Map<String, Object> body() {
            return Map.of("attempts", attempts, "message", "Sweep recovered");
        }
    }

    record SweepError(String message, String kind, Instant timestamp) implements StreamEvent {
        public StreamEventType type() { return StreamEventType.ERROR; }

        public Map<String, Object> body() {
            return Map.of("message", message, "kind", kind);
        }
    }

    record StateSync(SweepState before, SweepState after, List<String> changes, Instant timestamp)
            implements StreamEvent {
        public StateSync {
            changes = List.copyOf(changes);
        }

        public StreamEventType type() { return StreamEventType.STATE_SYNC; }

        public Map<String, Object> body() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("before", before.phase().name());
            data.put("after", after.phase().name());
            data.put("changes", changes);
            return data;
        }
    }

    record ServerReset(String message, Instant timestamp) implements StreamEvent {
        public StreamEventType type() { return StreamEventType.SERVER_RESET; }

        public Map<String, Object> body() {
            return Map.of("message", message);
        }
    }

    private static Map<String, Object> frequencyMap(FrequencySpec spec) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("centerMhz", spec.centerMhz());
        f.put("spanMhz", spec.spanMhz());
        f.put("binWidthHz", spec.binWidthHz());
        return f;
    }
}
