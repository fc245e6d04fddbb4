package com.sweepwatch.core.recovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Decides how the sweep reacts to failures.
 * <p>
 * Strategies escalate with the consecutive failure count: wait-and-retry, then aggressive
 * cleanup, then a device reset cooldown, and finally an extended cooldown that escalates to the
 * operator. A frequency that fails to start {@code blacklistThreshold} times is blacklisted.
 * Retries are capped per rolling minute; once the cap is hit every error escalates until the
 * window clears or an operator resets recovery.
 * <p>
 * Calls normally arrive on the sweep supervisor thread; methods are synchronized so status
 * snapshots can be read from request threads.
 */
@Service
public class RecoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(RecoveryEngine.class);

    private static final Duration RATE_WINDOW = Duration.ofMinutes(1);

    private final RecoveryProperties properties;
    private final Clock clock;
    private final FailureRateLimiter rateLimiter;

    private final Map<Integer, Integer> startupFailuresByFrequency = new HashMap<>();
    private final Set<Integer> blacklisted = new HashSet<>();

    private int consecutiveFailures;
    private int backoffLevel;
    private Instant lastKnownGood;
    private DeviceStatus deviceStatus = DeviceStatus.UNKNOWN;
    private ErrorKind lastErrorKind;

    @Autowired
    public RecoveryEngine(RecoveryProperties properties) {
        this(properties, Clock.systemUTC());
    }

    public RecoveryEngine(RecoveryProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.rateLimiter = new FailureRateLimiter(clock, properties.getMaxRetriesPerMinute(), RATE_WINDOW);
    }

    /**
     * Records a failure and returns what to do about it.
     */
    public synchronized RecoveryDecision decide(ErrorContext context) {
        ErrorAnalysis analysis = ErrorAnalysis.of(context.message());
        consecutiveFailures++;
        lastErrorKind = analysis.kind();
        deviceStatus = analysis.kind().deviceStatus();

        if (!analysis.recoverable()) {
            log.error("Non-recoverable error ({}): {}", analysis.kind().wireName(), context.message());
            return new RecoveryDecision.Escalate(
                    "Non-recoverable error: " + context.message() + ". " + analysis.suggestion(), analysis.kind());
        }

        if (rateLimiter.isExhausted()) {
            log.error("Failure rate limit reached ({} retries in the last minute)", rateLimiter.inWindow());
            return new RecoveryDecision.Escalate("Too many failures in the last minute", analysis.kind());
        }

        if (context.startupFatal() && context.frequencyIndex() != null) {
            int index = context.frequencyIndex();
            int failures = startupFailuresByFrequency.merge(index, 1, Integer::sum);
            if (failures >= properties.getBlacklistThreshold()) {
                startupFailuresByFrequency.remove(index);
                blacklisted.add(index);
                log.warn("Blacklisting frequency #{} after {} startup failures", index, failures);
                return new RecoveryDecision.Blacklist(index,
                        "Failed to start " + failures + " times: " + context.message());
            }
        }

        RecoveryStrategy strategy = strategyFor(consecutiveFailures);
        if (strategy == RecoveryStrategy.EXTENDED_COOLDOWN) {
            log.error("Extended cooldown after {} consecutive failures", consecutiveFailures);
            return new RecoveryDecision.Escalate(
                    consecutiveFailures + " consecutive failures; waiting for manual sync", analysis.kind());
        }

        if (!rateLimiter.tryAcquire()) {
            return new RecoveryDecision.Escalate("Too many failures in the last minute", analysis.kind());
        }

        backoffLevel = consecutiveFailures;
        long delay = strategy == RecoveryStrategy.DEVICE_RESET
                ? properties.getDeviceResetCooldownMs()
                : properties.getBaseDelayMs() * consecutiveFailures;
        log.info("Recovery attempt {}/{} via {} in {}ms ({})", consecutiveFailures, properties.getMaxAttempts(),
                strategy, delay, analysis.kind().wireName());
        return new RecoveryDecision.Retry(delay, strategy, consecutiveFailures, properties.getMaxAttempts(),
                analysis.kind());
    }

    RecoveryStrategy strategyFor(int failures) {
        if (failures >= properties.getExtendedCooldownAfter()) {
            return RecoveryStrategy.EXTENDED_COOLDOWN;
        }
        if (failures >= properties.getDeviceResetAfter()) {
            return RecoveryStrategy.DEVICE_RESET;
        }
        if (failures >= properties.getCleanupAfter()) {
            return RecoveryStrategy.AGGRESSIVE_CLEANUP;
        }
        return RecoveryStrategy.WAIT_AND_RETRY;
    }

    /**
     * Marks the device healthy after a sweep settled.
     */
    public synchronized void recordSuccess() {
        if (consecutiveFailures > 0) {
            log.info("Sweep healthy again after {} failure(s)", consecutiveFailures);
        }
        consecutiveFailures = 0;
        backoffLevel = 0;
        lastKnownGood = clock.instant();
        deviceStatus = DeviceStatus.AVAILABLE;
    }

    public synchronized void recordDeviceStatus(DeviceStatus status) {
        deviceStatus = status;
    }

    public synchronized boolean isBlacklisted(int frequencyIndex) {
        return blacklisted.contains(frequencyIndex);
    }

    public synchronized void clearBlacklist() {
        blacklisted.clear();
        startupFailuresByFrequency.clear();
    }

    /**
     * Returns recovery to its initial state, including the blacklist and the rate window.
     */
    public synchronized void reset() {
        clearBlacklist();
        consecutiveFailures = 0;
        backoffLevel = 0;
        deviceStatus = DeviceStatus.UNKNOWN;
        lastErrorKind = null;
        rateLimiter.reset();
        log.info("Recovery state reset");
    }

    public synchronized DeviceHealthRecord snapshot() {
        return new DeviceHealthRecord(lastKnownGood, consecutiveFailures, backoffLevel,
                blacklisted, deviceStatus, rateLimiter.inWindow(), lastErrorKind);
    }
}
