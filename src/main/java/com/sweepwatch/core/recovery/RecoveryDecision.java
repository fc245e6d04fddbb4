package com.sweepwatch.core.recovery;

/**
 * What the sweep controller should do about a failure.
 */
public sealed interface RecoveryDecision {

    /**
     * Respawn after {@code delayMs}, applying {@code strategy} first.
     */
    record Retry(long delayMs, RecoveryStrategy strategy, int attempt, int maxAttempts, ErrorKind kind)
            implements RecoveryDecision {}

    /**
     * Stop using this frequency and move on to the next usable one.
     */
    record Blacklist(int frequencyIndex, String reason) implements RecoveryDecision {}

    /**
     * Give up; the sweep stays in ERROR until an operator acts.
     */
    record Escalate(String reason, ErrorKind kind) implements RecoveryDecision {}
}
