package com.sweepwatch.core.model;

import java.time.Instant;

/**
 * Immutable snapshot of the sweep state machine. Replaced atomically on every transition.
 *
 * @param phase                  current lifecycle phase
 * @param currentFrequencyIndex  index into the active config's frequency list
 * @param cycleStartedAt         when the current frequency started, null when not sweeping
 * @param consecutiveErrorCount  errors since the last successful settle
 * @param lastError              most recent error message, null if none
 */
public record SweepState(
        SweepPhase phase,
        int currentFrequencyIndex,
        Instant cycleStartedAt,
        int consecutiveErrorCount,
        String lastError
) {

    public static SweepState initial() {
        return new SweepState(SweepPhase.IDLE, 0, null, 0, null);
    }

    public SweepState withPhase(SweepPhase newPhase) {
        return new SweepState(newPhase, currentFrequencyIndex, cycleStartedAt, consecutiveErrorCount, lastError);
    }

    public SweepState withFrequency(int index, Instant startedAt) {
        return new SweepState(phase, index, startedAt, consecutiveErrorCount, lastError);
    }

    public SweepState withError(String error) {
        return new SweepState(SweepPhase.ERROR, currentFrequencyIndex, cycleStartedAt,
                consecutiveErrorCount + 1, error);
    }

    public SweepState withErrorsCleared() {
        return new SweepState(phase, currentFrequencyIndex, cycleStartedAt, 0, null);
    }
}
