package com.sweepwatch.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of the sweep cycle for status queries.
 */
public record CycleStatus(
        SweepPhase phase,
        List<FrequencySpec> frequencies,
        int currentIndex,
        FrequencySpec currentFrequency,
        long cycleTimeMs,
        Instant cycleStartedAt,
        long timeRemainingMs,
        int consecutiveErrorCount,
        String lastError,
        List<Integer> blacklistedIndices,
        ProcessHealth processHealth
) {}
