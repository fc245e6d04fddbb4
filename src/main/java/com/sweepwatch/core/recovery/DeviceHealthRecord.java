package com.sweepwatch.core.recovery;

import java.time.Instant;
import java.util.Set;

/**
 * Snapshot of what recovery knows about the device.
 */
public record DeviceHealthRecord(
        Instant lastKnownGood,
        int consecutiveFailures,
        int backoffLevel,
        Set<Integer> blacklistedFrequencies,
        DeviceStatus deviceStatus,
        int retriesInWindow,
        ErrorKind lastErrorKind
) {

    public DeviceHealthRecord {
        blacklistedFrequencies = Set.copyOf(blacklistedFrequencies);
    }
}
