package com.sweepwatch.core.model;

import java.time.Instant;

/**
 * Liveness facts about the supervised sweep process.
 */
public record ProcessHealth(
        boolean running,
        Long processId,
        Long processGroupId,
        Instant startedAt,
        Instant lastDataAt
) {

    public static ProcessHealth none(Instant lastDataAt) {
        return new ProcessHealth(false, null, null, null, lastDataAt);
    }
}
