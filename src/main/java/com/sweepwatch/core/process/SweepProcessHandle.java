package com.sweepwatch.core.process;

import java.time.Instant;

/**
 * Identity of a spawned sweep process.
 *
 * @param processId      OS pid
 * @param processGroupId pgid when the process leads its own group, null when it shares ours
 * @param startTime      when it was spawned
 */
public record SweepProcessHandle(long processId, Long processGroupId, Instant startTime) {

    public boolean ownsProcessGroup() {
        return processGroupId != null;
    }
}
