package com.sweepwatch.core.process;

import java.util.List;

/**
 * What the operating system actually shows, used to reconcile believed state.
 *
 * @param handle      the handle the supervisor currently tracks, null if none
 * @param handleAlive whether that handle's process answers the liveness check
 * @param sweepPids   every live process named like the sweep binary
 */
public record ProcessObservation(SweepProcessHandle handle, boolean handleAlive, List<Long> sweepPids) {

    public ProcessObservation {
        sweepPids = List.copyOf(sweepPids);
    }

    /** Sweep processes we are not tracking. */
    public List<Long> orphans() {
        return sweepPids.stream()
                .filter(pid -> handle == null || pid != handle.processId())
                .toList();
    }

    public boolean anyAlive() {
        return handleAlive || !sweepPids.isEmpty();
    }
}
