package com.sweepwatch.core.sweep;

import com.sweepwatch.core.model.SweepState;

import java.util.List;

/**
 * Result of reconciling believed state with the processes the OS actually shows.
 */
public record SyncReport(SweepState before, SweepState after, List<String> changes) {

    public SyncReport {
        changes = List.copyOf(changes);
    }

    public boolean changed() {
        return !changes.isEmpty();
    }
}
