package com.sweepwatch.core.model;

/**
 * Lifecycle phase of the sweep state machine.
 */
public enum SweepPhase {
    IDLE,
    STARTING,
    RUNNING,
    STOPPING,
    ERROR,
    EMERGENCY_STOPPED;

    /**
     * Whether a sweep process is expected to exist in this phase.
     */
    public boolean expectsProcess() {
        return this == STARTING || this == RUNNING;
    }

    public boolean isTerminal() {
        return this == EMERGENCY_STOPPED;
    }
}
