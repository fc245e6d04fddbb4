package com.sweepwatch.core.health;

import com.sweepwatch.core.model.SweepPhase;
import com.sweepwatch.core.recovery.DeviceStatus;

import java.time.Instant;

/**
 * Detailed health of the sweep subsystem.
 *
 * @param hardwareDetected whether the radio answered (or is streaming)
 * @param deviceInfo       probe output summary, null when not probed
 * @param processRunning   whether the tracked sweep process is alive
 * @param sseClientCount   live stream subscriptions
 * @param stateValidation  believed state checked against OS reality
 */
public record SweepHealth(
        boolean hardwareDetected,
        String deviceInfo,
        boolean processRunning,
        int sseClientCount,
        StateValidation stateValidation,
        DeviceStatus deviceStatus,
        Instant lastDataAt
) {

    /**
     * @param consistent    true when the believed phase agrees with the processes actually running
     * @param orphanCount   sweep processes alive that are not tracked
     */
    public record StateValidation(boolean consistent, SweepPhase believedPhase, boolean processAlive,
                                  int orphanCount, String detail) {}
}
