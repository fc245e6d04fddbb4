package com.sweepwatch.core.sweep;

import com.sweepwatch.core.model.SweepState;

public record StartResult(boolean accepted, SweepState state, RejectionReason reason, String message) {

    public static StartResult accepted(SweepState state) {
        return new StartResult(true, state, null, "Sweep starting");
    }

    public static StartResult rejected(RejectionReason reason, String message, SweepState state) {
        return new StartResult(false, state, reason, message);
    }
}
