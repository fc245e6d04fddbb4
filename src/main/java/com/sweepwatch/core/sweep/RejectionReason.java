package com.sweepwatch.core.sweep;

public enum RejectionReason {
    INVALID_STATE,
    INVALID_CONFIG,
    DEVICE_UNAVAILABLE,
    SPAWN_FAILED,
    EMERGENCY_STOPPED,
    TIMEOUT
}
