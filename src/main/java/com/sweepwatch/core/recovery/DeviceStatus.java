package com.sweepwatch.core.recovery;

public enum DeviceStatus {
    UNKNOWN,
    AVAILABLE,
    BUSY,
    STUCK,
    DISCONNECTED
}
