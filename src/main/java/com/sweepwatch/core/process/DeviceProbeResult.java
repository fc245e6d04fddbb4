package com.sweepwatch.core.process;

/**
 * Result of asking the device info utility whether the radio is usable.
 */
public record DeviceProbeResult(boolean available, Outcome outcome, String reason, String deviceInfo) {

    public enum Outcome { AVAILABLE, BUSY, NOT_FOUND, TIMEOUT, FAILED }

    public static DeviceProbeResult available(String deviceInfo) {
        return new DeviceProbeResult(true, Outcome.AVAILABLE, "Device available", deviceInfo);
    }

    public static DeviceProbeResult unavailable(Outcome outcome, String reason) {
        return new DeviceProbeResult(false, outcome, reason, null);
    }
}
