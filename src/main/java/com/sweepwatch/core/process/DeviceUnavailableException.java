package com.sweepwatch.core.process;

/**
 * Thrown when the device probe says the radio is absent, busy or unresponsive.
 */
public class DeviceUnavailableException extends Exception {

    private final DeviceProbeResult probe;

    public DeviceUnavailableException(DeviceProbeResult probe) {
        super(probe.reason());
        this.probe = probe;
    }

    public DeviceProbeResult getProbe() {
        return probe;
    }
}
