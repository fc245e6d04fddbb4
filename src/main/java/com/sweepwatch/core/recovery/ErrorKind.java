package com.sweepwatch.core.recovery;

import java.util.Locale;

public enum ErrorKind {
    DEVICE_BUSY(true, DeviceStatus.BUSY),
    PERMISSION_DENIED(false, DeviceStatus.UNKNOWN),
    DEVICE_NOT_FOUND(true, DeviceStatus.DISCONNECTED),
    USB_ERROR(true, DeviceStatus.STUCK),
    PROCESS_EXIT(true, DeviceStatus.UNKNOWN),
    NO_DATA(true, DeviceStatus.STUCK),
    UNKNOWN(true, DeviceStatus.UNKNOWN);

    private final boolean recoverable;
    private final DeviceStatus deviceStatus;

    ErrorKind(boolean recoverable, DeviceStatus deviceStatus) {
        this.recoverable = recoverable;
        this.deviceStatus = deviceStatus;
    }

    public boolean recoverable() {
        return recoverable;
    }

    public DeviceStatus deviceStatus() {
        return deviceStatus;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
