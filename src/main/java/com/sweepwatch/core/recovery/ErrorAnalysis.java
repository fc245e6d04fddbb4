package com.sweepwatch.core.recovery;

import java.util.Locale;

/**
 * Classification of an error message into a kind with an operator-facing suggestion.
 */
public record ErrorAnalysis(ErrorKind kind, String suggestion) {

    public boolean recoverable() {
        return kind.recoverable();
    }

    public static ErrorAnalysis of(String message) {
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (lower.contains("resource busy") || lower.contains("device busy")) {
            return new ErrorAnalysis(ErrorKind.DEVICE_BUSY, "Another program holds the device; retrying after a delay");
        }
        if (lower.contains("permission denied")) {
            return new ErrorAnalysis(ErrorKind.PERMISSION_DENIED, "Check udev rules or run with device permissions");
        }
        if (lower.contains("no hackrf boards found") || lower.contains("device not found")
                || lower.contains("no hackrf found")) {
            return new ErrorAnalysis(ErrorKind.DEVICE_NOT_FOUND, "Check the USB connection");
        }
        if (lower.contains("usb") || lower.contains("libusb") || lower.contains("hackrf_error")
                || lower.contains("hackrf_is_streaming") || lower.contains("hackrf_start_rx")
                || lower.contains("hackrf_open")) {
            return new ErrorAnalysis(ErrorKind.USB_ERROR, "USB transfer failed; resetting the device may help");
        }
        if (lower.contains("no data")) {
            return new ErrorAnalysis(ErrorKind.NO_DATA, "Sweep produced no output; restarting");
        }
        if (lower.contains("exited") || lower.contains("died") || lower.contains("gone")) {
            return new ErrorAnalysis(ErrorKind.PROCESS_EXIT, "Sweep process ended unexpectedly; restarting");
        }
        return new ErrorAnalysis(ErrorKind.UNKNOWN, "Unexpected error; retrying");
    }
}
