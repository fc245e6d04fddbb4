package com.sweepwatch.core.model;

import java.util.Locale;

/**
 * One frequency the sweep visits: a center with a span, scanned with the given FFT bin width.
 */
public record FrequencySpec(double centerMhz, double spanMhz, int binWidthHz) {

    public double minMhz() {
        return centerMhz - spanMhz / 2.0;
    }

    public double maxMhz() {
        return centerMhz + spanMhz / 2.0;
    }

    /** Short label used in logs and status messages, e.g. "2437.0 MHz". */
    public String label() {
        return String.format(Locale.ROOT, "%.1f MHz", centerMhz);
    }
}
