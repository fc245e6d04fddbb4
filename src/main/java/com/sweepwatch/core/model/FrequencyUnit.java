package com.sweepwatch.core.model;

import java.util.Locale;

public enum FrequencyUnit {
    HZ(1e-6),
    KHZ(1e-3),
    MHZ(1.0),
    GHZ(1e3);

    private final double toMhzFactor;

    FrequencyUnit(double toMhzFactor) {
        this.toMhzFactor = toMhzFactor;
    }

    public double toMhz(double value) {
        return value * toMhzFactor;
    }

    /**
     * Parses a unit label such as "MHz", "ghz" or "Hz". Blank input means MHz.
     *
     * @throws IllegalArgumentException for an unknown label
     */
    public static FrequencyUnit parse(String label) {
        if (label == null || label.isBlank()) {
            return MHZ;
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown frequency unit: " + label);
        }
    }
}
