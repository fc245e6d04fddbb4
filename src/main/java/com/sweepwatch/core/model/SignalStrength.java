package com.sweepwatch.core.model;

/**
 * Coarse signal strength category derived from peak power in dB.
 */
public enum SignalStrength {
    NO_SIGNAL("No Signal"),
    VERY_WEAK("Very Weak"),
    WEAK("Weak"),
    MODERATE("Moderate"),
    STRONG("Strong"),
    VERY_STRONG("Very Strong");

    private final String label;

    SignalStrength(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static SignalStrength fromPower(double powerDb) {
        if (powerDb < -90) return NO_SIGNAL;
        if (powerDb < -70) return VERY_WEAK;
        if (powerDb < -50) return WEAK;
        if (powerDb < -30) return MODERATE;
        if (powerDb < -10) return STRONG;
        return VERY_STRONG;
    }
}
