package com.sweepwatch.core.model;

import java.time.Instant;
import java.util.List;

/**
 * One parsed line of sweep output: a block of power bins between {@code lowHz} and {@code highHz}.
 */
public record SpectrumSample(
        String date,
        String time,
        long lowHz,
        long highHz,
        double binWidthHz,
        int numSamples,
        List<Double> powerDb,
        int peakIndex,
        double peakFrequencyMhz,
        double peakPowerDb,
        double centerMhz,
        SignalStrength signalStrength,
        Instant receivedAt
) {

    public SpectrumSample {
        powerDb = List.copyOf(powerDb);
    }
}
