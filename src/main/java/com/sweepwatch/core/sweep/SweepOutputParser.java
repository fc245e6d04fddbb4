package com.sweepwatch.core.sweep;

import com.sweepwatch.core.model.SignalStrength;
import com.sweepwatch.core.model.SpectrumSample;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses sweep output lines of the form
 * {@code date, time, hz_low, hz_high, hz_bin_width, num_samples, dB, dB, ...}.
 */
public class SweepOutputParser {

    private static final Pattern SEPARATOR = Pattern.compile("[,\\s]+");
    private static final int FIXED_FIELDS = 6;

    public Optional<SpectrumSample> parse(String line, double centerMhz, Instant receivedAt) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        String[] parts = SEPARATOR.split(line.trim());
        if (parts.length < FIXED_FIELDS + 1) {
            return Optional.empty();
        }
        try {
            long lowHz = Long.parseLong(parts[2]);
            long highHz = Long.parseLong(parts[3]);
            double binWidth = Double.parseDouble(parts[4]);
            int numSamples = Integer.parseInt(parts[5]);

            List<Double> power = new ArrayList<>(parts.length - FIXED_FIELDS);
            int peakIndex = 0;
            double peak = Double.NEGATIVE_INFINITY;
            for (int i = FIXED_FIELDS; i < parts.length; i++) {
                if (parts[i].toLowerCase(Locale.ROOT).contains("nan")) {
                    continue;
                }
                double db = Double.parseDouble(parts[i]);
                if (db > peak) {
                    peak = db;
                    peakIndex = power.size();
                }
                power.add(db);
            }
            if (power.isEmpty()) {
                return Optional.empty();
            }

            double peakHz = lowHz + peakIndex * binWidth + binWidth / 2;
            return Optional.of(new SpectrumSample(parts[0], parts[1], lowHz, highHz, binWidth, numSamples,
                    power, peakIndex, peakHz / 1e6, peak, centerMhz, SignalStrength.fromPower(peak), receivedAt));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
