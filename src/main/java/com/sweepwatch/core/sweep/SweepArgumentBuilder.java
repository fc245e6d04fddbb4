package com.sweepwatch.core.sweep;

import com.sweepwatch.core.model.FrequencySpec;
import com.sweepwatch.core.model.SweepConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds sweep binary arguments and validates configs against the radio's tuning range.
 */
public class SweepArgumentBuilder {

    /** FFT bin width limits accepted by the sweep binary. */
    static final int MIN_BIN_WIDTH_HZ = 2445;
    static final int MAX_BIN_WIDTH_HZ = 5_000_000;

    private final SweepProperties properties;

    public SweepArgumentBuilder(SweepProperties properties) {
        this.properties = properties;
    }

    /**
     * Arguments for one frequency: {@code -f min:max -g vga -l lna -w binWidth}. The range is
     * widened to whole MHz because the binary only accepts integers.
     */
    public List<String> build(FrequencySpec spec) {
        long min = (long) Math.max(properties.getMinFrequencyMhz(), Math.floor(spec.minMhz()));
        long max = (long) Math.min(properties.getMaxFrequencyMhz(), Math.ceil(spec.maxMhz()));
        if (max <= min) {
            max = min + 1;
        }
        return List.of(
                "-f", min + ":" + max,
                "-g", String.valueOf(properties.getVgaGain()),
                "-l", String.valueOf(properties.getLnaGain()),
                "-w", String.valueOf(spec.binWidthHz())
        );
    }

    /**
     * @return human-readable problems, empty when the config is usable
     */
    public List<String> validate(SweepConfig config) {
        List<String> problems = new ArrayList<>();
        if (config == null || config.frequencies().isEmpty()) {
            problems.add("At least one frequency is required");
            return problems;
        }
        if (config.cycleTimeMs() <= 0) {
            problems.add("Cycle time must be positive");
        }
        for (int i = 0; i < config.frequencies().size(); i++) {
            FrequencySpec spec = config.frequencies().get(i);
            if (spec.spanMhz() <= 0) {
                problems.add("Frequency #" + i + ": span must be positive");
            }
            if (spec.minMhz() < properties.getMinFrequencyMhz() || spec.maxMhz() > properties.getMaxFrequencyMhz()) {
                problems.add(String.format(Locale.ROOT, "Frequency #%d: %.1f-%.1f MHz is outside %.0f-%.0f MHz", i,
                        spec.minMhz(), spec.maxMhz(), properties.getMinFrequencyMhz(), properties.getMaxFrequencyMhz()));
            }
            if (spec.binWidthHz() < MIN_BIN_WIDTH_HZ || spec.binWidthHz() > MAX_BIN_WIDTH_HZ) {
                problems.add("Frequency #" + i + ": bin width must be between "
                        + MIN_BIN_WIDTH_HZ + " and " + MAX_BIN_WIDTH_HZ + " Hz");
            }
        }
        return problems;
    }
}
