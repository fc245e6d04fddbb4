package com.sweepwatch.core.model;

import java.util.List;

/**
 * Immutable sweep configuration: the ordered frequencies to cycle through and the dwell time per frequency.
 */
public record SweepConfig(List<FrequencySpec> frequencies, long cycleTimeMs) {

    public SweepConfig {
        frequencies = frequencies == null ? List.of() : List.copyOf(frequencies);
    }

    public boolean isMultiFrequency() {
        return frequencies.size() > 1;
    }

    public FrequencySpec frequencyAt(int index) {
        return frequencies.get(index);
    }
}
