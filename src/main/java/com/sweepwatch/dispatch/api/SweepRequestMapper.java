package com.sweepwatch.dispatch.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.sweepwatch.core.model.FrequencySpec;
import com.sweepwatch.core.model.FrequencyUnit;
import com.sweepwatch.core.model.SweepConfig;
import com.sweepwatch.core.sweep.SweepProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the flexible start request into a {@link SweepConfig}.
 */
@Component
public class SweepRequestMapper {

    private final SweepProperties properties;

    public SweepRequestMapper(SweepProperties properties) {
        this.properties = properties;
    }

    /**
     * @throws IllegalArgumentException if an entry cannot be understood
     */
    public SweepConfig toConfig(StartSweepRequest request) {
        if (request == null || request.frequencies() == null || request.frequencies().isNull()) {
            throw new IllegalArgumentException("frequencies is required");
        }
        List<FrequencySpec> specs = new ArrayList<>();
        JsonNode node = request.frequencies();
        if (node.isArray()) {
            for (JsonNode entry : node) {
                specs.add(toSpec(entry));
            }
        } else {
            specs.add(toSpec(node));
        }

        long cycleTimeMs = properties.getDefaultCycleTimeMs();
        if (request.cycleTimeMs() != null) {
            cycleTimeMs = request.cycleTimeMs();
        } else if (request.cycleTime() != null) {
            cycleTimeMs = Math.round(request.cycleTime() * 1000);
        }
        return new SweepConfig(specs, cycleTimeMs);
    }

    FrequencySpec toSpec(JsonNode entry) {
        int binWidth = properties.getDefaultBinWidthHz();
        double span = properties.getDefaultSpanMhz();

        if (entry.isNumber()) {
            return new FrequencySpec(entry.asDouble(), span, binWidth);
        }
        if (!entry.isObject()) {
            throw new IllegalArgumentException("Invalid frequency entry: " + entry);
        }

        if (entry.hasNonNull("binWidthHz")) {
            binWidth = entry.get("binWidthHz").asInt();
        }
        FrequencyUnit unit = FrequencyUnit.parse(entry.path("unit").asText(null));

        if (entry.hasNonNull("start")) {
            JsonNode stopNode = entry.hasNonNull("stop") ? entry.get("stop") : entry.get("end");
            if (stopNode == null || stopNode.isNull()) {
                throw new IllegalArgumentException("Frequency range needs stop or end: " + entry);
            }
            double start = unit.toMhz(entry.get("start").asDouble());
            double stop = unit.toMhz(stopNode.asDouble());
            if (stop <= start) {
                throw new IllegalArgumentException("Frequency range stop must exceed start: " + entry);
            }
            return new FrequencySpec((start + stop) / 2.0, stop - start, binWidth);
        }
        if (entry.hasNonNull("value")) {
            if (entry.hasNonNull("spanMhz")) {
                span = entry.get("spanMhz").asDouble();
            }
            return new FrequencySpec(unit.toMhz(entry.get("value").asDouble()), span, binWidth);
        }
        if (entry.hasNonNull("centerMhz")) {
            if (entry.hasNonNull("spanMhz")) {
                span = entry.get("spanMhz").asDouble();
            }
            return new FrequencySpec(entry.get("centerMhz").asDouble(), span, binWidth);
        }
        throw new IllegalArgumentException("Invalid frequency entry: " + entry);
    }
}
