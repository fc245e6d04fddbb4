package com.sweepwatch.dispatch.api;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Inbound JSON body for POST /api/v1/sweep/start.
 * <p>
 * Each entry of {@code frequencies} may be a plain number (MHz), {@code {"value": 2.4, "unit": "GHz"}},
 * a range {@code {"start": 2400, "stop": 2480}} ({@code end} is accepted for {@code stop}), or
 * {@code {"centerMhz": ..., "spanMhz": ..., "binWidthHz": ...}}.
 *
 * @param frequencies one or more frequency entries; required
 * @param cycleTime   seconds per frequency; nullable, defaults to the configured cycle time
 * @param cycleTimeMs milliseconds per frequency; takes precedence over {@code cycleTime}
 */
public record StartSweepRequest(
    JsonNode frequencies,
    Double cycleTime,
    Long cycleTimeMs
) {}
