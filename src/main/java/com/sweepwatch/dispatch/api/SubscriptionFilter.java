package com.sweepwatch.dispatch.api;

import com.sweepwatch.core.events.StreamEvent;

import java.util.Set;

/**
 * Per-subscriber filters applied to sweep data. Other events always pass.
 *
 * @param minSignal   minimum peak power in dB, null for no limit
 * @param deviceTypes accepted data sources, empty for all
 */
public record SubscriptionFilter(Double minSignal, Set<String> deviceTypes) {

    public SubscriptionFilter {
        deviceTypes = deviceTypes == null ? Set.of() : Set.copyOf(deviceTypes);
    }

    public static SubscriptionFilter none() {
        return new SubscriptionFilter(null, Set.of());
    }

    public boolean matches(StreamEvent event) {
        if (!(event instanceof StreamEvent.SweepData data)) {
            return true;
        }
        if (minSignal != null && data.peakPowerDb() < minSignal) {
            return false;
        }
        return deviceTypes.isEmpty() || deviceTypes.contains(data.source());
    }
}
