package com.sweepwatch.core.health;

import java.util.Collection;
import java.util.Comparator;
import java.util.Map;

/**
 * Health of one sweepwatch component ({@code sweep}, {@code recovery}, {@code stream}).
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {

    /** Declared from best to worst; the overall status is the worst component's. */
    public enum Status { UP, DEGRADED, DOWN }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus degraded(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, metadata);
    }

    public static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }

    public static HealthStatus down(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DOWN, detail, metadata);
    }

    /**
     * The worst status among {@code checks}; DOWN when there are none.
     */
    public static Status overall(Collection<HealthStatus> checks) {
        return checks.stream()
                .map(HealthStatus::status)
                .max(Comparator.naturalOrder())
                .orElse(Status.DOWN);
    }
}
