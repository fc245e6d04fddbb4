package com.sweepwatch.core.events;

import java.util.Arrays;
import java.util.Optional;

/**
 * Event tags as they appear on the wire (the SSE {@code event:} field).
 */
public enum StreamEventType {
    CONNECTED("connected"),
    SWEEP_DATA("sweep_data"),
    STATUS("status"),
    CYCLE_CONFIG("cycle_config"),
    HEARTBEAT("heartbeat"),
    RECOVERY_START("recovery_start"),
    RECOVERY_COMPLETE("recovery_complete"),
    ERROR("error"),
    STATE_SYNC("state_sync"),
    SERVER_RESET("server_reset");

    private final String wireName;

    StreamEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Events every subscriber receives regardless of the types it asked for.
     */
    public boolean isControl() {
        return this == CONNECTED || this == HEARTBEAT || this == SERVER_RESET;
    }

    public static Optional<StreamEventType> fromWireName(String name) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equalsIgnoreCase(name.trim()))
                .findFirst();
    }
}
