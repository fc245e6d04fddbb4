package com.sweepwatch.dispatch.client;

/**
 * Snapshot of a {@link ClientReconnector}.
 *
 * @param lastDataAt epoch millis of the last event received, 0 before the first connection
 * @param message    operator-facing detail, e.g. the reconnect countdown or the refresh prompt
 */
public record ReconnectorState(
        ConnectionState connection,
        int reconnectAttempts,
        long lastDataAt,
        boolean visible,
        String message
) {
    public boolean connected() {
        return connection == ConnectionState.CONNECTED;
    }

    public boolean connecting() {
        return connection == ConnectionState.CONNECTING || connection == ConnectionState.RECONNECTING;
    }

    public boolean terminal() {
        return connection == ConnectionState.TERMINAL;
    }
}
