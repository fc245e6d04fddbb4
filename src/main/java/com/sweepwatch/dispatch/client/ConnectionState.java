package com.sweepwatch.dispatch.client;

public enum ConnectionState {
    IDLE,
    CONNECTING,
    CONNECTED,
    /** Lost; a reconnect is scheduled or deferred until visible. */
    RECONNECTING,
    /** Gave up after too many failures. Only a manual reconnect leaves this state. */
    TERMINAL,
    CLOSED
}
