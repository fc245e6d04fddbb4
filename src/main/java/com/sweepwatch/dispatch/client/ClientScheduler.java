package com.sweepwatch.dispatch.client;

/**
 * Timer source for {@link ClientReconnector}, replaceable in tests.
 */
public interface ClientScheduler {

    Cancellable schedule(Runnable task, long delayMs);

    Cancellable scheduleAtFixedRate(Runnable task, long periodMs);

    long nowMillis();
}
