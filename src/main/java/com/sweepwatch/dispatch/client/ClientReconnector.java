package com.sweepwatch.dispatch.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one event stream connected on behalf of a dashboard session.
 * <p>
 * A lost connection is retried after {@code min(base * 2^(attempt-1), max)} ms; once
 * {@code maxAttempts} consecutive losses have accumulated the reconnector stops and reports
 * the terminal state until {@link #reconnect()} is called. A successful open resets the count.
 * <p>
 * While connected and visible, a staleness check runs every {@code staleCheckIntervalMs}:
 * no event (heartbeats included) for {@code staleThresholdMs} counts as a loss. Hiding the
 * session suspends the check; showing it again restarts the check from a fresh baseline and
 * reconnects at once if the connection was lost in the meantime.
 * <p>
 * Every connection attempt gets a new generation number. Callbacks and timers carry the
 * generation they were created for and are ignored once it is no longer current.
 */
public class ClientReconnector implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClientReconnector.class);

    static final String REFRESH_MESSAGE = "Connection lost - please refresh";

    /**
     * Receives stream events and state changes. Never called while the reconnector holds its lock:
     * a connector that reports open, events or loss from inside {@code connect} has those callbacks
     * delivered through the scheduler once {@code connect} has returned.
     */
    public interface Listener {

        void onEvent(String name, String data);

        default void onStateChange(ReconnectorState state) {
        }
    }

    private final StreamConnector connector;
    private final ClientScheduler scheduler;
    private final ClientProperties properties;
    private final Listener listener;
    private final Object lock = new Object();

    private long generation;
    private StreamConnection connection;
    private Cancellable reconnectTimer;
    private Cancellable staleCheck;
    private ConnectionState state = ConnectionState.IDLE;
    private int attempts;
    private long lastDataAt;
    private boolean visible = true;
    private String message;

    public ClientReconnector(StreamConnector connector, ClientScheduler scheduler,
                             ClientProperties properties, Listener listener) {
        this.connector = connector;
        this.scheduler = scheduler;
        this.properties = properties;
        this.listener = listener;
    }

    /**
     * Delay before reconnect attempt {@code attempt} (1-based).
     */
    public static long backoffDelay(int attempt, long baseDelayMs, long maxDelayMs) {
        long delay = baseDelayMs;
        for (int i = 1; i < attempt && delay < maxDelayMs; i++) {
            delay *= 2;
        }
        return Math.min(delay, maxDelayMs);
    }

    public void start() {
        synchronized (lock) {
            if (state != ConnectionState.IDLE) {
                return;
            }
            openLocked();
        }
        notifyState();
    }

    /**
     * Manual reconnect: resets the attempt count and leaves the terminal state.
     */
    public void reconnect() {
        synchronized (lock) {
            if (state == ConnectionState.CLOSED) {
                return;
            }
            log.info("Manual reconnect requested");
            teardownLocked();
            attempts = 0;
            lastDataAt = scheduler.nowMillis();
            openLocked();
        }
        notifyState();
    }

    public void setVisible(boolean nowVisible) {
        synchronized (lock) {
            if (visible == nowVisible) {
                return;
            }
            visible = nowVisible;
            if (state == ConnectionState.CLOSED || state == ConnectionState.TERMINAL) {
                return;
            }
            if (!nowVisible) {
                log.debug("Session hidden, pausing staleness check");
                cancelStaleCheckLocked();
                return;
            }
            log.debug("Session visible, resuming staleness check");
            lastDataAt = scheduler.nowMillis();
            if (state == ConnectionState.CONNECTED) {
                startStaleCheckLocked();
            } else if (state == ConnectionState.RECONNECTING) {
                log.info("Connection lost while hidden, reconnecting now");
                openLocked();
            }
        }
        notifyState();
    }

    public ReconnectorState state() {
        synchronized (lock) {
            return new ReconnectorState(state, attempts, lastDataAt, visible, message);
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (state == ConnectionState.CLOSED) {
                return;
            }
            teardownLocked();
            state = ConnectionState.CLOSED;
            message = null;
        }
        notifyState();
    }

    private void openLocked() {
        long gen = ++generation;
        cancelReconnectTimerLocked();
        state = ConnectionState.CONNECTING;
        StreamConnection opened;
        try {
            opened = connector.connect(new GenerationListener(gen));
        } catch (RuntimeException e) {
            log.warn("Could not open stream: {}", e.getMessage());
            scheduler.schedule(() -> onLoss(gen, e.getMessage()), 0);
            return;
        }
        connection = opened;
    }

    private void onOpen(long gen) {
        synchronized (lock) {
            if (gen != generation || state != ConnectionState.CONNECTING) {
                return;
            }
            state = ConnectionState.CONNECTED;
            if (attempts > 0) {
                log.info("Stream reconnected after {} attempt(s)", attempts);
            } else {
                log.info("Stream connected");
            }
            attempts = 0;
            message = null;
            lastDataAt = scheduler.nowMillis();
            if (visible) {
                startStaleCheckLocked();
            }
        }
        notifyState();
    }

    private void onEvent(long gen, String name, String data) {
        synchronized (lock) {
            if (gen != generation) {
                return;
            }
            lastDataAt = scheduler.nowMillis();
        }
        listener.onEvent(name, data);
    }

    private void onLoss(long gen, String reason) {
        synchronized (lock) {
            if (gen != generation || state == ConnectionState.CLOSED || state == ConnectionState.TERMINAL) {
                return;
            }
            lossLocked(reason);
        }
        notifyState();
    }

    private void checkStale(long gen) {
        synchronized (lock) {
            if (gen != generation || state != ConnectionState.CONNECTED || !visible) {
                return;
            }
            long silentFor = scheduler.nowMillis() - lastDataAt;
            if (silentFor <= properties.getStaleThresholdMs()) {
                return;
            }
            log.warn("No events for {}s, connection is stale", silentFor / 1000);
            lossLocked("stale connection");
        }
        notifyState();
    }

    private void lossLocked(String reason) {
        teardownLocked();
        attempts++;
        if (attempts >= properties.getMaxAttempts()) {
            log.error("Giving up after {} reconnect attempts ({})", attempts, reason);
            state = ConnectionState.TERMINAL;
            message = REFRESH_MESSAGE;
            return;
        }
        long delay = backoffDelay(attempts, properties.getBaseDelayMs(), properties.getMaxDelayMs());
        state = ConnectionState.RECONNECTING;
        message = "Reconnecting... (attempt " + attempts + "/" + properties.getMaxAttempts() + ")";
        log.info("Stream lost ({}), reconnecting in {}ms (attempt {}/{})", reason, delay, attempts,
                properties.getMaxAttempts());
        long gen = generation;
        reconnectTimer = scheduler.schedule(() -> reconnectAfterBackoff(gen), delay);
    }

    private void reconnectAfterBackoff(long gen) {
        synchronized (lock) {
            if (gen != generation || state != ConnectionState.RECONNECTING) {
                return;
            }
            reconnectTimer = null;
            openLocked();
        }
        notifyState();
    }

    /** Drops the current connection and timers and invalidates their callbacks. */
    private void teardownLocked() {
        generation++;
        cancelStaleCheckLocked();
        cancelReconnectTimerLocked();
        if (connection != null) {
            StreamConnection current = connection;
            connection = null;
            try {
                current.close();
            } catch (RuntimeException e) {
                log.debug("Closing stream failed: {}", e.getMessage());
            }
        }
    }

    private void startStaleCheckLocked() {
        cancelStaleCheckLocked();
        long gen = generation;
        staleCheck = scheduler.scheduleAtFixedRate(() -> checkStale(gen), properties.getStaleCheckIntervalMs());
    }

    private void cancelStaleCheckLocked() {
        if (staleCheck != null) {
            staleCheck.cancel();
            staleCheck = null;
        }
    }

    private void cancelReconnectTimerLocked() {
        if (reconnectTimer != null) {
            reconnectTimer.cancel();
            reconnectTimer = null;
        }
    }

    private void notifyState() {
        listener.onStateChange(state());
    }

    private final class GenerationListener implements StreamListener {

        private final long gen;

        GenerationListener(long gen) {
            this.gen = gen;
        }

        @Override
        public void onOpen() {
            dispatch(() -> ClientReconnector.this.onOpen(gen));
        }

        @Override
        public void onEvent(String name, String data) {
            dispatch(() -> ClientReconnector.this.onEvent(gen, name, data));
        }

        @Override
        public void onClosed(Throwable error) {
            dispatch(() -> onLoss(gen, error == null ? "stream ended" : String.valueOf(error.getMessage())));
        }

        /** Callbacks made from inside {@code connect} run after the lock is released. */
        private void dispatch(Runnable callback) {
            if (Thread.holdsLock(lock)) {
                scheduler.schedule(callback, 0);
            } else {
                callback.run();
            }
        }
    }
}
