package com.sweepwatch.dispatch.client;

/**
 * An open (or opening) event stream. Closing it never triggers {@link StreamListener#onClosed}
 * as a loss; callers that close a connection are expected to ignore its late callbacks.
 */
public interface StreamConnection extends AutoCloseable {

    @Override
    void close();
}
