package com.sweepwatch.dispatch.client;

/**
 * Opens event streams. Connecting is asynchronous: success and failure both arrive through
 * the listener.
 */
public interface StreamConnector {

    StreamConnection connect(StreamListener listener);
}
