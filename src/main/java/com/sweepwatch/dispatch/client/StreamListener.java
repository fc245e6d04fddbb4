package com.sweepwatch.dispatch.client;

/**
 * Callbacks from one stream connection. Invoked from the connection's reader thread.
 */
public interface StreamListener {

    void onOpen();

    /**
     * @param name event name, {@code message} when the server sent none
     * @param data raw event payload
     */
    void onEvent(String name, String data);

    /**
     * The connection ended. {@code error} is null for a clean end of stream.
     */
    void onClosed(Throwable error);
}
