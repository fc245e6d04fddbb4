package com.sweepwatch.dispatch.api;

import com.sweepwatch.core.events.StreamEvent;

import java.io.IOException;

/**
 * Where a subscription's events are written. Sends for one subscription are never concurrent.
 */
public interface EventSink {

    void send(StreamEvent event) throws IOException;

    void complete();
}
