package com.sweepwatch.dispatch.client;

import java.util.function.BiConsumer;

/**
 * Incremental parser for the {@code text/event-stream} line format.
 * <p>
 * {@code event:} names the next event, consecutive {@code data:} lines are joined with
 * newlines, a blank line dispatches, and lines starting with {@code :} are comments.
 */
class SseEventParser {

    static final String DEFAULT_EVENT = "message";

    private final BiConsumer<String, String> dispatcher;
    private String eventName = "";
    private StringBuilder data;

    SseEventParser(BiConsumer<String, String> dispatcher) {
        this.dispatcher = dispatcher;
    }

    void accept(String line) {
        if (line.isEmpty()) {
            dispatch();
            return;
        }
        if (line.startsWith(":")) {
            return;
        }
        int colon = line.indexOf(':');
        String field = colon < 0 ? line : line.substring(0, colon);
        String value = colon < 0 ? "" : line.substring(colon + 1);
        if (value.startsWith(" ")) {
            value = value.substring(1);
        }
        switch (field) {
            case "event" -> eventName = value.trim();
            case "data" -> {
                if (data == null) {
                    data = new StringBuilder(value);
                } else {
                    data.append('\n').append(value);
                }
            }
            default -> {
                // id and retry are not used
            }
        }
    }

    /** Dispatches a pending event when the stream ends without a trailing blank line. */
    void finish() {
        dispatch();
    }

    private void dispatch() {
        if (data != null) {
            dispatcher.accept(eventName.isEmpty() ? DEFAULT_EVENT : eventName, data.toString());
        }
        eventName = "";
        data = null;
    }
}
