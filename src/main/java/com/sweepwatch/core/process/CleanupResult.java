package com.sweepwatch.core.process;

/**
 * Outcome of a kill-all: how many processes were signalled and how many still answered afterwards.
 */
public record CleanupResult(int killed, int remaining) {

    public boolean verified() {
        return remaining == 0;
    }
}
