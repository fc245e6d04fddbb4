package com.sweepwatch.core.process;

/**
 * Signals the supervisor sends to sweep processes.
 */
public enum Signal {
    TERM,
    KILL
}
