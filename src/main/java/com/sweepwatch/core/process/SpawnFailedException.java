package com.sweepwatch.core.process;

/**
 * Thrown when the sweep binary could not be started.
 */
public class SpawnFailedException extends Exception {

    public SpawnFailedException(String message) {
        super(message);
    }

    public SpawnFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
