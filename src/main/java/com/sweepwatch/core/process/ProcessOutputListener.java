package com.sweepwatch.core.process;

/**
 * Receives output and exit notifications from a supervised process.
 * Callbacks arrive on reader threads and must not block.
 */
public interface ProcessOutputListener {

    void onStdout(SweepProcessHandle handle, String line);

    void onStderr(SweepProcessHandle handle, String line);

    /**
     * Called once the process has exited and both output streams are drained.
     */
    default void onExit(SweepProcessHandle handle, int exitCode) {
    }
}
