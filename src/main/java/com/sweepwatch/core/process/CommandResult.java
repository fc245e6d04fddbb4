package com.sweepwatch.core.process;

/**
 * Outcome of a short-lived command run to completion with a deadline.
 */
public record CommandResult(int exitCode, String stdout, String stderr, boolean timedOut) {

    /** Exit code the coreutils {@code timeout} wrapper uses; kept for timed-out runs. */
    public static final int TIMEOUT_EXIT_CODE = 124;

    public static CommandResult timeout(String stdout, String stderr) {
        return new CommandResult(TIMEOUT_EXIT_CODE, stdout, stderr, true);
    }

    public String combinedOutput() {
        return stdout + "\n" + stderr;
    }
}
