package com.sweepwatch.core.process;

import java.io.InputStream;
import java.util.concurrent.CompletableFuture;

/**
 * A running child process as seen by the supervisor.
 */
public interface LaunchedProcess {

    long pid();

    /** The process group id if the process leads its own group, otherwise null. */
    Long processGroupId();

    InputStream stdout();

    InputStream stderr();

    /** Completes with the exit code once the process has terminated. */
    CompletableFuture<Integer> onExit();
}
