package com.sweepwatch.core.process;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Operating-system process facility used by {@link ProcessSupervisor}.
 * <p>
 * Production code uses {@link OsProcessLauncher}; tests substitute a scripted fake.
 */
public interface ProcessLauncher {

    /**
     * Starts a long-running process with stdin closed and stdout/stderr captured.
     */
    LaunchedProcess launch(List<String> command) throws IOException;

    boolean isAlive(long pid);

    /**
     * Delivers a signal to one process.
     *
     * @return true if the signal was delivered
     */
    boolean signal(long pid, Signal signal);

    /**
     * Delivers a signal to every member of a process group.
     */
    boolean signalGroup(long processGroupId, Signal signal);

    /**
     * Lists pids of live processes whose executable name is exactly {@code name}.
     */
    List<Long> findByName(String name);

    /**
     * Runs a command to completion, killing it when the timeout elapses.
     */
    CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException;
}
