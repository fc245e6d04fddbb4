package com.sweepwatch.core.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * {@link ProcessLauncher} backed by {@link ProcessBuilder} and {@link ProcessHandle}.
 * <p>
 * When {@code useSetsid} is on, the sweep binary is started through {@code setsid} so it leads
 * a fresh process group (pgid == pid) and group kills cannot reach the JVM.
 */
public class OsProcessLauncher implements ProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(OsProcessLauncher.class);

    private final boolean useSetsid;

    public OsProcessLauncher(boolean useSetsid) {
        this.useSetsid = useSetsid;
    }

    @Override
    public LaunchedProcess launch(List<String> command) throws IOException {
        List<String> full = new ArrayList<>();
        if (useSetsid) {
            full.add("setsid");
        }
        full.addAll(command);

        Process process = new ProcessBuilder(full)
                .redirectInput(ProcessBuilder.Redirect.from(Path.of("/dev/null").toFile()))
                .redirectErrorStream(false)
                .start();
        log.debug("Launched {} (pid={})", String.join(" ", full), process.pid());
        return new OsLaunchedProcess(process, useSetsid ? process.pid() : null);
    }

    @Override
    public boolean isAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    @Override
    public boolean signal(long pid, Signal signal) {
        return ProcessHandle.of(pid)
                .filter(ProcessHandle::isAlive)
                .map(ph -> signal == Signal.KILL ? ph.destroyForcibly() : ph.destroy())
                .orElse(false);
    }

    @Override
    public boolean signalGroup(long processGroupId, Signal signal) {
        String name = signal == Signal.KILL ? "KILL" : "TERM";
        try {
            CommandResult result = run(List.of("kill", "-s", name, "--", "-" + processGroupId),
                    Duration.ofSeconds(2));
            return result.exitCode() == 0;
        } catch (IOException e) {
            log.warn("Failed to signal process group {}: {}", processGroupId, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public List<Long> findByName(String name) {
        long self = ProcessHandle.current().pid();
        return ProcessHandle.allProcesses()
                .filter(ProcessHandle::isAlive)
                .filter(ph -> ph.pid() != self)
                .filter(ph -> ph.info().command()
                        .map(cmd -> name.equals(Path.of(cmd).getFileName().toString()))
                        .orElse(false))
                .map(ProcessHandle::pid)
                .toList();
    }

    @Override
    public CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException {
        Process process = new ProcessBuilder(command)
                .redirectInput(ProcessBuilder.Redirect.from(Path.of("/dev/null").toFile()))
                .start();

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));

        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            log.debug("Command timed out after {}ms: {}", timeout.toMillis(), String.join(" ", command));
            return CommandResult.timeout(collect(stdout), collect(stderr));
        }
        return new CommandResult(process.exitValue(), collect(stdout), collect(stderr), false);
    }

    private static String drain(InputStream in) {
        try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            log.debug("Output stream closed early: {}", e.getMessage());
            return "";
        }
    }

    private static String collect(CompletableFuture<String> output) throws InterruptedException {
        try {
            return output.get(1, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Command output not collected: {}", e.toString());
            return "";
        }
    }

    private record OsLaunchedProcess(Process process, Long processGroupId) implements LaunchedProcess {

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public InputStream stdout() {
            return process.getInputStream();
        }

        @Override
        public InputStream stderr() {
            return process.getErrorStream();
        }

        @Override
        public CompletableFuture<Integer> onExit() {
            return process.onExit().thenApply(Process::exitValue);
        }
    }
}
