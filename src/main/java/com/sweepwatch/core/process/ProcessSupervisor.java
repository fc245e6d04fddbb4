package com.sweepwatch.core.process;

import com.sweepwatch.core.logging.MdcContext;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Owns the lifetime of the external sweep binary.
 * <p>
 * Every change to the OS process table (spawn, signal, kill-all) happens under one lock so a
 * kill-all can never interleave with a spawn. At most one live {@link SweepProcessHandle} is
 * tracked at a time. Output is pumped line by line on daemon reader threads.
 */
@Service
public class ProcessSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);

    /** Messages that mean the sweep cannot start on this device. Matched case-insensitively. */
    static final List<String> FATAL_STARTUP_PATTERNS = List.of(
            "No HackRF boards found",
            "hackrf_open() failed",
            "Resource busy",
            "Permission denied",
            "libusb_open() failed",
            "USB error",
            "hackrf_is_streaming() failed",
            "hackrf_start_rx() failed"
    );

    /** Device faults that can surface while the sweep is already streaming. */
    static final List<String> RUNTIME_DEVICE_PATTERNS = List.of(
            "libusb_submit_transfer",
            "hackrf_is_streaming",
            "USB error",
            "Device not found",
            "usb_claim_interface error",
            "HACKRF_ERROR"
    );

    private static final long POLL_INTERVAL_MS = 20;

    private final ProcessLauncher launcher;
    private final ProcessProperties properties;

    private final ReentrantLock processTableLock = new ReentrantLock();
    private final AtomicReference<SweepProcessHandle> current = new AtomicReference<>();

    /** Bumped by every kill-all; a spawn that started before the bump is abandoned. */
    private final AtomicLong killEpoch = new AtomicLong();

    private final AtomicInteger readerCounter = new AtomicInteger();

    private final ExecutorService outputReaders = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "sweep-output-" + readerCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private final ScheduledExecutorService livenessScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sweep-liveness");
        t.setDaemon(true);
        return t;
    });

    private volatile ScheduledFuture<?> monitorFuture;

    public ProcessSupervisor(ProcessLauncher launcher, ProcessProperties properties) {
        this.launcher = launcher;
        this.properties = properties;
    }

    /**
     * Probes the device, then starts the sweep binary with the given arguments.
     *
     * @param args       arguments after the binary name
     * @param listener   receives output lines and the exit notification
     * @param probeFirst whether to run the device probe before spawning
     * @return the handle of the new process
     * @throws DeviceUnavailableException if the probe reports the device busy, absent or unresponsive
     * @throws SpawnFailedException       if a live process is still tracked or the launch fails
     */
    public SweepProcessHandle spawn(List<String> args, ProcessOutputListener listener, boolean probeFirst)
            throws DeviceUnavailableException, SpawnFailedException {
        long epoch = killEpoch.get();

        if (probeFirst) {
            DeviceProbeResult probe = probeDevice();
            if (!probe.available()) {
                log.warn("Device probe failed: {} ({})", probe.reason(), probe.outcome());
                throw new DeviceUnavailableException(probe);
            }
        }

        processTableLock.lock();
        try {
            if (killEpoch.get() != epoch) {
                throw new SpawnFailedException("Spawn abandoned: kill-all ran while starting");
            }
            SweepProcessHandle existing = current.get();
            if (existing != null && launcher.isAlive(existing.processId())) {
                throw new SpawnFailedException("Sweep process " + existing.processId() + " is still running");
            }

            List<String> command = new ArrayList<>();
            command.add(properties.getSweepBinary());
            command.addAll(args);

            LaunchedProcess process;
            try {
                process = launcher.launch(command);
            } catch (IOException e) {
                throw new SpawnFailedException("Failed to launch " + properties.getSweepBinary() + ": " + e.getMessage(), e);
            }

            SweepProcessHandle handle = new SweepProcessHandle(process.pid(), process.processGroupId(), Instant.now());
            current.set(handle);
            MdcContext.setProcess(handle.processId());
            log.info("Spawned {} (pid={}, pgid={}) args={}", properties.getSweepBinary(),
                    handle.processId(), handle.processGroupId(), String.join(" ", args));

            CompletableFuture<Void> stdoutDone = pump(process.stdout(), line -> listener.onStdout(handle, line));
            CompletableFuture<Void> stderrDone = pump(process.stderr(), line -> listener.onStderr(handle, line));

            process.onExit().thenCompose(code -> {
                current.compareAndSet(handle, null);
                log.info("Sweep process {} exited with code {}", handle.processId(), code);
                return CompletableFuture.allOf(stdoutDone, stderrDone).thenApply(v -> code);
            }).thenAccept(code -> listener.onExit(handle, code));

            return handle;
        } finally {
            processTableLock.unlock();
        }
    }

    /**
     * Runs the device info utility with a hard timeout and classifies its output.
     */
    public DeviceProbeResult probeDevice() {
        CommandResult result;
        try {
            result = launcher.run(List.of(properties.getInfoBinary()),
                    Duration.ofMillis(properties.getProbeTimeoutMs()));
        } catch (IOException e) {
            return DeviceProbeResult.unavailable(DeviceProbeResult.Outcome.FAILED,
                    properties.getInfoBinary() + " unavailable: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeviceProbeResult.unavailable(DeviceProbeResult.Outcome.FAILED, "Device probe interrupted");
        }

        if (result.timedOut()) {
            return DeviceProbeResult.unavailable(DeviceProbeResult.Outcome.TIMEOUT, "Device check timeout");
        }
        String output = result.combinedOutput();
        if (output.contains("Resource busy")) {
            return DeviceProbeResult.unavailable(DeviceProbeResult.Outcome.BUSY, "Device busy");
        }
        if (output.contains("No HackRF boards found")) {
            return DeviceProbeResult.unavailable(DeviceProbeResult.Outcome.NOT_FOUND, "No HackRF found");
        }
        if (result.stdout().contains("Serial number")) {
            String info = Arrays.stream(result.stdout().split("\n"))
                    .map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .reduce((a, b) -> a + ", " + b)
                    .orElse("");
            return DeviceProbeResult.available(info);
        }
        return DeviceProbeResult.unavailable(DeviceProbeResult.Outcome.FAILED,
                "Unknown device state (exit " + result.exitCode() + ")");
    }

    /**
     * Stops a process. Graceful stops send TERM and wait the grace window before escalating to KILL.
     * The process group is killed too when the process leads one, and any stray process named
     * like the sweep binary is killed last.
     *
     * @param token cuts the grace window short when cancelled
     * @return true if the process is confirmed dead
     */
    public boolean stop(SweepProcessHandle handle, boolean graceful, CancellationToken token) {
        stopMonitoring();
        processTableLock.lock();
        try {
            long pid = handle.processId();
            if (graceful && launcher.isAlive(pid)) {
                log.debug("Sending TERM to {}", pid);
                launcher.signal(pid, Signal.TERM);
                token.await(Duration.ofMillis(properties.getGracePeriodMs()));
            }
            if (launcher.isAlive(pid)) {
                log.debug("Sending KILL to {}", pid);
                launcher.signal(pid, Signal.KILL);
            }
            if (handle.ownsProcessGroup()) {
                launcher.signalGroup(handle.processGroupId(), Signal.KILL);
            }
            killByName(List.of(properties.getSweepBinary()));

            boolean dead = awaitDeath(List.of(pid), properties.getKillVerifyTimeoutMs());
            if (dead) {
                current.compareAndSet(handle, null);
                log.info("Sweep process {} stopped ({})", pid, graceful ? "graceful" : "forced");
            } else {
                log.error("Sweep process {} still alive after stop", pid);
            }
            return dead;
        } finally {
            processTableLock.unlock();
        }
    }

    /**
     * Kills every process named like the sweep or info binary, bypassing all tracked state.
     */
    public CleanupResult forceCleanupAll() {
        killEpoch.incrementAndGet();
        processTableLock.lock();
        try {
            return killAllByName();
        } finally {
            processTableLock.unlock();
        }
    }

    /**
     * Kill-all used by emergency stop: stops monitoring, kills the tracked process and its group,
     * then every process named like the sweep or info binary. Returns after verification or the
     * verify timeout.
     */
    public CleanupResult emergencyKillAll() {
        killEpoch.incrementAndGet();
        stopMonitoring();
        processTableLock.lock();
        try {
            SweepProcessHandle handle = current.get();
            int killed = 0;
            if (handle != null) {
                if (launcher.signal(handle.processId(), Signal.KILL)) {
                    killed++;
                }
                if (handle.ownsProcessGroup()) {
                    launcher.signalGroup(handle.processGroupId(), Signal.KILL);
                }
            }
            CleanupResult byName = killAllByName();
            log.warn("Emergency kill-all: {} killed, {} remaining", killed + byName.killed(), byName.remaining());
            return new CleanupResult(killed + byName.killed(), byName.remaining());
        } finally {
            processTableLock.unlock();
        }
    }

    /**
     * Polls liveness of {@code handle} and invokes {@code onDeath} exactly once when it disappears.
     * Replaces any previous monitor.
     */
    public void startMonitoring(SweepProcessHandle handle, Runnable onDeath) {
        stopMonitoring();
        AtomicBoolean fired = new AtomicBoolean();
        AtomicReference<ScheduledFuture<?>> self = new AtomicReference<>();
        long interval = properties.getMonitorIntervalMs();
        ScheduledFuture<?> future = livenessScheduler.scheduleAtFixedRate(() -> {
            if (launcher.isAlive(handle.processId())) {
                return;
            }
            if (fired.compareAndSet(false, true)) {
                ScheduledFuture<?> f = self.get();
                if (f != null) {
                    f.cancel(false);
                }
                log.warn("Liveness check: sweep process {} is gone", handle.processId());
                try {
                    onDeath.run();
                } catch (Exception e) {
                    log.error("Death callback failed for {}: {}", handle.processId(), e.getMessage(), e);
                }
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
        self.set(future);
        monitorFuture = future;
    }

    public void stopMonitoring() {
        ScheduledFuture<?> future = monitorFuture;
        if (future != null) {
            future.cancel(false);
            monitorFuture = null;
        }
    }

    public boolean isMonitoring() {
        ScheduledFuture<?> future = monitorFuture;
        return future != null && !future.isDone();
    }

    /**
     * Whether a line of output means the sweep cannot start on this device.
     */
    public boolean classifyStartupError(String message) {
        return matchesAny(message, FATAL_STARTUP_PATTERNS);
    }

    /**
     * Whether a line of output reports a device fault that appeared mid-stream.
     */
    public boolean isRuntimeDeviceError(String message) {
        return matchesAny(message, RUNTIME_DEVICE_PATTERNS);
    }

    /**
     * Reads OS reality for split-brain reconciliation.
     */
    public ProcessObservation observe() {
        SweepProcessHandle handle = current.get();
        boolean alive = handle != null && launcher.isAlive(handle.processId());
        return new ProcessObservation(handle, alive, launcher.findByName(properties.getSweepBinary()));
    }

    /**
     * Kills sweep processes that are not in {@code keep}.
     *
     * @return how many were signalled
     */
    public int killOrphans(Collection<Long> keep) {
        processTableLock.lock();
        try {
            int killed = 0;
            for (long pid : launcher.findByName(properties.getSweepBinary())) {
                if (!keep.contains(pid) && launcher.signal(pid, Signal.KILL)) {
                    log.warn("Killed orphaned sweep process {}", pid);
                    killed++;
                }
            }
            return killed;
        } finally {
            processTableLock.unlock();
        }
    }

    public Optional<SweepProcessHandle> currentHandle() {
        return Optional.ofNullable(current.get());
    }

    /** Drops the tracked handle once the caller has confirmed the process is gone. */
    public void forget(SweepProcessHandle handle) {
        current.compareAndSet(handle, null);
    }

    public int countSweepProcesses() {
        return launcher.findByName(properties.getSweepBinary()).size();
    }

    @PreDestroy
    public void shutdown() {
        stopMonitoring();
        SweepProcessHandle handle = current.get();
        if (handle != null && launcher.isAlive(handle.processId())) {
            log.info("Shutting down: killing sweep process {}", handle.processId());
            stop(handle, false, new CancellationToken());
        }
        livenessScheduler.shutdownNow();
        outputReaders.shutdownNow();
    }

    private CleanupResult killAllByName() {
        List<String> names = List.of(properties.getSweepBinary(), properties.getInfoBinary());
        int killed = killByName(names);
        List<Long> remaining = new ArrayList<>();
        for (String name : names) {
            remaining.addAll(launcher.findByName(name));
        }
        if (!remaining.isEmpty()) {
            awaitDeath(remaining, properties.getKillVerifyTimeoutMs());
        }
        int left = 0;
        for (String name : names) {
            left += launcher.findByName(name).size();
        }
        SweepProcessHandle handle = current.get();
        if (handle != null && !launcher.isAlive(handle.processId())) {
            current.compareAndSet(handle, null);
        }
        return new CleanupResult(killed, left);
    }

    private int killByName(List<String> names) {
        int killed = 0;
        for (String name : names) {
            for (long pid : launcher.findByName(name)) {
                if (launcher.signal(pid, Signal.KILL)) {
                    killed++;
                }
            }
        }
        if (killed > 0) {
            log.info("Killed {} process(es) named {}", killed, names);
        }
        return killed;
    }

    private boolean awaitDeath(List<Long> pids, long timeoutMs) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (true) {
            boolean anyAlive = pids.stream().anyMatch(launcher::isAlive);
            if (!anyAlive) {
                return true;
            }
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return !pids.stream().anyMatch(launcher::isAlive);
            }
        }
    }

    private CompletableFuture<Void> pump(InputStream stream, Consumer<String> sink) {
        return CompletableFuture.runAsync(() -> {
            try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    try {
                        sink.accept(line);
                    } catch (Exception e) {
                        log.warn("Output handler failed: {}", e.getMessage(), e);
                    }
                }
            } catch (IOException e) {
                log.debug("Output stream closed: {}", e.getMessage());
            }
        }, outputReaders);
    }

    private static boolean matchesAny(String message, List<String> patterns) {
        if (message == null || message.isBlank()) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return patterns.stream().anyMatch(p -> lower.contains(p.toLowerCase(Locale.ROOT)));
    }
}
