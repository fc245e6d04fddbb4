package com.sweepwatch.core.sweep;

import com.sweepwatch.core.events.EventBus;
import com.sweepwatch.core.events.StreamEvent;
import com.sweepwatch.core.logging.MdcContext;
import com.sweepwatch.core.metrics.SweepMetrics;
import com.sweepwatch.core.model.CycleStatus;
import com.sweepwatch.core.model.FrequencySpec;
import com.sweepwatch.core.model.ProcessHealth;
import com.sweepwatch.core.model.SweepConfig;
import com.sweepwatch.core.model.SweepPhase;
import com.sweepwatch.core.model.SweepState;
import com.sweepwatch.core.process.CancellationToken;
import com.sweepwatch.core.process.CleanupResult;
import com.sweepwatch.core.process.DeviceProbeResult;
import com.sweepwatch.core.process.DeviceUnavailableException;
import com.sweepwatch.core.process.ProcessObservation;
import com.sweepwatch.core.process.ProcessOutputListener;
import com.sweepwatch.core.process.ProcessSupervisor;
import com.sweepwatch.core.process.SpawnFailedException;
import com.sweepwatch.core.process.SweepProcessHandle;
import com.sweepwatch.core.recovery.DeviceHealthRecord;
import com.sweepwatch.core.recovery.DeviceStatus;
import com.sweepwatch.core.recovery.ErrorAnalysis;
import com.sweepwatch.core.recovery.ErrorContext;
import com.sweepwatch.core.recovery.RecoveryDecision;
import com.sweepwatch.core.recovery.RecoveryEngine;
import com.sweepwatch.core.recovery.RecoveryStrategy;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * The sweep state machine.
 * <p>
 * A single {@code sweep-supervisor} thread owns every transition: commands, timer ticks,
 * liveness callbacks and fatal-output callbacks are all tasks on that thread. Status queries read
 * the current {@link SweepState} snapshot without waiting. Emergency stop is the exception: it
 * kills processes on the caller's thread first, cancels every pending wait through the
 * {@link CancellationToken}, and fences all queued tasks before the supervisor thread records
 * the terminal phase.
 * <p>
 * Callbacks carry the {@link SweepProcessHandle} they were created for and are ignored once that
 * handle is no longer the active one.
 */
@Service
public class SweepController {

    private static final Logger log = LoggerFactory.getLogger(SweepController.class);

    static final String DEVICE_SOURCE = "hackrf";

    private static final int QUEUED = 0;
    private static final int STARTED = 1;
    private static final int ABANDONED = 2;

    private final ProcessSupervisor supervisor;
    private final RecoveryEngine recovery;
    private final EventBus eventBus;
    private final SweepProperties properties;
    private final SweepMetrics metrics;
    private final Clock clock;
    private final SweepArgumentBuilder argumentBuilder;
    private final SweepOutputParser parser = new SweepOutputParser();

    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sweep-supervisor");
        t.setDaemon(true);
        return t;
    });

    private final AtomicReference<SweepState> state = new AtomicReference<>(SweepState.initial());
    private final AtomicBoolean emergency = new AtomicBoolean();

    private volatile SweepConfig config;
    private volatile SweepProcessHandle activeHandle;
    private volatile CancellationToken token = new CancellationToken();

    private volatile ScheduledFuture<?> settleTimer;
    private volatile ScheduledFuture<?> cycleTimer;
    private volatile ScheduledFuture<?> retryTimer;
    private volatile ScheduledFuture<?> selfCheckTimer;

    private volatile boolean recovering;
    private volatile int recoveryAttempts;
    private volatile Instant spawnedAt;
    private volatile Instant lastDataAt;

    @Autowired
    public SweepController(ProcessSupervisor supervisor, RecoveryEngine recovery, EventBus eventBus,
                           SweepProperties properties, SweepMetrics metrics) {
        this(supervisor, recovery, eventBus, properties, metrics, Clock.systemUTC());
    }

    public SweepController(ProcessSupervisor supervisor, RecoveryEngine recovery, EventBus eventBus,
                           SweepProperties properties, SweepMetrics metrics, Clock clock) {
        this.supervisor = supervisor;
        this.recovery = recovery;
        this.eventBus = eventBus;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        this.argumentBuilder = new SweepArgumentBuilder(properties);
    }

    @PostConstruct
    void startSelfCheck() {
        long interval = properties.getSelfCheckIntervalMs();
        if (interval <= 0) {
            return;
        }
        selfCheckTimer = executor.scheduleAtFixedRate(fenced(this::selfCheck), interval, interval,
                TimeUnit.MILLISECONDS);
        log.info("Sweep self-check started (interval={}ms)", interval);
    }

    @PreDestroy
    public void shutdown() {
        cancel(selfCheckTimer);
        cancelTimers();
        token.cancel();
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Sweep supervisor thread did not terminate");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        SweepProcessHandle handle = activeHandle;
        if (handle != null) {
            supervisor.stop(handle, false, new CancellationToken());
        }
        log.info("Sweep controller stopped");
    }

    // ── Commands ─────────────────────────────────────────────────────

    /**
     * Starts sweeping. Only valid from IDLE.
     */
    public StartResult start(SweepConfig newConfig) {
        List<String> problems = argumentBuilder.validate(newConfig);
        if (!problems.isEmpty()) {
            return StartResult.rejected(RejectionReason.INVALID_CONFIG, String.join("; ", problems), state.get());
        }
        if (emergency.get()) {
            return StartResult.rejected(RejectionReason.EMERGENCY_STOPPED,
                    "Emergency stop is active; reset the server first", state.get());
        }
        return call(() -> doStart(newConfig),
                () -> StartResult.rejected(RejectionReason.TIMEOUT, "Start timed out", state.get()));
    }

    /**
     * Gracefully stops the sweep and returns to IDLE once the process is confirmed dead.
     */
    public StopResult stop() {
        return call(this::doStop,
                () -> new StopResult(false, state.get().phase(), "Stop timed out"));
    }

    /**
     * Kills every sweep process immediately, from any phase, and enters EMERGENCY_STOPPED.
     * Returns after verifying no sweep process remains or the kill timeout elapses.
     */
    public EmergencyStopResult emergencyStop() {
        log.warn("EMERGENCY STOP requested (phase={})", state.get().phase());
        emergency.set(true);
        token.cancel();
        cancelTimers();
        supervisor.emergencyKillAll();
        activeHandle = null;

        SweepPhase finalPhase = SweepPhase.EMERGENCY_STOPPED;
        Future<?> finish;
        try {
            finish = executor.submit(guarded(this::finishEmergencyStop));
        } catch (RejectedExecutionException e) {
            // executor is gone, so this thread is the only writer
            log.error("Sweep supervisor is shut down; recording emergency stop directly");
            forceEmergencyState();
            finish = null;
        }
        if (finish != null) {
            try {
                finish.get(properties.getCommandTimeoutMs(), TimeUnit.MILLISECONDS);
                finalPhase = state.get().phase();
            } catch (TimeoutException | ExecutionException e) {
                log.error("Supervisor thread has not finished emergency stop ({}); it stays queued", e.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        int remaining = supervisor.countSweepProcesses();
        metrics.recordEmergencyStop(remaining);
        if (remaining > 0) {
            log.error("Emergency stop left {} sweep process(es) alive", remaining);
        }
        return new EmergencyStopResult(remaining == 0, remaining, finalPhase);
    }

    /**
     * Kills every sweep and info process regardless of state. A running sweep is abandoned and the
     * controller returns to IDLE (EMERGENCY_STOPPED is kept).
     */
    public CleanupResult forceCleanup() {
        return call(() -> {
            cancelTimers();
            activeHandle = null;
            CleanupResult result = supervisor.forceCleanupAll();
            if (state.get().phase() != SweepPhase.EMERGENCY_STOPPED) {
                config = null;
                recovering = false;
                state.set(SweepState.initial());
                MdcContext.setPhase(SweepPhase.IDLE);
                publishStatus("Force cleanup killed " + result.killed() + " process(es)");
            }
            return result;
        }, () -> supervisor.forceCleanupAll());
    }

    /**
     * Compares believed state with OS reality, fixes any disagreement, resets recovery, and
     * always reports the result as a state sync event.
     */
    public SyncReport manualSync() {
        return call(() -> reconcile(true),
                () -> new SyncReport(state.get(), state.get(), List.of("Sync timed out")));
    }

    /**
     * Kills everything and returns the controller and recovery to their initial state. This is the
     * only way out of EMERGENCY_STOPPED.
     */
    public ResetResult serverReset() {
        log.warn("Server reset requested (phase={})", state.get().phase());
        emergency.set(true);
        token.cancel();
        cancelTimers();
        CleanupResult killed = supervisor.emergencyKillAll();

        try {
            executor.submit(guarded(this::finishReset)).get(properties.getCommandTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | ExecutionException e) {
            log.error("Supervisor thread has not finished reset ({}); it stays queued", e.toString());
        } catch (RejectedExecutionException e) {
            log.error("Sweep supervisor is shut down; reset not applied");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return new ResetResult(killed.killed(), state.get().phase());
    }

    // ── Queries ──────────────────────────────────────────────────────

    public SweepState currentState() {
        return state.get();
    }

    public SweepConfig currentConfig() {
        return config;
    }

    public Instant lastDataAt() {
        return lastDataAt;
    }

    public DeviceHealthRecord deviceHealth() {
        return recovery.snapshot();
    }

    public CycleStatus cycleStatus() {
        SweepState s = state.get();
        SweepConfig cfg = config;
        List<FrequencySpec> freqs = cfg == null ? List.of() : cfg.frequencies();
        FrequencySpec currentFreq = s.currentFrequencyIndex() < freqs.size()
                ? freqs.get(s.currentFrequencyIndex()) : null;
        long cycleTime = cfg == null ? 0 : cfg.cycleTimeMs();

        long remaining = 0;
        if (s.phase() == SweepPhase.RUNNING && cfg != null && cfg.isMultiFrequency() && s.cycleStartedAt() != null) {
            long elapsed = Duration.between(s.cycleStartedAt(), clock.instant()).toMillis();
            remaining = Math.max(0, cycleTime - elapsed);
        }

        DeviceHealthRecord health = recovery.snapshot();
        List<Integer> blacklisted = health.blacklistedFrequencies().stream().sorted().toList();

        SweepProcessHandle handle = activeHandle;
        ProcessHealth processHealth = handle == null
                ? ProcessHealth.none(lastDataAt)
                : new ProcessHealth(true, handle.processId(), handle.processGroupId(), handle.startTime(), lastDataAt);

        return new CycleStatus(s.phase(), freqs, s.currentFrequencyIndex(), currentFreq, cycleTime,
                s.cycleStartedAt(), remaining, s.consecutiveErrorCount(), s.lastError(), blacklisted, processHealth);
    }

    // ── Supervisor-thread logic ──────────────────────────────────────

    private StartResult doStart(SweepConfig newConfig) {
        SweepState s = state.get();
        if (s.phase() == SweepPhase.EMERGENCY_STOPPED || emergency.get()) {
            return StartResult.rejected(RejectionReason.EMERGENCY_STOPPED,
                    "Emergency stop is active; reset the server first", s);
        }
        if (s.phase() != SweepPhase.IDLE) {
            return StartResult.rejected(RejectionReason.INVALID_STATE, "Sweep is already " + s.phase(), s);
        }

        recovery.clearBlacklist();
        config = newConfig;
        recovering = false;
        recoveryAttempts = 0;
        lastDataAt = null;

        try {
            spawnAt(0, true, true);
        } catch (DeviceUnavailableException e) {
            config = null;
            recovery.recordDeviceStatus(deviceStatusFor(e.getProbe()));
            log.warn("Start rejected: {}", e.getMessage());
            return StartResult.rejected(RejectionReason.DEVICE_UNAVAILABLE, e.getMessage(), state.get());
        } catch (SpawnFailedException e) {
            config = null;
            log.error("Start failed: {}", e.getMessage());
            return StartResult.rejected(RejectionReason.SPAWN_FAILED, e.getMessage(), state.get());
        }

        publish(new StreamEvent.CycleConfig(newConfig, 0, clock.instant()));
        log.info("Sweep started: {} frequency(ies), cycle {}ms", newConfig.frequencies().size(),
                newConfig.cycleTimeMs());
        return StartResult.accepted(state.get());
    }

    private StopResult doStop() {
        SweepState s = state.get();
        if (s.phase() == SweepPhase.IDLE) {
            return new StopResult(true, SweepPhase.IDLE, "Sweep already stopped");
        }
        if (s.phase() == SweepPhase.EMERGENCY_STOPPED) {
            return new StopResult(true, SweepPhase.EMERGENCY_STOPPED, "Emergency stop is active");
        }

        transition(st -> st.withPhase(SweepPhase.STOPPING));
        publishStatus("Stopping sweep");
        cancelTimers();
        recovering = false;

        SweepProcessHandle handle = activeHandle;
        activeHandle = null;
        boolean dead = handle == null || supervisor.stop(handle, true, token);
        if (!dead) {
            transition(st -> st.withError("Sweep process did not terminate"));
            publish(new StreamEvent.SweepError("Sweep process did not terminate", "stop_failed", clock.instant()));
            return new StopResult(false, SweepPhase.ERROR, "Sweep process did not terminate");
        }

        config = null;
        transition(st -> SweepState.initial());
        publishStatus("Sweep stopped");
        return new StopResult(true, SweepPhase.IDLE, "Sweep stopped");
    }

    private void finishEmergencyStop() {
        cancelTimers();
        activeHandle = null;
        supervisor.emergencyKillAll();
        forceEmergencyState();
    }

    private void forceEmergencyState() {
        config = null;
        recovering = false;
        state.set(new SweepState(SweepPhase.EMERGENCY_STOPPED, 0, null, 0, "Emergency stop"));
        MdcContext.setPhase(SweepPhase.EMERGENCY_STOPPED);
        log.warn("Sweep is EMERGENCY_STOPPED");
        publishStatus("Emergency stop: all sweep processes killed");
    }

    private void finishReset() {
        try {
            cancelTimers();
            activeHandle = null;
            supervisor.emergencyKillAll();
            config = null;
            recovering = false;
            recoveryAttempts = 0;
            lastDataAt = null;
            recovery.reset();
            token = new CancellationToken();
            state.set(SweepState.initial());
            MdcContext.setPhase(SweepPhase.IDLE);
        } finally {
            emergency.set(false);
        }
        log.info("Server state reset to IDLE");
        publish(new StreamEvent.ServerReset("Server state reset", clock.instant()));
        publishStatus("Sweep idle after server reset");
    }

    /**
     * Spawns the process for {@code index}. With {@code settle} the phase becomes STARTING and the
     * settle timer decides when it is RUNNING; otherwise (a cycle switch) the phase stays RUNNING.
     */
    private void spawnAt(int index, boolean probe, boolean settle)
            throws DeviceUnavailableException, SpawnFailedException {
        FrequencySpec spec = config.frequencyAt(index);
        SweepProcessHandle handle;
        try {
            handle = supervisor.spawn(argumentBuilder.build(spec), new Listener(), probe);
            metrics.recordSpawn(true);
        } catch (DeviceUnavailableException | SpawnFailedException e) {
            metrics.recordSpawn(false);
            throw e;
        }

        Instant now = clock.instant();
        activeHandle = handle;
        spawnedAt = now;
        if (settle) {
            transition(st -> new SweepState(SweepPhase.STARTING, index, now, st.consecutiveErrorCount(), st.lastError()));
            settleTimer = schedule(() -> onSettled(handle), properties.getSettleMs());
            publishStatus("Starting sweep on " + spec.label());
        } else {
            transition(st -> st.withFrequency(index, now));
        }
        supervisor.startMonitoring(handle, () -> post(() ->
                onProcessGone(handle, "Sweep process " + handle.processId() + " is gone")));
    }

    private void onSettled(SweepProcessHandle handle) {
        if (handle != activeHandle || state.get().phase() != SweepPhase.STARTING) {
            return;
        }
        recovery.recordSuccess();
        transition(st -> st.withPhase(SweepPhase.RUNNING).withErrorsCleared());
        metrics.recordSettleDuration(Duration.between(handle.startTime(), clock.instant()).toMillis());
        if (recovering) {
            publish(new StreamEvent.RecoveryComplete(recoveryAttempts, clock.instant()));
            recovering = false;
            recoveryAttempts = 0;
        }
        publishStatus("Sweep running on " + config.frequencyAt(state.get().currentFrequencyIndex()).label());
        armCycleTimer();
    }

    private void armCycleTimer() {
        cancel(cycleTimer);
        long period = config.cycleTimeMs();
        cycleTimer = executor.scheduleAtFixedRate(fenced(this::onCycleTick), period, period, TimeUnit.MILLISECONDS);
    }

    private void onCycleTick() {
        SweepState s = state.get();
        SweepConfig cfg = config;
        if (s.phase() != SweepPhase.RUNNING || cfg == null || !cfg.isMultiFrequency()) {
            return;
        }
        int current = s.currentFrequencyIndex();
        int next = nextUsableIndex(current);
        if (next < 0) {
            escalate("Every frequency is blacklisted", "blacklist");
            return;
        }
        if (next == current) {
            return;
        }

        SweepProcessHandle old = activeHandle;
        activeHandle = null;
        if (old != null && !supervisor.stop(old, true, token)) {
            handleFailure(null, ErrorContext.transientFailure("Could not stop sweep process for frequency switch", current));
            return;
        }
        if (token.await(Duration.ofMillis(properties.getSwitchDelayMs())) || emergency.get()) {
            return;
        }

        try {
            spawnAt(next, false, false);
        } catch (DeviceUnavailableException | SpawnFailedException e) {
            handleFailure(null, ErrorContext.transientFailure(e.getMessage(), next));
            return;
        }
        metrics.recordFrequencySwitch();
        FrequencySpec spec = cfg.frequencyAt(next);
        log.info("Switched to frequency #{} ({})", next, spec.label());
        publish(new StreamEvent.Status(SweepPhase.RUNNING, (double) (next + 1) / cfg.frequencies().size(),
                "Switched to " + spec.label(), clock.instant()));
        publish(new StreamEvent.CycleConfig(cfg, next, clock.instant()));
    }

    /**
     * The next index after {@code from} (wrapping) that is not blacklisted. Each skipped frequency
     * is reported. Returns {@code from} when it is the only usable one, -1 when none is.
     */
    private int nextUsableIndex(int from) {
        int n = config.frequencies().size();
        for (int step = 1; step <= n; step++) {
            int candidate = (from + step) % n;
            if (!recovery.isBlacklisted(candidate)) {
                return candidate;
            }
            if (candidate != from) {
                publishStatus("Skipping blacklisted frequency " + config.frequencyAt(candidate).label());
            }
        }
        return -1;
    }

    private void onFatalOutput(SweepProcessHandle handle, String line) {
        if (handle != activeHandle) {
            return;
        }
        boolean startupFatal = supervisor.classifyStartupError(line);
        log.error("Fatal sweep output: {}", line);
        handleFailure(handle, new ErrorContext(line, startupFatal, state.get().currentFrequencyIndex()));
    }

    private void onProcessGone(SweepProcessHandle handle, String message) {
        if (handle != activeHandle) {
            return;
        }
        log.warn("{} (phase={})", message, state.get().phase());
        handleFailure(handle, ErrorContext.transientFailure(message, state.get().currentFrequencyIndex()));
    }

    private void handleFailure(SweepProcessHandle failed, ErrorContext context) {
        if (emergency.get()) {
            return;
        }
        cancelTimers();
        activeHandle = null;
        if (failed != null) {
            supervisor.stop(failed, false, token);
        }

        transition(st -> st.withError(context.message()));
        ErrorAnalysis analysis = ErrorAnalysis.of(context.message());
        publish(new StreamEvent.SweepError(context.message(), analysis.kind().wireName(), clock.instant()));

        RecoveryDecision decision = recovery.decide(context);
        if (decision instanceof RecoveryDecision.Retry retry) {
            recovering = true;
            recoveryAttempts = retry.attempt();
            metrics.recordRecovery(retry.strategy().name());
            publish(new StreamEvent.RecoveryStart(context.message(), retry.attempt(), retry.maxAttempts(),
                    retry.strategy().name(), retry.delayMs(), clock.instant()));
            int index = context.frequencyIndex() == null ? state.get().currentFrequencyIndex() : context.frequencyIndex();
            retryTimer = schedule(() -> runRetry(index, retry.strategy()), retry.delayMs());
        } else if (decision instanceof RecoveryDecision.Blacklist blacklist) {
            metrics.recordBlacklist();
            publishStatus("Blacklisted frequency " + config.frequencyAt(blacklist.frequencyIndex()).label()
                    + ": " + blacklist.reason());
            int next = nextUsableIndex(blacklist.frequencyIndex());
            if (next < 0 || next == blacklist.frequencyIndex()) {
                escalate("Every frequency is blacklisted", "blacklist");
                return;
            }
            recovering = true;
            retryTimer = schedule(() -> runRetry(next, RecoveryStrategy.WAIT_AND_RETRY), 0);
        } else if (decision instanceof RecoveryDecision.Escalate escalate) {
            escalate(escalate.reason(), escalate.kind().wireName());
        }
    }

    private void escalate(String reason, String kind) {
        cancelTimers();
        recovering = false;
        metrics.recordEscalation(kind);
        log.error("Recovery escalated: {}", reason);
        if (state.get().phase() != SweepPhase.ERROR) {
            transition(st -> st.withError(reason));
        }
        publish(new StreamEvent.SweepError("Recovery stopped: " + reason, "escalated", clock.instant()));
        publishStatus("Sweep needs operator attention: " + reason);
    }

    private void runRetry(int index, RecoveryStrategy strategy) {
        retryTimer = null;
        if (state.get().phase() != SweepPhase.ERROR || config == null) {
            return;
        }
        boolean probe = true;
        if (strategy == RecoveryStrategy.AGGRESSIVE_CLEANUP) {
            CleanupResult cleanup = supervisor.forceCleanupAll();
            log.info("Aggressive cleanup before retry killed {} process(es)", cleanup.killed());
        } else if (strategy == RecoveryStrategy.DEVICE_RESET) {
            supervisor.forceCleanupAll();
            DeviceProbeResult result = supervisor.probeDevice();
            recovery.recordDeviceStatus(deviceStatusFor(result));
            if (!result.available()) {
                handleFailure(null, ErrorContext.transientFailure(result.reason(), index));
                return;
            }
            probe = false;
        }
        if (emergency.get()) {
            return;
        }

        try {
            spawnAt(index, probe, true);
        } catch (DeviceUnavailableException e) {
            recovery.recordDeviceStatus(deviceStatusFor(e.getProbe()));
            handleFailure(null, ErrorContext.transientFailure(e.getMessage(), index));
        } catch (SpawnFailedException e) {
            handleFailure(null, ErrorContext.transientFailure(e.getMessage(), index));
        }
    }

    private void selfCheck() {
        SyncReport report = reconcile(false);
        if (!report.changed()) {
            checkNoData();
        }
    }

    private void checkNoData() {
        SweepProcessHandle handle = activeHandle;
        if (state.get().phase() != SweepPhase.RUNNING || handle == null) {
            return;
        }
        Instant since = spawnedAt;
        Instant data = lastDataAt;
        if (data != null && (since == null || data.isAfter(since))) {
            since = data;
        }
        if (since != null && Duration.between(since, clock.instant()).toMillis() > properties.getNoDataTimeoutMs()) {
            handleFailure(handle, ErrorContext.transientFailure(
                    "No data received for " + properties.getNoDataTimeoutMs() / 1000 + "s",
                    state.get().currentFrequencyIndex()));
        }
    }

    /**
     * Reconciles believed state with OS reality. Manual syncs also clear errors, reset recovery
     * and always publish the outcome; the periodic check publishes only when it changed something
     * and hands a vanished process to recovery instead of idling.
     */
    private SyncReport reconcile(boolean manual) {
        SweepState before = state.get();
        ProcessObservation observed = supervisor.observe();
        List<String> changes = new ArrayList<>();
        SweepProcessHandle tracked = observed.handle();
        boolean trackedAlive = tracked != null && observed.handleAlive();
        SweepPhase phase = before.phase();
        Long keepPid = null;

        if (phase == SweepPhase.EMERGENCY_STOPPED) {
            int killed = supervisor.killOrphans(Set.of());
            if (killed > 0) {
                changes.add("Killed " + killed + " sweep process(es) left after emergency stop");
            }
        } else {
            if (phase.expectsProcess() && !trackedAlive) {
                if (manual) {
                    cancelTimers();
                    activeHandle = null;
                    recovering = false;
                    config = null;
                    transition(st -> SweepState.initial());
                    changes.add("State was " + phase + " but no sweep process is alive; now IDLE");
                } else {
                    changes.add("Sweep process vanished while " + phase + "; starting recovery");
                    handleFailure(activeHandle, ErrorContext.transientFailure("Sweep process vanished",
                            before.currentFrequencyIndex()));
                }
            } else if (!phase.expectsProcess() && phase != SweepPhase.STOPPING && trackedAlive) {
                if (config != null) {
                    activeHandle = tracked;
                    keepPid = tracked.processId();
                    cancel(retryTimer);
                    recovering = false;
                    transition(st -> st.withPhase(SweepPhase.RUNNING).withErrorsCleared());
                    SweepProcessHandle adopted = tracked;
                    supervisor.startMonitoring(adopted, () -> post(() ->
                            onProcessGone(adopted, "Sweep process " + adopted.processId() + " is gone")));
                    armCycleTimer();
                    changes.add("Sweep process " + tracked.processId() + " alive while state was " + phase
                            + "; now RUNNING");
                } else {
                    supervisor.stop(tracked, false, token);
                    changes.add("Killed untracked sweep process " + tracked.processId());
                }
            } else if (trackedAlive) {
                keepPid = tracked.processId();
            }

            Set<Long> keep = keepPid == null ? Set.of() : Set.of(keepPid);
            List<Long> orphans = observed.sweepPids().stream().filter(pid -> !keep.contains(pid)).toList();
            if (!orphans.isEmpty()) {
                int killed = supervisor.killOrphans(keep);
                changes.add("Killed " + killed + " orphaned sweep process(es)");
            }

            if (manual && state.get().phase() == SweepPhase.ERROR && activeHandle == null) {
                cancelTimers();
                recovering = false;
                config = null;
                transition(st -> SweepState.initial());
                changes.add("Cleared ERROR state; now IDLE");
            }
        }

        if (manual) {
            DeviceHealthRecord health = recovery.snapshot();
            if (!health.blacklistedFrequencies().isEmpty() || health.consecutiveFailures() > 0) {
                changes.add("Recovery state and frequency blacklist reset");
            }
            recovery.reset();
        }

        SweepState after = state.get();
        SyncReport report = new SyncReport(before, after, changes);
        if (manual || report.changed()) {
            metrics.recordStateSync(manual ? "manual" : "self-check", changes.size());
            if (report.changed()) {
                log.warn("State sync ({}): {}", manual ? "manual" : "self-check", changes);
            }
            publish(new StreamEvent.StateSync(before, after, changes, clock.instant()));
        }
        return report;
    }

    // ── Helpers ──────────────────────────────────────────────────────

    private SweepState transition(UnaryOperator<SweepState> change) {
        SweepState before = state.get();
        SweepState after = change.apply(before);
        state.set(after);
        if (before.phase() != after.phase()) {
            SweepProcessHandle handle = activeHandle;
            MdcContext.setSweep(after.phase(), handle == null ? null : handle.processId());
            log.info("Sweep phase {} -> {}", before.phase(), after.phase());
        }
        return after;
    }

    private void publish(StreamEvent event) {
        eventBus.publish(event);
    }

    private void publishStatus(String message) {
        publish(new StreamEvent.Status(state.get().phase(), null, message, clock.instant()));
    }

    private void cancelTimers() {
        cancel(settleTimer);
        cancel(cycleTimer);
        cancel(retryTimer);
        settleTimer = null;
        cycleTimer = null;
        retryTimer = null;
    }

    private static void cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }

    private static DeviceStatus deviceStatusFor(DeviceProbeResult probe) {
        return switch (probe.outcome()) {
            case AVAILABLE -> DeviceStatus.AVAILABLE;
            case BUSY -> DeviceStatus.BUSY;
            case NOT_FOUND -> DeviceStatus.DISCONNECTED;
            case TIMEOUT -> DeviceStatus.STUCK;
            case FAILED -> DeviceStatus.UNKNOWN;
        };
    }

    /**
     * Runs a command on the supervisor thread and waits for it with the command timeout.
     * <p>
     * A command still queued when the timeout expires is abandoned and never runs, so a caller
     * told TIMEOUT never sees the command take effect later. A command that has already started
     * is waited for until it finishes and its real result is returned.
     */
    private <T> T call(Callable<T> task, Supplier<T> onTimeout) {
        AtomicInteger claim = new AtomicInteger(QUEUED);
        Future<T> future;
        try {
            future = executor.submit(() -> {
                if (!claim.compareAndSet(QUEUED, STARTED)) {
                    return null;
                }
                try {
                    return task.call();
                } finally {
                    MdcContext.clear();
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Sweep supervisor is shut down");
            return onTimeout.get();
        }
        try {
            try {
                return future.get(properties.getCommandTimeoutMs(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (claim.compareAndSet(QUEUED, ABANDONED)) {
                    future.cancel(false);
                    log.error("Sweep command still queued after {}ms; abandoned", properties.getCommandTimeoutMs());
                    return onTimeout.get();
                }
                log.warn("Sweep command running longer than {}ms; waiting for it", properties.getCommandTimeoutMs());
                return future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (claim.compareAndSet(QUEUED, ABANDONED)) {
                future.cancel(false);
            }
            return onTimeout.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Sweep command failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    private void post(Runnable task) {
        try {
            executor.execute(fenced(task));
        } catch (RejectedExecutionException e) {
            log.debug("Dropped sweep task after shutdown");
        }
    }

    private ScheduledFuture<?> schedule(Runnable task, long delayMs) {
        try {
            return executor.schedule(fenced(task), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Dropped sweep timer after shutdown");
            return null;
        }
    }

    /** Skips the task once an emergency stop or reset is in progress. */
    private Runnable fenced(Runnable task) {
        return guarded(() -> {
            if (!emergency.get()) {
                task.run();
            }
        });
    }

    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Sweep supervisor task failed: {}", e.getMessage(), e);
            } finally {
                MdcContext.clear();
            }
        };
    }

    private final class Listener implements ProcessOutputListener {

        @Override
        public void onStdout(SweepProcessHandle handle, String line) {
            if (handle != activeHandle) {
                return;
            }
            SweepConfig cfg = config;
            if (cfg == null) {
                return;
            }
            int index = state.get().currentFrequencyIndex();
            double center = index < cfg.frequencies().size() ? cfg.frequencyAt(index).centerMhz() : 0;
            Instant now = clock.instant();
            parser.parse(line, center, now).ifPresent(sample -> {
                lastDataAt = now;
                metrics.recordSamples(1);
                publish(new StreamEvent.SweepData(sample, DEVICE_SOURCE, now));
            });
        }

        /**
         * Stderr can arrive before {@code spawnAt} has recorded the handle, so the handle check for
         * fatal lines happens on the supervisor thread, after the spawn task has finished.
         */
        @Override
        public void onStderr(SweepProcessHandle handle, String line) {
            if (supervisor.classifyStartupError(line) || supervisor.isRuntimeDeviceError(line)) {
                post(() -> onFatalOutput(handle, line));
            } else {
                log.debug("sweep stderr: {}", line);
            }
        }

        @Override
        public void onExit(SweepProcessHandle handle, int exitCode) {
            post(() -> onProcessGone(handle, "Sweep process exited with code " + exitCode));
        }
    }
}
