package com.sweepwatch.core.process;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ProcessSupervisorTest {

    private static final List<String> ARGS = List.of("-f", "423:444", "-w", "20000");

    private FakeProcessLauncher launcher;
    private ProcessProperties properties;
    private ProcessSupervisor supervisor;

    @BeforeEach
    void setUp() {
        launcher = new FakeProcessLauncher();
        properties = new ProcessProperties();
        properties.setGracePeriodMs(20);
        properties.setKillVerifyTimeoutMs(300);
        properties.setMonitorIntervalMs(25);
        supervisor = new ProcessSupervisor(launcher, properties);
    }

    @AfterEach
    void tearDown() {
        supervisor.shutdown();
    }

    private static ProcessOutputListener quietListener() {
        return new ProcessOutputListener() {
            @Override
            public void onStdout(SweepProcessHandle handle, String line) {
            }

            @Override
            public void onStderr(SweepProcessHandle handle, String line) {
            }
        };
    }

    @Nested
    @DisplayName("spawn")
    class SpawnTests {

        @Test
        @DisplayName("launches the sweep binary with its arguments and tracks the handle")
        void launchesAndTracks() throws Exception {
            SweepProcessHandle handle = supervisor.spawn(ARGS, quietListener(), true);

            assertEquals(1, launcher.launchCount());
            assertEquals("hackrf_sweep", launcher.launched().get(0).get(0));
            assertEquals(ARGS, launcher.launched().get(0).subList(1, 5));
            assertEquals(1, launcher.probeRuns());
            assertEquals(handle, supervisor.currentHandle().orElseThrow());
            assertTrue(handle.ownsProcessGroup());
        }

        @Test
        @DisplayName("busy device fails fast without launching")
        void busyDeviceFailsFast() {
            launcher.probeReturns(new CommandResult(1, "", "hackrf_open() failed: Resource busy (-1000)", false));

            DeviceUnavailableException e = assertThrows(DeviceUnavailableException.class,
                    () -> supervisor.spawn(ARGS, quietListener(), true));

            assertEquals(DeviceProbeResult.Outcome.BUSY, e.getProbe().outcome());
            assertEquals(0, launcher.launchCount());
        }

        @Test
        @DisplayName("refuses a second spawn while the tracked process is alive")
        void refusesSecondSpawn() throws Exception {
            supervisor.spawn(ARGS, quietListener(), false);

            assertThrows(SpawnFailedException.class, () -> supervisor.spawn(ARGS, quietListener(), false));
            assertEquals(1, launcher.launchCount());
        }

        @Test
        @DisplayName("launch failure surfaces as SpawnFailedException")
        void launchFailure() {
            launcher.failLaunches(true);

            SpawnFailedException e = assertThrows(SpawnFailedException.class,
                    () -> supervisor.spawn(ARGS, quietListener(), false));
            assertTrue(e.getMessage().contains("Failed to launch"));
        }

        @Test
        @DisplayName("output lines reach the listener and exit is reported after both streams drain")
        void pumpsOutputAndExit() throws Exception {
            List<String> out = new CopyOnWriteArrayList<>();
            List<String> err = new CopyOnWriteArrayList<>();
            CountDownLatch exited = new CountDownLatch(1);
            AtomicInteger exitCode = new AtomicInteger(-1);

            SweepProcessHandle handle = supervisor.spawn(ARGS, new ProcessOutputListener() {
                @Override
                public void onStdout(SweepProcessHandle h, String line) {
                    out.add(line);
                }

                @Override
                public void onStderr(SweepProcessHandle h, String line) {
                    err.add(line);
                }

                @Override
                public void onExit(SweepProcessHandle h, int code) {
                    exitCode.set(code);
                    exited.countDown();
                }
            }, false);

            launcher.emitStdout(handle.processId(), "line one");
            launcher.emitStdout(handle.processId(), "line two");
            launcher.emitStderr(handle.processId(), "warning");
            launcher.crash(handle.processId(), 3);

            assertTrue(exited.await(2, TimeUnit.SECONDS));
            assertEquals(List.of("line one", "line two"), out);
            assertEquals(List.of("warning"), err);
            assertEquals(3, exitCode.get());
            assertTrue(supervisor.currentHandle().isEmpty());
        }
    }

    @Nested
    @DisplayName("probeDevice")
    class ProbeTests {

        @Test
        @DisplayName("serial number means available, with the info lines joined")
        void available() {
            DeviceProbeResult result = supervisor.probeDevice();

            assertTrue(result.available());
            assertTrue(result.deviceInfo().contains("Serial number"));
            assertTrue(result.deviceInfo().contains(", "));
        }

        @Test
        @DisplayName("timeout, busy, and not found are distinct outcomes")
        void distinctFailures() {
            launcher.probeReturns(CommandResult.timeout("", ""));
            assertEquals(DeviceProbeResult.Outcome.TIMEOUT, supervisor.probeDevice().outcome());
            assertEquals("Device check timeout", supervisor.probeDevice().reason());

            launcher.probeReturns(new CommandResult(1, "", "Resource busy", false));
            assertEquals(DeviceProbeResult.Outcome.BUSY, supervisor.probeDevice().outcome());

            launcher.probeReturns(new CommandResult(1, "No HackRF boards found.", "", false));
            assertEquals(DeviceProbeResult.Outcome.NOT_FOUND, supervisor.probeDevice().outcome());

            launcher.probeReturns(new CommandResult(2, "garbage", "", false));
            assertEquals(DeviceProbeResult.Outcome.FAILED, supervisor.probeDevice().outcome());
        }
    }

    @Nested
    @DisplayName("stop")
    class StopTests {

        @Test
        @DisplayName("graceful stop sends TERM first")
        void gracefulTerm() throws Exception {
            SweepProcessHandle handle = supervisor.spawn(ARGS, quietListener(), false);

            assertTrue(supervisor.stop(handle, true, new CancellationToken()));

            assertEquals("TERM:" + handle.processId(), launcher.signals().get(0));
            assertFalse(launcher.isAlive(handle.processId()));
            assertTrue(supervisor.currentHandle().isEmpty());
        }

        @Test
        @DisplayName("escalates to KILL when TERM is ignored")
        void escalatesToKill() throws Exception {
            launcher.ignoreTerm(true);
            SweepProcessHandle handle = supervisor.spawn(ARGS, quietListener(), false);

            assertTrue(supervisor.stop(handle, true, new CancellationToken()));

            assertTrue(launcher.signals().contains("KILL:" + handle.processId()));
            assertFalse(launcher.isAlive(handle.processId()));
        }

        @Test
        @DisplayName("also kills the process group and stray processes by name")
        void killsGroupAndStrays() throws Exception {
            long stray = launcher.addStray("hackrf_sweep");
            SweepProcessHandle handle = supervisor.spawn(ARGS, quietListener(), false);

            supervisor.stop(handle, false, new CancellationToken());

            assertTrue(launcher.signals().contains("KILL:group:" + handle.processId()));
            assertFalse(launcher.isAlive(stray));
        }

        @Test
        @DisplayName("no group kill when the process shares our group")
        void noGroupKillWithoutSetsid() throws Exception {
            launcher.groupLeaders(false);
            SweepProcessHandle handle = supervisor.spawn(ARGS, quietListener(), false);

            supervisor.stop(handle, true, new CancellationToken());

            assertTrue(launcher.signals().stream().noneMatch(s -> s.contains("group")));
        }
    }

    @Nested
    @DisplayName("kill-all")
    class KillAllTests {

        @Test
        @DisplayName("emergencyKillAll leaves no sweep or info process alive")
        void emergencyKillAll() throws Exception {
            supervisor.spawn(ARGS, quietListener(), false);
            launcher.addStray("hackrf_sweep");
            launcher.addStray("hackrf_info");
            launcher.addStray("bash");

            CleanupResult result = supervisor.emergencyKillAll();

            assertTrue(result.verified());
            assertEquals(0, supervisor.countSweepProcesses());
            assertEquals(1, launcher.alivePids().size(), "unrelated process survives");
            assertTrue(supervisor.currentHandle().isEmpty());
        }

        @Test
        @DisplayName("forceCleanupAll kills by name regardless of tracked state")
        void forceCleanupAll() {
            launcher.addStray("hackrf_sweep");
            launcher.addStray("hackrf_sweep");

            CleanupResult result = supervisor.forceCleanupAll();

            assertEquals(2, result.killed());
            assertEquals(0, result.remaining());
        }

        @Test
        @DisplayName("killOrphans spares the pids it is told to keep")
        void killOrphansKeeps() throws Exception {
            SweepProcessHandle handle = supervisor.spawn(ARGS, quietListener(), false);
            long stray = launcher.addStray("hackrf_sweep");

            assertEquals(1, supervisor.killOrphans(Set.of(handle.processId())));
            assertTrue(launcher.isAlive(handle.processId()));
            assertFalse(launcher.isAlive(stray));
        }
    }

    @Nested
    @DisplayName("monitoring")
    class MonitoringTests {

        @Test
        @DisplayName("invokes the death callback exactly once and stops polling")
        void firesOnce() throws Exception {
            SweepProcessHandle handle = supervisor.spawn(ARGS, quietListener(), false);
            AtomicInteger deaths = new AtomicInteger();
            CountDownLatch died = new CountDownLatch(1);

            supervisor.startMonitoring(handle, () -> {
                deaths.incrementAndGet();
                died.countDown();
            });
            launcher.crash(handle.processId(), 1);

            assertTrue(died.await(2, TimeUnit.SECONDS));
            Thread.sleep(150);
            assertEquals(1, deaths.get());
            assertFalse(supervisor.isMonitoring());
        }

        @Test
        @DisplayName("stopMonitoring cancels the poll")
        void stopMonitoring() throws Exception {
            SweepProcessHandle handle = supervisor.spawn(ARGS, quietListener(), false);
            AtomicInteger deaths = new AtomicInteger();
            supervisor.startMonitoring(handle, deaths::incrementAndGet);

            supervisor.stopMonitoring();
            launcher.crash(handle.processId(), 1);
            Thread.sleep(100);

            assertFalse(supervisor.isMonitoring());
            assertEquals(0, deaths.get());
        }
    }

    @Nested
    @DisplayName("error classification")
    class ClassificationTests {

        @Test
        @DisplayName("known fatal startup messages match case-insensitively")
        void fatalPatterns() {
            assertTrue(supervisor.classifyStartupError("hackrf_open() failed: Resource busy (-1000)"));
            assertTrue(supervisor.classifyStartupError("No HackRF boards found."));
            assertTrue(supervisor.classifyStartupError("PERMISSION DENIED"));
            assertTrue(supervisor.classifyStartupError("libusb_open() failed"));
            assertFalse(supervisor.classifyStartupError("Sweeping from 2400 MHz to 2480 MHz"));
            assertFalse(supervisor.classifyStartupError(null));
        }

        @Test
        @DisplayName("runtime device errors are recognised")
        void runtimePatterns() {
            assertTrue(supervisor.isRuntimeDeviceError("libusb_submit_transfer failed"));
            assertTrue(supervisor.isRuntimeDeviceError("HACKRF_ERROR_STREAMING_THREAD_ERR"));
            assertFalse(supervisor.isRuntimeDeviceError("31 total sweeps completed"));
        }
    }

    @Test
    @DisplayName("observe reports untracked sweep processes as orphans")
    void observeOrphans() throws Exception {
        SweepProcessHandle handle = supervisor.spawn(ARGS, quietListener(), false);
        long stray = launcher.addStray("hackrf_sweep");

        ProcessObservation observation = supervisor.observe();

        assertTrue(observation.handleAlive());
        assertEquals(handle, observation.handle());
        assertEquals(List.of(stray), observation.orphans());
    }
}
