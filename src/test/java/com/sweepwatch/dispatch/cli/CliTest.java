package com.sweepwatch.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sweepwatch.dispatch.client.ClientProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.ConnectException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the sweepwatch CLI command structure.
 * These exercise picocli directly without a Spring context, with the REST client mocked.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private final ObjectMapper json = new ObjectMapper();
    private SweepApiClient client;

    @BeforeEach
    void setUp() {
        client = mock(SweepApiClient.class);
        when(client.baseUrl()).thenReturn("http://localhost:8092");
    }

    private SweepApiClient.ApiResponse response(int status, String body) throws Exception {
        return new SweepApiClient.ApiResponse(status, json.readTree(body));
    }

    /**
     * Custom picocli IFactory that hands the mocked client to server commands.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == StartCommand.class) {
                    return (K) new StartCommand(client);
                }
                if (cls == StopCommand.class) {
                    return (K) new StopCommand(client);
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(client, new ClientProperties());
                }
                if (cls == SyncCommand.class) {
                    return (K) new SyncCommand(client);
                }
                if (cls == ResetCommand.class) {
                    return (K) new ResetCommand(client);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(client);
                }
                if (cls == ServeCommand.class) {
                    return (K) new ServeCommand();
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new SweepwatchCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            String output = result.output();
            for (String name : List.of("serve", "start", "stop", "status", "sync", "reset", "health", "help")) {
                assertTrue(output.contains(name), "Help should list '" + name + "' subcommand");
            }
            assertTrue(output.contains("Supervises HackRF frequency sweeps"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("sweepwatch 0.1.0"));
        }

        @Test
        @DisplayName("start --help shows its options")
        void startHelp() {
            CliResult result = execute("start", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--cycle-time"));
            assertTrue(result.output().contains("--unit"));
        }

        @Test
        @DisplayName("stop rejects --emergency together with --cleanup")
        void stopModesExclusive() throws Exception {
            CliResult result = execute("stop", "--emergency", "--cleanup");
            assertNotEquals(0, result.exitCode());
            verify(client, never()).post(any(), any());
        }

        @Test
        @DisplayName("start without frequencies is a usage error")
        void startNeedsFrequencies() {
            CliResult result = execute("start");
            assertNotEquals(0, result.exitCode());
            assertTrue(result.output().contains("FREQ"));
        }
    }

    // =====================================================================
    //  Command execution tests
    // =====================================================================

    @Nested
    @DisplayName("start")
    class StartTests {

        @Test
        @DisplayName("posts each frequency with its unit and the cycle time")
        @SuppressWarnings("unchecked")
        void postsBody() throws Exception {
            when(client.post(eq("/api/v1/sweep/start"), any())).thenReturn(response(200,
                    "{\"status\":\"accepted\",\"state\":\"STARTING\",\"frequencies\":2,\"cycleTimeMs\":5000}"));

            CliResult result = execute("start", "2.412", "2.437", "--unit", "GHz", "--cycle-time", "5");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Sweep accepted: 2 frequency(ies), 5s per frequency"));
            assertTrue(result.output().contains("STARTING"));

            ArgumentCaptor<Object> body = ArgumentCaptor.forClass(Object.class);
            verify(client).post(eq("/api/v1/sweep/start"), body.capture());
            Map<String, Object> sent = (Map<String, Object>) body.getValue();
            List<Map<String, Object>> entries = (List<Map<String, Object>>) sent.get("frequencies");
            assertEquals(2, entries.size());
            assertEquals(2.412, entries.get(0).get("value"));
            assertEquals("GHz", entries.get(0).get("unit"));
            assertEquals(5.0, sent.get("cycleTime"));
        }

        @Test
        @DisplayName("prints the rejection reason")
        void rejected() throws Exception {
            when(client.post(eq("/api/v1/sweep/start"), any())).thenReturn(response(409,
                    "{\"status\":\"rejected\",\"state\":\"EMERGENCY_STOPPED\",\"reason\":\"EMERGENCY_STOPPED\","
                            + "\"message\":\"Reset required after emergency stop\"}"));

            CliResult result = execute("start", "433.92");

            assertTrue(result.output().contains("Start rejected (EMERGENCY_STOPPED): Reset required after emergency stop"));
        }

        @Test
        @DisplayName("reports an unreachable server")
        void serverDown() throws Exception {
            when(client.post(eq("/api/v1/sweep/start"), any())).thenThrow(new ConnectException("Connection refused"));

            CliResult result = execute("start", "433.92");

            assertTrue(result.output().contains("Cannot connect to sweepwatch server at http://localhost:8092"));
        }
    }

    @Nested
    @DisplayName("stop")
    class StopTests {

        @Test
        @DisplayName("plain stop calls /stop")
        void gracefulStop() throws Exception {
            when(client.post(eq("/api/v1/sweep/stop"), any())).thenReturn(response(200,
                    "{\"stopped\":true,\"finalState\":\"IDLE\",\"message\":\"Sweep stopped\"}"));

            CliResult result = execute("stop");

            assertTrue(result.output().contains("Sweep stopped"));
            assertTrue(result.output().contains("IDLE"));
        }

        @Test
        @DisplayName("--emergency calls /emergency-stop")
        void emergencyStop() throws Exception {
            when(client.post(eq("/api/v1/sweep/emergency-stop"), any())).thenReturn(response(200,
                    "{\"stopped\":true,\"remainingProcesses\":0,\"finalState\":\"EMERGENCY_STOPPED\"}"));

            CliResult result = execute("stop", "--emergency");

            assertTrue(result.output().contains("Emergency stop complete"));
            verify(client, never()).post(eq("/api/v1/sweep/stop"), any());
        }

        @Test
        @DisplayName("--cleanup reports survivors")
        void cleanupSurvivors() throws Exception {
            when(client.post(eq("/api/v1/sweep/force-cleanup"), any())).thenReturn(response(200,
                    "{\"ok\":false,\"killed\":2,\"remaining\":1,\"finalState\":\"IDLE\"}"));

            CliResult result = execute("stop", "--cleanup");

            assertTrue(result.output().contains("Cleanup left 1 process(es) running"));
        }
    }

    @Nested
    @DisplayName("status, sync, reset")
    class StatusTests {

        @Test
        @DisplayName("status lists frequencies and marks the current and blacklisted ones")
        void status() throws Exception {
            when(client.get("/api/v1/sweep/cycle-status")).thenReturn(response(200, """
                    {"phase":"RUNNING","currentIndex":1,"cycleTimeMs":10000,"timeRemainingMs":4000,
                     "frequencies":[{"centerMhz":433.92,"spanMhz":20.0},{"centerMhz":915.0,"spanMhz":20.0}],
                     "blacklistedIndices":[0],"consecutiveErrorCount":0,
                     "processHealth":{"running":true,"processId":4242}}
                    """));

            CliResult result = execute("status");
            String output = result.output();

            assertTrue(output.contains("RUNNING"));
            assertTrue(output.contains("blacklisted"));
            assertTrue(output.contains("<- current"));
            assertTrue(output.contains("Process 4242 running"));
            assertTrue(output.contains("next switch in 4s"));
        }

        @Test
        @DisplayName("sync prints each correction")
        void sync() throws Exception {
            when(client.post(eq("/api/v1/sweep/sync"), any())).thenReturn(response(200,
                    "{\"beforeState\":\"RUNNING\",\"afterState\":\"ERROR\",\"changes\":[\"Tracked process is gone\"]}"));

            CliResult result = execute("sync");

            assertTrue(result.output().contains("State corrected: RUNNING -> ERROR"));
            assertTrue(result.output().contains("- Tracked process is gone"));
        }

        @Test
        @DisplayName("sync with no changes reports a consistent state")
        void syncConsistent() throws Exception {
            when(client.post(eq("/api/v1/sweep/sync"), any())).thenReturn(response(200,
                    "{\"beforeState\":\"IDLE\",\"afterState\":\"IDLE\",\"changes\":[]}"));

            assertTrue(execute("sync").output().contains("State consistent: IDLE"));
        }

        @Test
        @DisplayName("reset reports killed processes and notified clients")
        void reset() throws Exception {
            when(client.post(eq("/api/v1/sweep/reset"), any())).thenReturn(response(200,
                    "{\"clientsNotified\":3,\"processesKilled\":1,\"finalState\":\"IDLE\"}"));

            CliResult result = execute("reset");

            assertTrue(result.output().contains("Server reset: 1 process(es) killed, 3 client(s) notified"));
        }

        @Test
        @DisplayName("server errors are shown with their status")
        void serverError() throws Exception {
            when(client.post(eq("/api/v1/sweep/reset"), any())).thenReturn(response(500,
                    "{\"error\":\"boom\"}"));

            assertTrue(execute("reset").output().contains("Server returned HTTP 500: boom"));
        }
    }

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("prints components and the sweep report")
        void health() throws Exception {
            when(client.get("/api/v1/health")).thenReturn(response(503, """
                    {"status":"DOWN","components":{
                      "hackrf":{"status":"DOWN","detail":"No HackRF boards found"},
                      "stream":{"status":"UP","detail":"0 subscribers"}}}
                    """));
            when(client.get("/api/v1/sweep/health")).thenReturn(response(200, """
                    {"hardwareDetected":false,"deviceInfo":null,"processRunning":false,"sseClientCount":0,
                     "stateValidation":{"consistent":true,"detail":"IDLE with no sweep processes"}}
                    """));

            CliResult result = execute("health");
            String output = result.output();

            assertTrue(output.contains("hackrf: No HackRF boards found"));
            assertTrue(output.contains("stream: 0 subscribers"));
            assertTrue(output.contains("Hardware: -"));
            assertTrue(output.contains("State validation: IDLE with no sweep processes"));
            assertTrue(output.contains("one or more components degraded or down"));
        }
    }
}
