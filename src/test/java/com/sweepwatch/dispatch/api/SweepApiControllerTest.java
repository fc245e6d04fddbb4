package com.sweepwatch.dispatch.api;

import com.sweepwatch.core.events.StreamEventType;
import com.sweepwatch.core.health.HealthCheckService;
import com.sweepwatch.core.health.SweepHealth;
import com.sweepwatch.core.model.CycleStatus;
import com.sweepwatch.core.model.FrequencySpec;
import com.sweepwatch.core.model.ProcessHealth;
import com.sweepwatch.core.model.SweepConfig;
import com.sweepwatch.core.model.SweepPhase;
import com.sweepwatch.core.model.SweepState;
import com.sweepwatch.core.process.CleanupResult;
import com.sweepwatch.core.recovery.DeviceStatus;
import com.sweepwatch.core.sweep.EmergencyStopResult;
import com.sweepwatch.core.sweep.RejectionReason;
import com.sweepwatch.core.sweep.ResetResult;
import com.sweepwatch.core.sweep.StartResult;
import com.sweepwatch.core.sweep.StopResult;
import com.sweepwatch.core.sweep.SweepController;
import com.sweepwatch.core.sweep.SweepProperties;
import com.sweepwatch.core.sweep.SyncReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SweepApiController.class)
@Import({SweepRequestMapper.class, SweepProperties.class})
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class SweepApiControllerTest {

    private static final SweepState STARTING = new SweepState(SweepPhase.STARTING, 0, null, 0, null);
    private static final SweepState RUNNING = new SweepState(SweepPhase.RUNNING, 0, Instant.parse("2026-01-01T00:00:00Z"), 0, null);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SweepController sweepController;

    @MockitoBean
    private StreamHub streamHub;

    @MockitoBean
    private HealthCheckService healthCheckService;

    // ── POST /start ─────────────────────────────────────────────────

    @Test
    @DisplayName("POST /start returns 200 with the accepted config summary")
    void startAccepted() throws Exception {
        when(sweepController.start(any())).thenReturn(StartResult.accepted(STARTING));

        mockMvc.perform(post("/api/v1/sweep/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"frequencies": [433.92, {"value": 2.437, "unit": "GHz"}], "cycleTime": 5}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("accepted"))
                .andExpect(jsonPath("$.state").value("STARTING"))
                .andExpect(jsonPath("$.frequencies").value(2))
                .andExpect(jsonPath("$.cycleTimeMs").value(5000));

        ArgumentCaptor<SweepConfig> config = ArgumentCaptor.forClass(SweepConfig.class);
        verify(sweepController).start(config.capture());
        assertEquals(433.92, config.getValue().frequencyAt(0).centerMhz(), 1e-9);
        assertEquals(2437.0, config.getValue().frequencyAt(1).centerMhz(), 1e-9);
    }

    @Test
    @DisplayName("POST /start while running returns 409 with the reason")
    void startConflict() throws Exception {
        when(sweepController.start(any())).thenReturn(
                StartResult.rejected(RejectionReason.INVALID_STATE, "Cannot start from RUNNING", RUNNING));

        mockMvc.perform(post("/api/v1/sweep/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"frequencies\": [433.92]}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value("rejected"))
                .andExpect(jsonPath("$.reason").value("INVALID_STATE"))
                .andExpect(jsonPath("$.state").value("RUNNING"));
    }

    @Test
    @DisplayName("POST /start with the device busy returns 503")
    void startDeviceUnavailable() throws Exception {
        when(sweepController.start(any())).thenReturn(
                StartResult.rejected(RejectionReason.DEVICE_UNAVAILABLE, "HackRF device is busy", SweepState.initial()));

        mockMvc.perform(post("/api/v1/sweep/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"frequencies\": [915]}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message", containsString("busy")));
    }

    @Test
    @DisplayName("POST /start rejected as invalid config returns 400")
    void startInvalidConfig() throws Exception {
        when(sweepController.start(any())).thenReturn(
                StartResult.rejected(RejectionReason.INVALID_CONFIG, "Frequency out of range", SweepState.initial()));

        mockMvc.perform(post("/api/v1/sweep/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"frequencies\": [9000]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("INVALID_CONFIG"));
    }

    @Test
    @DisplayName("POST /start with an unknown unit returns 400 without touching the controller")
    void startUnknownUnit() throws Exception {
        mockMvc.perform(post("/api/v1/sweep/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"frequencies\": [{\"value\": 433, \"unit\": \"furlongs\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown frequency unit: furlongs"));

        verify(sweepController, never()).start(any());
    }

    @Test
    @DisplayName("POST /start without frequencies returns 400")
    void startMissingFrequencies() throws Exception {
        mockMvc.perform(post("/api/v1/sweep/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cycleTime\": 10}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("frequencies is required"));
    }

    // ── Stop / emergency / cleanup ───────────────────────────────────

    @Test
    @DisplayName("POST /stop reports the final state")
    void stop() throws Exception {
        when(sweepController.stop()).thenReturn(new StopResult(true, SweepPhase.IDLE, "Sweep stopped"));

        mockMvc.perform(post("/api/v1/sweep/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stopped").value(true))
                .andExpect(jsonPath("$.finalState").value("IDLE"));
    }

    @Test
    @DisplayName("POST /stop returns 500 when processes survived")
    void stopFailed() throws Exception {
        when(sweepController.stop()).thenReturn(new StopResult(false, SweepPhase.ERROR, "1 process(es) survived"));

        mockMvc.perform(post("/api/v1/sweep/stop"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.stopped").value(false))
                .andExpect(jsonPath("$.finalState").value("ERROR"));
    }

    @Test
    @DisplayName("POST /emergency-stop reports remaining processes")
    void emergencyStop() throws Exception {
        when(sweepController.emergencyStop())
                .thenReturn(new EmergencyStopResult(true, 0, SweepPhase.EMERGENCY_STOPPED));

        mockMvc.perform(post("/api/v1/sweep/emergency-stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stopped").value(true))
                .andExpect(jsonPath("$.remainingProcesses").value(0))
                .andExpect(jsonPath("$.finalState").value("EMERGENCY_STOPPED"));
    }

    @Test
    @DisplayName("POST /force-cleanup reports killed and remaining counts")
    void forceCleanup() throws Exception {
        when(sweepController.forceCleanup()).thenReturn(new CleanupResult(3, 0));
        when(sweepController.currentState()).thenReturn(SweepState.initial());

        mockMvc.perform(post("/api/v1/sweep/force-cleanup"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.killed").value(3))
                .andExpect(jsonPath("$.remaining").value(0))
                .andExpect(jsonPath("$.finalState").value("IDLE"));
    }

    // ── Sync / reset ─────────────────────────────────────────────────

    @Test
    @DisplayName("POST /sync returns before and after states with the changes")
    void sync() throws Exception {
        SweepState error = SweepState.initial().withError("Sweep process died");
        when(sweepController.manualSync()).thenReturn(new SyncReport(RUNNING, error,
                List.of("Tracked process is gone, RUNNING -> ERROR")));

        mockMvc.perform(post("/api/v1/sweep/sync"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.beforeState").value("RUNNING"))
                .andExpect(jsonPath("$.afterState").value("ERROR"))
                .andExpect(jsonPath("$.changes", hasSize(1)));
    }

    @Test
    @DisplayName("POST /reset reports how many clients were connected")
    void reset() throws Exception {
        when(streamHub.subscriberCount()).thenReturn(2);
        when(sweepController.serverReset()).thenReturn(new ResetResult(1, SweepPhase.IDLE));

        mockMvc.perform(post("/api/v1/sweep/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.clientsNotified").value(2))
                .andExpect(jsonPath("$.processesKilled").value(1))
                .andExpect(jsonPath("$.finalState").value("IDLE"));
    }

    // ── Status / health ──────────────────────────────────────────────

    @Test
    @DisplayName("GET /cycle-status serialises the cycle snapshot")
    void cycleStatus() throws Exception {
        FrequencySpec f433 = new FrequencySpec(433.92, 20, 20000);
        FrequencySpec f915 = new FrequencySpec(915, 20, 20000);
        when(sweepController.cycleStatus()).thenReturn(new CycleStatus(SweepPhase.RUNNING, List.of(f433, f915),
                1, f915, 10000, Instant.parse("2026-01-01T00:00:00Z"), 4000, 0, null, List.of(0),
                new ProcessHealth(true, 4242L, 4242L, Instant.parse("2026-01-01T00:00:00Z"), null)));

        mockMvc.perform(get("/api/v1/sweep/cycle-status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("RUNNING"))
                .andExpect(jsonPath("$.frequencies", hasSize(2)))
                .andExpect(jsonPath("$.currentIndex").value(1))
                .andExpect(jsonPath("$.currentFrequency.centerMhz").value(915.0))
                .andExpect(jsonPath("$.blacklistedIndices[0]").value(0))
                .andExpect(jsonPath("$.processHealth.processId").value(4242));
    }

    @Test
    @DisplayName("GET /health reports hardware, process, clients and state validation")
    void health() throws Exception {
        when(healthCheckService.sweepHealth()).thenReturn(new SweepHealth(true, "Serial number: 0000457863c82b2c1f4f",
                true, 3, new SweepHealth.StateValidation(true, SweepPhase.RUNNING, true, 0, "consistent"),
                DeviceStatus.AVAILABLE, null));

        mockMvc.perform(get("/api/v1/sweep/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hardwareDetected").value(true))
                .andExpect(jsonPath("$.processRunning").value(true))
                .andExpect(jsonPath("$.sseClientCount").value(3))
                .andExpect(jsonPath("$.stateValidation.consistent").value(true))
                .andExpect(jsonPath("$.deviceStatus").value("AVAILABLE"));
    }

    // ── GET /data-stream ─────────────────────────────────────────────

    @Test
    @DisplayName("GET /data-stream subscribes with the requested types and filters")
    @SuppressWarnings("unchecked")
    void dataStream() throws Exception {
        when(sweepController.currentState()).thenReturn(RUNNING);
        when(streamHub.createEmitter(any(), any(), anyList())).thenReturn(new SseEmitter());

        mockMvc.perform(get("/api/v1/sweep/data-stream")
                        .param("types", "sweep_data,status,bogus")
                        .param("minSignal", "-60")
                        .param("deviceTypes", "hackrf, ")
                        .accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(request().asyncStarted());

        ArgumentCaptor<Set<StreamEventType>> types = ArgumentCaptor.forClass(Set.class);
        ArgumentCaptor<SubscriptionFilter> filter = ArgumentCaptor.forClass(SubscriptionFilter.class);
        verify(streamHub).createEmitter(types.capture(), filter.capture(), anyList());
        assertEquals(Set.of(StreamEventType.SWEEP_DATA, StreamEventType.STATUS), types.getValue());
        assertEquals(-60.0, filter.getValue().minSignal(), 1e-9);
        assertEquals(Set.of("hackrf"), filter.getValue().deviceTypes());
    }
}
