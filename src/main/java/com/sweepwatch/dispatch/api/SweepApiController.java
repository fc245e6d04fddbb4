package com.sweepwatch.dispatch.api;

import com.sweepwatch.core.events.StreamEvent;
import com.sweepwatch.core.events.StreamEventType;
import com.sweepwatch.core.health.HealthCheckService;
import com.sweepwatch.core.health.SweepHealth;
import com.sweepwatch.core.model.CycleStatus;
import com.sweepwatch.core.model.SweepConfig;
import com.sweepwatch.core.model.SweepState;
import com.sweepwatch.core.process.CleanupResult;
import com.sweepwatch.core.sweep.EmergencyStopResult;
import com.sweepwatch.core.sweep.ResetResult;
import com.sweepwatch.core.sweep.StartResult;
import com.sweepwatch.core.sweep.StopResult;
import com.sweepwatch.core.sweep.SweepController;
import com.sweepwatch.core.sweep.SyncReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * REST controller for sweep control and the live data stream.
 */
@RestController
@RequestMapping("/api/v1/sweep")
public class SweepApiController {

    private static final Logger log = LoggerFactory.getLogger(SweepApiController.class);

    private final SweepController sweepController;
    private final StreamHub streamHub;
    private final SweepRequestMapper requestMapper;
    private final HealthCheckService healthCheckService;

    public SweepApiController(SweepController sweepController,
                              StreamHub streamHub,
                              SweepRequestMapper requestMapper,
                              @Autowired(required = false) HealthCheckService healthCheckService) {
        this.sweepController = sweepController;
        this.streamHub = streamHub;
        this.requestMapper = requestMapper;
        this.healthCheckService = healthCheckService;
    }

    /**
     * POST /api/v1/sweep/start: Start sweeping the requested frequencies.
     * Returns 200 when accepted; 400 for a bad config, 409 when not idle or emergency stopped,
     * 503 when the device is unavailable.
     */
    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start(@RequestBody StartSweepRequest request) {
        SweepConfig config = requestMapper.toConfig(request);
        StartResult result = sweepController.start(config);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", result.accepted() ? "accepted" : "rejected");
        body.put("state", result.state().phase().name());
        body.put("message", result.message());
        if (result.accepted()) {
            body.put("frequencies", config.frequencies().size());
            body.put("cycleTimeMs", config.cycleTimeMs());
            return ResponseEntity.ok(body);
        }

        body.put("reason", result.reason().name());
        HttpStatus status = switch (result.reason()) {
            case INVALID_CONFIG -> HttpStatus.BAD_REQUEST;
            case INVALID_STATE, EMERGENCY_STOPPED -> HttpStatus.CONFLICT;
            case DEVICE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case SPAWN_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        log.info("Start rejected ({}): {}", result.reason(), result.message());
        return ResponseEntity.status(status).body(body);
    }

    /**
     * POST /api/v1/sweep/stop: Graceful stop.
     */
    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        StopResult result = sweepController.stop();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("stopped", result.stopped());
        body.put("finalState", result.finalPhase().name());
        body.put("message", result.message());
        return result.stopped() ? ResponseEntity.ok(body)
                                : ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    /**
     * POST /api/v1/sweep/emergency-stop: Kill every sweep process now.
     */
    @PostMapping("/emergency-stop")
    public ResponseEntity<Map<String, Object>> emergencyStop() {
        EmergencyStopResult result = sweepController.emergencyStop();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("stopped", result.stopped());
        body.put("remainingProcesses", result.remainingProcesses());
        body.put("finalState", result.finalPhase().name());
        return ResponseEntity.ok(body);
    }

    /**
     * POST /api/v1/sweep/force-cleanup: Kill sweep and probe processes regardless of state.
     */
    @PostMapping("/force-cleanup")
    public ResponseEntity<Map<String, Object>> forceCleanup() {
        CleanupResult result = sweepController.forceCleanup();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", result.verified());
        body.put("killed", result.killed());
        body.put("remaining", result.remaining());
        body.put("finalState", sweepController.currentState().phase().name());
        return ResponseEntity.ok(body);
    }

    /**
     * GET /api/v1/sweep/cycle-status: Current phase, frequencies and process health.
     */
    @GetMapping("/cycle-status")
    public ResponseEntity<CycleStatus> cycleStatus() {
        return ResponseEntity.ok(sweepController.cycleStatus());
    }

    /**
     * POST /api/v1/sweep/sync: Reconcile believed state with running processes.
     */
    @PostMapping("/sync")
    public ResponseEntity<Map<String, Object>> sync() {
        SyncReport report = sweepController.manualSync();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("beforeState", report.before().phase().name());
        body.put("afterState", report.after().phase().name());
        body.put("changes", report.changes());
        return ResponseEntity.ok(body);
    }

    /**
     * POST /api/v1/sweep/reset: Kill everything and return to IDLE, notifying all clients.
     */
    @PostMapping("/reset")
    public ResponseEntity<Map<String, Object>> reset() {
        int clients = streamHub.subscriberCount();
        ResetResult result = sweepController.serverReset();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("clientsNotified", clients);
        body.put("processesKilled", result.processesKilled());
        body.put("finalState", result.finalPhase().name());
        return ResponseEntity.ok(body);
    }

    /**
     * GET /api/v1/sweep/health: Hardware, process, stream and state-consistency report.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        if (healthCheckService == null) {
            body.put("error", "Health check service not available");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
        SweepHealth health = healthCheckService.sweepHealth();
        body.put("hardwareDetected", health.hardwareDetected());
        body.put("deviceInfo", health.deviceInfo());
        body.put("processRunning", health.processRunning());
        body.put("sseClientCount", health.sseClientCount());
        body.put("stateValidation", health.stateValidation());
        body.put("deviceStatus", health.deviceStatus());
        body.put("lastDataAt", health.lastDataAt());
        return ResponseEntity.ok(body);
    }

    /**
     * GET /api/v1/sweep/data-stream: Server-sent events.
     *
     * @param types       comma-separated event names (e.g. {@code sweep_data,status}); all when absent
     * @param minSignal   drop sweep data whose peak power is below this dB value
     * @param deviceTypes comma-separated data sources to keep
     */
    @GetMapping(path = "/data-stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter dataStream(@RequestParam(required = false) String types,
                                 @RequestParam(required = false) Double minSignal,
                                 @RequestParam(required = false) String deviceTypes) {
        Set<StreamEventType> wanted = parseTypes(types);
        Set<String> sources = deviceTypes == null || deviceTypes.isBlank() ? Set.of()
                : Arrays.stream(deviceTypes.split(",")).map(String::trim).filter(s -> !s.isEmpty())
                        .collect(Collectors.toSet());

        SweepState state = sweepController.currentState();
        StreamEvent snapshot = new StreamEvent.Status(state.phase(), null,
                "Current sweep state: " + state.phase(), Instant.now());
        return streamHub.createEmitter(wanted, new SubscriptionFilter(minSignal, sources), List.of(snapshot));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    private static Set<StreamEventType> parseTypes(String types) {
        if (types == null || types.isBlank()) {
            return Set.of();
        }
        Set<StreamEventType> wanted = EnumSet.noneOf(StreamEventType.class);
        for (String name : types.split(",")) {
            if (name.isBlank()) {
                continue;
            }
            Optional<StreamEventType> type = StreamEventType.fromWireName(name);
            if (type.isPresent()) {
                wanted.add(type.get());
            } else {
                log.warn("Ignoring unknown stream event type: {}", name);
            }
        }
        return wanted;
    }
}
