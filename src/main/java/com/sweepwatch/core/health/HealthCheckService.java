package com.sweepwatch.core.health;

import com.sweepwatch.core.model.SweepPhase;
import com.sweepwatch.core.model.SweepState;
import com.sweepwatch.core.process.DeviceProbeResult;
import com.sweepwatch.core.process.ProcessObservation;
import com.sweepwatch.core.process.ProcessSupervisor;
import com.sweepwatch.core.recovery.DeviceHealthRecord;
import com.sweepwatch.core.sweep.SweepController;
import com.sweepwatch.dispatch.api.StreamHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final SweepController sweepController;
    private final ProcessSupervisor processSupervisor;
    private final StreamHub streamHub;

    public HealthCheckService(
            @Autowired(required = false) SweepController sweepController,
            @Autowired(required = false) ProcessSupervisor processSupervisor,
            @Autowired(required = false) StreamHub streamHub) {
        this.sweepController = sweepController;
        this.processSupervisor = processSupervisor;
        this.streamHub = streamHub;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkSweep());
        results.add(checkRecovery());
        results.add(checkStream());
        return results;
    }

    /**
     * Detailed sweep health. Probes the device only when no sweep is running, since a running
     * sweep holds the device.
     */
    public SweepHealth sweepHealth() {
        SweepState state = sweepController == null ? SweepState.initial() : sweepController.currentState();
        int clients = streamHub == null ? 0 : streamHub.subscriberCount();
        if (processSupervisor == null) {
            return new SweepHealth(false, null, false, clients,
                    new SweepHealth.StateValidation(false, state.phase(), false, 0, "No process supervisor"),
                    null, null);
        }

        ProcessObservation observed = processSupervisor.observe();
        SweepHealth.StateValidation validation = validate(state, observed);

        boolean hardwareDetected;
        String deviceInfo = null;
        if (state.phase().expectsProcess() && observed.handleAlive()) {
            hardwareDetected = true;
        } else {
            DeviceProbeResult probe = processSupervisor.probeDevice();
            hardwareDetected = probe.available();
            deviceInfo = probe.available() ? probe.deviceInfo() : probe.reason();
        }

        DeviceHealthRecord device = sweepController == null ? null : sweepController.deviceHealth();
        return new SweepHealth(hardwareDetected, deviceInfo, observed.handleAlive(), clients, validation,
                device == null ? null : device.deviceStatus(),
                sweepController == null ? null : sweepController.lastDataAt());
    }

    static SweepHealth.StateValidation validate(SweepState state, ProcessObservation observed) {
        SweepPhase phase = state.phase();
        int orphans = observed.orphans().size();
        boolean alive = observed.handleAlive();
        if (phase.expectsProcess() && !alive) {
            return new SweepHealth.StateValidation(false, phase, false, orphans,
                    "State is " + phase + " but no sweep process is alive");
        }
        if (!phase.expectsProcess() && phase != SweepPhase.STOPPING && alive) {
            return new SweepHealth.StateValidation(false, phase, true, orphans,
                    "Sweep process alive while state is " + phase);
        }
        if (orphans > 0) {
            return new SweepHealth.StateValidation(false, phase, alive, orphans,
                    orphans + " untracked sweep process(es)");
        }
        return new SweepHealth.StateValidation(true, phase, alive, 0, "State matches running processes");
    }

    private HealthStatus checkSweep() {
        if (sweepController == null || processSupervisor == null) {
            return HealthStatus.down("sweep", "Sweep controller not available");
        }
        try {
            SweepState state = sweepController.currentState();
            SweepHealth.StateValidation validation = validate(state, processSupervisor.observe());
            Map<String, String> meta = Map.of("phase", state.phase().name(),
                    "consecutiveErrors", String.valueOf(state.consecutiveErrorCount()));
            if (state.phase() == SweepPhase.EMERGENCY_STOPPED) {
                return HealthStatus.down("sweep", "Emergency stopped; server reset required", meta);
            }
            if (state.phase() == SweepPhase.ERROR || !validation.consistent()) {
                return HealthStatus.degraded("sweep",
                        state.lastError() != null ? state.lastError() : validation.detail(), meta);
            }
            return HealthStatus.up("sweep", "Sweep " + state.phase(), meta);
        } catch (Exception e) {
            log.warn("Sweep health check failed: {}", e.getMessage());
            return HealthStatus.down("sweep", "Sweep check error: " + e.getMessage());
        }
    }

    private HealthStatus checkRecovery() {
        if (sweepController == null) {
            return HealthStatus.down("recovery", "Recovery engine not available");
        }
        DeviceHealthRecord record = sweepController.deviceHealth();
        Map<String, String> meta = Map.of("deviceStatus", record.deviceStatus().name(),
                "blacklisted", String.valueOf(record.blacklistedFrequencies().size()),
                "retriesInWindow", String.valueOf(record.retriesInWindow()));
        if (record.consecutiveFailures() > 0 || !record.blacklistedFrequencies().isEmpty()) {
            return HealthStatus.degraded("recovery",
                    record.consecutiveFailures() + " consecutive failure(s), "
                            + record.blacklistedFrequencies().size() + " blacklisted frequency(ies)", meta);
        }
        return HealthStatus.up("recovery", "No recent failures", meta);
    }

    private HealthStatus checkStream() {
        if (streamHub == null) {
            return HealthStatus.down("stream", "Stream hub not available");
        }
        return HealthStatus.up("stream",
                streamHub.subscriberCount() + " subscriber(s)",
                Map.of("subscribers", String.valueOf(streamHub.subscriberCount())));
    }
}
