package com.sweepwatch.core.logging;

import com.sweepwatch.core.model.SweepPhase;
import org.slf4j.MDC;

/**
 * Utility for managing Sweepwatch-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setPhase(SweepPhase phase) {
        MDC.put("sweepPhase", phase.name());
    }

    public static void setProcess(long pid) {
        MDC.put("pid", String.valueOf(pid));
    }

    public static void setSweep(SweepPhase phase, Long pid) {
        setPhase(phase);
        if (pid != null) {
            setProcess(pid);
        } else {
            MDC.remove("pid");
        }
    }

    public static void setConnection(String connectionId) {
        MDC.put("connectionId", connectionId);
    }

    public static void clear() {
        MDC.remove("sweepPhase");
        MDC.remove("pid");
        MDC.remove("connectionId");
    }
}
