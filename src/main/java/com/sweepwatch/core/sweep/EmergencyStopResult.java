package com.sweepwatch.core.sweep;

import com.sweepwatch.core.model.SweepPhase;

public record EmergencyStopResult(boolean stopped, int remainingProcesses, SweepPhase finalPhase) {}
