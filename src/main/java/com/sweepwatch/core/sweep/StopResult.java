package com.sweepwatch.core.sweep;

import com.sweepwatch.core.model.SweepPhase;

public record StopResult(boolean stopped, SweepPhase finalPhase, String message) {}
