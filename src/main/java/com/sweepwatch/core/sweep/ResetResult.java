package com.sweepwatch.core.sweep;

import com.sweepwatch.core.model.SweepPhase;

public record ResetResult(int processesKilled, SweepPhase finalPhase) {}
