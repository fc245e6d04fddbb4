package com.sweepwatch.core.recovery;

/**
 * Escalating recovery strategies, ordered by how many consecutive failures trigger them.
 */
public enum RecoveryStrategy {
    /** Wait a linearly growing delay, then respawn. */
    WAIT_AND_RETRY,
    /** Kill every sweep process before respawning. */
    AGGRESSIVE_CLEANUP,
    /** Re-probe the device after a longer cooldown before respawning. */
    DEVICE_RESET,
    /** Stop retrying until an operator intervenes. */
    EXTENDED_COOLDOWN
}
