package com.sweepwatch.core.recovery;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sweepwatch.recovery")
public class RecoveryProperties {

    private long baseDelayMs = 2000;
    /** Consecutive failures at which retries start with a forced cleanup. */
    private int cleanupAfter = 3;
    /** Consecutive failures at which the device is re-probed after a longer cooldown. */
    private int deviceResetAfter = 5;
    /** Consecutive failures at which recovery gives up until a manual sync. */
    private int extendedCooldownAfter = 8;
    private long deviceResetCooldownMs = 10000;
    private int blacklistThreshold = 3;
    private int maxRetriesPerMinute = 5;
    private int maxAttempts = 7;

    public long getBaseDelayMs() { return baseDelayMs; }
    public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }
    public int getCleanupAfter() { return cleanupAfter; }
    public void setCleanupAfter(int cleanupAfter) { this.cleanupAfter = cleanupAfter; }
    public int getDeviceResetAfter() { return deviceResetAfter; }
    public void setDeviceResetAfter(int deviceResetAfter) { this.deviceResetAfter = deviceResetAfter; }
    public int getExtendedCooldownAfter() { return extendedCooldownAfter; }
    public void setExtendedCooldownAfter(int extendedCooldownAfter) { this.extendedCooldownAfter = extendedCooldownAfter; }
    public long getDeviceResetCooldownMs() { return deviceResetCooldownMs; }
    public void setDeviceResetCooldownMs(long deviceResetCooldownMs) { this.deviceResetCooldownMs = deviceResetCooldownMs; }
    public int getBlacklistThreshold() { return blacklistThreshold; }
    public void setBlacklistThreshold(int blacklistThreshold) { this.blacklistThreshold = blacklistThreshold; }
    public int getMaxRetriesPerMinute() { return maxRetriesPerMinute; }
    public void setMaxRetriesPerMinute(int maxRetriesPerMinute) { this.maxRetriesPerMinute = maxRetriesPerMinute; }
    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
}
