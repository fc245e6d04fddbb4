package com.sweepwatch.dispatch.api;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sweepwatch.stream")
public class StreamProperties {

    private long heartbeatIntervalMs = 15000;
    /** A subscriber with no successful send for this many heartbeat intervals is evicted. */
    private int evictAfterMissedHeartbeats = 4;
    private int queueCapacity = 256;
    /** Minimum gap between sweep data events per subscriber; 0 disables throttling. */
    private long sweepDataMinIntervalMs = 50;
    private long emitterTimeoutMs = 30 * 60 * 1000L;

    public long getEvictAfterMs() {
        return heartbeatIntervalMs * evictAfterMissedHeartbeats;
    }

    public long getHeartbeatIntervalMs() { return heartbeatIntervalMs; }
    public void setHeartbeatIntervalMs(long heartbeatIntervalMs) { this.heartbeatIntervalMs = heartbeatIntervalMs; }
    public int getEvictAfterMissedHeartbeats() { return evictAfterMissedHeartbeats; }
    public void setEvictAfterMissedHeartbeats(int evictAfterMissedHeartbeats) { this.evictAfterMissedHeartbeats = evictAfterMissedHeartbeats; }
    public int getQueueCapacity() { return queueCapacity; }
    public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    public long getSweepDataMinIntervalMs() { return sweepDataMinIntervalMs; }
    public void setSweepDataMinIntervalMs(long sweepDataMinIntervalMs) { this.sweepDataMinIntervalMs = sweepDataMinIntervalMs; }
    public long getEmitterTimeoutMs() { return emitterTimeoutMs; }
    public void setEmitterTimeoutMs(long emitterTimeoutMs) { this.emitterTimeoutMs = emitterTimeoutMs; }
}
