package com.sweepwatch.dispatch.client;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sweepwatch.client")
public class ClientProperties {

    private String baseUrl = "http://localhost:8092";
    private long baseDelayMs = 1000;
    private long maxDelayMs = 30000;
    /** Consecutive connection losses after which the reconnector gives up. */
    private int maxAttempts = 10;
    private long staleCheckIntervalMs = 30000;
    private long staleThresholdMs = 90000;
    private long connectTimeoutMs = 5000;

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    public long getBaseDelayMs() { return baseDelayMs; }
    public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }
    public long getMaxDelayMs() { return maxDelayMs; }
    public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }
    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public long getStaleCheckIntervalMs() { return staleCheckIntervalMs; }
    public void setStaleCheckIntervalMs(long staleCheckIntervalMs) { this.staleCheckIntervalMs = staleCheckIntervalMs; }
    public long getStaleThresholdMs() { return staleThresholdMs; }
    public void setStaleThresholdMs(long staleThresholdMs) { this.staleThresholdMs = staleThresholdMs; }
    public long getConnectTimeoutMs() { return connectTimeoutMs; }
    public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
}
