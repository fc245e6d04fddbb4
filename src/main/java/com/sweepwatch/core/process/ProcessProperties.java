package com.sweepwatch.core.process;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sweepwatch.process")
public class ProcessProperties {

    private String sweepBinary = "hackrf_sweep";
    private String infoBinary = "hackrf_info";
    private boolean useSetsid = true;
    private long probeTimeoutMs = 3000;
    private long gracePeriodMs = 100;
    private long killVerifyTimeoutMs = 2000;
    private long monitorIntervalMs = 2000;

    public String getSweepBinary() { return sweepBinary; }
    public void setSweepBinary(String sweepBinary) { this.sweepBinary = sweepBinary; }
    public String getInfoBinary() { return infoBinary; }
    public void setInfoBinary(String infoBinary) { this.infoBinary = infoBinary; }
    public boolean isUseSetsid() { return useSetsid; }
    public void setUseSetsid(boolean useSetsid) { this.useSetsid = useSetsid; }
    public long getProbeTimeoutMs() { return probeTimeoutMs; }
    public void setProbeTimeoutMs(long probeTimeoutMs) { this.probeTimeoutMs = probeTimeoutMs; }
    public long getGracePeriodMs() { return gracePeriodMs; }
    public void setGracePeriodMs(long gracePeriodMs) { this.gracePeriodMs = gracePeriodMs; }
    public long getKillVerifyTimeoutMs() { return killVerifyTimeoutMs; }
    public void setKillVerifyTimeoutMs(long killVerifyTimeoutMs) { this.killVerifyTimeoutMs = killVerifyTimeoutMs; }
    public long getMonitorIntervalMs() { return monitorIntervalMs; }
    public void setMonitorIntervalMs(long monitorIntervalMs) { this.monitorIntervalMs = monitorIntervalMs; }
}
