package com.sweepwatch.core.sweep;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sweepwatch.sweep")
public class SweepProperties {

    /** How long a fresh process must run without a fatal error before the sweep counts as RUNNING. */
    private long settleMs = 2500;
    /** Pause between stopping one frequency's process and starting the next. */
    private long switchDelayMs = 500;
    private long commandTimeoutMs = 15000;
    /** Periodic split-brain check; 0 disables it. */
    private long selfCheckIntervalMs = 30000;
    private long noDataTimeoutMs = 60000;
    private long defaultCycleTimeMs = 10000;
    private double defaultSpanMhz = 20;
    private int defaultBinWidthHz = 20000;
    private int lnaGain = 32;
    private int vgaGain = 20;
    private double minFrequencyMhz = 1;
    private double maxFrequencyMhz = 7250;

    public long getSettleMs() { return settleMs; }
    public void setSettleMs(long settleMs) { this.settleMs = settleMs; }
    public long getSwitchDelayMs() { return switchDelayMs; }
    public void setSwitchDelayMs(long switchDelayMs) { this.switchDelayMs = switchDelayMs; }
    public long getCommandTimeoutMs() { return commandTimeoutMs; }
    public void setCommandTimeoutMs(long commandTimeoutMs) { this.commandTimeoutMs = commandTimeoutMs; }
    public long getSelfCheckIntervalMs() { return selfCheckIntervalMs; }
    public void setSelfCheckIntervalMs(long selfCheckIntervalMs) { this.selfCheckIntervalMs = selfCheckIntervalMs; }
    public long getNoDataTimeoutMs() { return noDataTimeoutMs; }
    public void setNoDataTimeoutMs(long noDataTimeoutMs) { this.noDataTimeoutMs = noDataTimeoutMs; }
    public long getDefaultCycleTimeMs() { return defaultCycleTimeMs; }
    public void setDefaultCycleTimeMs(long defaultCycleTimeMs) { this.defaultCycleTimeMs = defaultCycleTimeMs; }
    public double getDefaultSpanMhz() { return defaultSpanMhz; }
    public void setDefaultSpanMhz(double defaultSpanMhz) { this.defaultSpanMhz = defaultSpanMhz; }
    public int getDefaultBinWidthHz() { return defaultBinWidthHz; }
    public void setDefaultBinWidthHz(int defaultBinWidthHz) { this.defaultBinWidthHz = defaultBinWidthHz; }
    public int getLnaGain() { return lnaGain; }
    public void setLnaGain(int lnaGain) { this.lnaGain = lnaGain; }
    public int getVgaGain() { return vgaGain; }
    public void setVgaGain(int vgaGain) { this.vgaGain = vgaGain; }
    public double getMinFrequencyMhz() { return minFrequencyMhz; }
    public void setMinFrequencyMhz(double minFrequencyMhz) { this.minFrequencyMhz = minFrequencyMhz; }
    public double getMaxFrequencyMhz() { return maxFrequencyMhz; }
    public void setMaxFrequencyMhz(double maxFrequencyMhz) { this.maxFrequencyMhz = maxFrequencyMhz; }
}
