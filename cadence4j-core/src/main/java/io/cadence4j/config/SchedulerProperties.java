package io.cadence4j.config;

import java.time.Duration;

/**
 * Runtime configuration for scheduler behavior.
 */
public class SchedulerProperties {
    private Duration pollInterval = Duration.ofSeconds(1);
    private Duration shutdownGracePeriod = Duration.ofSeconds(30);
    private int maxConcurrency = 16;
    private int resultHistorySize = 20;
    private String timezone; // null = system default
    private String workerNamePrefix = "cadence.worker-";

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
        this.shutdownGracePeriod = shutdownGracePeriod;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getResultHistorySize() {
        return resultHistorySize;
    }

    public void setResultHistorySize(int resultHistorySize) {
        this.resultHistorySize = resultHistorySize;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public String getWorkerNamePrefix() {
        return workerNamePrefix;
    }

    public void setWorkerNamePrefix(String workerNamePrefix) {
        this.workerNamePrefix = workerNamePrefix;
    }
}
