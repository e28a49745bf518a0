package com.mike.contactenricher.pool;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

@Getter
@Setter
@ToString
public class BrowserMetrics {

    private double memoryMb;
    private int openPageCount;
    private Instant lastUsedAt;
    private int errorCount;
    private final Instant startedAt;

    public BrowserMetrics(Instant startedAt) {
        this.startedAt = startedAt;
        this.lastUsedAt = startedAt;
    }

    public void incrementErrors() {
        errorCount++;
    }

    public Duration age(Instant now) {
        return Duration.between(startedAt, now);
    }

    /**
     * All limits must hold; the lifetime limit rotates instances that never fail any other check.
     */
    public boolean isHealthy(HealthThresholds thresholds, Instant now) {
        return memoryMb < thresholds.getMemoryLimitMb()
                && openPageCount <= thresholds.getMaxOpenPages()
                && errorCount < thresholds.getMaxErrors()
                && age(now).compareTo(thresholds.getMaxLifetime()) < 0;
    }
}
