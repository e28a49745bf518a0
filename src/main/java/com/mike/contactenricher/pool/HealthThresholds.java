package com.mike.contactenricher.pool;

import com.mike.contactenricher.config.EnricherProperties;
import lombok.Value;

import java.time.Duration;

@Value
public class HealthThresholds {
    double memoryLimitMb;
    int maxOpenPages;
    int maxErrors;
    Duration maxLifetime;

    public static HealthThresholds from(EnricherProperties.Pool pool) {
        return new HealthThresholds(
                pool.getMemoryLimitMb(),
                pool.getMaxOpenPages(),
                pool.getMaxErrors(),
                Duration.ofMillis(pool.getMaxLifetimeMillis()));
    }
}
