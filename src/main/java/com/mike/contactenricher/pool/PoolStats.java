package com.mike.contactenricher.pool;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class PoolStats {
    long browsersCreated;
    long browsersReplaced;
    long browsersRetired;
    long totalRequests;
    long healthyRequests;
    long failedRequests;
    int totalBrowsers;
    int availableBrowsers;
    int busyBrowsers;
    double totalMemoryMb;
    /** Share of healthy checks over the recent history, per live browser id. */
    Map<String, Double> healthTrends;

    public double lowestHealthTrend() {
        return healthTrends == null ? 1.0 : healthTrends.values().stream().mapToDouble(Double::doubleValue).min().orElse(1.0);
    }

    public double successRate() {
        return healthyRequests * 100.0 / Math.max(1, totalRequests);
    }
}
