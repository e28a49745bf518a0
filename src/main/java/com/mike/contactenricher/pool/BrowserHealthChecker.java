package com.mike.contactenricher.pool;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates browsers against {@link HealthThresholds} and keeps a short rolling history per browser.
 */
@Slf4j
public class BrowserHealthChecker {

    static final int TREND_WINDOW = 5;
    static final int MIN_SAMPLES_FOR_TREND = 3;

    private final HealthThresholds thresholds;
    private final int historySize;
    private final Clock clock;
    private final Map<String, Deque<HealthSample>> history = new ConcurrentHashMap<>();

    public BrowserHealthChecker(HealthThresholds thresholds, int historySize, Clock clock) {
        this.thresholds = thresholds;
        this.historySize = Math.max(1, historySize);
        this.clock = clock;
    }

    public boolean check(BrowserHandle handle) {
        boolean healthy;
        try {
            handle.refreshMetrics();
            healthy = handle.getMetrics().isHealthy(thresholds, clock.instant());
        } catch (RuntimeException e) {
            log.warn("POOL: health check failed for browser {}: {}", handle.getId(), e.getMessage());
            healthy = false;
        }

        BrowserMetrics m = handle.getMetrics();
        record(handle.getId(), new HealthSample(clock.instant(), healthy, m.getMemoryMb(), m.getOpenPageCount()));

        if (!healthy) {
            log.debug("POOL: browser {} unhealthy: {}", handle.getId(), m);
        }
        return healthy;
    }

    /**
     * Fraction of healthy results among the latest checks, 1.0 while there are too few samples.
     */
    public double healthTrend(String browserId) {
        Deque<HealthSample> samples = history.get(browserId);
        if (samples == null) {
            return 1.0;
        }
        synchronized (samples) {
            if (samples.size() < MIN_SAMPLES_FOR_TREND) {
                return 1.0;
            }
            List<HealthSample> recent = List.copyOf(samples);
            List<HealthSample> window = recent.subList(Math.max(0, recent.size() - TREND_WINDOW), recent.size());
            long healthy = window.stream().filter(HealthSample::isHealthy).count();
            return (double) healthy / window.size();
        }
    }

    List<HealthSample> history(String browserId) {
        Deque<HealthSample> samples = history.get(browserId);
        if (samples == null) {
            return List.of();
        }
        synchronized (samples) {
            return List.copyOf(samples);
        }
    }

    void forget(String browserId) {
        history.remove(browserId);
    }

    private void record(String browserId, HealthSample sample) {
        Deque<HealthSample> samples = history.computeIfAbsent(browserId, id -> new ArrayDeque<>());
        synchronized (samples) {
            samples.addLast(sample);
            while (samples.size() > historySize) {
                samples.removeFirst();
            }
        }
    }
}
