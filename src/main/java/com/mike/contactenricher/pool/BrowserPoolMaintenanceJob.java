package com.mike.contactenricher.pool;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class BrowserPoolMaintenanceJob {

    private final BrowserPool pool;

    @Scheduled(fixedDelayString = "${enricher.pool.health-check-interval-millis:60000}",
            initialDelayString = "${enricher.pool.health-check-interval-millis:60000}")
    public void maintain() {
        try {
            pool.runHealthMaintenance();
        } catch (RuntimeException e) {
            log.warn("POOL: maintenance failed: {}", e.getMessage(), e);
        }
        PoolStats stats = pool.stats();
        if (stats.lowestHealthTrend() < 0.5) {
            log.warn("POOL: degrading browsers, health trends {}", stats.getHealthTrends());
        }
        if (log.isDebugEnabled()) {
            log.debug("POOL: {} browsers ({} busy), {} MB, success rate {}%, lowest health trend {}",
                    stats.getTotalBrowsers(), stats.getBusyBrowsers(),
                    Math.round(stats.getTotalMemoryMb()), Math.round(stats.successRate()),
                    stats.lowestHealthTrend());
        }
    }
}
