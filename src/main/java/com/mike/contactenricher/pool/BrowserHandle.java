package com.mike.contactenricher.pool;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

/**
 * Pool-owned wrapper around a {@link BrowserInstance} and its health metrics.
 * Handed to exactly one caller between {@link BrowserPool#acquire} and {@link BrowserPool#release}.
 */
@Slf4j
public class BrowserHandle {

    private final BrowserInstance instance;

    @Getter
    private final BrowserMetrics metrics;

    BrowserHandle(BrowserInstance instance, Instant startedAt) {
        this.instance = instance;
        this.metrics = new BrowserMetrics(startedAt);
    }

    public String getId() {
        return instance.id();
    }

    public PageSnapshot load(String url, int timeoutMillis) {
        try {
            return instance.load(url, timeoutMillis);
        } catch (RuntimeException e) {
            metrics.incrementErrors();
            throw e;
        }
    }

    void resetState(Instant now) {
        try {
            instance.resetState();
            metrics.setOpenPageCount(instance.openPageCount());
        } catch (RuntimeException e) {
            metrics.incrementErrors();
            log.warn("POOL: state reset failed for browser {}: {}", getId(), e.getMessage());
        }
        metrics.setLastUsedAt(now);
    }

    void refreshMetrics() {
        try {
            metrics.setMemoryMb(instance.sampleMemoryMb());
            metrics.setOpenPageCount(instance.openPageCount());
        } catch (RuntimeException e) {
            metrics.incrementErrors();
            log.debug("POOL: metrics refresh failed for browser {}: {}", getId(), e.getMessage());
        }
    }

    void close() {
        try {
            instance.close();
        } catch (RuntimeException e) {
            log.warn("POOL: error closing browser {}: {}", getId(), e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "BrowserHandle[" + getId() + "]";
    }
}
