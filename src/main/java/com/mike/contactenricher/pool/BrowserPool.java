package com.mike.contactenricher.pool;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, self-healing pool of browsers.
 *
 * <ul>
 *     <li>Grows on demand up to {@code maxInstances}, shrinks back to {@code minInstances} on release.</li>
 *     <li>Every handle is health-checked before it is handed out; unhealthy ones are closed and replaced,
 *     at most {@code maxReplacementAttempts} times per acquire.</li>
 *     <li>State is reset before a handle is handed out and again before it goes back to the idle set.</li>
 *     <li>{@link #runHealthMaintenance()} checks idle handles so degraded browsers are rotated even when
 *     nobody asks for them.</li>
 * </ul>
 *
 * Creation failures never reach the caller; the pool just does not grow.
 */
@Slf4j
public class BrowserPool implements AutoCloseable {

    private final BrowserInstanceFactory factory;
    private final BrowserHealthChecker healthChecker;
    private final Clock clock;

    private final int minInstances;
    private final int maxInstances;
    private final int maxReplacementAttempts;

    private final LinkedBlockingDeque<BrowserHandle> available = new LinkedBlockingDeque<>();
    private final Set<BrowserHandle> busy = ConcurrentHashMap.newKeySet();
    private final Set<BrowserHandle> all = ConcurrentHashMap.newKeySet();

    /** Guards {@link #all} size decisions together with {@link #reserved}. */
    private final ReentrantLock scaleLock = new ReentrantLock();
    private int reserved;

    private volatile boolean closed;

    private final AtomicLong browsersCreated = new AtomicLong();
    private final AtomicLong browsersReplaced = new AtomicLong();
    private final AtomicLong browsersRetired = new AtomicLong();
    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong healthyRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();

    public BrowserPool(BrowserInstanceFactory factory,
                       BrowserHealthChecker healthChecker,
                       Clock clock,
                       int minInstances,
                       int maxInstances,
                       int maxReplacementAttempts) {
        if (minInstances < 0) throw new IllegalArgumentException("minInstances must be >= 0");
        if (maxInstances < 1 || maxInstances < minInstances) {
            throw new IllegalArgumentException("maxInstances must be >= max(1, minInstances)");
        }
        this.factory = factory;
        this.healthChecker = healthChecker;
        this.clock = clock;
        this.minInstances = minInstances;
        this.maxInstances = maxInstances;
        this.maxReplacementAttempts = Math.max(0, maxReplacementAttempts);
    }

    /**
     * Pre-warms {@code minInstances} browsers.
     */
    public void initialize() {
        log.info("POOL: initializing with {} pre-warmed browsers (max={})", minInstances, maxInstances);
        fillToMinimum();
        log.info("POOL: ready, {} browsers available", available.size());
    }

    /**
     * Exclusive use of a healthy browser with a clean state. Must be given back with {@link #release}.
     *
     * @throws BrowserPoolTimeoutException when nothing becomes available within {@code timeout}
     * @throws BrowserPoolException        when the pool is closed or cannot produce a healthy browser
     */
    public BrowserHandle acquire(Duration timeout) {
        ensureOpen();
        totalRequests.incrementAndGet();
        long deadline = System.nanoTime() + timeout.toNanos();

        BrowserHandle handle = takeOrCreate(deadline, timeout);
        int replacements = 0;

        while (!healthChecker.check(handle)) {
            if (replacements >= maxReplacementAttempts) {
                retire(handle, "unhealthy");
                failedRequests.incrementAndGet();
                throw new BrowserPoolException(
                        "No healthy browser after " + replacements + " replacements");
            }
            replacements++;
            log.warn("POOL: browser {} unhealthy, replacing ({}/{})",
                    handle.getId(), replacements, maxReplacementAttempts);

            Optional<BrowserHandle> fresh = replace(handle);
            if (fresh.isPresent()) {
                handle = fresh.get();
                busy.add(handle);
            } else {
                handle = takeOrCreate(deadline, timeout);
            }
        }

        handle.resetState(clock.instant());
        healthyRequests.incrementAndGet();
        return handle;
    }

    /**
     * Resets the handle and puts it back in the idle set; retires one idle browser when the
     * idle set grows past {@code minInstances}.
     */
    public void release(BrowserHandle handle) {
        if (handle == null || !busy.remove(handle)) {
            return;
        }
        if (closed) {
            all.remove(handle);
            handle.close();
            return;
        }

        handle.resetState(clock.instant());
        available.offerLast(handle);

        if (available.size() > minInstances) {
            scaleDown();
        }
    }

    /**
     * Checks every idle browser and replaces the unhealthy ones, then tops the pool up to
     * {@code minInstances} if earlier creations failed.
     */
    public void runHealthMaintenance() {
        if (closed) {
            return;
        }

        int idle = available.size();
        int replaced = 0;
        for (int i = 0; i < idle; i++) {
            BrowserHandle handle = available.pollFirst();
            if (handle == null) {
                break;
            }
            busy.add(handle);

            if (healthChecker.check(handle)) {
                busy.remove(handle);
                available.offerLast(handle);
                continue;
            }

            log.warn("POOL: replacing unhealthy idle browser {}", handle.getId());
            Optional<BrowserHandle> fresh = replace(handle);
            fresh.ifPresent(available::offerLast);
            replaced++;
        }

        fillToMinimum();

        if (replaced > 0 || log.isDebugEnabled()) {
            log.info("POOL: maintenance done, replaced={}, total={}, available={}, busy={}",
                    replaced, all.size(), available.size(), busy.size());
        }
    }

    public PoolStats stats() {
        return PoolStats.builder()
                .browsersCreated(browsersCreated.get())
                .browsersReplaced(browsersReplaced.get())
                .browsersRetired(browsersRetired.get())
                .totalRequests(totalRequests.get())
                .healthyRequests(healthyRequests.get())
                .failedRequests(failedRequests.get())
                .totalBrowsers(all.size())
                .availableBrowsers(available.size())
                .busyBrowsers(busy.size())
                .totalMemoryMb(totalMemoryMb())
                .healthTrends(healthTrends())
                .build();
    }

    public double totalMemoryMb() {
        return all.stream().mapToDouble(h -> h.getMetrics().getMemoryMb()).sum();
    }

    private Map<String, Double> healthTrends() {
        Map<String, Double> trends = new TreeMap<>();
        for (BrowserHandle handle : all) {
            trends.put(handle.getId(), healthChecker.healthTrend(handle.getId()));
        }
        return trends;
    }

    public int size() {
        return all.size();
    }

    public int availableCount() {
        return available.size();
    }

    public int busyCount() {
        return busy.size();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        log.info("POOL: closing {} browsers", all.size());

        List<BrowserHandle> handles = new ArrayList<>(all);
        all.clear();
        available.clear();
        busy.clear();
        for (BrowserHandle handle : handles) {
            healthChecker.forget(handle.getId());
            handle.close();
        }
        log.info("POOL: closed");
    }

    private BrowserHandle takeOrCreate(long deadlineNanos, Duration timeout) {
        BrowserHandle handle = available.pollFirst();
        if (handle == null) {
            handle = scaleUp().orElse(null);
        }
        if (handle == null) {
            long remaining = deadlineNanos - System.nanoTime();
            try {
                handle = remaining > 0 ? available.pollFirst(remaining, TimeUnit.NANOSECONDS) : null;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failedRequests.incrementAndGet();
                throw new BrowserPoolException("Interrupted while waiting for a browser");
            }
        }
        if (handle == null) {
            failedRequests.incrementAndGet();
            throw new BrowserPoolTimeoutException(timeout);
        }
        busy.add(handle);
        return handle;
    }

    /**
     * Creates a browser for immediate use if the pool is below {@code maxInstances}.
     * The new handle is registered but not put in the idle set.
     */
    private Optional<BrowserHandle> scaleUp() {
        if (!reserveSlot()) {
            return Optional.empty();
        }
        Optional<BrowserHandle> created = Optional.empty();
        try {
            created = create();
            created.ifPresent(h -> log.info("POOL: scaled up to {} browsers", all.size() + 1));
        } finally {
            commitSlot(created.orElse(null));
        }
        return created;
    }

    private void scaleDown() {
        BrowserHandle victim = null;
        scaleLock.lock();
        try {
            if (all.size() > minInstances) {
                victim = available.pollFirst();
                if (victim != null) {
                    all.remove(victim);
                }
            }
        } finally {
            scaleLock.unlock();
        }

        if (victim != null) {
            healthChecker.forget(victim.getId());
            victim.close();
            browsersRetired.incrementAndGet();
            log.info("POOL: scaled down to {} browsers", all.size());
        }
    }

    /**
     * Closes {@code old} and creates a replacement. On failure the pool is one browser smaller.
     */
    private Optional<BrowserHandle> replace(BrowserHandle old) {
        retire(old, "replaced");
        Optional<BrowserHandle> fresh = scaleUp();
        if (fresh.isPresent()) {
            browsersReplaced.incrementAndGet();
            log.info("POOL: replaced browser {} with {}", old.getId(), fresh.get().getId());
        } else {
            log.error("POOL: failed to create replacement for browser {}", old.getId());
        }
        return fresh;
    }

    private void retire(BrowserHandle handle, String reason) {
        scaleLock.lock();
        try {
            all.remove(handle);
            busy.remove(handle);
            available.remove(handle);
        } finally {
            scaleLock.unlock();
        }
        healthChecker.forget(handle.getId());
        handle.close();
        browsersRetired.incrementAndGet();
        log.debug("POOL: retired browser {} ({})", handle.getId(), reason);
    }

    private void fillToMinimum() {
        while (!closed && all.size() < minInstances) {
            Optional<BrowserHandle> created = scaleUp();
            if (created.isEmpty()) {
                break;
            }
            available.offerLast(created.get());
        }
    }

    private Optional<BrowserHandle> create() {
        try {
            BrowserInstance instance = factory.create();
            BrowserHandle handle = new BrowserHandle(instance, clock.instant());
            browsersCreated.incrementAndGet();
            log.debug("POOL: created browser {}", handle.getId());
            return Optional.of(handle);
        } catch (RuntimeException e) {
            log.error("POOL: failed to create browser: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private boolean reserveSlot() {
        scaleLock.lock();
        try {
            if (closed || all.size() + reserved >= maxInstances) {
                return false;
            }
            reserved++;
            return true;
        } finally {
            scaleLock.unlock();
        }
    }

    private void commitSlot(BrowserHandle created) {
        scaleLock.lock();
        try {
            reserved--;
            if (created != null) {
                all.add(created);
            }
        } finally {
            scaleLock.unlock();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new BrowserPoolException("Browser pool is closed");
        }
    }
}
