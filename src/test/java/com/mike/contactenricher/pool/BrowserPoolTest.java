package com.mike.contactenricher.pool;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BrowserPoolTest {

    private static final Duration SHORT = Duration.ofMillis(50);
    private static final HealthThresholds THRESHOLDS =
            new HealthThresholds(500, 10, 5, Duration.ofHours(1));

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private FakeBrowserFactory factory;
    private BrowserPool pool;

    @BeforeEach
    void setUp() {
        factory = new FakeBrowserFactory();
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.close();
        }
    }

    private BrowserPool newPool(int min, int max, int maxReplacements) {
        pool = new BrowserPool(factory, new BrowserHealthChecker(THRESHOLDS, 10, clock), clock,
                min, max, maxReplacements);
        return pool;
    }

    private void assertAccounting() {
        assertEquals(pool.size(), pool.availableCount() + pool.busyCount(),
                "available + busy must equal all");
    }

    @Nested
    @DisplayName("sizing")
    class Sizing {

        @Test
        @DisplayName("initialize pre-warms minInstances")
        void initialize_prewarms_min() {
            //Arrange
            newPool(2, 4, 3);
            //Act
            pool.initialize();
            //Assert
            assertEquals(2, pool.size());
            assertEquals(2, pool.availableCount());
            assertEquals(0, pool.busyCount());
        }

        @Test
        @DisplayName("acquire scales up when nothing is idle")
        void acquire_scales_up_when_no_idle() {
            //Arrange
            newPool(1, 3, 3);
            pool.initialize();
            //Act
            BrowserHandle first = pool.acquire(SHORT);
            BrowserHandle second = pool.acquire(SHORT);
            //Assert
            assertNotEquals(first.getId(), second.getId());
            assertEquals(2, pool.size());
            assertEquals(2, pool.busyCount());
            assertAccounting();
        }

        @Test
        @DisplayName("acquire at maxInstances times out")
        void acquire_at_max_times_out() {
            //Arrange
            newPool(1, 2, 3);
            pool.initialize();
            pool.acquire(SHORT);
            pool.acquire(SHORT);
            //Act + Assert
            assertThrows(BrowserPoolTimeoutException.class, () -> pool.acquire(SHORT));
            assertEquals(2, pool.size());
            assertEquals(1, pool.stats().getFailedRequests());
        }

        @Test
        @DisplayName("waiting acquire gets the released browser")
        void waiting_acquire_gets_released_browser() throws Exception {
            //Arrange
            newPool(1, 1, 3);
            pool.initialize();
            BrowserHandle held = pool.acquire(SHORT);
            CompletableFuture<BrowserHandle> waiter =
                    CompletableFuture.supplyAsync(() -> pool.acquire(Duration.ofSeconds(5)));
            //Act
            Thread.sleep(100);
            pool.release(held);
            BrowserHandle handedOver = waiter.get(5, TimeUnit.SECONDS);
            //Assert
            assertEquals(held.getId(), handedOver.getId());
            assertEquals(1, pool.size());
        }

        @Test
        @DisplayName("release shrinks idle set back to minInstances")
        void release_scales_down_to_min() {
            //Arrange
            newPool(1, 3, 3);
            pool.initialize();
            List<BrowserHandle> handles = List.of(pool.acquire(SHORT), pool.acquire(SHORT), pool.acquire(SHORT));
            assertEquals(3, pool.size());
            //Act
            handles.forEach(pool::release);
            //Assert
            assertEquals(1, pool.size());
            assertEquals(1, pool.availableCount());
            assertEquals(2, factory.closedCount());
            assertEquals(2, pool.stats().getBrowsersRetired());
            assertAccounting();
        }

        @Test
        @DisplayName("releasing an unknown or already released handle is ignored")
        void release_twice_is_ignored() {
            //Arrange
            newPool(1, 2, 3);
            pool.initialize();
            BrowserHandle handle = pool.acquire(SHORT);
            //Act
            pool.release(handle);
            pool.release(handle);
            pool.release(null);
            //Assert
            assertEquals(1, pool.size());
            assertEquals(1, pool.availableCount());
        }

        @Test
        @DisplayName("concurrent acquire/release never exceeds maxInstances")
        void concurrent_use_stays_within_bounds() throws Exception {
            //Arrange
            newPool(1, 3, 3);
            pool.initialize();
            ExecutorService workers = Executors.newFixedThreadPool(8);
            AtomicInteger concurrentHolders = new AtomicInteger();
            AtomicInteger maxHolders = new AtomicInteger();
            AtomicInteger maxSize = new AtomicInteger();
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            //Act
            for (int t = 0; t < 8; t++) {
                futures.add(workers.submit(() -> {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        BrowserHandle h = pool.acquire(Duration.ofSeconds(5));
                        maxHolders.accumulateAndGet(concurrentHolders.incrementAndGet(), Math::max);
                        maxSize.accumulateAndGet(pool.size(), Math::max);
                        concurrentHolders.decrementAndGet();
                        pool.release(h);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
            workers.shutdown();
            //Assert
            assertTrue(maxSize.get() <= 3, "pool size peaked at " + maxSize.get());
            assertTrue(maxHolders.get() <= 3);
            assertTrue(pool.size() >= 1 && pool.size() <= 3);
            assertEquals(0, pool.busyCount());
            assertAccounting();
        }
    }

    @Nested
    @DisplayName("health")
    class Health {

        @Test
        @DisplayName("unhealthy idle browser is retired and replaced, never handed out")
        void unhealthy_browser_is_replaced_on_acquire() {
            //Arrange
            newPool(1, 2, 3);
            pool.initialize();
            FakeBrowserInstance degraded = factory.created.get(0);
            degraded.memoryMb = 900;
            //Act
            BrowserHandle handle = pool.acquire(SHORT);
            //Assert
            assertNotEquals(degraded.id(), handle.getId());
            assertTrue(degraded.closed);
            assertEquals(1, pool.size());
            assertEquals(1, pool.stats().getBrowsersReplaced());
            assertAccounting();
        }

        @Test
        @DisplayName("replacement is bounded when no healthy browser can be produced")
        void replacement_is_bounded() {
            //Arrange
            factory.customizer = instance -> instance.memoryMb = 900;
            newPool(1, 2, 3);
            pool.initialize();
            //Act
            BrowserPoolException e = assertThrows(BrowserPoolException.class, () -> pool.acquire(SHORT));
            //Assert
            assertFalse(e instanceof BrowserPoolTimeoutException);
            assertEquals(4, factory.created.size(), "initial browser plus three replacements");
            assertTrue(factory.created.stream().allMatch(i -> i.closed));
            assertEquals(0, pool.busyCount());
            assertAccounting();
        }

        @Test
        @DisplayName("failed replacement shrinks the pool and acquire falls back to another browser")
        void failed_replacement_shrinks_pool() {
            //Arrange
            newPool(2, 2, 3);
            pool.initialize();
            FakeBrowserInstance degraded = factory.created.get(0);
            degraded.memoryMb = 900;
            factory.alwaysFail = true;
            //Act
            BrowserHandle handle = pool.acquire(SHORT);
            //Assert
            assertEquals(factory.created.get(1).id(), handle.getId());
            assertTrue(degraded.closed);
            assertEquals(1, pool.size());
        }

        @Test
        @DisplayName("state is reset before handing out and again on release")
        void state_reset_on_acquire_and_release() {
            //Arrange
            newPool(1, 1, 3);
            pool.initialize();
            FakeBrowserInstance instance = factory.created.get(0);
            //Act
            BrowserHandle handle = pool.acquire(SHORT);
            int afterAcquire = instance.resets.get();
            instance.openPages = 4;
            pool.release(handle);
            //Assert
            assertEquals(1, afterAcquire);
            assertEquals(2, instance.resets.get());
            assertEquals(1, handle.getMetrics().getOpenPageCount());
        }

        @Test
        @DisplayName("maintenance replaces unhealthy idle browsers")
        void maintenance_replaces_unhealthy_idle() {
            //Arrange
            newPool(2, 3, 3);
            pool.initialize();
            FakeBrowserInstance degraded = factory.created.get(0);
            degraded.openPages = 50;
            //Act
            pool.runHealthMaintenance();
            //Assert
            assertTrue(degraded.closed);
            assertEquals(2, pool.size());
            assertEquals(2, pool.availableCount());
            assertAccounting();
        }

        @Test
        @DisplayName("maintenance tops the pool up to min after failed creations")
        void maintenance_tops_up_to_min() {
            //Arrange
            factory.failuresRemaining.set(1);
            newPool(2, 3, 3);
            pool.initialize();
            assertEquals(0, pool.size());
            //Act
            pool.runHealthMaintenance();
            //Assert
            assertEquals(2, pool.size());
            assertEquals(2, pool.availableCount());
        }

        @Test
        @DisplayName("load failures count as errors on the handle")
        void load_failure_counts_errors() {
            //Arrange
            newPool(1, 1, 3);
            pool.initialize();
            FakeBrowserInstance instance = factory.created.get(0);
            instance.loadFailure = new IllegalStateException("net::ERR_NAME_NOT_RESOLVED");
            BrowserHandle handle = pool.acquire(SHORT);
            //Act
            assertThrows(IllegalStateException.class, () -> handle.load("https://nope.invalid", 1000));
            //Assert
            assertEquals(1, handle.getMetrics().getErrorCount());
        }
    }

    @Nested
    @DisplayName("failures and lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("creation failure never raises, the pool just does not grow")
        void creation_failure_is_swallowed() {
            //Arrange
            factory.alwaysFail = true;
            newPool(2, 3, 3);
            //Act
            pool.initialize();
            //Assert
            assertEquals(0, pool.size());
            assertThrows(BrowserPoolTimeoutException.class, () -> pool.acquire(SHORT));
        }

        @Test
        @DisplayName("close retires every browser and rejects further acquires")
        void close_retires_everything() {
            //Arrange
            newPool(2, 3, 3);
            pool.initialize();
            BrowserHandle busy = pool.acquire(SHORT);
            //Act
            pool.close();
            pool.release(busy);
            //Assert
            assertEquals(0, pool.size());
            assertTrue(factory.created.stream().allMatch(i -> i.closed));
            assertThrows(BrowserPoolException.class, () -> pool.acquire(SHORT));
        }

        @Test
        @DisplayName("stats count requests and browsers")
        void stats_reflect_activity() {
            //Arrange
            newPool(1, 2, 3);
            pool.initialize();
            //Act
            BrowserHandle a = pool.acquire(SHORT);
            BrowserHandle b = pool.acquire(SHORT);
            pool.release(a);
            PoolStats stats = pool.stats();
            //Assert
            assertEquals(2, stats.getBrowsersCreated());
            assertEquals(2, stats.getTotalRequests());
            assertEquals(2, stats.getHealthyRequests());
            assertEquals(2, stats.getTotalBrowsers());
            assertEquals(1, stats.getBusyBrowsers());
            assertEquals(100.0, stats.successRate());
            assertEquals(b.getId(), factory.created.get(1).id());
            assertEquals(Map.of(a.getId(), 1.0, b.getId(), 1.0), stats.getHealthTrends());
        }
    }
}
