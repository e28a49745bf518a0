package com.mike.contactenricher.pool;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BrowserHealthCheckerTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
    private static final HealthThresholds THRESHOLDS =
            new HealthThresholds(500, 10, 5, Duration.ofHours(1));

    private FakeBrowserInstance instance;
    private BrowserHandle handle;
    private BrowserHealthChecker checker;

    @BeforeEach
    void setUp() {
        instance = new FakeBrowserInstance("b-1");
        handle = new BrowserHandle(instance, START);
        checker = new BrowserHealthChecker(THRESHOLDS, 10, Clock.fixed(START.plusSeconds(60), ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("check")
    class Check {

        @Test
        @DisplayName("fresh browser within limits is healthy")
        void fresh_browser_is_healthy() {
            //Act
            boolean healthy = checker.check(handle);
            //Assert
            assertTrue(healthy);
            assertEquals(100.0, handle.getMetrics().getMemoryMb());
        }

        @Test
        @DisplayName("memory at the limit is unhealthy")
        void memory_at_limit_is_unhealthy() {
            //Arrange
            instance.memoryMb = 500;
            //Act + Assert
            assertFalse(checker.check(handle));
        }

        @Test
        @DisplayName("too many open pages is unhealthy")
        void too_many_pages_is_unhealthy() {
            //Arrange
            instance.openPages = 11;
            //Act + Assert
            assertFalse(checker.check(handle));
        }

        @Test
        @DisplayName("browser older than max lifetime is unhealthy")
        void too_old_is_unhealthy() {
            //Arrange
            BrowserHealthChecker later = new BrowserHealthChecker(THRESHOLDS, 10,
                    Clock.fixed(START.plus(Duration.ofHours(1)), ZoneOffset.UTC));
            //Act + Assert
            assertFalse(later.check(handle));
        }

        @Test
        @DisplayName("a failing metrics sample counts as an error, not an exception")
        void failing_sample_counts_error() {
            //Arrange
            FakeBrowserInstance broken = new FakeBrowserInstance("b-2") {
                @Override
                public double sampleMemoryMb() {
                    throw new IllegalStateException("target closed");
                }
            };
            BrowserHandle brokenHandle = new BrowserHandle(broken, START);
            //Act
            boolean healthy = checker.check(brokenHandle);
            //Assert
            assertTrue(healthy, "one error stays below maxErrors");
            assertEquals(1, brokenHandle.getMetrics().getErrorCount());
        }
    }

    @Nested
    @DisplayName("history and trend")
    class Trend {

        @Test
        @DisplayName("trend is 1.0 with fewer than three samples")
        void trend_defaults_to_one() {
            //Arrange
            instance.memoryMb = 900;
            checker.check(handle);
            checker.check(handle);
            //Act
            double trend = checker.healthTrend("b-1");
            //Assert
            assertEquals(1.0, trend);
            assertEquals(1.0, checker.healthTrend("unknown"));
        }

        @Test
        @DisplayName("trend is the healthy share of the last five checks")
        void trend_over_last_five() {
            //Arrange
            instance.memoryMb = 900;
            checker.check(handle);
            checker.check(handle);
            instance.memoryMb = 100;
            checker.check(handle);
            checker.check(handle);
            checker.check(handle);
            instance.memoryMb = 900;
            checker.check(handle);
            //Act
            double trend = checker.healthTrend("b-1");
            //Assert
            assertEquals(0.6, trend, 1e-9);
        }

        @Test
        @DisplayName("history keeps only the configured number of samples")
        void history_is_bounded() {
            //Arrange
            BrowserHealthChecker small = new BrowserHealthChecker(THRESHOLDS, 3, Clock.fixed(START, ZoneOffset.UTC));
            //Act
            for (int i = 0; i < 7; i++) {
                small.check(handle);
            }
            //Assert
            assertEquals(3, small.history("b-1").size());
        }

        @Test
        @DisplayName("forget drops the history of a retired browser")
        void forget_drops_history() {
            //Arrange
            checker.check(handle);
            //Act
            checker.forget("b-1");
            //Assert
            assertTrue(checker.history("b-1").isEmpty());
        }
    }
}
