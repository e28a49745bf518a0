package com.mike.contactenricher.pool;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BrowserMetricsTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
    private static final HealthThresholds THRESHOLDS =
            new HealthThresholds(500, 10, 5, Duration.ofMinutes(30));

    @Test
    @DisplayName("open pages equal to the limit are still healthy")
    void pages_at_limit_are_healthy() {
        //Arrange
        BrowserMetrics metrics = new BrowserMetrics(START);
        metrics.setOpenPageCount(10);
        //Act + Assert
        assertTrue(metrics.isHealthy(THRESHOLDS, START));
    }

    @Test
    @DisplayName("errors reaching maxErrors make the browser unhealthy")
    void errors_at_limit_are_unhealthy() {
        //Arrange
        BrowserMetrics metrics = new BrowserMetrics(START);
        for (int i = 0; i < 5; i++) {
            metrics.incrementErrors();
        }
        //Act + Assert
        assertFalse(metrics.isHealthy(THRESHOLDS, START));
    }

    @Test
    @DisplayName("age is measured from the start instant")
    void age_from_start() {
        //Arrange
        BrowserMetrics metrics = new BrowserMetrics(START);
        //Act
        Duration age = metrics.age(START.plusSeconds(90));
        //Assert
        assertEquals(Duration.ofSeconds(90), age);
        assertFalse(metrics.isHealthy(THRESHOLDS, START.plus(Duration.ofMinutes(30))));
    }
}
