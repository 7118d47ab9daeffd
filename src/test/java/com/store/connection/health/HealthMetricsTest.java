package com.store.connection.health;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Health Metrics Tests")
class HealthMetricsTest {

    private final HealthMetrics metrics = new HealthMetrics(new ReentrantLock());

    @Test
    @DisplayName("success and failure streaks should reset each other")
    void streaks() {
        metrics.recordSuccess();
        metrics.recordSuccess();
        assertEquals(2, metrics.getConsecutiveSuccesses());

        metrics.recordFailure();
        assertEquals(0, metrics.getConsecutiveSuccesses());
        assertEquals(1, metrics.getConsecutiveFailures());

        metrics.recordSuccess();
        assertEquals(0, metrics.getConsecutiveFailures());
    }

    @Test
    @DisplayName("average should be null before any sample")
    void emptyAverage() {
        assertNull(metrics.getAverageResponseTime());
        assertNull(metrics.getLastResponseTime());
    }

    @Test
    @DisplayName("window should keep only the most recent samples")
    void rollingWindow() {
        for (int i = 0; i < HealthMetrics.WINDOW_SIZE; i++) {
            metrics.recordResponseTime(Duration.ofMillis(1000));
        }
        for (int i = 0; i < HealthMetrics.WINDOW_SIZE; i++) {
            metrics.recordResponseTime(Duration.ofMillis(10));
        }

        assertEquals(HealthMetrics.WINDOW_SIZE, metrics.getSampleCount());
        assertEquals(Duration.ofMillis(10), metrics.getAverageResponseTime());
        assertEquals(Duration.ofMillis(10), metrics.getLastResponseTime());
    }

    @Test
    @DisplayName("average should be the mean of the window")
    void average() {
        metrics.recordResponseTime(Duration.ofMillis(10));
        metrics.recordResponseTime(Duration.ofMillis(30));
        assertEquals(Duration.ofMillis(20), metrics.getAverageResponseTime());
    }
}
