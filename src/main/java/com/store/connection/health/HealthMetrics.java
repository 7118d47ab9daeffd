package com.store.connection.health;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rolling health metrics: the last {@value #WINDOW_SIZE} probe response times and
 * consecutive success/failure counters. Guarded by the manager's shared state lock.
 */
public class HealthMetrics {

    public static final int WINDOW_SIZE = 100;

    private final ReentrantLock lock;
    private final Deque<Duration> responseTimes = new ArrayDeque<>(WINDOW_SIZE);
    private long consecutiveSuccesses;
    private long consecutiveFailures;
    private Duration lastResponseTime;

    public HealthMetrics(ReentrantLock lock) {
        this.lock = lock;
    }

    public void recordSuccess() {
        lock.lock();
        try {
            consecutiveSuccesses++;
            consecutiveFailures = 0;
        } finally {
            lock.unlock();
        }
    }

    public void recordFailure() {
        lock.lock();
        try {
            consecutiveFailures++;
            consecutiveSuccesses = 0;
        } finally {
            lock.unlock();
        }
    }

    public void recordResponseTime(Duration responseTime) {
        lock.lock();
        try {
            if (responseTimes.size() == WINDOW_SIZE) {
                responseTimes.removeFirst();
            }
            responseTimes.addLast(responseTime);
            lastResponseTime = responseTime;
        } finally {
            lock.unlock();
        }
    }

    public long getConsecutiveSuccesses() {
        lock.lock();
        try {
            return consecutiveSuccesses;
        } finally {
            lock.unlock();
        }
    }

    public long getConsecutiveFailures() {
        lock.lock();
        try {
            return consecutiveFailures;
        } finally {
            lock.unlock();
        }
    }

    public Duration getLastResponseTime() {
        lock.lock();
        try {
            return lastResponseTime;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Mean of the rolling window, or null when no probe has been timed yet.
     */
    public Duration getAverageResponseTime() {
        lock.lock();
        try {
            if (responseTimes.isEmpty()) {
                return null;
            }
            long totalNanos = 0;
            for (Duration d : responseTimes) {
                totalNanos += d.toNanos();
            }
            return Duration.ofNanos(totalNanos / responseTimes.size());
        } finally {
            lock.unlock();
        }
    }

    public int getSampleCount() {
        lock.lock();
        try {
            return responseTimes.size();
        } finally {
            lock.unlock();
        }
    }
}
