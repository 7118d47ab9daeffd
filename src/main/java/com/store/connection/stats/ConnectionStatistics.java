package com.store.connection.stats;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Live, monotonically growing counters of a connection manager.
 * Counters are lock-free so the hot request path never contends on the state lock.
 */
public class ConnectionStatistics {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong successfulRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final AtomicLong circuitOpens = new AtomicLong();
    private final AtomicLong circuitCloses = new AtomicLong();
    private final AtomicLong fallbackActivations = new AtomicLong();
    private final AtomicLong retryAttempts = new AtomicLong();
    private final AtomicLong retrySuccesses = new AtomicLong();
    private final AtomicLong healthCheckCount = new AtomicLong();
    private final AtomicReference<String> lastError = new AtomicReference<>();
    private final AtomicReference<Instant> lastHealthCheck = new AtomicReference<>();

    public void recordRequest() {
        totalRequests.incrementAndGet();
    }

    public void recordSuccessfulRequest() {
        successfulRequests.incrementAndGet();
    }

    public void recordFailedRequest(String message) {
        failedRequests.incrementAndGet();
        lastError.set(message);
    }

    public void recordCircuitOpen() {
        circuitOpens.incrementAndGet();
    }

    public void recordCircuitClose() {
        circuitCloses.incrementAndGet();
    }

    public void recordFallbackActivation() {
        fallbackActivations.incrementAndGet();
    }

    public void recordRetryAttempt() {
        retryAttempts.incrementAndGet();
    }

    public void recordRetrySuccess() {
        retrySuccesses.incrementAndGet();
    }

    public void recordHealthCheck(Instant at) {
        healthCheckCount.incrementAndGet();
        lastHealthCheck.set(at);
    }

    public long getTotalRequests() { return totalRequests.get(); }
    public long getSuccessfulRequests() { return successfulRequests.get(); }
    public long getFailedRequests() { return failedRequests.get(); }
    public long getCircuitOpens() { return circuitOpens.get(); }
    public long getCircuitCloses() { return circuitCloses.get(); }
    public long getFallbackActivations() { return fallbackActivations.get(); }
    public long getRetryAttempts() { return retryAttempts.get(); }
    public long getRetrySuccesses() { return retrySuccesses.get(); }
    public long getHealthCheckCount() { return healthCheckCount.get(); }
    public String getLastError() { return lastError.get(); }
    public Instant getLastHealthCheck() { return lastHealthCheck.get(); }

    /**
     * Percentage of successful requests; 100 when nothing has been requested yet.
     */
    public double successRate() {
        long total = totalRequests.get();
        if (total == 0) {
            return 100.0;
        }
        return (double) successfulRequests.get() / total * 100.0;
    }

    /**
     * Percentage of retry attempts that ended a retried operation successfully; 0 without attempts.
     */
    public double retrySuccessRate() {
        long attempts = retryAttempts.get();
        if (attempts == 0) {
            return 0.0;
        }
        return (double) retrySuccesses.get() / attempts * 100.0;
    }
}
