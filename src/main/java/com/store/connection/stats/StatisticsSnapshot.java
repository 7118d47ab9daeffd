package com.store.connection.stats;

import com.store.connection.circuit.CircuitState;
import com.store.connection.pool.PoolStats;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of a connection manager's statistics.
 *
 * @param totalRequests       access attempts (client lookups and health probes)
 * @param successfulRequests  store calls that succeeded
 * @param failedRequests      store calls that failed, transient or not
 * @param circuitOpens        CLOSED to OPEN transitions
 * @param circuitCloses       HALF_OPEN to CLOSED transitions
 * @param fallbackActivations times the caller's fallback path was taken
 * @param healthCheckCount    health probes performed
 * @param lastError           message of the most recent failure, or null
 * @param lastHealthCheck     time of the most recent probe, or null
 * @param circuitState        current circuit state
 * @param failureCount        failures counted toward the threshold
 * @param healthy             result of the most recent liveness probe
 * @param successRate         successful / total as a percentage, 100 when total is 0
 * @param pool                pool occupancy, or null when the pool is not initialized
 * @param healthMonitoring    background monitor metadata
 * @param retry               retry executor counters
 */
public record StatisticsSnapshot(
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        long circuitOpens,
        long circuitCloses,
        long fallbackActivations,
        long healthCheckCount,
        String lastError,
        Instant lastHealthCheck,
        CircuitState circuitState,
        int failureCount,
        boolean healthy,
        double successRate,
        PoolStats pool,
        HealthMonitoring healthMonitoring,
        Retry retry
) {

    public boolean poolInitialized() {
        return pool != null;
    }

    /**
     * @param enabled              whether the background monitor was configured
     * @param running              whether its task is currently alive
     * @param interval             time between probes
     * @param lastCheck            time of the most recent probe, or null
     * @param consecutiveFailures  failed probes/operations in a row
     * @param consecutiveSuccesses successful probes/operations in a row
     * @param averageResponseTime  mean of the rolling probe window, or null when empty
     * @param lastResponseTime     most recent probe duration, or null
     */
    public record HealthMonitoring(
            boolean enabled,
            boolean running,
            Duration interval,
            Instant lastCheck,
            long consecutiveFailures,
            long consecutiveSuccesses,
            Duration averageResponseTime,
            Duration lastResponseTime
    ) {
    }

    /**
     * @param maxAttempts  configured attempts per operation
     * @param attempts     total attempts made
     * @param successes    operations that succeeded after at least one retry
     * @param successRate  successes / attempts as a percentage, 0 without attempts
     */
    public record Retry(int maxAttempts, long attempts, long successes, double successRate) {
    }
}
