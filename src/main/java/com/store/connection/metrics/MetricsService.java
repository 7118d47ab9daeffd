package com.store.connection.metrics;

import com.store.connection.circuit.CircuitState;

import java.time.Duration;

/**
 * Interface for recording connection manager metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the manager works
 * without any metrics registry configured.
 */
public interface MetricsService {

    void recordOperation(String operationName, boolean success, Duration duration);

    void recordFallback(String operationName);

    void recordCircuitTransition(CircuitState from, CircuitState to);

    void recordRetryAttempt(String operationName);

    void recordHealthProbe(boolean success, Duration latency);
}
