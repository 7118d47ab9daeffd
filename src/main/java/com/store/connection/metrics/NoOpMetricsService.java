package com.store.connection.metrics;

import com.store.connection.circuit.CircuitState;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordOperation(String operationName, boolean success, Duration duration) {
    }

    @Override
    public void recordFallback(String operationName) {
    }

    @Override
    public void recordCircuitTransition(CircuitState from, CircuitState to) {
    }

    @Override
    public void recordRetryAttempt(String operationName) {
    }

    @Override
    public void recordHealthProbe(boolean success, Duration latency) {
    }
}
