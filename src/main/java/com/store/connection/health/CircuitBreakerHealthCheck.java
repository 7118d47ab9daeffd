package com.store.connection.health;

import com.store.connection.circuit.CircuitBreaker;
import com.store.connection.circuit.CircuitState;

/**
 * Maps the circuit breaker state to health: CLOSED is UP, HALF_OPEN is DEGRADED,
 * OPEN is DOWN. Reads state only, never touches the store.
 */
public class CircuitBreakerHealthCheck implements HealthCheck {

    private final CircuitBreaker circuitBreaker;

    public CircuitBreakerHealthCheck(CircuitBreaker circuitBreaker) {
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public String getName() {
        return "circuitBreaker";
    }

    @Override
    public HealthStatus check() {
        CircuitState state = circuitBreaker.getState();
        int failures = circuitBreaker.getFailureCount();

        HealthStatus base = switch (state) {
            case CLOSED -> HealthStatus.up();
            case HALF_OPEN -> HealthStatus.degraded("Circuit half-open, testing store recovery");
            case OPEN -> HealthStatus.down("Circuit open after " + failures + " failures");
        };

        return base
                .withDetail("state", state.name())
                .withDetail("failureCount", failures)
                .withDetail("failureThreshold", circuitBreaker.getFailureThreshold());
    }
}
