package com.store.connection.health;

/**
 * A named check of one part of the store connection (the store itself, the pool,
 * the circuit breaker) reporting a {@link HealthStatus}.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
