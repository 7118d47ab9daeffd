package com.store.connection.health;

/**
 * Synchronous liveness probe of the backing store.
 * A {@link HealthStatus#isReachable() reachable} result means the store answered.
 */
@FunctionalInterface
public interface HealthProbe {

    HealthStatus probe();
}
