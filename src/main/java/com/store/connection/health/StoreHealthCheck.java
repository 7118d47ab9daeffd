package com.store.connection.health;

/**
 * Health check that runs a live probe against the backing store.
 */
public class StoreHealthCheck implements HealthCheck {

    private final HealthProbe probe;

    public StoreHealthCheck(HealthProbe probe) {
        this.probe = probe;
    }

    @Override
    public String getName() {
        return "store";
    }

    @Override
    public HealthStatus check() {
        return probe.probe();
    }
}
