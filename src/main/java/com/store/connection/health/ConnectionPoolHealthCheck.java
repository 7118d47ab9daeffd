package com.store.connection.health;

import com.store.connection.pool.PoolStats;
import com.store.connection.pool.PooledClientHandle;

import java.util.Optional;

/**
 * Health check for the store connection pool.
 * Reports DOWN when no pool is established or every connection is in use,
 * DEGRADED above 80% utilization.
 */
public class ConnectionPoolHealthCheck implements HealthCheck {

    private static final double DOWN_THRESHOLD = 1.0;
    private static final double DEGRADED_THRESHOLD = 0.80;

    private final PooledClientHandle<?> handle;

    public ConnectionPoolHealthCheck(PooledClientHandle<?> handle) {
        this.handle = handle;
    }

    @Override
    public String getName() {
        return "connectionPool";
    }

    @Override
    public HealthStatus check() {
        try {
            Optional<PoolStats> maybeStats = handle.getStats();
            if (maybeStats.isEmpty()) {
                return HealthStatus.down("Connection pool not initialized");
            }
            PoolStats stats = maybeStats.get();
            double usage = stats.utilization();

            HealthStatus base;
            if (usage >= DOWN_THRESHOLD) {
                base = HealthStatus.down("Connection pool exhausted: all connections active");
            } else if (usage >= DEGRADED_THRESHOLD) {
                base = HealthStatus.degraded("Connection pool usage high: " +
                        String.format("%.0f%%", usage * 100));
            } else {
                base = HealthStatus.up();
            }

            return base
                    .withDetail("maxConnections", stats.maxConnections())
                    .withDetail("activeConnections", stats.activeConnections())
                    .withDetail("idleConnections", stats.idleConnections())
                    .withDetail("totalBorrowed", stats.totalBorrowed())
                    .withDetail("totalReturned", stats.totalReturned());
        } catch (RuntimeException e) {
            return HealthStatus.down("Connection pool check failed: " + e.getMessage());
        }
    }
}
