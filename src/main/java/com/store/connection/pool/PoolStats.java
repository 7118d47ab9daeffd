package com.store.connection.pool;

/**
 * Occupancy of a {@link StoreConnectionPool}.
 *
 * @param maxConnections    configured upper bound of the pool
 * @param totalConnections  managed connections (active + idle)
 * @param activeConnections connections currently borrowed
 * @param idleConnections   connections available for borrowing
 * @param totalBorrowed     cumulative borrow count since pool creation
 * @param totalReturned     cumulative return count since pool creation
 * @param totalCreated      cumulative connection creation count
 */
public record PoolStats(
        int maxConnections,
        int totalConnections,
        int activeConnections,
        int idleConnections,
        long totalBorrowed,
        long totalReturned,
        long totalCreated
) {

    /**
     * Fraction of the pool currently in use, 0.0 to 1.0.
     */
    public double utilization() {
        return maxConnections > 0 ? (double) activeConnections / maxConnections : 0.0;
    }
}
