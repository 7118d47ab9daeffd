package com.store.connection.pool;

/**
 * A live, bounded pool of connections to the backing store, exposed as one
 * thread-safe client shared by all callers.
 *
 * @param <C> the store client type handed to operations
 */
public interface StoreConnectionPool<C> extends AutoCloseable {

    /**
     * Returns the shared client. Callers must not close it.
     */
    C client();

    /**
     * Performs a cheap liveness probe against the store.
     *
     * @return true if the store answered as expected
     * @throws RuntimeException if the store could not be reached
     */
    boolean ping();

    /**
     * Returns current pool statistics.
     */
    PoolStats getStats();

    /**
     * Releases every connection held by the pool.
     */
    @Override
    void close();
}
