package com.store.connection.pool;

/**
 * Builds a {@link StoreConnectionPool} from configuration.
 * Called at manager construction and again whenever the pool is re-established.
 *
 * @param <C> the store client type
 */
@FunctionalInterface
public interface StoreConnectionPoolFactory<C> {

    StoreConnectionPool<C> create(StoreConfig config);
}
