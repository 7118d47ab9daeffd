package com.store.connection.pool;

import com.store.connection.error.StoreInitializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Owns the lifecycle of the manager's {@link StoreConnectionPool}.
 *
 * <p>Initialization builds the pool through the factory and runs one liveness probe.
 * It is idempotent: while a pool is live, {@link #initialize()} returns it unchanged.
 * Construction is serialized on this handle, never on the manager's state lock, so
 * slow connects do not block circuit reads.</p>
 *
 * @param <C> the store client type
 */
public class PooledClientHandle<C> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PooledClientHandle.class);

    private final StoreConnectionPoolFactory<C> factory;
    private final StoreConfig config;
    private final Object initLock = new Object();
    private volatile StoreConnectionPool<C> pool;

    public PooledClientHandle(StoreConnectionPoolFactory<C> factory, StoreConfig config) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Returns the live pool, building and probing a new one if none exists.
     *
     * @throws StoreInitializationException if the pool cannot be built or the probe fails
     */
    public StoreConnectionPool<C> initialize() {
        StoreConnectionPool<C> current = pool;
        if (current != null) {
            return current;
        }
        synchronized (initLock) {
            if (pool == null) {
                pool = connect();
            }
            return pool;
        }
    }

    /**
     * Discards the current pool, if any, and builds a fresh one.
     *
     * @throws StoreInitializationException if the new pool cannot be built or the probe fails
     */
    public StoreConnectionPool<C> reinitialize() {
        synchronized (initLock) {
            StoreConnectionPool<C> previous = pool;
            pool = null;
            if (previous != null) {
                closeQuietly(previous);
            }
            pool = connect();
            return pool;
        }
    }

    public Optional<StoreConnectionPool<C>> current() {
        return Optional.ofNullable(pool);
    }

    public boolean isInitialized() {
        return pool != null;
    }

    /**
     * Returns pool statistics, or empty when no pool is live.
     */
    public Optional<PoolStats> getStats() {
        StoreConnectionPool<C> current = pool;
        if (current == null) {
            return Optional.empty();
        }
        return Optional.of(current.getStats());
    }

    @Override
    public void close() {
        synchronized (initLock) {
            StoreConnectionPool<C> previous = pool;
            pool = null;
            if (previous != null) {
                closeQuietly(previous);
                log.info("Store connection pool released");
            }
        }
    }

    private StoreConnectionPool<C> connect() {
        StoreConnectionPool<C> created;
        try {
            created = factory.create(config);
        } catch (RuntimeException e) {
            throw new StoreInitializationException(
                    "Failed to create connection pool for " + config.redactedAddress() + ": " + e.getMessage(), e);
        }
        if (created == null) {
            throw new StoreInitializationException("Pool factory returned null for " + config.redactedAddress());
        }

        try {
            if (!created.ping()) {
                throw new StoreInitializationException(
                        "Liveness probe to " + config.redactedAddress() + " returned an unexpected reply");
            }
        } catch (StoreInitializationException e) {
            closeQuietly(created);
            throw e;
        } catch (RuntimeException e) {
            closeQuietly(created);
            throw new StoreInitializationException(
                    "Liveness probe to " + config.redactedAddress() + " failed: " + e.getMessage(), e);
        }

        log.info("Store connection pool initialized: address={} maxConnections={}",
                config.redactedAddress(), config.getMaxConnections());
        return created;
    }

    private void closeQuietly(StoreConnectionPool<C> target) {
        try {
            target.close();
        } catch (Exception e) {
            log.warn("Error closing connection pool: {}", e.getMessage());
        }
    }
}
