package com.store.connection.api;

import com.store.connection.pool.StoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.UnifiedJedis;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Composition-root helper that lazily builds one {@link StoreConnectionManager} per
 * store address and hands out the same instance on every later lookup.
 *
 * <p>The default address comes from the {@value #ADDRESS_ENV} environment variable,
 * falling back to {@link StoreConfig#DEFAULT_ADDRESS}. A manager that was closed
 * elsewhere is replaced on the next lookup. {@link #reset()} closes every manager
 * and forgets them.</p>
 *
 * @param <C> the store client type
 */
public class StoreConnectionManagerFactory<C> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StoreConnectionManagerFactory.class);

    public static final String ADDRESS_ENV = "REDIS_URL";

    private final StoreConfig baseConfig;
    private final String defaultAddress;
    private final Function<StoreConfig, StoreConnectionManager<C>> managerBuilder;
    private final Map<String, StoreConnectionManager<C>> managers = new ConcurrentHashMap<>();

    /**
     * @param baseConfig     settings shared by every manager; only the address varies
     * @param defaultAddress address used by {@link #get()}
     * @param managerBuilder builds a manager for one address-specific configuration
     */
    public StoreConnectionManagerFactory(StoreConfig baseConfig, String defaultAddress,
                                         Function<StoreConfig, StoreConnectionManager<C>> managerBuilder) {
        this.baseConfig = Objects.requireNonNull(baseConfig, "baseConfig");
        this.defaultAddress = Objects.requireNonNull(defaultAddress, "defaultAddress");
        this.managerBuilder = Objects.requireNonNull(managerBuilder, "managerBuilder");
    }

    /**
     * Factory of Jedis-backed managers whose default address comes from the environment.
     */
    public static StoreConnectionManagerFactory<UnifiedJedis> jedis(StoreConfig baseConfig) {
        return new StoreConnectionManagerFactory<>(baseConfig, resolveDefaultAddress(System::getenv),
                StoreConnectionManager::jedis);
    }

    /**
     * Reads {@value #ADDRESS_ENV} through the given lookup, ignoring blank values.
     */
    static String resolveDefaultAddress(UnaryOperator<String> environment) {
        String fromEnv = environment.apply(ADDRESS_ENV);
        if (fromEnv == null || fromEnv.isBlank()) {
            return StoreConfig.DEFAULT_ADDRESS;
        }
        return fromEnv.trim();
    }

    public StoreConnectionManager<C> get() {
        return get(defaultAddress);
    }

    /**
     * Returns the manager for the address, building it on first use.
     *
     * @throws IllegalArgumentException if the address is not a valid store address
     */
    public StoreConnectionManager<C> get(String address) {
        Objects.requireNonNull(address, "address");
        return managers.compute(address, (key, existing) -> {
            if (existing != null && !existing.isClosed()) {
                return existing;
            }
            StoreConfig config = baseConfig.toBuilder().storeAddress(key).build();
            log.info("Creating store connection manager for {}", config.redactedAddress());
            return managerBuilder.apply(config);
        });
    }

    public String getDefaultAddress() {
        return defaultAddress;
    }

    public int size() {
        return managers.size();
    }

    /**
     * Closes every manager built so far and forgets them.
     */
    public void reset() {
        List<StoreConnectionManager<C>> toClose = new ArrayList<>(managers.values());
        managers.clear();
        for (StoreConnectionManager<C> manager : toClose) {
            try {
                manager.close();
            } catch (RuntimeException e) {
                log.warn("Error closing store connection manager: {}", e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        reset();
    }
}
