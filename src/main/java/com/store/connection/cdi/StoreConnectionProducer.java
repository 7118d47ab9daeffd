package com.store.connection.cdi;

import com.store.connection.api.StoreConnectionManager;
import com.store.connection.metrics.MetricsService;
import com.store.connection.metrics.MicrometerMetricsService;
import com.store.connection.metrics.NoOpMetricsService;
import com.store.connection.pool.JedisStoreConnectionPool;
import com.store.connection.pool.StoreConfig;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.UnifiedJedis;

import java.time.Duration;

/**
 * CDI producer that wires a store connection manager from MicroProfile Config properties.
 *
 * <p>When this class is on the classpath of a CDI container (e.g., Quarkus), it reads
 * {@code store.connection.*} settings and produces a {@link StoreConfig} and a
 * Jedis-backed {@link StoreConnectionManager}. A {@link MeterRegistry} bean, when one
 * is resolvable, receives the manager's metrics.</p>
 *
 * <pre>
 * store:
 *   connection:
 *     address: redis://cache:6379/0
 *     failure-threshold: 5
 *     recovery-timeout-seconds: 60
 * </pre>
 */
@ApplicationScoped
public class StoreConnectionProducer {

    private static final Logger log = LoggerFactory.getLogger(StoreConnectionProducer.class);

    // ── Connection ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "store.connection.address", defaultValue = StoreConfig.DEFAULT_ADDRESS)
    String address;

    @Inject
    @ConfigProperty(name = "store.connection.max-connections", defaultValue = "50")
    int maxConnections;

    @Inject
    @ConfigProperty(name = "store.connection.connect-timeout-seconds", defaultValue = "5")
    long connectTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "store.connection.socket-timeout-seconds", defaultValue = "5")
    long socketTimeoutSeconds;

    // ── Resilience ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "store.connection.failure-threshold", defaultValue = "5")
    int failureThreshold;

    @Inject
    @ConfigProperty(name = "store.connection.recovery-timeout-seconds", defaultValue = "60")
    long recoveryTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "store.connection.max-retry-attempts", defaultValue = "3")
    int maxRetryAttempts;

    // ── Health Monitoring ─────────────────────────────────────

    @Inject
    @ConfigProperty(name = "store.connection.health-check-interval-seconds", defaultValue = "30")
    long healthCheckIntervalSeconds;

    @Inject
    @ConfigProperty(name = "store.connection.health-monitoring-enabled", defaultValue = "true")
    boolean healthMonitoringEnabled;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @Singleton
    public StoreConfig storeConfig() {
        StoreConfig config = StoreConfig.builder()
                .storeAddress(address)
                .maxConnections(maxConnections)
                .connectTimeout(Duration.ofSeconds(connectTimeoutSeconds))
                .socketTimeout(Duration.ofSeconds(socketTimeoutSeconds))
                .failureThreshold(failureThreshold)
                .recoveryTimeout(Duration.ofSeconds(recoveryTimeoutSeconds))
                .maxRetryAttempts(maxRetryAttempts)
                .healthCheckInterval(Duration.ofSeconds(healthCheckIntervalSeconds))
                .enableHealthMonitoring(healthMonitoringEnabled)
                .build();
        log.info("Store config: {}", config);
        return config;
    }

    /**
     * Singleton rather than a normal scope: the manager has no proxyable constructor.
     * The container owns the lifecycle, so no JVM shutdown hook is registered.
     */
    @Produces
    @Singleton
    public StoreConnectionManager<UnifiedJedis> storeConnectionManager(StoreConfig config) {
        log.info("Producing StoreConnectionManager for {}", config.redactedAddress());
        return StoreConnectionManager.<UnifiedJedis>builder(JedisStoreConnectionPool::new)
                .config(config)
                .metricsService(metricsService())
                .registerShutdownHook(false)
                .build();
    }

    public void closeManager(@Disposes StoreConnectionManager<UnifiedJedis> manager) {
        log.info("Closing StoreConnectionManager");
        manager.close();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    MetricsService metricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Store metrics enabled via Micrometer");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        return new NoOpMetricsService();
    }
}
