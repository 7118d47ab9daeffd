package com.store.connection.api;

import com.store.connection.circuit.CircuitBreaker;
import com.store.connection.circuit.CircuitState;
import com.store.connection.error.ErrorCategory;
import com.store.connection.error.StoreErrorClassifier;
import com.store.connection.error.StoreInitializationException;
import com.store.connection.health.CircuitBreakerHealthCheck;
import com.store.connection.health.ConnectionPoolHealthCheck;
import com.store.connection.health.HealthCheckRegistry;
import com.store.connection.health.HealthMetrics;
import com.store.connection.health.HealthMonitor;
import com.store.connection.health.HealthStatus;
import com.store.connection.health.StoreHealthCheck;
import com.store.connection.logging.LogContext;
import com.store.connection.metrics.MetricsService;
import com.store.connection.metrics.NoOpMetricsService;
import com.store.connection.pool.JedisStoreConnectionPool;
import com.store.connection.pool.PooledClientHandle;
import com.store.connection.pool.StoreConfig;
import com.store.connection.pool.StoreConnectionPool;
import com.store.connection.pool.StoreConnectionPoolFactory;
import com.store.connection.retry.BackoffPolicy;
import com.store.connection.retry.RetryExecutor;
import com.store.connection.retry.Sleeper;
import com.store.connection.stats.ConnectionStatistics;
import com.store.connection.stats.StatisticsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.UnifiedJedis;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single entry point for every access to the backing key-value store.
 *
 * <p>Composes a {@link CircuitBreaker}, a {@link RetryExecutor} with exponential
 * backoff, a {@link PooledClientHandle} owning the connection pool, and an optional
 * background {@link HealthMonitor}. Callers hand it an operation plus a fallback that
 * performs the equivalent work against local state; when the store is down, slow or
 * the circuit is open, the fallback answers instead and no transient failure ever
 * reaches the caller. Non-transient failures (auth, malformed requests, bugs)
 * propagate unchanged.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * StoreConnectionManager&lt;UnifiedJedis&gt; store = StoreConnectionManager.jedis(
 *     StoreConfig.builder().storeAddress("redis://cache:6379/0").build());
 *
 * List&lt;String&gt; history = store.executeWithFallback(
 *     client -&gt; client.lrange("conversation:" + userId, 0, -1),
 *     () -&gt; localHistory.getOrDefault(userId, List.of()),
 *     "conversation.load");
 * </pre>
 *
 * <h2>Concurrency</h2>
 * <p>Circuit state and health metrics share one {@link ReentrantLock}; statistics are
 * atomic counters. Store I/O, retry backoff and pool construction never run under
 * that lock.</p>
 *
 * @param <C> the store client type handed to operations
 */
public class StoreConnectionManager<C> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StoreConnectionManager.class);

    static final String DEFAULT_OPERATION_NAME = "store_operation";
    private static final String GET_CLIENT_OPERATION = "getClient";

    private final StoreConfig config;
    private final PooledClientHandle<C> handle;
    private final CircuitBreaker circuitBreaker;
    private final RetryExecutor retryExecutor;
    private final StoreErrorClassifier classifier;
    private final ConnectionStatistics statistics;
    private final HealthMetrics healthMetrics;
    private final MetricsService metricsService;
    private final Clock clock;
    private final HealthCheckRegistry healthCheckRegistry;
    private final HealthMonitor healthMonitor;
    private final Thread shutdownHook;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile boolean healthy;

    private StoreConnectionManager(Builder<C> builder) {
        this.config = builder.config;
        this.clock = builder.clock;
        this.classifier = builder.errorClassifier != null
                ? builder.errorClassifier : new StoreErrorClassifier();
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        BackoffPolicy backoffPolicy = builder.backoffPolicy != null
                ? builder.backoffPolicy : BackoffPolicy.defaults();

        ReentrantLock stateLock = new ReentrantLock();
        this.statistics = new ConnectionStatistics();
        this.healthMetrics = new HealthMetrics(stateLock);
        this.circuitBreaker = new CircuitBreaker(config.getFailureThreshold(), config.getRecoveryTimeout(),
                statistics, metricsService, clock, stateLock);
        this.retryExecutor = new RetryExecutor(config.getMaxRetryAttempts(), backoffPolicy, classifier,
                statistics, metricsService, builder.sleeper);
        this.handle = new PooledClientHandle<>(builder.poolFactory, config);

        this.healthCheckRegistry = new HealthCheckRegistry();
        healthCheckRegistry.register(new StoreHealthCheck(this::healthCheck));
        healthCheckRegistry.register(new ConnectionPoolHealthCheck(handle));
        healthCheckRegistry.register(new CircuitBreakerHealthCheck(circuitBreaker));

        log.info("Initializing store connection manager: {}", config);
        initializePool(false);

        if (config.isEnableHealthMonitoring()) {
            this.healthMonitor = new HealthMonitor(this::healthCheck, circuitBreaker, healthMetrics,
                    config.getHealthCheckInterval());
            healthMonitor.start();
        } else {
            this.healthMonitor = null;
        }

        if (builder.registerShutdownHook) {
            this.shutdownHook = new Thread(this::close, "store-connection-shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);
        } else {
            this.shutdownHook = null;
        }
    }

    // ========== Client Access ==========

    /**
     * Returns the shared store client, or empty when the circuit is open (fail fast,
     * no store I/O), the pool cannot be established, or the manager is closed.
     * Lazily re-establishes the pool when none is live.
     */
    public Optional<C> getClient() {
        return Optional.ofNullable(acquireClient(GET_CLIENT_OPERATION).client());
    }

    // ========== Guarded Execution ==========

    /**
     * Runs the operation with retries and falls back on transient failure.
     *
     * @see #executeWithFallback(StoreOperation, Supplier, String, boolean)
     */
    public <T> T executeWithFallback(StoreOperation<C, T> operation, Supplier<T> fallback, String operationName) {
        return executeWithFallback(operation, fallback, operationName, true);
    }

    /**
     * Runs an operation against the store, answering from the fallback when the store
     * cannot.
     *
     * <ul>
     *   <li>No client available: the fallback result is returned (null without fallback).</li>
     *   <li>Success: recorded into the circuit breaker; the result is returned.</li>
     *   <li>Transient failure (after retries when {@code useRetry}): recorded into the
     *       circuit breaker; the fallback result is returned, or null without fallback.</li>
     *   <li>Non-transient failure: recorded in statistics and rethrown unchanged.</li>
     * </ul>
     *
     * @param operation     the unit of work, given the shared client
     * @param fallback      equivalent work against local state, may be null
     * @param operationName name used in logs and metrics
     * @param useRetry      whether transient failures are retried with backoff
     */
    public <T> T executeWithFallback(StoreOperation<C, T> operation, Supplier<T> fallback,
                                     String operationName, boolean useRetry) {
        Objects.requireNonNull(operation, "operation");
        String name = operationName != null ? operationName : DEFAULT_OPERATION_NAME;

        try (LogContext ctx = LogContext.forOperation(name)) {
            ClientLookup<C> lookup = acquireClient(name);
            C client = lookup.client();
            if (client == null) {
                log.warn("Store unavailable for '{}', using fallback", name);
                return useFallback(fallback, name, !lookup.failedFast());
            }

            long start = System.nanoTime();
            try {
                T result = useRetry
                        ? retryExecutor.execute(() -> operation.execute(client), name)
                        : operation.execute(client);
                circuitBreaker.recordSuccess();
                healthMetrics.recordSuccess();
                metricsService.recordOperation(name, true, elapsedSince(start));
                return result;
            } catch (RuntimeException e) {
                metricsService.recordOperation(name, false, elapsedSince(start));
                String message = describe(e);

                if (classifier.classify(e) == ErrorCategory.NON_TRANSIENT) {
                    statistics.recordFailedRequest(message);
                    log.error("Non-transient error in store operation '{}': {}", name, message);
                    throw e;
                }

                log.error("Store operation '{}' failed: {}", name, message);
                circuitBreaker.recordFailure(message);
                healthMetrics.recordFailure();
                return useFallback(fallback, name, true);
            }
        }
    }

    /**
     * Runs the operation with retries and no fallback: a transient failure yields null.
     */
    public <T> T execute(StoreOperation<C, T> operation, String operationName) {
        return executeWithFallback(operation, null, operationName, true);
    }

    /**
     * Wraps an operation and its fallback into a reusable guarded call.
     */
    public <T> Supplier<T> guard(StoreOperation<C, T> operation, Supplier<T> fallback, String operationName) {
        Objects.requireNonNull(operation, "operation");
        return () -> executeWithFallback(operation, fallback, operationName);
    }

    /**
     * Wraps an operation into a reusable guarded call answering {@code fallbackValue}
     * whenever the store cannot.
     */
    public <T> Supplier<T> guardOrDefault(StoreOperation<C, T> operation, T fallbackValue, String operationName) {
        return guard(operation, () -> fallbackValue, operationName);
    }

    // ========== Health ==========

    /**
     * Synchronous liveness probe of the store, independent of caller operations.
     * Establishes the pool if none is live. Feeds the result into the circuit breaker
     * and health metrics.
     *
     * @return UP when the store answered and the circuit is closed, DEGRADED when it
     *         answered while the circuit is still open or half-open, DOWN otherwise
     */
    public HealthStatus healthCheck() {
        try (LogContext ctx = LogContext.forHealthCheck()) {
            Instant timestamp = clock.instant();
            statistics.recordRequest();
            statistics.recordHealthCheck(timestamp);

            if (closed.get()) {
                return describeHealth(HealthStatus.down("Connection manager closed"), timestamp, false, null, null);
            }

            long start = System.nanoTime();
            boolean pingSuccessful;
            String pingError = null;
            Optional<StoreConnectionPool<C>> current = handle.current();

            if (current.isEmpty()) {
                // pool initialization includes its own liveness probe and records its own failure
                pingSuccessful = initializePool(false) != null;
                if (pingSuccessful) {
                    circuitBreaker.recordSuccess();
                    healthMetrics.recordSuccess();
                } else {
                    pingError = statistics.getLastError();
                }
            } else {
                try {
                    pingSuccessful = current.get().ping();
                    if (!pingSuccessful) {
                        pingError = "Unexpected reply to liveness probe";
                    }
                } catch (RuntimeException e) {
                    pingSuccessful = false;
                    pingError = describe(e);
                }
                healthy = pingSuccessful;
                if (pingSuccessful) {
                    circuitBreaker.recordSuccess();
                    healthMetrics.recordSuccess();
                } else {
                    log.error("Health check ping failed: {}", pingError);
                    circuitBreaker.recordFailure(pingError);
                    healthMetrics.recordFailure();
                }
            }

            Duration latency = elapsedSince(start);
            metricsService.recordHealthProbe(pingSuccessful, latency);

            HealthStatus base;
            CircuitState state = circuitBreaker.getState();
            if (!pingSuccessful) {
                base = HealthStatus.down("Store unreachable: " + pingError);
            } else if (state == CircuitState.CLOSED) {
                base = HealthStatus.up();
            } else {
                base = HealthStatus.degraded("Store reachable, circuit " + state);
            }
            return describeHealth(base, timestamp, pingSuccessful, pingError, latency);
        }
    }

    /**
     * Aggregate health of the store probe, the connection pool and the circuit breaker.
     */
    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    public HealthCheckRegistry getHealthCheckRegistry() {
        return healthCheckRegistry;
    }

    // ========== Statistics ==========

    public StatisticsSnapshot getStatistics() {
        StatisticsSnapshot.HealthMonitoring monitoring = new StatisticsSnapshot.HealthMonitoring(
                config.isEnableHealthMonitoring(),
                isHealthMonitorRunning(),
                config.getHealthCheckInterval(),
                statistics.getLastHealthCheck(),
                healthMetrics.getConsecutiveFailures(),
                healthMetrics.getConsecutiveSuccesses(),
                healthMetrics.getAverageResponseTime(),
                healthMetrics.getLastResponseTime());

        StatisticsSnapshot.Retry retry = new StatisticsSnapshot.Retry(
                retryExecutor.getMaxAttempts(),
                statistics.getRetryAttempts(),
                statistics.getRetrySuccesses(),
                statistics.retrySuccessRate());

        return new StatisticsSnapshot(
                statistics.getTotalRequests(),
                statistics.getSuccessfulRequests(),
                statistics.getFailedRequests(),
                statistics.getCircuitOpens(),
                statistics.getCircuitCloses(),
                statistics.getFallbackActivations(),
                statistics.getHealthCheckCount(),
                statistics.getLastError(),
                statistics.getLastHealthCheck(),
                circuitBreaker.getState(),
                circuitBreaker.getFailureCount(),
                healthy,
                statistics.successRate(),
                poolStatsOrNull(),
                monitoring,
                retry);
    }

    // ========== Administration ==========

    /**
     * Operator override: forces the circuit CLOSED and rebuilds the connection pool.
     */
    public void resetCircuit() {
        circuitBreaker.manualReset();
        if (closed.get()) {
            return;
        }
        initializePool(true);
    }

    public CircuitState getCircuitState() {
        return circuitBreaker.getState();
    }

    public int getFailureCount() {
        return circuitBreaker.getFailureCount();
    }

    public boolean isHealthy() {
        return healthy;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public boolean isHealthMonitorRunning() {
        return healthMonitor != null && healthMonitor.isRunning();
    }

    public StoreConfig getConfig() {
        return config;
    }

    /**
     * Stops the health monitor (bounded wait), releases the pool and marks the manager
     * unhealthy. Safe to call more than once.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Closing store connection manager for {}", config.redactedAddress());
        if (healthMonitor != null) {
            healthMonitor.stop();
        }
        handle.close();
        healthy = false;
        removeShutdownHook();
    }

    // ========== Internals ==========

    private ClientLookup<C> acquireClient(String operationName) {
        statistics.recordRequest();

        if (closed.get()) {
            return ClientLookup.unavailable();
        }

        if (!circuitBreaker.allowRequest()) {
            statistics.recordFallbackActivation();
            metricsService.recordFallback(operationName);
            log.debug("Circuit open, failing fast for '{}'", operationName);
            return ClientLookup.failFast();
        }

        Optional<StoreConnectionPool<C>> current = handle.current();
        if (current.isPresent()) {
            return ClientLookup.of(current.get().client());
        }

        StoreConnectionPool<C> pool = initializePool(false);
        return pool != null ? ClientLookup.of(pool.client()) : ClientLookup.unavailable();
    }

    private StoreConnectionPool<C> initializePool(boolean fresh) {
        try {
            StoreConnectionPool<C> pool = fresh ? handle.reinitialize() : handle.initialize();
            healthy = true;
            return pool;
        } catch (StoreInitializationException e) {
            healthy = false;
            log.error("Failed to initialize store connection: {}", e.getMessage());
            circuitBreaker.recordFailure(e.getMessage());
            healthMetrics.recordFailure();
            return null;
        }
    }

    private <T> T useFallback(Supplier<T> fallback, String operationName, boolean countActivation) {
        if (fallback == null) {
            return null;
        }
        if (countActivation) {
            statistics.recordFallbackActivation();
            metricsService.recordFallback(operationName);
        }
        log.info("Using fallback for '{}'", operationName);
        return fallback.get();
    }

    private HealthStatus describeHealth(HealthStatus base, Instant timestamp, boolean pingSuccessful,
                                        String pingError, Duration latency) {
        Instant lastFailure = circuitBreaker.getLastFailureTime();
        HealthStatus status = base
                .withDetail("circuitState", circuitBreaker.getState().name())
                .withDetail("failureCount", circuitBreaker.getFailureCount())
                .withDetail("lastFailureTime", lastFailure != null ? lastFailure.toString() : null)
                .withDetail("poolInitialized", handle.isInitialized())
                .withDetail("pingSuccessful", pingSuccessful)
                .withDetail("timestamp", timestamp.toString());
        if (latency != null) {
            status = status.withDetail("latencyMs", latency.toMillis());
        }
        if (pingError != null) {
            status = status.withDetail("pingError", pingError);
        }
        return status;
    }

    private com.store.connection.pool.PoolStats poolStatsOrNull() {
        try {
            return handle.getStats().orElse(null);
        } catch (RuntimeException e) {
            log.warn("Error reading connection pool stats: {}", e.getMessage());
            return null;
        }
    }

    private void removeShutdownHook() {
        if (shutdownHook == null || Thread.currentThread() == shutdownHook) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.debug("JVM shutdown in progress, shutdown hook left in place");
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private record ClientLookup<C>(C client, boolean failedFast) {

        static <C> ClientLookup<C> of(C client) {
            return new ClientLookup<>(client, false);
        }

        static <C> ClientLookup<C> unavailable() {
            return new ClientLookup<>(null, false);
        }

        static <C> ClientLookup<C> failFast() {
            return new ClientLookup<>(null, true);
        }
    }

    // ========== Construction ==========

    public static <C> Builder<C> builder(StoreConnectionPoolFactory<C> poolFactory) {
        return new Builder<>(poolFactory);
    }

    /**
     * Builds a manager over a Jedis connection pool with default collaborators.
     */
    public static StoreConnectionManager<UnifiedJedis> jedis(StoreConfig config) {
        return StoreConnectionManager.<UnifiedJedis>builder(JedisStoreConnectionPool::new)
                .config(config)
                .build();
    }

    public static class Builder<C> {
        private final StoreConnectionPoolFactory<C> poolFactory;
        private StoreConfig config = StoreConfig.defaults();
        private MetricsService metricsService;
        private BackoffPolicy backoffPolicy;
        private StoreErrorClassifier errorClassifier;
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = Sleeper.THREAD;
        private boolean registerShutdownHook = true;

        private Builder(StoreConnectionPoolFactory<C> poolFactory) {
            this.poolFactory = Objects.requireNonNull(poolFactory, "poolFactory");
        }

        public Builder<C> config(StoreConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /**
         * Sets a metrics service. Defaults to {@link NoOpMetricsService}.
         */
        public Builder<C> metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Sets the retry backoff. Defaults to {@link BackoffPolicy#defaults()}.
         */
        public Builder<C> backoffPolicy(BackoffPolicy backoffPolicy) {
            this.backoffPolicy = backoffPolicy;
            return this;
        }

        public Builder<C> errorClassifier(StoreErrorClassifier errorClassifier) {
            this.errorClassifier = errorClassifier;
            return this;
        }

        public Builder<C> clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder<C> sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
            return this;
        }

        /**
         * Controls whether {@link #close()} is registered as a JVM shutdown hook. Defaults to true.
         */
        public Builder<C> registerShutdownHook(boolean registerShutdownHook) {
            this.registerShutdownHook = registerShutdownHook;
            return this;
        }

        public StoreConnectionManager<C> build() {
            return new StoreConnectionManager<>(this);
        }
    }
}
