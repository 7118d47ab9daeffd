package com.store.connection.api;

import com.store.connection.circuit.CircuitState;
import com.store.connection.health.HealthStatus;
import com.store.connection.metrics.MetricsService;
import com.store.connection.pool.PoolStats;
import com.store.connection.pool.StoreConfig;
import com.store.connection.pool.StoreConnectionPool;
import com.store.connection.pool.StoreConnectionPoolFactory;
import com.store.connection.retry.BackoffPolicy;
import com.store.connection.stats.StatisticsSnapshot;
import com.store.connection.support.MutableClock;
import com.store.connection.support.RecordingSleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.exceptions.JedisDataException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Store Connection Manager Tests")
class StoreConnectionManagerTest {

    /** Stand-in for a store client such as a Jedis instance. */
    interface KeyValueClient {
        String get(String key);
    }

    private MutableClock clock;
    private RecordingSleeper sleeper;
    private KeyValueClient client;
    private StoreConnectionPool<KeyValueClient> pool;
    private AtomicInteger poolsCreated;
    private final List<StoreConnectionManager<KeyValueClient>> managers = new ArrayList<>();

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        clock = new MutableClock();
        sleeper = new RecordingSleeper();
        client = mock(KeyValueClient.class);
        pool = mock(StoreConnectionPool.class);
        when(pool.client()).thenReturn(client);
        when(pool.ping()).thenReturn(true);
        when(pool.getStats()).thenReturn(new PoolStats(50, 2, 1, 1, 10, 9, 2));
        poolsCreated = new AtomicInteger();
    }

    @AfterEach
    void tearDown() {
        managers.forEach(StoreConnectionManager::close);
    }

    private StoreConfig.Builder config() {
        return StoreConfig.builder()
                .failureThreshold(3)
                .recoveryTimeout(Duration.ofSeconds(60))
                .maxRetryAttempts(1)
                .enableHealthMonitoring(false);
    }

    private StoreConnectionManager<KeyValueClient> manager(StoreConfig config) {
        return manager(config, cfg -> {
            poolsCreated.incrementAndGet();
            return pool;
        }, null);
    }

    private StoreConnectionManager<KeyValueClient> manager(StoreConfig config,
                                                           StoreConnectionPoolFactory<KeyValueClient> factory,
                                                           MetricsService metrics) {
        StoreConnectionManager.Builder<KeyValueClient> builder = StoreConnectionManager.builder(factory)
                .config(config)
                .clock(clock)
                .sleeper(sleeper)
                .backoffPolicy(BackoffPolicy.builder().jitterEnabled(false).build())
                .registerShutdownHook(false);
        if (metrics != null) {
            builder.metricsService(metrics);
        }
        StoreConnectionManager<KeyValueClient> manager = builder.build();
        managers.add(manager);
        return manager;
    }

    private static String failingGet(KeyValueClient c) {
        throw new JedisConnectionException("Connection refused");
    }

    private void tripCircuit(StoreConnectionManager<KeyValueClient> manager, int failures) {
        for (int i = 0; i < failures; i++) {
            manager.executeWithFallback(StoreConnectionManagerTest::failingGet, () -> "local", "get");
        }
    }

    @Nested
    @DisplayName("Circuit behavior")
    class CircuitBehavior {

        @Test
        @DisplayName("should open exactly at the failure threshold")
        void opensAtThreshold() {
            StoreConnectionManager<KeyValueClient> manager = manager(config().build());

            tripCircuit(manager, 2);
            assertEquals(CircuitState.CLOSED, manager.getCircuitState());

            tripCircuit(manager, 1);
            assertEquals(CircuitState.OPEN, manager.getCircuitState());
            assertEquals(1, manager.getStatistics().circuitOpens());
        }

        @Test
        @DisplayName("open circuit should fail fast without touching the store")
        void failsFastWhenOpen() {
            StoreConnectionManager<KeyValueClient> manager = manager(config().build());
            tripCircuit(manager, 3);
            clearInvocations(pool, client);

            assertTrue(manager.getClient().isEmpty());
            String result = manager.executeWithFallback(c -> c.get("k"), () -> "local", "get");

            assertEquals("local", result);
            verifyNoInteractions(pool, client);
        }

        @Test
        @DisplayName("open circuit should answer from the fallback without invoking the operation")
        void fallbackWithoutOperation() {
            StoreConnectionManager<KeyValueClient> manager = manager(config().build());
            tripCircuit(manager, 3);
            long fallbacksBefore = manager.getStatistics().fallbackActivations();
            AtomicBoolean invoked = new AtomicBoolean();

            String result = manager.executeWithFallback(c -> {
                invoked.set(true);
                return "remote";
            }, () -> "local", "get");

            assertEquals("local", result);
            assertFalse(invoked.get());
            assertEquals(fallbacksBefore + 1, manager.getStatistics().fallbackActivations());
        }

        @Test
        @DisplayName("a fail-fast fallback should be counted once in metrics")
        void failFastCountedOnce() {
            MetricsService metrics = mock(MetricsService.class);
            StoreConnectionManager<KeyValueClient> manager = manager(config().failureThreshold(1).build(),
                    cfg -> pool, metrics);
            tripCircuit(manager, 1);
            clearInvocations(metrics);

            manager.executeWithFallback(c -> c.get("k"), () -> "local", "get");

            verify(metrics, times(1)).recordFallback("get");
        }

        @Test
        @DisplayName("should recover through HALF_OPEN after the recovery timeout")
        void recovers() {
            StoreConnectionManager<KeyValueClient> manager = manager(config()
                    .failureThreshold(2)
                    .recoveryTimeout(Duration.ofSeconds(1))
                    .build());
            when(client.get("k")).thenReturn("remote");

            tripCircuit(manager, 2);
            assertEquals(CircuitState.OPEN, manager.getCircuitState());
            assertTrue(manager.getClient().isEmpty());

            clock.advance(Duration.ofMillis(1100));
            assertTrue(manager.getClient().isPresent());
            assertEquals(CircuitState.HALF_OPEN, manager.getCircuitState());

            assertEquals("remote", manager.executeWithFallback(c -> c.get("k"), () -> "local", "get"));
            assertEquals(CircuitState.CLOSED, manager.getCircuitState());
            assertEquals(0, manager.getFailureCount());
            assertEquals(1, manager.getStatistics().circuitCloses());
        }

        @Test
        @DisplayName("failed trial request should re-open the circuit")
        void halfOpenFailureReopens() {
            StoreConnectionManager<KeyValueClient> manager = manager(config()
                    .failureThreshold(2)
                    .recoveryTimeout(Duration.ofSeconds(1))
                    .build());
            tripCircuit(manager, 2);
            clock.advance(Duration.ofSeconds(2));

            tripCircuit(manager, 1);

            assertEquals(CircuitState.OPEN, manager.getCircuitState());
            assertEquals(1, manager.getStatistics().circuitOpens());
        }

        @Test
        @DisplayName("resetCircuit should close the circuit and rebuild the pool")
        void resetCircuit() {
            StoreConnectionManager<KeyValueClient> manager = manager(config().build());
            tripCircuit(manager, 3);

            manager.resetCircuit();

            assertEquals(CircuitState.CLOSED, manager.getCircuitState());
            assertEquals(0, manager.getFailureCount());
            assertEquals(2, poolsCreated.get());
            verify(pool).close();
            assertTrue(manager.isHealthy());
        }
    }

    @Nested
    @DisplayName("Guarded execution")
    class GuardedExecution {

        @Test
        @DisplayName("should retry transient failures and return the eventual result")
        void retriesThenSucceeds() {
            StoreConnectionManager<KeyValueClient> manager = manager(config().maxRetryAttempts(3).build());
            when(client.get("k"))
                    .thenThrow(new JedisConnectionException("reset"))
                    .thenThrow(new JedisConnectionException("reset"))
                    .thenReturn("remote");

            String result = manager.executeWithFallback(c -> c.get("k"), () -> "local", "get");

            assertEquals("remote", result);
            StatisticsSnapshot stats = manager.getStatistics();
            assertEquals(3, stats.retry().attempts());
            assertEquals(1, stats.retry().successes());
            assertEquals(0, stats.fallbackActivations());
            assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeper.delays());
            assertEquals(CircuitState.CLOSED, manager.getCircuitState());
        }

        @Test
        @DisplayName("useRetry=false should attempt the operation once")
        void withoutRetry() {
            StoreConnectionManager<KeyValueClient> manager = manager(config().maxRetryAttempts(3).build());
            when(client.get("k")).thenThrow(new JedisConnectionException("reset"));

            String result = manager.executeWithFallback(c -> c.get("k"), () -> "local", "get", false);

            assertEquals("local", result);
            verify(client, times(1)).get("k");
            assertTrue(sleeper.delays().isEmpty());
        }

        @Test
        @DisplayName("transient failure without fallback should return null")
        void noFallback() {
            StoreConnectionManager<KeyValueClient> manager = manager(config().build());

            assertNull(manager.execute(StoreConnectionManagerTest::failingGet, "get"));
            assertEquals(0, manager.getStatistics().fallbackActivations());
            assertEquals(1, manager.getFailureCount());
        }

        @Test
        @DisplayName("non-transient errors should propagate unchanged and not count toward the circuit")
        void nonTransientPropagates() {
            StoreConnectionManager<KeyValueClient> manager = manager(config().build());
            JedisDataException error = new JedisDataException("WRONGTYPE Operation against a key");
            when(client.get("k")).thenThrow(error);
            AtomicBoolean fallbackUsed = new AtomicBoolean();

            JedisDataException thrown = assertThrows(JedisDataException.class,
                    () -> manager.executeWithFallback(c -> c.get("k"), () -> {
                        fallbackUsed.set(true);
                        return "local";
                    }, "get"));

            assertSame(error, thrown);
            assertFalse(fallbackUsed.get());
            assertEquals(0, manager.getFailureCount());
            StatisticsSnapshot stats = manager.getStatistics();
            assertEquals(1, stats.failedRequests());
            assertEquals("WRONGTYPE Operation against a key", stats.lastError());
        }

        @Test
        @DisplayName("fallback exceptions should propagate")
        void fallbackExceptionPropagates() {
            StoreConnectionManager<KeyValueClient> manager = manager(config().build());

            assertThrows(IllegalStateException.class, () -> manager.executeWithFallback(
                    StoreConnectionManagerTest::failingGet,
                    () -> {
                        throw new IllegalStateException("no local state");
                    }, "get"));
        }

        @Test
        @DisplayName("guard should produce a reusable guarded call")
        void guard() {
            StoreConnectionManager<KeyValueClient> manager = manager(config().build());
            when(client.get("k")).thenReturn("remote").thenThrow(new JedisConnectionException("down"));

            Supplier<String> guarded = manager.guard(c -> c.get("k"), () -> "local", "get");
            Supplier<String> withDefault = manager.guardOrDefault(
                    StoreConnectionManagerTest::failingGet, "default", "get");

            assertEquals("remote", guarded.get());
            assertEquals("local", guarded.get());
            assertEquals("default", withDefault.get());
        }

        @Test
        @DisplayName("statistics should reflect every outcome")
        void statisticsAccuracy() {
            StoreConnectionManager<KeyValueClient> manager = manager(config().failureThreshold(5).build());
            when(client.get("k")).thenReturn("remote");

            for (int i = 0; i < 3; i++) {
                manager.executeWithFallback(c -> c.get("k"), () -> "local", "get", false);
            }
            for (int i = 0; i < 2; i++) {
                manager.executeWithFallback(StoreConnectionManagerTest::failingGet, () -> "local", "get", false);
            }

            StatisticsSnapshot stats = manager.getStatistics();
            assertEquals(5, stats.totalRequests());
            assertEquals(3, stats.successfulRequests());
            assertEquals(2, stats.failedRequests());
            assertEquals(2, stats.fallbackActivations());
            assertEquals(60.0, stats.successRate(), 0.0001);
            assertEquals(2, stats.failureCount());
            assertEquals("Connection refused", stats.lastError());
        }

        @Test
        @DisplayName("concurrent callers during an outage should all be answered by the fallback")
        void concurrentOutage() throws Exception {
            StoreConnectionManager<KeyValueClient> manager = manager(config().failureThreshold(5).build());
            when(client.get(anyString())).thenThrow(new JedisConnectionException("down"));

            int threads = 8;
            int callsPerThread = 50;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger fallbackAnswers = new AtomicInteger();
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < callsPerThread; i++) {
                        if ("local".equals(manager.executeWithFallback(c -> c.get("k"), () -> "local", "get"))) {
                            fallbackAnswers.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
            executor.shutdown();

            StatisticsSnapshot stats = manager.getStatistics();
            assertEquals(threads * callsPerThread, fallbackAnswers.get());
            assertEquals(threads * callsPerThread, stats.totalRequests());
            assertEquals(threads * callsPerThread, stats.fallbackActivations());
            assertEquals(1, stats.circuitOpens());
            assertEquals(CircuitState.OPEN, manager.getCircuitState());
        }
    }

    @Nested
    @DisplayName("Degraded start")
    class DegradedStart {

        @Test
        @DisplayName("unreachable store at startup should degrade to the fallback")
        void unreachableAtStartup() {
            StoreConnectionManager<KeyValueClient> manager = manager(config().failureThreshold(5).build(),
                    cfg -> {
                        throw new JedisConnectionException("Connection refused");
                    }, null);

            assertFalse(manager.isHealthy());
            assertTrue(manager.getClient().isEmpty());

            String result = manager.executeWithFallback(c -> c.get("k"), () -> "local", "get");

            assertEquals("local", result);
            assertEquals(1, manager.getStatistics().fallbackActivations());
            assertFalse(manager.getStatistics().poolInitialized());
        }

        @Test
        @DisplayName("pool should be established lazily once the store comes up")
        void lazyInitialization() {
            AtomicBoolean storeUp = new AtomicBoolean(false);
            StoreConnectionManager<KeyValueClient> manager = manager(config().failureThreshold(5).build(),
                    cfg -> {
                        if (!storeUp.get()) {
                            throw new JedisConnectionException("Connection refused");
                        }
                        return pool;
                    }, null);
            when(client.get("k")).thenReturn("remote");

            storeUp.set(true);

            assertEquals("remote", manager.executeWithFallback(c -> c.get("k"), () -> "local", "get"));
            assertTrue(manager.isHealthy());
        }
    }

    @Nested
    @DisplayName("Health")
    class Health {

        @Test
        @DisplayName("healthy store should report UP with details")
        void up() {
            StoreConnectionManager<KeyValueClient> manager = manager(config().build());

            HealthStatus status = manager.healthCheck();

            assertTrue(status.isUp());
            assertEquals("CLOSED", status.details().get("circuitState"));
            assertEquals(true, status.details().get("pingSuccessful"));
            assertEquals(true, status.details().get("poolInitialized"));
            assertTrue(status.details().containsKey("latencyMs"));
            assertEquals(clock.instant().toString(), status.details().get("timestamp"));

            StatisticsSnapshot stats = manager.getStatistics();
            assertEquals(1, stats.healthCheckCount());
            assertEquals(1, stats.totalRequests());
            assertEquals(clock.instant(), stats.lastHealthCheck());
        }

        @Test
        @DisplayName("failing ping should report DOWN and count toward the circuit")
        void down() {
            StoreConnectionManager<KeyValueClient> manager = manager(config().build());
            when(pool.ping()).thenThrow(new JedisConnectionException("Read timed out"));

            HealthStatus status = manager.healthCheck();

            assertTrue(status.isDown());
            assertEquals("Read timed out", status.details().get("pingError"));
            assertEquals(1, manager.getFailureCount());
            assertFalse(manager.isHealthy());
        }

        @Test
        @DisplayName("reachable store with an open circuit should report DEGRADED")
        void degraded() {
            StoreConnectionManager<KeyValueClient> manager = manager(config().build());
            tripCircuit(manager, 3);

            HealthStatus status = manager.healthCheck();

            assertTrue(status.isDegraded());
            assertEquals("OPEN", status.details().get("circuitState"));
        }

        @Test
        @DisplayName("health check should establish a missing pool")
        void initializesPool() {
            AtomicBoolean storeUp = new AtomicBoolean(false);
            StoreConnectionManager<KeyValueClient> manager = manager(config().build(), cfg -> {
                if (!storeUp.get()) {
                    throw new JedisConnectionException("Connection refused");
                }
                return pool;
            }, null);

            assertTrue(manager.healthCheck().isDown());

            storeUp.set(true);
            HealthStatus status = manager.healthCheck();

            assertTrue(status.isUp());
            assertEquals(true, status.details().get("poolInitialized"));
            assertTrue(manager.isHealthy());
        }

        @Test
        @DisplayName("aggregate health should include store, pool and circuit checks")
        void aggregate() {
            StoreConnectionManager<KeyValueClient> manager = manager(config().build());

            HealthStatus status = manager.health();

            assertTrue(status.isUp());
            assertTrue(status.details().containsKey("store"));
            assertTrue(status.details().containsKey("connectionPool"));
            assertTrue(status.details().containsKey("circuitBreaker"));
        }

        @Test
        @DisplayName("background monitor should run when enabled and stop on close")
        void monitorLifecycle() {
            StoreConnectionManager<KeyValueClient> manager = manager(config()
                    .enableHealthMonitoring(true)
                    .healthCheckInterval(Duration.ofHours(1))
                    .build());

            assertTrue(manager.isHealthMonitorRunning());
            assertTrue(manager.getStatistics().healthMonitoring().running());

            manager.close();

            assertFalse(manager.isHealthMonitorRunning());
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("close should be idempotent and release the pool once")
        void idempotentClose() {
            StoreConnectionManager<KeyValueClient> manager = manager(config().build());

            manager.close();
            manager.close();

            verify(pool, times(1)).close();
            assertTrue(manager.isClosed());
            assertFalse(manager.isHealthy());
            assertFalse(manager.isHealthMonitorRunning());
        }

        @Test
        @DisplayName("closed manager should answer from the fallback")
        void closedManager() {
            StoreConnectionManager<KeyValueClient> manager = manager(config().build());
            manager.close();

            assertTrue(manager.getClient().isEmpty());
            assertEquals("local", manager.executeWithFallback(c -> c.get("k"), () -> "local", "get"));
            assertTrue(manager.healthCheck().isDown());
            assertEquals(1, poolsCreated.get());
        }

        @Test
        @DisplayName("statistics snapshot should describe pool, retry and monitoring")
        void snapshot() {
            StoreConnectionManager<KeyValueClient> manager = manager(config().maxRetryAttempts(4).build());

            StatisticsSnapshot stats = manager.getStatistics();

            assertTrue(stats.poolInitialized());
            assertEquals(50, stats.pool().maxConnections());
            assertEquals(4, stats.retry().maxAttempts());
            assertEquals(0.0, stats.retry().successRate());
            assertFalse(stats.healthMonitoring().enabled());
            assertEquals(100.0, stats.successRate());
            assertEquals(CircuitState.CLOSED, stats.circuitState());
            assertTrue(stats.healthy());
        }
    }
}
