package com.store.connection.health;

import com.store.connection.circuit.CircuitBreaker;
import com.store.connection.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Background loop that periodically probes the store and nudges the circuit breaker
 * toward recovery.
 *
 * <p>Each cycle times the {@link HealthProbe}, records the duration into
 * {@link HealthMetrics}, and when the store answered while the circuit is OPEN and
 * past its recovery timeout, moves the circuit to HALF_OPEN so a silent recovery does
 * not wait for the next caller. The wait between cycles is a latch, so {@link #stop()}
 * wakes the loop immediately; shutdown is bounded by the join timeout.</p>
 */
public class HealthMonitor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    public static final Duration DEFAULT_JOIN_TIMEOUT = Duration.ofSeconds(5);
    static final String THREAD_NAME = "store-health-monitor";

    private final HealthProbe probe;
    private final CircuitBreaker circuitBreaker;
    private final HealthMetrics healthMetrics;
    private final Duration interval;
    private final Duration joinTimeout;
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    private ExecutorService executor;
    private Future<?> task;
    private volatile boolean lastReachable = true;

    public HealthMonitor(HealthProbe probe, CircuitBreaker circuitBreaker, HealthMetrics healthMetrics,
                         Duration interval) {
        this(probe, circuitBreaker, healthMetrics, interval, DEFAULT_JOIN_TIMEOUT);
    }

    public HealthMonitor(HealthProbe probe, CircuitBreaker circuitBreaker, HealthMetrics healthMetrics,
                         Duration interval, Duration joinTimeout) {
        this.probe = Objects.requireNonNull(probe, "probe");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker");
        this.healthMetrics = Objects.requireNonNull(healthMetrics, "healthMetrics");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.joinTimeout = Objects.requireNonNull(joinTimeout, "joinTimeout");
    }

    /**
     * Starts the loop on a dedicated daemon thread. A monitor runs at most once.
     */
    public synchronized void start() {
        if (task != null) {
            log.warn("Health monitor already started");
            return;
        }
        executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, THREAD_NAME);
            thread.setDaemon(true);
            return thread;
        });
        task = executor.submit(this::loop);
        log.info("Started store health monitor (interval: {}s)", interval.toSeconds());
    }

    /**
     * Signals the loop to stop and waits up to the join timeout for it to exit.
     */
    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        log.info("Stopping store health monitor");
        stopSignal.countDown();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(joinTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Health monitor did not stop within {} ms, interrupting", joinTimeout.toMillis());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        executor = null;
    }

    public boolean isRunning() {
        Future<?> current = task;
        return current != null && !current.isDone();
    }

    public Duration getInterval() {
        return interval;
    }

    @Override
    public void close() {
        stop();
    }

    private void loop() {
        while (stopSignal.getCount() > 0) {
            runCycle();
            try {
                if (stopSignal.await(interval.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.debug("Store health monitor loop exited");
    }

    /**
     * One probe cycle. Exceptions are logged and never end the loop.
     */
    void runCycle() {
        try (LogContext ctx = LogContext.forHealthCheck()) {
            long start = System.nanoTime();
            HealthStatus status = probe.probe();
            healthMetrics.recordResponseTime(Duration.ofNanos(System.nanoTime() - start));

            boolean reachable = status.isReachable();
            if (reachable && !lastReachable) {
                log.info("Store connection recovered, health check successful");
            } else if (!reachable && lastReachable) {
                log.warn("Store connection degraded, health check failed: {}", status.message());
            }
            lastReachable = reachable;

            if (reachable && circuitBreaker.isOpen() && circuitBreaker.shouldAttemptReset()) {
                log.info("Auto-recovering circuit breaker based on health check");
                circuitBreaker.attemptReset();
            }
        } catch (RuntimeException e) {
            log.error("Error in store health monitor cycle", e);
        }
    }
}
