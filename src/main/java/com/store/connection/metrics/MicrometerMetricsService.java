package com.store.connection.metrics;

import com.store.connection.circuit.CircuitState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code store.operation.duration}: Timer (tags: operation, outcome)</li>
 *   <li>{@code store.fallback.activations}: Counter (tag: operation)</li>
 *   <li>{@code store.circuit.transitions}: Counter (tags: from, to)</li>
 *   <li>{@code store.retry.attempts}: Counter (tag: operation)</li>
 *   <li>{@code store.health.probe}: Timer (tag: outcome)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private static final String SUCCESS = "success";
    private static final String FAILURE = "failure";

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer probeSuccessTimer;
    private final Timer probeFailureTimer;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.probeSuccessTimer = Timer.builder("store.health.probe")
                .description("Latency of store liveness probes")
                .tag("outcome", SUCCESS)
                .register(registry);
        this.probeFailureTimer = Timer.builder("store.health.probe")
                .description("Latency of store liveness probes")
                .tag("outcome", FAILURE)
                .register(registry);
    }

    @Override
    public void recordOperation(String operationName, boolean success, Duration duration) {
        String outcome = success ? SUCCESS : FAILURE;
        String key = operationName + ":" + outcome;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("store.operation.duration")
                        .description("Duration of store operations run through the connection manager")
                        .tag("operation", operationName)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordFallback(String operationName) {
        String key = "fallback:" + operationName;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("store.fallback.activations")
                        .description("Number of times the caller's fallback was used")
                        .tag("operation", operationName)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordCircuitTransition(CircuitState from, CircuitState to) {
        String key = "transition:" + from.name() + ":" + to.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("store.circuit.transitions")
                        .description("Circuit breaker state transitions")
                        .tag("from", from.name())
                        .tag("to", to.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordRetryAttempt(String operationName) {
        String key = "retry:" + operationName;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("store.retry.attempts")
                        .description("Number of store operation attempts made by the retry executor")
                        .tag("operation", operationName)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordHealthProbe(boolean success, Duration latency) {
        (success ? probeSuccessTimer : probeFailureTimer).record(latency);
    }
}
