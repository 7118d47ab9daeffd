package com.store.connection.metrics;

import com.store.connection.circuit.CircuitState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Metrics Service Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("should accept every call without side effects")
        void noOp() {
            MetricsService metrics = new NoOpMetricsService();
            assertDoesNotThrow(() -> {
                metrics.recordOperation("get", true, Duration.ofMillis(1));
                metrics.recordFallback("get");
                metrics.recordCircuitTransition(CircuitState.CLOSED, CircuitState.OPEN);
                metrics.recordRetryAttempt("get");
                metrics.recordHealthProbe(false, Duration.ofMillis(1));
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private SimpleMeterRegistry registry;
        private MicrometerMetricsService metrics;

        @BeforeEach
        void setUp() {
            registry = new SimpleMeterRegistry();
            metrics = new MicrometerMetricsService(registry);
        }

        @Test
        @DisplayName("should time operations by name and outcome")
        void operationTimer() {
            metrics.recordOperation("conversation.load", true, Duration.ofMillis(5));
            metrics.recordOperation("conversation.load", true, Duration.ofMillis(15));
            metrics.recordOperation("conversation.load", false, Duration.ofMillis(1));

            Timer success = registry.find("store.operation.duration")
                    .tags("operation", "conversation.load", "outcome", "success").timer();
            Timer failure = registry.find("store.operation.duration")
                    .tags("operation", "conversation.load", "outcome", "failure").timer();

            assertNotNull(success);
            assertEquals(2, success.count());
            assertEquals(20, success.totalTime(TimeUnit.MILLISECONDS), 0.001);
            assertEquals(1, failure.count());
        }

        @Test
        @DisplayName("should count fallbacks and retries per operation")
        void counters() {
            metrics.recordFallback("get");
            metrics.recordFallback("get");
            metrics.recordRetryAttempt("get");

            Counter fallbacks = registry.find("store.fallback.activations").tag("operation", "get").counter();
            Counter retries = registry.find("store.retry.attempts").tag("operation", "get").counter();
            assertEquals(2.0, fallbacks.count());
            assertEquals(1.0, retries.count());
        }

        @Test
        @DisplayName("should count circuit transitions by from and to state")
        void transitions() {
            metrics.recordCircuitTransition(CircuitState.CLOSED, CircuitState.OPEN);
            metrics.recordCircuitTransition(CircuitState.OPEN, CircuitState.HALF_OPEN);
            metrics.recordCircuitTransition(CircuitState.CLOSED, CircuitState.OPEN);

            Counter opened = registry.find("store.circuit.transitions")
                    .tags("from", "CLOSED", "to", "OPEN").counter();
            assertEquals(2.0, opened.count());
        }

        @Test
        @DisplayName("should time health probes by outcome")
        void probes() {
            metrics.recordHealthProbe(true, Duration.ofMillis(2));
            metrics.recordHealthProbe(false, Duration.ofMillis(3));
            metrics.recordHealthProbe(false, Duration.ofMillis(3));

            assertEquals(1, registry.find("store.health.probe").tag("outcome", "success").timer().count());
            assertEquals(2, registry.find("store.health.probe").tag("outcome", "failure").timer().count());
        }
    }
}
