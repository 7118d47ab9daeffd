package com.store.connection.circuit;

import com.store.connection.metrics.MetricsService;
import com.store.connection.stats.ConnectionStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Circuit breaker for the backing store.
 *
 * <p>State machine:</p>
 * <pre>
 * CLOSED    --failures &gt;= threshold--------------&gt; OPEN
 * OPEN      --recovery timeout elapsed + access---&gt; HALF_OPEN
 * HALF_OPEN --success-----------------------------&gt; CLOSED
 * HALF_OPEN --failure-----------------------------&gt; OPEN
 * </pre>
 *
 * <p>All state lives behind a {@link ReentrantLock} that may be shared with other
 * manager state, so nested calls (e.g. {@link #allowRequest()} calling
 * {@link #attemptReset()}) re-enter safely. A success while CLOSED does not reset
 * the failure count; only a HALF_OPEN -&gt; CLOSED transition or
 * {@link #manualReset()} does.</p>
 */
public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final ConnectionStatistics statistics;
    private final MetricsService metricsService;
    private final Clock clock;
    private final ReentrantLock lock;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureTime;
    private Instant halfOpenStartedAt;

    public CircuitBreaker(int failureThreshold, Duration recoveryTimeout,
                          ConnectionStatistics statistics, MetricsService metricsService,
                          Clock clock, ReentrantLock lock) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be > 0");
        }
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = Objects.requireNonNull(recoveryTimeout, "recoveryTimeout");
        this.statistics = Objects.requireNonNull(statistics, "statistics");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lock = Objects.requireNonNull(lock, "lock");
    }

    /**
     * Records a store failure. Opens the circuit once the threshold is reached
     * while CLOSED; in any other state the failure only re-arms the timestamp.
     */
    public void recordFailure(String message) {
        lock.lock();
        try {
            failureCount++;
            lastFailureTime = clock.instant();
            statistics.recordFailedRequest(message);

            if (state == CircuitState.CLOSED && failureCount >= failureThreshold) {
                transitionTo(CircuitState.OPEN);
                statistics.recordCircuitOpen();
                log.warn("Circuit breaker opened after {} failures: {}", failureCount, message);
            } else if (state == CircuitState.HALF_OPEN) {
                transitionTo(CircuitState.OPEN);
                log.warn("Trial request failed, circuit breaker re-opened: {}", message);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a successful store call. Closes the circuit when HALF_OPEN.
     */
    public void recordSuccess() {
        lock.lock();
        try {
            statistics.recordSuccessfulRequest();
            if (state == CircuitState.HALF_OPEN) {
                transitionTo(CircuitState.CLOSED);
                failureCount = 0;
                halfOpenStartedAt = null;
                statistics.recordCircuitClose();
                log.info("Circuit breaker closed, store connection restored");
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isOpen() {
        lock.lock();
        try {
            return state == CircuitState.OPEN;
        } finally {
            lock.unlock();
        }
    }

    /**
     * True when the circuit is OPEN and the recovery timeout has elapsed since the
     * last failure (or no failure time was ever recorded).
     */
    public boolean shouldAttemptReset() {
        lock.lock();
        try {
            if (state != CircuitState.OPEN) {
                return false;
            }
            if (lastFailureTime == null) {
                return true;
            }
            Duration sinceFailure = Duration.between(lastFailureTime, clock.instant());
            return sinceFailure.compareTo(recoveryTimeout) >= 0;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves OPEN -&gt; HALF_OPEN if the recovery timeout has elapsed, otherwise does nothing.
     *
     * @return true if this call performed the transition
     */
    public boolean attemptReset() {
        lock.lock();
        try {
            if (!shouldAttemptReset()) {
                return false;
            }
            transitionTo(CircuitState.HALF_OPEN);
            halfOpenStartedAt = clock.instant();
            log.info("Circuit breaker moved to half-open state, testing connection");
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gate used by every access attempt: tries the OPEN -&gt; HALF_OPEN transition and
     * reports whether the caller may proceed to the store.
     */
    public boolean allowRequest() {
        lock.lock();
        try {
            if (state == CircuitState.OPEN) {
                attemptReset();
            }
            return state != CircuitState.OPEN;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Operator override: forces CLOSED and clears failure bookkeeping.
     */
    public void manualReset() {
        lock.lock();
        try {
            log.info("Manually resetting circuit breaker (state={}, failures={})", state, failureCount);
            if (state != CircuitState.CLOSED) {
                transitionTo(CircuitState.CLOSED);
            }
            failureCount = 0;
            lastFailureTime = null;
            halfOpenStartedAt = null;
        } finally {
            lock.unlock();
        }
    }

    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int getFailureCount() {
        lock.lock();
        try {
            return failureCount;
        } finally {
            lock.unlock();
        }
    }

    public Instant getLastFailureTime() {
        lock.lock();
        try {
            return lastFailureTime;
        } finally {
            lock.unlock();
        }
    }

    public Instant getHalfOpenStartedAt() {
        lock.lock();
        try {
            return halfOpenStartedAt;
        } finally {
            lock.unlock();
        }
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getRecoveryTimeout() {
        return recoveryTimeout;
    }

    // caller holds the lock
    private void transitionTo(CircuitState next) {
        CircuitState previous = state;
        state = next;
        metricsService.recordCircuitTransition(previous, next);
    }
}
