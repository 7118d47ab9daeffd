package com.store.connection.retry;

import com.store.connection.error.StoreErrorClassifier;
import com.store.connection.metrics.MetricsService;
import com.store.connection.stats.ConnectionStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs a unit of work with bounded retries on transient store errors.
 *
 * <p>Every attempt is counted. Transient failures are retried after the
 * {@link BackoffPolicy} delay until {@code maxAttempts} is reached, at which point the
 * last failure is rethrown. Non-transient failures are rethrown immediately.
 * No lock is held while sleeping; fallback decisions belong to the caller.</p>
 */
public class RetryExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final int maxAttempts;
    private final BackoffPolicy backoffPolicy;
    private final StoreErrorClassifier classifier;
    private final ConnectionStatistics statistics;
    private final MetricsService metricsService;
    private final Sleeper sleeper;

    public RetryExecutor(int maxAttempts, BackoffPolicy backoffPolicy, StoreErrorClassifier classifier,
                         ConnectionStatistics statistics, MetricsService metricsService, Sleeper sleeper) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        this.maxAttempts = maxAttempts;
        this.backoffPolicy = Objects.requireNonNull(backoffPolicy, "backoffPolicy");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.statistics = Objects.requireNonNull(statistics, "statistics");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public <T> T execute(Supplier<T> operation, String operationName) {
        RuntimeException lastError = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            statistics.recordRetryAttempt();
            metricsService.recordRetryAttempt(operationName);
            try {
                T result = operation.get();
                if (attempt > 0) {
                    statistics.recordRetrySuccess();
                    log.info("Store operation '{}' succeeded after {} attempts", operationName, attempt + 1);
                }
                return result;
            } catch (RuntimeException e) {
                if (!classifier.isTransient(e)) {
                    log.debug("Non-retryable error in store operation '{}': {}", operationName, e.toString());
                    throw e;
                }
                lastError = e;

                if (attempt == maxAttempts - 1) {
                    log.error("Store operation '{}' failed after {} attempts: {}",
                            operationName, maxAttempts, e.getMessage());
                    break;
                }

                Duration delay = backoffPolicy.delay(attempt);
                log.warn("Store operation '{}' failed (attempt {}/{}), retrying in {} ms: {}",
                        operationName, attempt + 1, maxAttempts, delay.toMillis(), e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while backing off store operation '{}'", operationName);
                    break;
                }
            }
        }

        throw lastError;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public BackoffPolicy getBackoffPolicy() {
        return backoffPolicy;
    }
}
