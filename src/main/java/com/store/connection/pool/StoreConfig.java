package com.store.connection.pool;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable configuration for a store connection manager and its pool.
 */
public class StoreConfig {

    public static final String DEFAULT_ADDRESS = "redis://localhost:6379/0";

    private final String storeAddress;
    private final int maxConnections;
    private final Duration connectTimeout;
    private final Duration socketTimeout;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int maxRetryAttempts;
    private final Duration healthCheckInterval;
    private final boolean enableHealthMonitoring;

    private StoreConfig(Builder builder) {
        this.storeAddress = builder.storeAddress;
        this.maxConnections = builder.maxConnections;
        this.connectTimeout = builder.connectTimeout;
        this.socketTimeout = builder.socketTimeout;
        this.failureThreshold = builder.failureThreshold;
        this.recoveryTimeout = builder.recoveryTimeout;
        this.maxRetryAttempts = builder.maxRetryAttempts;
        this.healthCheckInterval = builder.healthCheckInterval;
        this.enableHealthMonitoring = builder.enableHealthMonitoring;
    }

    public String getStoreAddress() { return storeAddress; }
    public int getMaxConnections() { return maxConnections; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public Duration getSocketTimeout() { return socketTimeout; }
    public int getFailureThreshold() { return failureThreshold; }
    public Duration getRecoveryTimeout() { return recoveryTimeout; }
    public int getMaxRetryAttempts() { return maxRetryAttempts; }
    public Duration getHealthCheckInterval() { return healthCheckInterval; }
    public boolean isEnableHealthMonitoring() { return enableHealthMonitoring; }

    public static StoreConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .storeAddress(storeAddress)
                .maxConnections(maxConnections)
                .connectTimeout(connectTimeout)
                .socketTimeout(socketTimeout)
                .failureThreshold(failureThreshold)
                .recoveryTimeout(recoveryTimeout)
                .maxRetryAttempts(maxRetryAttempts)
                .healthCheckInterval(healthCheckInterval)
                .enableHealthMonitoring(enableHealthMonitoring);
    }

    public static class Builder {
        private String storeAddress = DEFAULT_ADDRESS;
        private int maxConnections = 50;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration socketTimeout = Duration.ofSeconds(5);
        private int failureThreshold = 5;
        private Duration recoveryTimeout = Duration.ofSeconds(60);
        private int maxRetryAttempts = 3;
        private Duration healthCheckInterval = Duration.ofSeconds(30);
        private boolean enableHealthMonitoring = true;

        public Builder storeAddress(String storeAddress) {
            if (storeAddress == null || storeAddress.isBlank()) {
                throw new IllegalArgumentException("storeAddress must not be blank");
            }
            this.storeAddress = storeAddress;
            return this;
        }

        public Builder maxConnections(int maxConnections) {
            if (maxConnections <= 0) throw new IllegalArgumentException("maxConnections must be > 0");
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = positive(connectTimeout, "connectTimeout");
            return this;
        }

        public Builder socketTimeout(Duration socketTimeout) {
            this.socketTimeout = positive(socketTimeout, "socketTimeout");
            return this;
        }

        public Builder failureThreshold(int failureThreshold) {
            if (failureThreshold <= 0) throw new IllegalArgumentException("failureThreshold must be > 0");
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Builder recoveryTimeout(Duration recoveryTimeout) {
            Objects.requireNonNull(recoveryTimeout, "recoveryTimeout");
            if (recoveryTimeout.isNegative()) throw new IllegalArgumentException("recoveryTimeout must be >= 0");
            this.recoveryTimeout = recoveryTimeout;
            return this;
        }

        public Builder maxRetryAttempts(int maxRetryAttempts) {
            if (maxRetryAttempts <= 0) throw new IllegalArgumentException("maxRetryAttempts must be > 0");
            this.maxRetryAttempts = maxRetryAttempts;
            return this;
        }

        public Builder healthCheckInterval(Duration healthCheckInterval) {
            this.healthCheckInterval = positive(healthCheckInterval, "healthCheckInterval");
            return this;
        }

        public Builder enableHealthMonitoring(boolean enableHealthMonitoring) {
            this.enableHealthMonitoring = enableHealthMonitoring;
            return this;
        }

        public StoreConfig build() {
            URI uri;
            try {
                uri = URI.create(storeAddress);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid storeAddress: " + storeAddress, e);
            }
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("storeAddress must look like redis://host:port/db, got: "
                        + storeAddress);
            }
            return new StoreConfig(this);
        }

        private static Duration positive(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be > 0");
            }
            return value;
        }
    }

    @Override
    public String toString() {
        return "StoreConfig{" +
                "storeAddress='" + redactedAddress() + '\'' +
                ", maxConnections=" + maxConnections +
                ", connectTimeout=" + connectTimeout +
                ", socketTimeout=" + socketTimeout +
                ", failureThreshold=" + failureThreshold +
                ", recoveryTimeout=" + recoveryTimeout +
                ", maxRetryAttempts=" + maxRetryAttempts +
                ", healthCheckInterval=" + healthCheckInterval +
                ", enableHealthMonitoring=" + enableHealthMonitoring +
                '}';
    }

    /**
     * Address with any credentials masked, for logs.
     */
    public String redactedAddress() {
        URI uri = URI.create(storeAddress);
        if (uri.getUserInfo() == null) {
            return storeAddress;
        }
        return storeAddress.replace(uri.getRawUserInfo() + "@", "***@");
    }
}
