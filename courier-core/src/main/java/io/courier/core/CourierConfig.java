package io.courier.core;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/// Configuration options for a Courier mediator environment.
///
/// Controls which built-in behaviors {@link CourierFactory} registers and how they are
/// tuned. Use the {@link Builder} for fluent configuration, {@link #fromProperties(Properties)}
/// to read a properties source, or the setters for mutable configuration.
///
/// ### Default Values
/// - `performanceLoggingEnabled`: `true`
/// - `slowRequestThreshold`: `500 ms`
/// - `requestTimeout`: `null` (no timeout behavior)
/// - `validationEnabled`: `true` (only effective with a validator registry)
/// - `cachingEnabled`: `true` (only effective with a cache store)
/// - `cacheKeyPrefix`: `"Courier:Cache"`
/// - `notificationPoolSize`: `0` (notification handlers subscribed on the publishing thread)
///
/// ### Property Keys
/// | Key | Type |
/// |---|---|
/// | `courier.performance-logging.enabled` | boolean |
/// | `courier.performance-logging.slow-threshold-ms` | long, not negative |
/// | `courier.timeout.request-ms` | long, positive |
/// | `courier.validation.enabled` | boolean |
/// | `courier.caching.enabled` | boolean |
/// | `courier.cache.key-prefix` | string |
/// | `courier.notification.pool-size` | int, not negative |
///
/// @implNote **Not thread-safe**. Configure before passing to {@link CourierFactory} and do
/// not modify afterwards.
///
/// @see CourierFactory.Builder#config(CourierConfig)
public class CourierConfig {

    public static final String PERFORMANCE_LOGGING_ENABLED = "courier.performance-logging.enabled";
    public static final String SLOW_THRESHOLD_MS = "courier.performance-logging.slow-threshold-ms";
    public static final String REQUEST_TIMEOUT_MS = "courier.timeout.request-ms";
    public static final String VALIDATION_ENABLED = "courier.validation.enabled";
    public static final String CACHING_ENABLED = "courier.caching.enabled";
    public static final String CACHE_KEY_PREFIX = "courier.cache.key-prefix";
    public static final String NOTIFICATION_POOL_SIZE = "courier.notification.pool-size";

    private boolean performanceLoggingEnabled = true;
    private Duration slowRequestThreshold = Duration.ofMillis(500);
    private Duration requestTimeout;
    private boolean validationEnabled = true;
    private boolean cachingEnabled = true;
    private String cacheKeyPrefix = "Courier:Cache";
    private int notificationPoolSize = 0;

    /// Creates a configuration with default values.
    public CourierConfig() {}

    /// Reads a configuration from properties. Missing keys keep their defaults.
    ///
    /// @param properties the source, not null
    /// @return populated configuration, never null
    /// @throws IllegalArgumentException if a value cannot be parsed or is out of range
    public static CourierConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        CourierConfig config = new CourierConfig();

        String value = properties.getProperty(PERFORMANCE_LOGGING_ENABLED);
        if (value != null) {
            config.setPerformanceLoggingEnabled(parseBoolean(PERFORMANCE_LOGGING_ENABLED, value));
        }
        value = properties.getProperty(SLOW_THRESHOLD_MS);
        if (value != null) {
            long millis = parseLong(SLOW_THRESHOLD_MS, value);
            if (millis < 0) {
                throw invalid(SLOW_THRESHOLD_MS, value, "must not be negative");
            }
            config.setSlowRequestThreshold(Duration.ofMillis(millis));
        }
        value = properties.getProperty(REQUEST_TIMEOUT_MS);
        if (value != null) {
            long millis = parseLong(REQUEST_TIMEOUT_MS, value);
            if (millis <= 0) {
                throw invalid(REQUEST_TIMEOUT_MS, value, "must be positive");
            }
            config.setRequestTimeout(Duration.ofMillis(millis));
        }
        value = properties.getProperty(VALIDATION_ENABLED);
        if (value != null) {
            config.setValidationEnabled(parseBoolean(VALIDATION_ENABLED, value));
        }
        value = properties.getProperty(CACHING_ENABLED);
        if (value != null) {
            config.setCachingEnabled(parseBoolean(CACHING_ENABLED, value));
        }
        value = properties.getProperty(CACHE_KEY_PREFIX);
        if (value != null) {
            if (value.isBlank()) {
                throw invalid(CACHE_KEY_PREFIX, value, "must not be blank");
            }
            config.setCacheKeyPrefix(value.trim());
        }
        value = properties.getProperty(NOTIFICATION_POOL_SIZE);
        if (value != null) {
            long size = parseLong(NOTIFICATION_POOL_SIZE, value);
            if (size < 0 || size > Integer.MAX_VALUE) {
                throw invalid(NOTIFICATION_POOL_SIZE, value, "must be between 0 and 2147483647");
            }
            config.setNotificationPoolSize((int) size);
        }
        return config;
    }

    public boolean isPerformanceLoggingEnabled() {
        return performanceLoggingEnabled;
    }

    public void setPerformanceLoggingEnabled(boolean performanceLoggingEnabled) {
        this.performanceLoggingEnabled = performanceLoggingEnabled;
    }

    /// Returns the elapsed time at which a request is logged as slow.
    ///
    /// @return threshold, never null
    public Duration getSlowRequestThreshold() {
        return slowRequestThreshold;
    }

    public void setSlowRequestThreshold(Duration slowRequestThreshold) {
        this.slowRequestThreshold =
                Objects.requireNonNull(
                        slowRequestThreshold, "slowRequestThreshold must not be null");
    }

    /// Returns the per-request timeout.
    ///
    /// @return timeout, or null when no timeout behavior is registered
    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public boolean isValidationEnabled() {
        return validationEnabled;
    }

    public void setValidationEnabled(boolean validationEnabled) {
        this.validationEnabled = validationEnabled;
    }

    public boolean isCachingEnabled() {
        return cachingEnabled;
    }

    public void setCachingEnabled(boolean cachingEnabled) {
        this.cachingEnabled = cachingEnabled;
    }

    public String getCacheKeyPrefix() {
        return cacheKeyPrefix;
    }

    public void setCacheKeyPrefix(String cacheKeyPrefix) {
        this.cacheKeyPrefix =
                Objects.requireNonNull(cacheKeyPrefix, "cacheKeyPrefix must not be null");
    }

    /// Returns the size of the pool notification handlers are subscribed on.
    ///
    /// @return pool size, `0` when handlers are subscribed on the publishing thread
    public int getNotificationPoolSize() {
        return notificationPoolSize;
    }

    public void setNotificationPoolSize(int notificationPoolSize) {
        this.notificationPoolSize = notificationPoolSize;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    private static boolean parseBoolean(String key, String value) {
        String normalized = value.trim();
        if ("true".equalsIgnoreCase(normalized)) {
            return true;
        }
        if ("false".equalsIgnoreCase(normalized)) {
            return false;
        }
        throw invalid(key, value, "expected true or false");
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw invalid(key, value, "expected a whole number");
        }
    }

    private static IllegalArgumentException invalid(String key, String value, String reason) {
        return new IllegalArgumentException(
                "Invalid value '" + value + "' for " + key + ": " + reason);
    }

    /// Fluent builder for constructing {@link CourierConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final CourierConfig config = new CourierConfig();

        public Builder performanceLogging(boolean enabled) {
            config.performanceLoggingEnabled = enabled;
            return this;
        }

        /// Sets the slow-request threshold of the performance logging behavior.
        ///
        /// @param threshold elapsed time at which requests are logged as slow, not null
        /// @return this builder for chaining, never null
        public Builder slowRequestThreshold(Duration threshold) {
            config.setSlowRequestThreshold(threshold);
            return this;
        }

        /// Enables the timeout behavior.
        ///
        /// @param timeout maximum duration of a dispatch, or null to disable
        /// @return this builder for chaining, never null
        public Builder requestTimeout(Duration timeout) {
            config.requestTimeout = timeout;
            return this;
        }

        public Builder validation(boolean enabled) {
            config.validationEnabled = enabled;
            return this;
        }

        public Builder caching(boolean enabled) {
            config.cachingEnabled = enabled;
            return this;
        }

        public Builder cacheKeyPrefix(String prefix) {
            config.setCacheKeyPrefix(prefix);
            return this;
        }

        /// Sets the notification fan-out pool size.
        ///
        /// @param poolSize number of threads, `0` to subscribe on the publishing thread
        /// @return this builder for chaining, never null
        public Builder notificationPoolSize(int poolSize) {
            config.notificationPoolSize = poolSize;
            return this;
        }

        /// Builds and returns the configured {@link CourierConfig} instance.
        ///
        /// @return the configured instance, never null
        public CourierConfig build() {
            return config;
        }
    }
}
