package com.cajunsystems.mirepoix.runtime;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

public record RuntimeConfig(
        int computationThreads,
        Duration blockingKeepAlive,
        Duration shutdownTimeout,
        String threadNamePrefix
) {
    public static final String COMPUTATION_THREADS_PROPERTY = "mirepoix.computation.threads";
    public static final String BLOCKING_KEEP_ALIVE_PROPERTY = "mirepoix.blocking.keepAlive.ms";
    public static final String SHUTDOWN_TIMEOUT_PROPERTY = "mirepoix.shutdown.timeout.ms";
    public static final String THREAD_PREFIX_PROPERTY = "mirepoix.thread.prefix";

    public static final Duration DEFAULT_BLOCKING_KEEP_ALIVE = Duration.ofSeconds(60);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);
    public static final String DEFAULT_THREAD_PREFIX = "mirepoix";

    public RuntimeConfig {
        if (computationThreads < 1) {
            throw new IllegalArgumentException("computationThreads must be >= 1, was " + computationThreads);
        }
        Objects.requireNonNull(blockingKeepAlive, "blockingKeepAlive");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        Objects.requireNonNull(threadNamePrefix, "threadNamePrefix");
        if (blockingKeepAlive.isNegative() || shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("durations must not be negative");
        }
        if (threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix must not be blank");
        }
    }

    public static int defaultComputationThreads() {
        return Math.max(2, Runtime.getRuntime().availableProcessors());
    }

    public static RuntimeConfig defaults() {
        return new RuntimeConfig(
                defaultComputationThreads(),
                DEFAULT_BLOCKING_KEEP_ALIVE,
                DEFAULT_SHUTDOWN_TIMEOUT,
                DEFAULT_THREAD_PREFIX
        );
    }

    public static RuntimeConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    public static RuntimeConfig fromProperties(Properties properties) {
        return new RuntimeConfig(
                intProperty(properties, COMPUTATION_THREADS_PROPERTY, defaultComputationThreads()),
                millisProperty(properties, BLOCKING_KEEP_ALIVE_PROPERTY, DEFAULT_BLOCKING_KEEP_ALIVE),
                millisProperty(properties, SHUTDOWN_TIMEOUT_PROPERTY, DEFAULT_SHUTDOWN_TIMEOUT),
                properties.getProperty(THREAD_PREFIX_PROPERTY, DEFAULT_THREAD_PREFIX).trim()
        );
    }

    public RuntimeConfig withComputationThreads(int threads) {
        return new RuntimeConfig(threads, blockingKeepAlive, shutdownTimeout, threadNamePrefix);
    }

    public RuntimeConfig withBlockingKeepAlive(Duration keepAlive) {
        return new RuntimeConfig(computationThreads, keepAlive, shutdownTimeout, threadNamePrefix);
    }

    public RuntimeConfig withShutdownTimeout(Duration timeout) {
        return new RuntimeConfig(computationThreads, blockingKeepAlive, timeout, threadNamePrefix);
    }

    public RuntimeConfig withThreadNamePrefix(String prefix) {
        return new RuntimeConfig(computationThreads, blockingKeepAlive, shutdownTimeout, prefix);
    }

    private static int intProperty(Properties properties, String key, int fallback) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, e);
        }
    }

    private static Duration millisProperty(Properties properties, String key, Duration fallback) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Duration.ofMillis(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid milliseconds for " + key + ": " + raw, e);
        }
    }
}
