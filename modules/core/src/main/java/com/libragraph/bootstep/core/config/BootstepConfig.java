package com.libragraph.bootstep.core.config;

import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import java.time.Duration;
import java.util.Objects;

/**
 * Namespace settings read from MicroProfile Config:
 * <pre>
 *   bootstep.shutdown.socket-timeout-ms = 5000
 *   bootstep.shutdown.failure-policy    = propagate | continue
 * </pre>
 */
public record BootstepConfig(Duration shutdownSocketTimeout, ShutdownPolicy shutdownPolicy) {

    public static final String SOCKET_TIMEOUT_KEY = "bootstep.shutdown.socket-timeout-ms";
    public static final String FAILURE_POLICY_KEY = "bootstep.shutdown.failure-policy";

    /** Default socket timeout while shutting down. */
    public static final Duration DEFAULT_SHUTDOWN_SOCKET_TIMEOUT = Duration.ofSeconds(5);

    public BootstepConfig {
        Objects.requireNonNull(shutdownSocketTimeout, "shutdownSocketTimeout cannot be null");
        Objects.requireNonNull(shutdownPolicy, "shutdownPolicy cannot be null");
        if (shutdownSocketTimeout.isNegative() || shutdownSocketTimeout.isZero()) {
            throw new IllegalArgumentException(
                    "Shutdown socket timeout must be > 0, got: " + shutdownSocketTimeout);
        }
    }

    public static BootstepConfig defaults() {
        return new BootstepConfig(DEFAULT_SHUTDOWN_SOCKET_TIMEOUT, ShutdownPolicy.PROPAGATE);
    }

    /** Reads from the application's {@link ConfigProvider#getConfig() config}. */
    public static BootstepConfig load() {
        return from(ConfigProvider.getConfig());
    }

    public static BootstepConfig from(Config config) {
        Duration timeout = config.getOptionalValue(SOCKET_TIMEOUT_KEY, Long.class)
                .map(Duration::ofMillis)
                .orElse(DEFAULT_SHUTDOWN_SOCKET_TIMEOUT);
        ShutdownPolicy policy = config.getOptionalValue(FAILURE_POLICY_KEY, String.class)
                .map(ShutdownPolicy::parse)
                .orElse(ShutdownPolicy.PROPAGATE);
        return new BootstepConfig(timeout, policy);
    }

    public BootstepConfig withShutdownPolicy(ShutdownPolicy policy) {
        return new BootstepConfig(shutdownSocketTimeout, policy);
    }
}
